package com.slb.stake_backend.modules.event.mapper;

import com.slb.stake_backend.modules.event.entity.StakeEvent;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * MyBatis mapper：stake_event 表。
 */
@Mapper
public interface StakeEventMapper {

    int insert(StakeEvent event);

    /**
     * 条件均可为空；按 id 倒序。
     */
    List<StakeEvent> selectPage(@Param("poolId") Integer poolId,
                                @Param("principal") String principal,
                                @Param("eventType") String eventType,
                                @Param("offset") int offset,
                                @Param("limit") int limit);

    long count(@Param("poolId") Integer poolId,
               @Param("principal") String principal,
               @Param("eventType") String eventType);
}
