package com.slb.stake_backend.modules.event.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.slb.stake_backend.common.exception.StakeException;
import com.slb.stake_backend.common.trace.TraceIdHolder;
import com.slb.stake_backend.common.vo.PageVo;
import com.slb.stake_backend.modules.event.entity.StakeEvent;
import com.slb.stake_backend.modules.event.enums.StakeEventType;
import com.slb.stake_backend.modules.event.mapper.StakeEventMapper;
import com.slb.stake_backend.modules.event.vo.StakeEventVo;
import com.slb.stake_backend.modules.stake.port.StakeEventPublisher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 事件流水：写入失败只记录告警，不影响已提交的账本操作。
 */
@Service
@Slf4j
public class StakeEventService implements StakeEventPublisher {

    private static final int MAX_PAGE_SIZE = 100;

    private final StakeEventMapper stakeEventMapper;
    private final ObjectMapper objectMapper;

    public StakeEventService(StakeEventMapper stakeEventMapper, ObjectMapper objectMapper) {
        this.stakeEventMapper = stakeEventMapper;
        this.objectMapper = objectMapper;
    }

    @Override
    public void publish(StakeEvent event) {
        try {
            if (event.getTraceId() == null) {
                event.setTraceId(TraceIdHolder.getOptional().orElse(null));
            }
            if (event.getAttributes() != null && !event.getAttributes().isEmpty()) {
                event.setDetail(objectMapper.writeValueAsString(event.getAttributes()));
            }
            stakeEventMapper.insert(event);
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("Failed to journal stake event: type={}, poolId={}, principal={}, height={}, reason={}",
                    event.getEventType(), event.getPoolId(), event.getPrincipal(), event.getHeight(), e.getMessage());
        }
    }

    public PageVo<StakeEventVo> listEvents(Integer poolId, String principal, String eventType, int page, int size) {
        if (page < 1) {
            page = 1;
        }
        if (size < 1 || size > MAX_PAGE_SIZE) {
            size = Math.min(Math.max(size, 1), MAX_PAGE_SIZE);
        }
        String type = normalizeType(eventType);
        String who = StringUtils.hasText(principal) ? principal.trim() : null;

        long total = stakeEventMapper.count(poolId, who, type);
        List<StakeEventVo> list = new ArrayList<>();
        if (total > 0) {
            for (StakeEvent event : stakeEventMapper.selectPage(poolId, who, type, (page - 1) * size, size)) {
                list.add(toVo(event));
            }
        }
        return new PageVo<>(total, page, size, list);
    }

    private String normalizeType(String eventType) {
        if (!StringUtils.hasText(eventType)) {
            return null;
        }
        try {
            return StakeEventType.valueOf(eventType.trim().toUpperCase(Locale.ROOT)).name();
        } catch (IllegalArgumentException e) {
            throw StakeException.invalidParameter("unknown event type: " + eventType);
        }
    }

    private StakeEventVo toVo(StakeEvent event) {
        StakeEventVo vo = new StakeEventVo();
        vo.setId(event.getId());
        vo.setEventType(event.getEventType() != null ? event.getEventType().name() : null);
        vo.setPoolId(event.getPoolId());
        vo.setPrincipal(event.getPrincipal());
        vo.setAssetId(event.getAssetId());
        vo.setAmount(event.getAmount() != null ? event.getAmount().toString() : null);
        vo.setHeight(event.getHeight());
        vo.setDetail(event.getDetail());
        vo.setTraceId(event.getTraceId());
        vo.setCreatedTime(event.getCreatedTime());
        return vo;
    }
}
