package com.slb.stake_backend.modules.event.entity;

import com.slb.stake_backend.modules.event.enums.StakeEventType;
import lombok.Data;

import java.io.Serializable;
import java.math.BigInteger;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 质押事件流水，对应 stake_event 表。
 */
@Data
public class StakeEvent implements Serializable {
    private static final long serialVersionUID = 1L;

    private Long id;
    private StakeEventType eventType;
    /** 关联池子，emission / pause 类事件为空 */
    private Integer poolId;
    /** 触发者或受益人 */
    private String principal;
    private String assetId;
    /** 主金额：存入/解押/提取/实付奖励/池子结算奖励 */
    private BigInteger amount;
    /** 发生时的区块高度 */
    private Long height;
    /** 其余字段的 JSON，入库前由 attributes 序列化 */
    private String detail;
    private String traceId;
    private LocalDateTime createdTime;

    /** 不入库 */
    private transient Map<String, Object> attributes = new LinkedHashMap<>();

    public static StakeEvent of(StakeEventType type, Integer poolId, String principal, long height) {
        StakeEvent event = new StakeEvent();
        event.setEventType(type);
        event.setPoolId(poolId);
        event.setPrincipal(principal);
        event.setHeight(height);
        return event;
    }

    public StakeEvent asset(String assetId) {
        this.assetId = assetId;
        return this;
    }

    public StakeEvent amount(BigInteger amount) {
        this.amount = amount;
        return this;
    }

    public StakeEvent attr(String key, Object value) {
        if (value != null) {
            attributes.put(key, value instanceof BigInteger ? value.toString() : value);
        }
        return this;
    }
}
