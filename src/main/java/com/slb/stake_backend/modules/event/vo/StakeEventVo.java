package com.slb.stake_backend.modules.event.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@Schema(description = "质押事件 / Staking event")
public class StakeEventVo {

    @Schema(description = "事件 ID / Event id", example = "42")
    private Long id;

    @Schema(description = "事件类型 / Event type", example = "DEPOSIT")
    private String eventType;

    @Schema(description = "池子 ID / Pool id", example = "0", nullable = true)
    private Integer poolId;

    @Schema(description = "相关账户 / Principal", example = "alice", nullable = true)
    private String principal;

    @Schema(description = "资产 / Asset id", example = "NATIVE", nullable = true)
    private String assetId;

    @Schema(description = "金额（十进制字符串，避免精度丢失）/ Amount as decimal string", example = "1000000000000000000", nullable = true)
    private String amount;

    @Schema(description = "区块高度 / Block height", example = "150")
    private Long height;

    @Schema(description = "扩展字段 JSON / Extra fields as JSON", nullable = true)
    private String detail;

    @Schema(description = "请求链路 ID / Trace id", nullable = true)
    private String traceId;

    @Schema(description = "入库时间 / Journal time")
    private LocalDateTime createdTime;
}
