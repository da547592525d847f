package com.slb.stake_backend.modules.stake.vo;

import com.fasterxml.jackson.annotation.JsonFormat;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.math.BigInteger;

@Data
@Schema(description = "排放参数与全局状态 / Emission config and global state")
public class EmissionVo {

    @Schema(description = "奖励资产 / Reward asset", example = "MetaNode")
    private String rewardAsset;

    @Schema(description = "奖励开始高度（含）/ Start height, inclusive", example = "100")
    private Long startHeight;

    @Schema(description = "奖励结束高度（不含）/ End height, exclusive", example = "200")
    private Long endHeight;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    @Schema(description = "每块奖励 / Reward per block", example = "1")
    private BigInteger rewardPerBlock;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    @Schema(description = "所有池子权重之和 / Sum of pool weights")
    private BigInteger totalWeight;

    @Schema(description = "池子数量 / Number of pools", example = "2")
    private Integer poolLength;

    @Schema(description = "当前高度 / Current height", example = "150")
    private Long currentHeight;

    private Boolean withdrawPaused;

    private Boolean claimPaused;

    @Schema(description = "奖励不足时的处理方式 / Reward shortfall mode", example = "LENIENT")
    private String rewardShortfallMode;
}
