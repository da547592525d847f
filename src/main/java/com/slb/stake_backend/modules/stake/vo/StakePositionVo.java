package com.slb.stake_backend.modules.stake.vo;

import com.fasterxml.jackson.annotation.JsonFormat;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.math.BigInteger;
import java.util.List;

@Data
@Schema(description = "用户在某个池子的仓位 / A principal's position in one pool")
public class StakePositionVo {

    private Integer poolId;

    private String principal;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    @Schema(description = "质押中数量 / Staked amount")
    private BigInteger stakeAmount;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    @Schema(description = "当前可领取奖励 / Reward claimable at the current height")
    private BigInteger pendingReward;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    @Schema(description = "解押队列总量 / Total queued for withdrawal")
    private BigInteger requestAmount;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    @Schema(description = "已到期数量 / Total already matured")
    private BigInteger pendingWithdrawAmount;

    @Schema(description = "查询高度 / Height of this snapshot")
    private Long height;

    private List<UnstakeRequestVo> requests;
}
