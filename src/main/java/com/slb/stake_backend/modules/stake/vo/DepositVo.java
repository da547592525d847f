package com.slb.stake_backend.modules.stake.vo;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.slb.stake_backend.modules.stake.engine.LedgerReceipts;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.math.BigInteger;

@Data
@Schema(description = "存入结果 / Deposit result")
public class DepositVo {

    private Integer poolId;
    private String stakeAssetId;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private BigInteger amount;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    @Schema(description = "存入后质押量 / Staked amount after the deposit")
    private BigInteger stakeAmount;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    @Schema(description = "已结转未领取奖励 / Reward carried as pending")
    private BigInteger pendingReward;

    private Long height;

    public static DepositVo from(LedgerReceipts.Deposit receipt) {
        DepositVo vo = new DepositVo();
        vo.setPoolId(receipt.poolId());
        vo.setStakeAssetId(receipt.stakeAssetId());
        vo.setAmount(receipt.amount());
        vo.setStakeAmount(receipt.stakeAmount());
        vo.setPendingReward(receipt.pendingReward());
        vo.setHeight(receipt.height());
        return vo;
    }
}
