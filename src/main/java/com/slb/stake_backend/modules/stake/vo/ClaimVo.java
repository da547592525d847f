package com.slb.stake_backend.modules.stake.vo;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.slb.stake_backend.modules.stake.engine.LedgerReceipts;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.math.BigInteger;

@Data
@Schema(description = "领取奖励结果 / Claim result")
public class ClaimVo {

    private Integer poolId;
    private String rewardAsset;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    @Schema(description = "应得奖励 / Reward owed")
    private BigInteger owed;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    @Schema(description = "实付奖励，受金库余额限制 / Reward paid, capped by the vault balance")
    private BigInteger paid;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    @Schema(description = "领取后仍保留的奖励（仅 STRICT 模式下可能非 0）/ Reward still pending afterwards")
    private BigInteger pendingReward;

    private Long height;

    public static ClaimVo from(LedgerReceipts.Claim receipt) {
        ClaimVo vo = new ClaimVo();
        vo.setPoolId(receipt.poolId());
        vo.setRewardAsset(receipt.rewardAssetId());
        vo.setOwed(receipt.owed());
        vo.setPaid(receipt.paid());
        vo.setPendingReward(receipt.pendingReward());
        vo.setHeight(receipt.height());
        return vo;
    }
}
