package com.slb.stake_backend.modules.stake.vo;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.slb.stake_backend.modules.stake.engine.LedgerReceipts;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.math.BigInteger;

@Data
@Schema(description = "解押申请结果 / Unstake request result")
public class UnstakeVo {

    private Integer poolId;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private BigInteger amount;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private BigInteger stakeAmount;

    @Schema(description = "可提取高度，数量为 0 时为空 / Maturity height, null for a zero amount", nullable = true)
    private Long maturityHeight;

    private Long height;

    public static UnstakeVo from(LedgerReceipts.Unstake receipt) {
        UnstakeVo vo = new UnstakeVo();
        vo.setPoolId(receipt.poolId());
        vo.setAmount(receipt.amount());
        vo.setStakeAmount(receipt.stakeAmount());
        vo.setMaturityHeight(receipt.maturityHeight());
        vo.setHeight(receipt.height());
        return vo;
    }
}
