package com.slb.stake_backend.modules.stake.vo;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.slb.stake_backend.modules.stake.engine.LedgerReceipts;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.math.BigInteger;

@Data
@Schema(description = "提取结果 / Withdraw result")
public class WithdrawVo {

    private Integer poolId;
    private String stakeAssetId;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    @Schema(description = "本次到账数量，无到期请求时为 0 / Amount released, 0 when nothing matured")
    private BigInteger amount;

    private Integer releasedRequests;
    private Integer remainingRequests;
    private Long height;

    public static WithdrawVo from(LedgerReceipts.Withdraw receipt) {
        WithdrawVo vo = new WithdrawVo();
        vo.setPoolId(receipt.poolId());
        vo.setStakeAssetId(receipt.stakeAssetId());
        vo.setAmount(receipt.amount());
        vo.setReleasedRequests(receipt.releasedRequests());
        vo.setRemainingRequests(receipt.remainingRequests());
        vo.setHeight(receipt.height());
        return vo;
    }
}
