package com.slb.stake_backend.modules.stake.vo;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.slb.stake_backend.modules.stake.engine.PoolSettlement;
import lombok.Data;

import java.math.BigInteger;

@Data
public class PoolSettlementVo {

    private Integer poolId;
    private Long fromHeight;
    private Long toHeight;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private BigInteger reward;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private BigInteger accRewardPerShare;

    public static PoolSettlementVo from(PoolSettlement settlement) {
        PoolSettlementVo vo = new PoolSettlementVo();
        vo.setPoolId(settlement.poolId());
        vo.setFromHeight(settlement.fromHeight());
        vo.setToHeight(settlement.toHeight());
        vo.setReward(settlement.reward());
        vo.setAccRewardPerShare(settlement.accRewardPerShare());
        return vo;
    }
}
