package com.slb.stake_backend.modules.stake.vo;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.slb.stake_backend.modules.stake.engine.Pool;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.math.BigInteger;

@Data
@Schema(description = "质押池 / Staking pool")
public class PoolVo {

    @Schema(description = "池子 ID，0 号池为原生资产 / Pool id, pool 0 stakes the native asset", example = "1")
    private Integer poolId;

    @Schema(description = "质押资产 / Staking asset", example = "NATIVE")
    private String stakeAssetId;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    @Schema(description = "池子权重 / Pool weight", example = "100")
    private BigInteger weight;

    @Schema(description = "最后结算高度 / Last settled height", example = "150")
    private Long lastSettledHeight;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    @Schema(description = "每份额累计奖励（放大 1e18）/ Accumulated reward per share scaled by 1e18")
    private BigInteger accRewardPerShare;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    @Schema(description = "池子总质押量 / Total staked")
    private BigInteger totalStaked;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    @Schema(description = "最小存入量 / Minimum deposit")
    private BigInteger minDeposit;

    @Schema(description = "解押锁定块数 / Unstake lock blocks", example = "20")
    private Long unstakeLockBlocks;

    public static PoolVo from(Pool pool) {
        PoolVo vo = new PoolVo();
        vo.setPoolId(pool.getPoolId());
        vo.setStakeAssetId(pool.getStakeAssetId());
        vo.setWeight(pool.getWeight());
        vo.setLastSettledHeight(pool.getLastSettledHeight());
        vo.setAccRewardPerShare(pool.getAccRewardPerShare());
        vo.setTotalStaked(pool.getTotalStaked());
        vo.setMinDeposit(pool.getMinDeposit());
        vo.setUnstakeLockBlocks(pool.getUnstakeLockBlocks());
        return vo;
    }
}
