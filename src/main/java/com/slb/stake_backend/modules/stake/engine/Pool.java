package com.slb.stake_backend.modules.stake.engine;

import lombok.Data;

import java.math.BigInteger;

/**
 * 质押池状态。池 0 固定为原生币，其余池各接受一种代币。
 */
@Data
public class Pool {

    public static final String NATIVE_ASSET = "NATIVE";

    private int poolId;
    private String stakeAssetId;
    private BigInteger weight;
    private long lastSettledHeight;
    /** 每单位质押累计奖励，放大 SCALE (1e18) 倍，只增不减 */
    private BigInteger accRewardPerShare;
    private BigInteger totalStaked;
    private BigInteger minDeposit;
    private long unstakeLockBlocks;

    public boolean isNative() {
        return NATIVE_ASSET.equals(stakeAssetId);
    }

    public Pool copy() {
        Pool copy = new Pool();
        copy.setPoolId(poolId);
        copy.setStakeAssetId(stakeAssetId);
        copy.setWeight(weight);
        copy.setLastSettledHeight(lastSettledHeight);
        copy.setAccRewardPerShare(accRewardPerShare);
        copy.setTotalStaked(totalStaked);
        copy.setMinDeposit(minDeposit);
        copy.setUnstakeLockBlocks(unstakeLockBlocks);
        return copy;
    }
}
