package com.slb.stake_backend.modules.stake.engine;

import java.math.BigInteger;

/**
 * 单个池子的一次结算：[fromHeight, toHeight) 内分到的排放量和结算后的累计值。
 */
public record PoolSettlement(int poolId,
                             long fromHeight,
                             long toHeight,
                             BigInteger reward,
                             BigInteger accRewardPerShare) {
}
