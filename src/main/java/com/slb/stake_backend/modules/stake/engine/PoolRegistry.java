package com.slb.stake_backend.modules.stake.engine;

import com.slb.stake_backend.common.exception.StakeException;
import com.slb.stake_backend.modules.stake.math.CheckedMath;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * 按池子 ID 索引的池子列表，只追加不删除，ID 一旦分配始终有效。
 */
public class PoolRegistry {

    private final List<Pool> pools = new ArrayList<>();
    private BigInteger totalWeight = BigInteger.ZERO;

    public int size() {
        return pools.size();
    }

    public Pool get(int poolId) {
        if (poolId < 0 || poolId >= pools.size()) {
            throw StakeException.invalidPoolId(poolId);
        }
        return pools.get(poolId);
    }

    public List<Pool> snapshot() {
        List<Pool> copies = new ArrayList<>(pools.size());
        for (Pool pool : pools) {
            copies.add(pool.copy());
        }
        return copies;
    }

    public BigInteger getTotalWeight() {
        return totalWeight;
    }

    /**
     * 把 poolId 的权重换成 newWeight 之后的总权重，只计算不写入。
     */
    public BigInteger totalWeightWith(int poolId, BigInteger newWeight) {
        Pool pool = get(poolId);
        return CheckedMath.add(CheckedMath.sub(totalWeight, pool.getWeight()), newWeight);
    }

    void append(Pool pool, BigInteger newTotalWeight) {
        pool.setPoolId(pools.size());
        pools.add(pool);
        totalWeight = newTotalWeight;
    }

    /** 暂存副本写回 */
    void replace(Pool staged) {
        get(staged.getPoolId());
        pools.set(staged.getPoolId(), staged);
    }

    void replace(Pool staged, BigInteger newTotalWeight) {
        replace(staged);
        totalWeight = newTotalWeight;
    }
}
