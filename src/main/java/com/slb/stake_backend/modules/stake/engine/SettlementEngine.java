package com.slb.stake_backend.modules.stake.engine;

import com.slb.stake_backend.modules.stake.math.CheckedMath;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * 池子结算。所有影响奖励的操作都先经过 {@link #settle(Pool, long)}。
 * <p>
 * 只操作池子副本，结算抛异常时原池子不变。
 */
public class SettlementEngine {

    private final EmissionSchedule schedule;
    private final PoolRegistry registry;

    public SettlementEngine(EmissionSchedule schedule, PoolRegistry registry) {
        this.schedule = schedule;
        this.registry = registry;
    }

    /**
     * 把 staged 结算到 height，已是最新时返回 null。无人质押期间的排放直接丢弃。
     */
    public PoolSettlement settle(Pool staged, long height) {
        long from = staged.getLastSettledHeight();
        if (height <= from) {
            return null;
        }
        BigInteger reward = poolShare(staged, from, height);
        BigInteger acc = accrue(staged.getAccRewardPerShare(), reward, staged.getTotalStaked());

        staged.setAccRewardPerShare(acc);
        staged.setLastSettledHeight(height);
        return new PoolSettlement(staged.getPoolId(), from, height, reward, acc);
    }

    /**
     * 推算在 height 结算后的累计值，不修改 pool。
     */
    public BigInteger projectAccRewardPerShare(Pool pool, long height) {
        if (height <= pool.getLastSettledHeight() || pool.getTotalStaked().signum() == 0) {
            return pool.getAccRewardPerShare();
        }
        BigInteger reward = poolShare(pool, pool.getLastSettledHeight(), height);
        return accrue(pool.getAccRewardPerShare(), reward, pool.getTotalStaked());
    }

    /**
     * 按 ID 顺序结算所有池子的副本，不写回，由调用方提交。
     */
    public List<StagedSettlement> stageAll(long height) {
        List<StagedSettlement> staged = new ArrayList<>(registry.size());
        for (Pool copy : registry.snapshot()) {
            PoolSettlement settlement = settle(copy, height);
            staged.add(new StagedSettlement(copy, settlement));
        }
        return staged;
    }

    private BigInteger poolShare(Pool pool, long from, long to) {
        BigInteger emitted = schedule.multiplier(from, to);
        return CheckedMath.mulDiv(emitted, pool.getWeight(), registry.getTotalWeight());
    }

    private static BigInteger accrue(BigInteger acc, BigInteger reward, BigInteger totalStaked) {
        if (totalStaked.signum() == 0) {
            return acc;
        }
        return CheckedMath.add(acc, CheckedMath.mulDiv(reward, CheckedMath.SCALE, totalStaked));
    }

    /** 待提交的已结算副本，池子原本已是最新时 settlement 为 null */
    public record StagedSettlement(Pool pool, PoolSettlement settlement) {
    }
}
