package com.slb.stake_backend.modules.stake.service;

import com.slb.stake_backend.modules.event.entity.StakeEvent;
import com.slb.stake_backend.modules.event.enums.StakeEventType;
import com.slb.stake_backend.modules.stake.engine.LedgerReceipts;
import com.slb.stake_backend.modules.stake.engine.Pool;
import com.slb.stake_backend.modules.stake.engine.PoolSettlement;

/**
 * 账本回执到事件流水的转换。
 */
final class StakeEvents {

    private StakeEvents() {
    }

    static StakeEvent settled(PoolSettlement settlement) {
        return StakeEvent.of(StakeEventType.POOL_SETTLED, settlement.poolId(), null, settlement.toHeight())
                .amount(settlement.reward())
                .attr("fromHeight", settlement.fromHeight())
                .attr("accRewardPerShare", settlement.accRewardPerShare());
    }

    static StakeEvent deposit(LedgerReceipts.Deposit r) {
        return StakeEvent.of(StakeEventType.DEPOSIT, r.poolId(), r.principal(), r.height())
                .asset(r.stakeAssetId())
                .amount(r.amount())
                .attr("stakeAmount", r.stakeAmount());
    }

    static StakeEvent unstake(LedgerReceipts.Unstake r) {
        return StakeEvent.of(StakeEventType.UNSTAKE_REQUESTED, r.poolId(), r.principal(), r.height())
                .amount(r.amount())
                .attr("stakeAmount", r.stakeAmount())
                .attr("maturityHeight", r.maturityHeight());
    }

    static StakeEvent withdraw(LedgerReceipts.Withdraw r) {
        return StakeEvent.of(StakeEventType.WITHDRAW, r.poolId(), r.principal(), r.height())
                .asset(r.stakeAssetId())
                .amount(r.amount())
                .attr("releasedRequests", r.releasedRequests());
    }

    static StakeEvent claim(LedgerReceipts.Claim r) {
        return StakeEvent.of(StakeEventType.CLAIM, r.poolId(), r.principal(), r.height())
                .asset(r.rewardAssetId())
                .amount(r.paid())
                .attr("owed", r.owed())
                .attr("pendingReward", r.pendingReward());
    }

    static StakeEvent poolAdded(Pool pool, String caller, long height) {
        return StakeEvent.of(StakeEventType.POOL_ADDED, pool.getPoolId(), caller, height)
                .asset(pool.getStakeAssetId())
                .attr("weight", pool.getWeight())
                .attr("minDeposit", pool.getMinDeposit())
                .attr("unstakeLockBlocks", pool.getUnstakeLockBlocks());
    }

    static StakeEvent poolUpdated(Pool pool, String caller, long height) {
        return StakeEvent.of(StakeEventType.POOL_UPDATED, pool.getPoolId(), caller, height)
                .attr("minDeposit", pool.getMinDeposit())
                .attr("unstakeLockBlocks", pool.getUnstakeLockBlocks());
    }

    static StakeEvent poolWeightSet(LedgerReceipts.PoolWeightChanged r, String caller, long height) {
        return StakeEvent.of(StakeEventType.POOL_WEIGHT_SET, r.poolId(), caller, height)
                .attr("oldWeight", r.oldWeight())
                .attr("weight", r.newWeight())
                .attr("totalWeight", r.totalWeight());
    }

    static StakeEvent config(StakeEventType type, String caller, long height, Object value) {
        return StakeEvent.of(type, null, caller, height).attr("value", value);
    }
}
