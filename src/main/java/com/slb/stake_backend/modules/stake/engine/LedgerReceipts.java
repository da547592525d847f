package com.slb.stake_backend.modules.stake.engine;

import java.math.BigInteger;
import java.util.List;

/**
 * 账本操作回执，随暂存状态一起返回。
 */
public final class LedgerReceipts {

    private LedgerReceipts() {
    }

    public record Deposit(int poolId,
                          String principal,
                          String stakeAssetId,
                          BigInteger amount,
                          BigInteger stakeAmount,
                          BigInteger pendingReward,
                          long height) {
    }

    /** 解押 0 时不入队，maturityHeight 为 null */
    public record Unstake(int poolId,
                          String principal,
                          BigInteger amount,
                          BigInteger stakeAmount,
                          Long maturityHeight,
                          long height) {
    }

    public record Withdraw(int poolId,
                           String principal,
                           String stakeAssetId,
                           BigInteger amount,
                           int releasedRequests,
                           int remainingRequests,
                           long height) {
    }

    public record Claim(int poolId,
                        String principal,
                        String rewardAssetId,
                        BigInteger owed,
                        BigInteger paid,
                        BigInteger pendingReward,
                        long height) {

        public BigInteger shortfall() {
            return owed.subtract(paid);
        }
    }

    public record PoolAdded(Pool pool, List<PoolSettlement> settlements) {
    }

    public record PoolWeightChanged(int poolId,
                                    BigInteger oldWeight,
                                    BigInteger newWeight,
                                    BigInteger totalWeight,
                                    List<PoolSettlement> settlements) {
    }

    public record WithdrawAmounts(BigInteger requestAmount, BigInteger pendingWithdrawAmount) {
    }
}
