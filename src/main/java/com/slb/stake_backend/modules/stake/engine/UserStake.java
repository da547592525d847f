package com.slb.stake_backend.modules.stake.engine;

import lombok.Data;

import java.math.BigInteger;

/**
 * 用户在某个池中的账本记录，首次触达时创建，之后永不删除（质押为 0 也是合法状态）。
 */
@Data
public class UserStake {

    private int poolId;
    private String principal;
    private BigInteger stakeAmount = BigInteger.ZERO;
    /** 上次结算时已计入的奖励：stakeAmount * accRewardPerShare / SCALE */
    private BigInteger settledBaseline = BigInteger.ZERO;
    /** 已累计但尚未发放的奖励 */
    private BigInteger pendingReward = BigInteger.ZERO;
    private WithdrawalQueue withdrawalQueue = new WithdrawalQueue();

    public UserStake() {
    }

    public UserStake(int poolId, String principal) {
        this.poolId = poolId;
        this.principal = principal;
    }

    public UserStake copy() {
        UserStake copy = new UserStake(poolId, principal);
        copy.setStakeAmount(stakeAmount);
        copy.setSettledBaseline(settledBaseline);
        copy.setPendingReward(pendingReward);
        copy.setWithdrawalQueue(withdrawalQueue.copy());
        return copy;
    }
}
