package com.slb.stake_backend.modules.stake.port;

import java.math.BigInteger;

public interface RewardAssetTransfer {

    /** 金库持有的奖励资产余额 */
    BigInteger rewardBalance(String rewardAssetId);

    void rewardTransfer(String rewardAssetId, String to, BigInteger amount);
}
