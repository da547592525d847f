package com.slb.stake_backend.modules.event.enums;

/**
 * 质押事件类型
 */
public enum StakeEventType {
    POOL_SETTLED,        // 池子结算
    DEPOSIT,             // 存入
    UNSTAKE_REQUESTED,   // 申请解押
    WITHDRAW,            // 提取已到期解押
    CLAIM,               // 领取奖励
    POOL_ADDED,
    POOL_UPDATED,
    POOL_WEIGHT_SET,
    REWARD_ASSET_SET,
    START_HEIGHT_SET,
    END_HEIGHT_SET,
    EMISSION_RATE_SET,
    WITHDRAW_PAUSED,
    WITHDRAW_UNPAUSED,
    CLAIM_PAUSED,
    CLAIM_UNPAUSED
}
