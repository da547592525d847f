package com.slb.stake_backend.modules.stake.engine;

/**
 * 奖励金库余额不足时领取的处理方式。
 */
public enum RewardShortfallMode {
    /** 按余额发放，待领奖励清零，差额作废 */
    LENIENT,
    /** 按余额发放，未发部分保留可继续领取 */
    STRICT
}
