package com.slb.stake_backend.modules.stake.port;

/**
 * 提取 / 领取暂停开关。
 */
public interface PauseControl {

    boolean isWithdrawPaused();

    boolean isClaimPaused();

    void setWithdrawPaused(boolean paused);

    void setClaimPaused(boolean paused);
}
