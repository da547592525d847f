package com.slb.stake_backend.modules.stake.service;

import com.slb.stake_backend.modules.stake.port.PauseControl;
import org.springframework.stereotype.Component;

/**
 * 进程内暂停开关，重启后恢复为未暂停。
 */
@Component
public class InMemoryPauseControl implements PauseControl {

    private volatile boolean withdrawPaused;
    private volatile boolean claimPaused;

    @Override
    public boolean isWithdrawPaused() {
        return withdrawPaused;
    }

    @Override
    public boolean isClaimPaused() {
        return claimPaused;
    }

    @Override
    public void setWithdrawPaused(boolean paused) {
        this.withdrawPaused = paused;
    }

    @Override
    public void setClaimPaused(boolean paused) {
        this.claimPaused = paused;
    }
}
