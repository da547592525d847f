package com.slb.stake_backend.modules.stake.service;

import com.slb.stake_backend.common.exception.StakeException;
import com.slb.stake_backend.modules.stake.config.StakingProperties;
import com.slb.stake_backend.modules.stake.port.BlockClock;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 由墙钟推算区块高度：genesisHeight + (now - genesisEpochMillis) / blockIntervalMillis。
 * 返回值单调不减，系统时间回拨时保持上一次的高度。
 */
@Component
public class WallClockBlockClock implements BlockClock {

    private final Clock clock;
    private final StakingProperties.Clock config;
    private final AtomicLong lastHeight = new AtomicLong(Long.MIN_VALUE);

    public WallClockBlockClock(Clock clock, StakingProperties properties) {
        this.clock = clock;
        this.config = properties.getClock();
        if (config.getBlockIntervalMillis() <= 0) {
            throw StakeException.invalidParameter("app.staking.clock.block-interval-millis must be positive");
        }
    }

    @Override
    public long currentHeight() {
        long elapsed = Math.max(0, clock.millis() - config.getGenesisEpochMillis());
        long height = config.getGenesisHeight() + elapsed / config.getBlockIntervalMillis();
        return lastHeight.accumulateAndGet(height, Math::max);
    }
}
