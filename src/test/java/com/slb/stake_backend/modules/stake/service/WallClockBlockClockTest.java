package com.slb.stake_backend.modules.stake.service;

import com.slb.stake_backend.common.exception.StakeException;
import com.slb.stake_backend.modules.stake.config.StakingProperties;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class WallClockBlockClockTest {

    @Test
    void currentHeight_shouldCountBlocksSinceGenesis() {
        StakingProperties properties = properties(1_000, 10_000, 12_000);
        Clock clock = Clock.fixed(Instant.ofEpochMilli(10_000 + 12_000 * 5 + 11_999), ZoneOffset.UTC);

        assertEquals(1_005, new WallClockBlockClock(clock, properties).currentHeight());
    }

    @Test
    void currentHeight_beforeGenesis_shouldStayAtGenesisHeight() {
        StakingProperties properties = properties(7, 10_000, 1_000);
        Clock clock = Clock.fixed(Instant.ofEpochMilli(0), ZoneOffset.UTC);

        assertEquals(7, new WallClockBlockClock(clock, properties).currentHeight());
    }

    @Test
    void currentHeight_clockStepsBack_shouldNotDecrease() {
        Clock clock = mock(Clock.class);
        when(clock.millis()).thenReturn(50_000L, 20_000L);
        WallClockBlockClock blockClock = new WallClockBlockClock(clock, properties(0, 0, 1_000));

        assertEquals(50, blockClock.currentHeight());
        assertEquals(50, blockClock.currentHeight());
    }

    @Test
    void constructor_nonPositiveInterval_shouldFail() {
        assertThrows(StakeException.class,
                () -> new WallClockBlockClock(Clock.systemUTC(), properties(0, 0, 0)));
    }

    private static StakingProperties properties(long genesisHeight, long genesisEpochMillis, long intervalMillis) {
        StakingProperties properties = new StakingProperties();
        properties.getClock().setGenesisHeight(genesisHeight);
        properties.getClock().setGenesisEpochMillis(genesisEpochMillis);
        properties.getClock().setBlockIntervalMillis(intervalMillis);
        return properties;
    }
}
