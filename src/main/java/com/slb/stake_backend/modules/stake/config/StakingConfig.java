package com.slb.stake_backend.modules.stake.config;

import com.slb.stake_backend.modules.stake.engine.EmissionSchedule;
import com.slb.stake_backend.modules.stake.engine.StakeLedger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@Slf4j
public class StakingConfig {

    /**
     * 排放参数非法时启动失败。
     */
    @Bean
    public StakeLedger stakeLedger(StakingProperties properties) {
        EmissionSchedule schedule = new EmissionSchedule(
                properties.getRewardAsset(),
                properties.getStartHeight(),
                properties.getEndHeight(),
                properties.getRewardPerBlock());
        log.info("Staking ledger initialized: rewardAsset={}, startHeight={}, endHeight={}, rewardPerBlock={}, shortfallMode={}",
                schedule.getRewardAssetId(), schedule.getStartHeight(), schedule.getEndHeight(),
                schedule.getRatePerBlock(), properties.getRewardShortfallMode());
        return new StakeLedger(schedule);
    }

    @Bean
    public Clock systemClock() {
        return Clock.systemUTC();
    }
}
