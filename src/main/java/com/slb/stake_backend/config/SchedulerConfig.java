package com.slb.stake_backend.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * 启用定时任务（池子批量结算，默认关闭，见 app.staking.maintenance）
 */
@Configuration
@EnableScheduling
public class SchedulerConfig {
}
