package com.slb.stake_backend.modules.stake.service;

import com.slb.stake_backend.modules.stake.config.StakingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * 定时批量结算所有池子，默认关闭（app.staking.maintenance.settle-enabled）。
 */
@Service
@Slf4j
public class StakingMaintenanceService {

    private final StakingAdminService adminService;
    private final StakingProperties properties;

    public StakingMaintenanceService(StakingAdminService adminService, StakingProperties properties) {
        this.adminService = adminService;
        this.properties = properties;
    }

    @Scheduled(initialDelay = 30_000, fixedDelayString = "${app.staking.maintenance.settle-interval-millis:60000}")
    public void settleAllPools() {
        if (!properties.getMaintenance().isSettleEnabled()) {
            return;
        }
        try {
            adminService.settleAllPoolsInternal();
        } catch (RuntimeException e) {
            log.warn("Scheduled pool settlement failed: {}", e.getMessage());
        }
    }
}
