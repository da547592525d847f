package com.slb.stake_backend.modules.stake.config;

import com.slb.stake_backend.modules.stake.engine.RewardShortfallMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 质押账本配置（app.staking.*）。
 */
@ConfigurationProperties(prefix = "app.staking")
@Data
public class StakingProperties {

    /** 奖励资产 */
    private String rewardAsset = "MetaNode";

    private long startHeight;

    private long endHeight;

    /** 每块奖励，最小单位 */
    private BigInteger rewardPerBlock;

    /** 奖励金库不足时的处理方式 */
    private RewardShortfallMode rewardShortfallMode = RewardShortfallMode.LENIENT;

    private Clock clock = new Clock();

    /**
     * principal -> 角色。ADMIN 可执行全部管理操作；与 StakeAction 同名的角色只授权该操作。
     */
    private Map<String, List<String>> roles = new LinkedHashMap<>();

    private Maintenance maintenance = new Maintenance();

    @Data
    public static class Clock {
        /** genesisEpochMillis 时刻对应的高度 */
        private long genesisHeight;
        private long genesisEpochMillis;
        private long blockIntervalMillis = 12_000;
    }

    @Data
    public static class Maintenance {
        /** 是否定时批量结算所有池子 */
        private boolean settleEnabled = false;
        private long settleIntervalMillis = 60_000;
    }
}
