package com.slb.stake_backend.modules.custody.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 进程内托管的初始余额（app.custody.*），便于本地联调。
 */
@ConfigurationProperties(prefix = "app.custody")
@Data
public class CustodyProperties {

    /** 启动时注入奖励金库的数量 */
    private BigInteger initialRewardFunding = BigInteger.ZERO;

    /** asset -> (principal -> 余额) */
    private Map<String, Map<String, BigInteger>> initialBalances = new LinkedHashMap<>();
}
