package com.slb.stake_backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * 浏览器前端跨域配置。
 */
@ConfigurationProperties(prefix = "app.cors")
@Data
public class CorsProperties {

    private boolean enabled = true;

    /** 精确 Origin 白名单；为空时使用 allowedOriginPatterns */
    private List<String> allowedOrigins = new ArrayList<>();

    private List<String> allowedOriginPatterns = new ArrayList<>(List.of("*"));

    private List<String> allowedMethods = new ArrayList<>(List.of("GET", "POST", "PUT", "DELETE", "OPTIONS"));

    private List<String> allowedHeaders = new ArrayList<>(List.of(
            "Content-Type",
            "Authorization",
            "X-Trace-Id"
    ));

    private List<String> exposedHeaders = new ArrayList<>(List.of("X-Trace-Id"));

    private boolean allowCredentials = false;

    /** 预检缓存时间（秒） */
    private long maxAgeSeconds = 3600;
}
