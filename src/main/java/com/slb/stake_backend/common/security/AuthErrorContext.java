package com.slb.stake_backend.common.security;

import org.springframework.lang.Nullable;

import java.util.Map;

/**
 * 过滤器里记录的鉴权失败原因，由入口点统一输出。
 */
public record AuthErrorContext(
        AuthErrorType type,
        @Nullable String detail,
        @Nullable Map<String, String> errors
) {
}
