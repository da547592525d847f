package com.slb.stake_backend.common.trace;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * 保证每个请求和响应都带 X-Trace-Id，事件流水也按这个 ID 记录。
 */
@Component
public class TraceIdFilter extends OncePerRequestFilter {

    private static final int MAX_SUPPLIED_LENGTH = 64;

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain filterChain
    ) throws ServletException, IOException {
        String traceId = resolveTraceId(request.getHeader(TraceIdHolder.TRACE_ID_HEADER));
        TraceIdHolder.set(traceId);
        response.setHeader(TraceIdHolder.TRACE_ID_HEADER, traceId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            TraceIdHolder.clear();
        }
    }

    static String resolveTraceId(String supplied) {
        if (!StringUtils.hasText(supplied)) {
            return TraceIdHolder.newTraceId();
        }
        String trimmed = supplied.trim();
        // 只接受安全字符，避免日志注入
        if (trimmed.length() > MAX_SUPPLIED_LENGTH || !trimmed.matches("[A-Za-z0-9_-]+")) {
            return TraceIdHolder.newTraceId();
        }
        return trimmed;
    }
}
