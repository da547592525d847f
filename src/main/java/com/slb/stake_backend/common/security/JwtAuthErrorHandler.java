package com.slb.stake_backend.common.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpStatus;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.access.AccessDeniedHandler;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.util.Map;

/**
 * 401 / 403 的统一出口：优先使用 JwtFilter 记录的原因。
 */
@Component
public class JwtAuthErrorHandler implements AuthenticationEntryPoint, AccessDeniedHandler {

    private final ObjectMapper objectMapper;

    public JwtAuthErrorHandler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response, AuthenticationException authException) throws IOException {
        AuthErrorContext context = AuthProblemSupport.get(request);
        if (context == null) {
            context = defaultAuthenticationContext(request, authException);
        }
        AuthProblemSupport.writeApiResponse(response, context, objectMapper);
    }

    @Override
    public void handle(HttpServletRequest request, HttpServletResponse response, AccessDeniedException accessDeniedException) throws IOException {
        AuthErrorContext context = AuthProblemSupport.get(request);
        // AccessDeniedHandler 固定 403
        if (context == null || context.type().getStatus() != HttpStatus.FORBIDDEN) {
            context = new AuthErrorContext(
                    AuthErrorType.INSUFFICIENT_SCOPE,
                    accessDeniedException != null ? accessDeniedException.getMessage() : null,
                    Map.of("scope", "insufficient"));
        }
        AuthProblemSupport.writeApiResponse(response, context, objectMapper);
    }

    private AuthErrorContext defaultAuthenticationContext(HttpServletRequest request, AuthenticationException authException) {
        String authHeader = request.getHeader("Authorization");
        if (!StringUtils.hasText(authHeader)) {
            return new AuthErrorContext(AuthErrorType.MISSING_AUTHORIZATION,
                    "Missing Authorization: Bearer header",
                    Map.of("Authorization", "Required header not provided"));
        }
        if (!authHeader.startsWith("Bearer ")) {
            return new AuthErrorContext(AuthErrorType.BAD_AUTHORIZATION_HEADER,
                    "Malformed Authorization header",
                    Map.of("Authorization", "Expected 'Authorization: Bearer <token>' format"));
        }
        return new AuthErrorContext(AuthErrorType.INVALID_TOKEN,
                authException != null ? authException.getMessage() : null,
                Map.of("token", "invalid"));
    }
}
