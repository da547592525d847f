package com.slb.stake_backend.common.util;

import com.slb.stake_backend.common.security.AuthErrorType;
import com.slb.stake_backend.common.security.AuthProblemSupport;
import com.slb.stake_backend.common.security.StakePrincipal;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.MalformedJwtException;
import io.jsonwebtoken.UnsupportedJwtException;
import io.jsonwebtoken.security.SignatureException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Map;

@Component
public class JwtFilter extends OncePerRequestFilter {

    private static final String BEARER = "Bearer ";

    private final JwtUtil jwtUtil;

    public JwtFilter(JwtUtil jwtUtil) {
        this.jwtUtil = jwtUtil;
    }

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain filterChain
    ) throws ServletException, IOException {

        if (SecurityContextHolder.getContext().getAuthentication() == null) {
            processAuthentication(request);
        }

        filterChain.doFilter(request, response);
    }

    private void processAuthentication(HttpServletRequest request) {
        String authHeader = request.getHeader("Authorization");
        // 没带 Authorization 直接放行，由后续过滤器决定接口是否需要登录
        if (!StringUtils.hasText(authHeader)) {
            return;
        }

        if (!authHeader.startsWith(BEARER)) {
            AuthProblemSupport.flag(
                    request,
                    AuthErrorType.BAD_AUTHORIZATION_HEADER,
                    "Malformed Authorization header",
                    Map.of("Authorization", "Expected 'Authorization: Bearer <token>' format")
            );
            return;
        }

        String token = authHeader.substring(BEARER.length()).trim();
        if (!StringUtils.hasText(token)) {
            AuthProblemSupport.flag(
                    request,
                    AuthErrorType.BAD_AUTHORIZATION_HEADER,
                    "Missing bearer token",
                    Map.of("Authorization", "Bearer token value is missing")
            );
            return;
        }

        try {
            Claims claims = jwtUtil.parseClaims(token);

            if (JwtUtil.isExpired(claims)) {
                AuthProblemSupport.flag(
                        request,
                        AuthErrorType.TOKEN_EXPIRED,
                        "The bearer token is expired at " + claims.getExpiration(),
                        Map.of("token", "expired")
                );
                return;
            }

            String tokenType = claims.get(JwtUtil.CLAIM_TYP, String.class);
            if (!JwtUtil.TOKEN_TYPE_ACCESS.equalsIgnoreCase(tokenType)) {
                AuthProblemSupport.flag(
                        request,
                        AuthErrorType.WRONG_TOKEN_TYPE,
                        "Wrong token type: " + tokenType,
                        Map.of("token", "wrong_type")
                );
                return;
            }

            String subject = claims.getSubject();
            if (!StringUtils.hasText(subject)) {
                AuthProblemSupport.flag(
                        request,
                        AuthErrorType.MISSING_SUBJECT,
                        "Missing subject claim",
                        Map.of("token", "principal_missing")
                );
                return;
            }

            StakePrincipal principal = new StakePrincipal(subject.trim());
            UsernamePasswordAuthenticationToken authToken = new UsernamePasswordAuthenticationToken(
                    principal, null, principal.getAuthorities());
            authToken.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
            SecurityContextHolder.getContext().setAuthentication(authToken);
        } catch (ExpiredJwtException e) {
            AuthProblemSupport.flag(
                    request,
                    AuthErrorType.TOKEN_EXPIRED,
                    "The bearer token is expired at " + e.getClaims().getExpiration(),
                    Map.of("token", "expired")
            );
        } catch (SignatureException e) {
            AuthProblemSupport.flag(
                    request,
                    AuthErrorType.INVALID_TOKEN,
                    "Signature invalid",
                    Map.of("token", "signature_invalid")
            );
        } catch (MalformedJwtException | UnsupportedJwtException e) {
            AuthProblemSupport.flag(
                    request,
                    AuthErrorType.INVALID_TOKEN,
                    "Malformed token: " + e.getMessage(),
                    Map.of("token", "malformed")
            );
        } catch (JwtException | IllegalArgumentException e) {
            AuthProblemSupport.flag(
                    request,
                    AuthErrorType.INVALID_TOKEN,
                    "Invalid token: " + e.getMessage(),
                    Map.of("token", "invalid")
            );
        }
    }
}
