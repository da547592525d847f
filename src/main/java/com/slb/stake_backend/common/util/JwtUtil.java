package com.slb.stake_backend.common.util;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.UnsupportedJwtException;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.util.Date;
import java.util.Map;

/**
 * HS256 访问令牌。subject 即账本 principal；令牌由共享密钥的签发方生成，本服务只校验。
 */
@Component
@Slf4j
public class JwtUtil {

    public static final String CLAIM_TYP = "typ";
    public static final String TOKEN_TYPE_ACCESS = "access";

    @Value("${security.jwt.secret}")
    private String secret;

    @Value("${security.jwt.access-token-expire:3600}")
    private long accessTokenExpire;  // seconds

    private Key key;

    @PostConstruct
    public void init() {
        // HS256 要求 secret 至少 32 bytes
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    }

    public Claims parseClaims(String token) {
        return Jwts.parserBuilder().setSigningKey(key).build().parseClaimsJws(token).getBody();
    }

    public Claims parseAccessClaims(String token) {
        Claims claims = parseClaims(token);
        String tokenType = claims.get(CLAIM_TYP, String.class);
        if (!TOKEN_TYPE_ACCESS.equalsIgnoreCase(tokenType)) {
            throw new UnsupportedJwtException("Wrong token type: " + tokenType);
        }
        return claims;
    }

    public String getSubject(String token) {
        return parseClaims(token).getSubject();
    }

    public boolean validateAccessToken(String token, String principal) {
        try {
            Claims claims = parseAccessClaims(token);
            return StringUtils.hasText(claims.getSubject())
                    && claims.getSubject().equals(principal)
                    && !isExpired(claims);
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Failed to validate access token: {}", e.getMessage());
            return false;
        }
    }

    public String generateAccessToken(String principal) {
        Date now = new Date();
        Date exp = new Date(now.getTime() + accessTokenExpire * 1000);
        return Jwts.builder()
                .setClaims(Map.of(CLAIM_TYP, TOKEN_TYPE_ACCESS))
                .setSubject(principal)
                .setIssuedAt(now)
                .setExpiration(exp)
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();
    }

    public static boolean isExpired(Claims claims) {
        Date expiration = claims.getExpiration();
        return expiration == null || expiration.before(new Date());
    }
}
