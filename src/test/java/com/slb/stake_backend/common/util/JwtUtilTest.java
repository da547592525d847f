package com.slb.stake_backend.common.util;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.UnsupportedJwtException;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 访问令牌的签发与校验。
 */
class JwtUtilTest {

    private static final String SECRET = "unit-test-secret-unit-test-secret-0123456789";

    private JwtUtil jwtUtil;

    @BeforeEach
    void setup() {
        jwtUtil = new JwtUtil();
        ReflectionTestUtils.setField(jwtUtil, "secret", SECRET);
        ReflectionTestUtils.setField(jwtUtil, "accessTokenExpire", 3600L);
        jwtUtil.init();
    }

    @Test
    void generatedToken_shouldValidateForItsSubjectOnly() {
        String token = jwtUtil.generateAccessToken("alice");

        assertEquals("alice", jwtUtil.getSubject(token));
        assertTrue(jwtUtil.validateAccessToken(token, "alice"));
        assertFalse(jwtUtil.validateAccessToken(token, "bob"));
    }

    @Test
    void tokenWithoutAccessType_shouldBeRejected() {
        String refresh = Jwts.builder()
                .setClaims(Map.of(JwtUtil.CLAIM_TYP, "refresh"))
                .setSubject("alice")
                .setExpiration(new Date(System.currentTimeMillis() + 60_000))
                .signWith(Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8)), SignatureAlgorithm.HS256)
                .compact();

        assertThrows(UnsupportedJwtException.class, () -> jwtUtil.parseAccessClaims(refresh));
        assertFalse(jwtUtil.validateAccessToken(refresh, "alice"));
    }

    @Test
    void tokenSignedWithOtherKey_shouldBeRejected() {
        String forged = Jwts.builder()
                .setClaims(Map.of(JwtUtil.CLAIM_TYP, JwtUtil.TOKEN_TYPE_ACCESS))
                .setSubject("alice")
                .setExpiration(new Date(System.currentTimeMillis() + 60_000))
                .signWith(Keys.hmacShaKeyFor("another-secret-another-secret-0123456789ab".getBytes(StandardCharsets.UTF_8)),
                        SignatureAlgorithm.HS256)
                .compact();

        assertFalse(jwtUtil.validateAccessToken(forged, "alice"));
    }

    @Test
    void expiredToken_shouldBeRejected() {
        ReflectionTestUtils.setField(jwtUtil, "accessTokenExpire", -60L);
        String token = jwtUtil.generateAccessToken("alice");

        assertFalse(jwtUtil.validateAccessToken(token, "alice"));
    }
}
