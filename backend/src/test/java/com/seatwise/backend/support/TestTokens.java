package com.seatwise.backend.support;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.List;
import java.util.UUID;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import com.seatwise.backend.global.security.JwtTokenService;

import io.jsonwebtoken.Jwts;

/**
 * Mints access tokens the way the identity service does, signed with the secret from application-test.yml.
 */
public final class TestTokens {

    public static final String TEST_SECRET = "test-jwt-secret-key-for-seatwise-integration-tests-0123456789";

    private TestTokens() {
    }

    public static String admin(UUID companyId) {
        return issue(UUID.randomUUID(), companyId, List.of("ADMIN"));
    }

    public static String planner(UUID companyId) {
        return issue(UUID.randomUUID(), companyId, List.of("PLANNER"));
    }

    public static String issue(UUID userId, UUID companyId, List<String> roles) {
        return issue(TEST_SECRET, userId, companyId, roles, Instant.now(), Instant.now().plus(15, ChronoUnit.MINUTES));
    }

    public static String issue(String secret, UUID userId, UUID companyId, List<String> roles,
                               Instant issuedAt, Instant expiresAt) {
        SecretKey key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256");
        var builder = Jwts.builder()
                .subject(userId.toString())
                .claim(JwtTokenService.CLAIM_ROLES, roles)
                .issuedAt(Date.from(issuedAt))
                .expiration(Date.from(expiresAt))
                .signWith(key, Jwts.SIG.HS256);
        if (companyId != null) {
            builder.claim(JwtTokenService.CLAIM_COMPANY_ID, companyId.toString());
        }
        return builder.compact();
    }

    public static String bearer(String token) {
        return "Bearer " + token;
    }
}
