package com.seatwise.backend.global.security;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Date;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;

import org.springframework.stereotype.Service;

/**
 * Verifies access tokens minted by the identity service. Tokens carry the user id as subject,
 * the tenant as the {@code companyId} claim and the granted role codes as {@code roles}.
 */
@Service
public class JwtTokenService {

    public static final String CLAIM_COMPANY_ID = "companyId";
    public static final String CLAIM_ROLES = "roles";

    private final JwtSigningKeyProvider keyProvider;
    private final Clock clock;

    public JwtTokenService(JwtSigningKeyProvider keyProvider, Clock clock) {
        this.keyProvider = keyProvider;
        this.clock = clock;
    }

    public ParsedToken parseAccessToken(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(keyProvider.getSecretKey())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            UUID userId = UUID.fromString(claims.getSubject());
            String companyClaim = claims.get(CLAIM_COMPANY_ID, String.class);
            UUID companyId = companyClaim == null ? null : UUID.fromString(companyClaim);
            List<?> rolesClaim = claims.get(CLAIM_ROLES, List.class);
            List<String> roles = rolesClaim == null ? List.of() : rolesClaim.stream()
                    .filter(Objects::nonNull)
                    .map(Object::toString)
                    .toList();
            Instant issuedAt = claims.getIssuedAt() != null ? claims.getIssuedAt().toInstant() : clock.instant();
            Instant expiresAt = claims.getExpiration() != null ? claims.getExpiration().toInstant() : issuedAt;

            return new ParsedToken(
                    userId,
                    companyId,
                    roles,
                    OffsetDateTime.ofInstant(issuedAt, clock.getZone()),
                    OffsetDateTime.ofInstant(expiresAt, clock.getZone())
            );
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid access token", e);
        }
    }

    public record ParsedToken(UUID userId, UUID companyId, List<String> roles, OffsetDateTime issuedAt, OffsetDateTime expiresAt) {
    }

    public static class InvalidTokenException extends RuntimeException {
        public InvalidTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
