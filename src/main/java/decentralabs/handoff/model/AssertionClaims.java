package decentralabs.handoff.model;

import io.jsonwebtoken.Claims;
import java.time.Instant;
import java.util.Date;
import java.util.Set;

/**
 * Claims of an identity assertion whose signature has been verified.
 *
 * @param audience all audience values, a single string audience becomes a one element set
 * @param nonce    the {@code jti} claim, may be null
 */
public record AssertionClaims(
    String issuer,
    Set<String> audience,
    String subject,
    String email,
    Instant expiresAt,
    Instant notBefore,
    Instant issuedAt,
    String nonce
) {

    public static AssertionClaims from(Claims claims) {
        Object email = claims.get("email");
        Set<String> audience = claims.getAudience();
        return new AssertionClaims(
            claims.getIssuer(),
            audience == null ? Set.of() : Set.copyOf(audience),
            claims.getSubject(),
            email instanceof String text ? text : null,
            toInstant(claims.getExpiration()),
            toInstant(claims.getNotBefore()),
            toInstant(claims.getIssuedAt()),
            claims.getId()
        );
    }

    private static Instant toInstant(Date date) {
        return date == null ? null : date.toInstant();
    }
}
