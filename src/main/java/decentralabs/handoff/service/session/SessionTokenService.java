package decentralabs.handoff.service.session;

import decentralabs.handoff.config.HandoffProperties;
import decentralabs.handoff.exception.SessionRejectedException;
import decentralabs.handoff.model.SessionPrincipal;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.UnsupportedJwtException;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.WeakKeyException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import javax.crypto.SecretKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Mints and verifies the HS256 session tokens carried in the session cookie.
 */
@Service
@Slf4j
public class SessionTokenService {

    public static final String ALGORITHM = "HS256";

    private final SecretKey signingKey;
    private final String issuer;
    private final String audience;
    private final Duration ttl;
    private final Clock clock;

    @Autowired
    public SessionTokenService(HandoffProperties properties, Clock clock) {
        this(properties.getSession().getSecret(), properties.getSession().getIssuer(),
            properties.getSession().getAudience(), properties.getSession().getTtl(), clock);
    }

    public SessionTokenService(String secret, String issuer, String audience, Duration ttl, Clock clock) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("handoff.session.secret must be configured");
        }
        try {
            this.signingKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        } catch (WeakKeyException e) {
            throw new IllegalStateException("handoff.session.secret must be at least 32 bytes", e);
        }
        this.issuer = issuer;
        this.audience = audience;
        this.ttl = ttl;
        this.clock = clock;
    }

    public String issue(String userId, String email, String roles) {
        return issue(userId, email, roles, ttl);
    }

    public String issue(String userId, String email, String roles, Duration lifetime) {
        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        return Jwts.builder()
            .header().add("typ", "JWT").and()
            .issuer(issuer)
            .audience().single(audience)
            .subject(userId)
            .claim("email", email)
            .claim("roles", roles)
            .issuedAt(Date.from(now))
            .expiration(Date.from(now.plus(lifetime)))
            .signWith(signingKey, Jwts.SIG.HS256)
            .compact();
    }

    /**
     * Verifies signature, algorithm, issuer, audience and expiry.
     */
    public SessionPrincipal verify(String token) throws SessionRejectedException {
        if (token == null || token.isBlank()) {
            throw new SessionRejectedException("Unauthorized", "No session cookie found");
        }
        try {
            Claims claims = Jwts.parser()
                .keyLocator(header -> {
                    if (!ALGORITHM.equals(header.getAlgorithm())) {
                        throw new UnsupportedJwtException("Unsupported algorithm: " + header.getAlgorithm());
                    }
                    return signingKey;
                })
                .clock(() -> Date.from(clock.instant()))
                .requireIssuer(issuer)
                .requireAudience(audience)
                .build()
                .parseSignedClaims(token)
                .getPayload();
            if (claims.getExpiration() == null || claims.getSubject() == null) {
                throw new SessionRejectedException("Unauthorized", "Invalid session");
            }
            Object email = claims.get("email");
            Object roles = claims.get("roles");
            return new SessionPrincipal(
                claims.getSubject(),
                email instanceof String text ? text : null,
                roles instanceof String text ? text : null,
                claims.getExpiration().toInstant());
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Session token rejected: {}", e.getMessage());
            throw new SessionRejectedException("Unauthorized", "Invalid session", e);
        }
    }

    public Duration getTtl() {
        return ttl;
    }
}
