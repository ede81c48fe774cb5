package decentralabs.handoff.service.auth;

import decentralabs.handoff.exception.AssertionVerificationException;
import decentralabs.handoff.model.AssertionClaims;
import decentralabs.handoff.service.auth.JwksKeyCache.ResolvedKey;
import io.jsonwebtoken.ClaimJwtException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Header;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.ProtectedHeader;
import io.jsonwebtoken.UnsupportedJwtException;
import java.security.Key;
import java.time.Clock;
import java.util.Date;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Verifies RS256 identity assertions against the cached JWKS.
 * <p>
 * Key selection: a {@code kid} header must match a cached key exactly, there is
 * no fallback to another key. Without a {@code kid} the first published key is used.
 * Any algorithm other than RS256 is rejected before a key is chosen.
 * <p>
 * Time claims are not enforced here: an expired or premature assertion whose
 * signature verified is returned as is, so {@link ClaimsValidator} reports the
 * first failing claim in its own order.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AssertionVerifier {

    public static final String ACCEPTED_ALGORITHM = "RS256";

    private final JwksKeyCache keyCache;
    private final Clock clock;

    public AssertionClaims verify(String token) throws AssertionVerificationException {
        if (token == null || token.isBlank()) {
            throw new AssertionVerificationException("Invalid JWT", "Assertion is empty");
        }
        List<ResolvedKey> keys = keyCache.getKeys();
        try {
            Claims claims = Jwts.parser()
                .keyLocator(header -> selectKey(header, keys))
                .clock(() -> Date.from(clock.instant()))
                .build()
                .parseSignedClaims(token)
                .getPayload();
            return AssertionClaims.from(claims);
        } catch (ClaimJwtException e) {
            // Raised after the signature check, so the carried claims are authentic
            return AssertionClaims.from(e.getClaims());
        } catch (JwtException | IllegalArgumentException e) {
            log.warn("Assertion rejected: {}", e.getMessage());
            throw new AssertionVerificationException("Invalid JWT", "JWT verification failed", e);
        }
    }

    private Key selectKey(Header header, List<ResolvedKey> keys) {
        String algorithm = header.getAlgorithm();
        if (!ACCEPTED_ALGORITHM.equals(algorithm)) {
            throw new UnsupportedJwtException("Unsupported algorithm: " + algorithm);
        }
        String kid = header instanceof ProtectedHeader protectedHeader ? protectedHeader.getKeyId() : null;
        if (kid != null) {
            return keys.stream()
                .filter(key -> kid.equals(key.kid()))
                .findFirst()
                .map(ResolvedKey::publicKey)
                .orElseThrow(() -> new JwtException("No matching key found in JWKS"));
        }
        if (keys.isEmpty()) {
            throw new JwtException("No matching key found in JWKS");
        }
        if (keys.size() > 1) {
            log.warn("Assertion has no kid; using first of {} published keys", keys.size());
        }
        return keys.get(0).publicKey();
    }
}
