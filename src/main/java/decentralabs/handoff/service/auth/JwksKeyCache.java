package decentralabs.handoff.service.auth;

import decentralabs.handoff.config.HandoffProperties;
import decentralabs.handoff.dto.JsonWebKeySet;
import decentralabs.handoff.dto.JsonWebKeySet.JsonWebKey;
import decentralabs.handoff.exception.AssertionVerificationException;
import java.math.BigInteger;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.RSAPublicKeySpec;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Caches the identity provider's RSA signing keys for a bounded time.
 * The cached set is replaced as a whole; concurrent refreshes may race and
 * the last writer wins, which is harmless since every writer stores a full set.
 */
@Service
@Slf4j
public class JwksKeyCache {

    private static final String ACCEPTED_ALGORITHM = "RS256";

    private final JwksClient jwksClient;
    private final Duration ttl;
    private final Clock clock;

    private volatile CachedKeys cached;

    @Autowired
    public JwksKeyCache(JwksClient jwksClient, HandoffProperties properties, Clock clock) {
        this(jwksClient, properties.getAssertion().getJwksTtl(), clock);
    }

    public JwksKeyCache(JwksClient jwksClient, Duration ttl, Clock clock) {
        this.jwksClient = jwksClient;
        this.ttl = ttl;
        this.clock = clock;
    }

    /**
     * Returns the cached keys in published order, refreshing when the TTL has lapsed.
     */
    public List<ResolvedKey> getKeys() throws AssertionVerificationException {
        CachedKeys snapshot = cached;
        if (snapshot == null || !clock.instant().isBefore(snapshot.fetchedAt().plus(ttl))) {
            snapshot = refresh();
        }
        return snapshot.keys();
    }

    /**
     * Fetches the key set immediately, replacing whatever is cached.
     */
    public CachedKeys refresh() throws AssertionVerificationException {
        JsonWebKeySet keySet = jwksClient.fetch();
        List<ResolvedKey> keys = new ArrayList<>();
        for (JsonWebKey jwk : keySet.keys()) {
            if (!isUsableSigningKey(jwk)) {
                log.debug("Skipping JWKS entry kid={} kty={} alg={}", jwk.kid(), jwk.kty(), jwk.alg());
                continue;
            }
            try {
                keys.add(new ResolvedKey(jwk.kid(), toPublicKey(jwk)));
            } catch (GeneralSecurityException | IllegalArgumentException e) {
                log.warn("Skipping malformed JWKS entry kid={}: {}", jwk.kid(), e.getMessage());
            }
        }
        CachedKeys snapshot = new CachedKeys(List.copyOf(keys), clock.instant());
        cached = snapshot;
        log.info("JWKS cache refreshed with {} signing key(s)", keys.size());
        return snapshot;
    }

    public boolean isCached() {
        return cached != null;
    }

    public int cachedKeyCount() {
        CachedKeys snapshot = cached;
        return snapshot == null ? 0 : snapshot.keys().size();
    }

    private boolean isUsableSigningKey(JsonWebKey jwk) {
        if (jwk == null || !"RSA".equals(jwk.kty()) || jwk.n() == null || jwk.e() == null) {
            return false;
        }
        if (jwk.alg() != null && !ACCEPTED_ALGORITHM.equals(jwk.alg())) {
            return false;
        }
        return jwk.use() == null || "sig".equals(jwk.use());
    }

    private RSAPublicKey toPublicKey(JsonWebKey jwk) throws GeneralSecurityException {
        BigInteger modulus = new BigInteger(1, Base64.getUrlDecoder().decode(jwk.n()));
        BigInteger exponent = new BigInteger(1, Base64.getUrlDecoder().decode(jwk.e()));
        return (RSAPublicKey) KeyFactory.getInstance("RSA").generatePublic(new RSAPublicKeySpec(modulus, exponent));
    }

    public record ResolvedKey(String kid, RSAPublicKey publicKey) {
    }

    public record CachedKeys(List<ResolvedKey> keys, Instant fetchedAt) {
    }
}
