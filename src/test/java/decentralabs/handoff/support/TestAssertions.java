package decentralabs.handoff.support;

import decentralabs.handoff.dto.JsonWebKeySet;
import decentralabs.handoff.dto.JsonWebKeySet.JsonWebKey;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.Jwts;
import java.math.BigInteger;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.security.interfaces.RSAPublicKey;
import java.time.Instant;
import java.util.Arrays;
import java.util.Base64;
import java.util.Date;
import java.util.List;
import java.util.UUID;

/**
 * Signs identity assertions with throwaway RSA keys and publishes them as a JWKS.
 */
public final class TestAssertions {

    public static final String ISSUER = "https://idp.example.test";
    public static final String AUDIENCE = "handoff-gateway";

    private TestAssertions() {
    }

    public static KeyPair rsaKeyPair() {
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
            generator.initialize(2048);
            return generator.generateKeyPair();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }

    public static JsonWebKey jwk(String kid, KeyPair keyPair) {
        RSAPublicKey publicKey = (RSAPublicKey) keyPair.getPublic();
        return new JsonWebKey("RSA", "sig", kid, "RS256",
            base64Url(publicKey.getModulus()), base64Url(publicKey.getPublicExponent()));
    }

    public static JsonWebKeySet keySet(JsonWebKey... keys) {
        return new JsonWebKeySet(List.of(keys));
    }

    /**
     * Builder pre-filled with valid claims for {@code email}, valid for five minutes from {@code now}.
     */
    public static JwtBuilder assertion(String email, Instant now) {
        return Jwts.builder()
            .issuer(ISSUER)
            .audience().add(AUDIENCE).and()
            .subject("idp|" + email)
            .claim("email", email)
            .id(UUID.randomUUID().toString())
            .issuedAt(Date.from(now))
            .expiration(Date.from(now.plusSeconds(300)));
    }

    public static String signed(JwtBuilder builder, String kid, KeyPair keyPair) {
        if (kid != null) {
            builder.header().keyId(kid).and();
        }
        return builder.signWith(keyPair.getPrivate(), Jwts.SIG.RS256).compact();
    }

    private static String base64Url(BigInteger value) {
        byte[] bytes = value.toByteArray();
        if (bytes.length > 1 && bytes[0] == 0) {
            bytes = Arrays.copyOfRange(bytes, 1, bytes.length);
        }
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
