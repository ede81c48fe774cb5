package decentralabs.handoff.service.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import decentralabs.handoff.config.HandoffProperties;
import decentralabs.handoff.exception.AssertionVerificationException;
import decentralabs.handoff.exception.ClaimValidationException;
import decentralabs.handoff.model.AssertionClaims;
import decentralabs.handoff.support.TestAssertions;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Date;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class AssertionVerifierTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    private static KeyPair primary;
    private static KeyPair secondary;

    private AssertionVerifier verifier;

    @BeforeAll
    static void generateKeys() {
        primary = TestAssertions.rsaKeyPair();
        secondary = TestAssertions.rsaKeyPair();
    }

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        JwksKeyCache cache = new JwksKeyCache(
            () -> TestAssertions.keySet(TestAssertions.jwk("primary", primary), TestAssertions.jwk("secondary", secondary)),
            Duration.ofMinutes(10), clock);
        verifier = new AssertionVerifier(cache, clock);
    }

    @Nested
    @DisplayName("Accepted assertions")
    class Accepted {

        @Test
        @DisplayName("Token signed with the key named by kid verifies")
        void verifiesWithMatchingKid() throws Exception {
            String token = TestAssertions.signed(TestAssertions.assertion("alice@example.com", NOW), "secondary", secondary);

            AssertionClaims claims = verifier.verify(token);

            assertThat(claims.email()).isEqualTo("alice@example.com");
            assertThat(claims.issuer()).isEqualTo(TestAssertions.ISSUER);
            assertThat(claims.audience()).containsExactly(TestAssertions.AUDIENCE);
            assertThat(claims.nonce()).isNotBlank();
        }

        @Test
        @DisplayName("Token without kid uses the first published key")
        void fallsBackToFirstKeyWithoutKid() throws Exception {
            String token = TestAssertions.signed(TestAssertions.assertion("alice@example.com", NOW), null, primary);

            assertThat(verifier.verify(token).subject()).isEqualTo("idp|alice@example.com");
        }
    }

    @Nested
    @DisplayName("Rejected assertions")
    class Rejected {

        @Test
        @DisplayName("Unknown kid fails even when another cached key would verify")
        void unknownKidFailsClosed() {
            String token = TestAssertions.signed(TestAssertions.assertion("alice@example.com", NOW), "rotated", primary);

            assertThatThrownBy(() -> verifier.verify(token)).isInstanceOf(AssertionVerificationException.class);
        }

        @Test
        @DisplayName("Token without kid signed by a later key fails")
        void noKidWrongKey() {
            String token = TestAssertions.signed(TestAssertions.assertion("alice@example.com", NOW), null, secondary);

            assertThatThrownBy(() -> verifier.verify(token)).isInstanceOf(AssertionVerificationException.class);
        }

        @Test
        @DisplayName("HS256 token is rejected before key selection")
        void rejectsSymmetricAlgorithm() {
            String token = TestAssertions.assertion("alice@example.com", NOW)
                .header().keyId("primary").and()
                .signWith(Keys.hmacShaKeyFor("an-hmac-secret-that-is-long-enough!!".getBytes(StandardCharsets.UTF_8)),
                    Jwts.SIG.HS256)
                .compact();

            assertThatThrownBy(() -> verifier.verify(token)).isInstanceOf(AssertionVerificationException.class);
        }

        @Test
        @DisplayName("Tampered payload fails signature check")
        void rejectsTamperedToken() {
            String token = TestAssertions.signed(TestAssertions.assertion("alice@example.com", NOW), "primary", primary);
            String other = TestAssertions.signed(TestAssertions.assertion("mallory@example.com", NOW), "primary", primary);
            String[] parts = token.split("\\.");
            String forged = parts[0] + "." + other.split("\\.")[1] + "." + parts[2];

            assertThatThrownBy(() -> verifier.verify(forged)).isInstanceOf(AssertionVerificationException.class);
        }

        @Test
        @DisplayName("Expired token with a valid signature is handed on for claim checks")
        void returnsExpiredClaimsForValidation() throws Exception {
            String token = TestAssertions.signed(TestAssertions.assertion("alice@example.com", NOW.minusSeconds(600))
                .expiration(Date.from(NOW.minusSeconds(1))), "primary", primary);

            AssertionClaims claims = verifier.verify(token);

            assertThat(claims.expiresAt()).isEqualTo(NOW.minusSeconds(1));
            assertThatThrownBy(() -> claimsValidator().validate(claims))
                .isInstanceOf(ClaimValidationException.class)
                .hasFieldOrPropertyWithValue("claim", "exp");
        }

        @Test
        @DisplayName("Expired token from a foreign issuer reports the issuer first")
        void issuerFailureWinsOverExpiry() throws Exception {
            String token = TestAssertions.signed(TestAssertions.assertion("alice@example.com", NOW.minusSeconds(600))
                .issuer("https://evil.example")
                .expiration(Date.from(NOW.minusSeconds(1))), "primary", primary);

            AssertionClaims claims = verifier.verify(token);

            assertThatThrownBy(() -> claimsValidator().validate(claims))
                .isInstanceOf(ClaimValidationException.class)
                .hasFieldOrPropertyWithValue("claim", "iss");
        }

        @Test
        @DisplayName("Expired token with a bad signature is still a verification failure")
        void rejectsExpiredTokenSignedByUnknownKey() {
            KeyPair stranger = TestAssertions.rsaKeyPair();
            String token = TestAssertions.signed(TestAssertions.assertion("alice@example.com", NOW.minusSeconds(600))
                .expiration(Date.from(NOW.minusSeconds(1))), "primary", stranger);

            assertThatThrownBy(() -> verifier.verify(token)).isInstanceOf(AssertionVerificationException.class);
        }

        @Test
        @DisplayName("Garbage input is a verification failure")
        void rejectsGarbage() {
            assertThatThrownBy(() -> verifier.verify("not-a-jwt")).isInstanceOf(AssertionVerificationException.class);
            assertThatThrownBy(() -> verifier.verify("")).isInstanceOf(AssertionVerificationException.class);
        }
    }

    private static ClaimsValidator claimsValidator() {
        HandoffProperties properties = new HandoffProperties();
        properties.getAssertion().setIssuer(TestAssertions.ISSUER);
        properties.getAssertion().setAudience(TestAssertions.AUDIENCE);
        return new ClaimsValidator(properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }
}
