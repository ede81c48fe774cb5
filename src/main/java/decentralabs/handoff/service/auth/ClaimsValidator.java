package decentralabs.handoff.service.auth;

import decentralabs.handoff.config.HandoffProperties;
import decentralabs.handoff.exception.ClaimValidationException;
import decentralabs.handoff.model.AssertionClaims;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Checks a verified assertion against the configured trust settings.
 * Checks run in order issuer, audience, expiry, not-before, email and
 * the first failure is reported. No clock leeway is applied.
 */
@Component
@RequiredArgsConstructor
public class ClaimsValidator {

    private final HandoffProperties properties;
    private final Clock clock;

    public void validate(AssertionClaims claims) throws ClaimValidationException {
        HandoffProperties.Assertion trust = properties.getAssertion();
        if (claims.issuer() == null || !claims.issuer().equals(trust.getIssuer())) {
            throw new ClaimValidationException("iss", "Invalid issuer");
        }
        if (claims.audience().size() != 1 || !claims.audience().contains(trust.getAudience())) {
            throw new ClaimValidationException("aud", "Invalid audience");
        }
        Instant now = clock.instant();
        if (claims.expiresAt() != null && claims.expiresAt().isBefore(now)) {
            throw new ClaimValidationException("exp", "Token expired");
        }
        if (claims.notBefore() != null && claims.notBefore().isAfter(now)) {
            throw new ClaimValidationException("nbf", "Token not yet valid");
        }
        if (claims.email() == null || claims.email().isBlank()) {
            throw new ClaimValidationException("email", "Missing email claim");
        }
    }
}
