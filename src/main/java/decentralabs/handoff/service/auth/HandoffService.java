package decentralabs.handoff.service.auth;

import decentralabs.handoff.exception.EmailMismatchException;
import decentralabs.handoff.exception.GatewayException;
import decentralabs.handoff.exception.ReplayDetectedException;
import decentralabs.handoff.exception.UserAccessDeniedException;
import decentralabs.handoff.model.AssertionClaims;
import decentralabs.handoff.model.UserRecord;
import decentralabs.handoff.service.persistence.ReplayGuardService;
import decentralabs.handoff.service.persistence.UserDirectoryService;
import decentralabs.handoff.service.session.SessionTokenService;
import decentralabs.handoff.util.LogSanitizer;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Exchanges a verified identity assertion for a gateway session token.
 * <p>
 * Steps run in a fixed order and stop at the first failure: signature, claims,
 * email match, nonce, directory. The nonce is recorded before the directory
 * lookup, so a rejected user still burns it.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class HandoffService {

    private final AssertionVerifier assertionVerifier;
    private final ClaimsValidator claimsValidator;
    private final ReplayGuardService replayGuardService;
    private final UserDirectoryService userDirectoryService;
    private final SessionTokenService sessionTokenService;

    /**
     * @return a freshly minted session token for the directory user
     */
    public String exchange(String assertion, String claimedEmail) throws GatewayException {
        AssertionClaims claims = assertionVerifier.verify(assertion);
        claimsValidator.validate(claims);

        if (!claims.email().toLowerCase(Locale.ROOT).equals(claimedEmail.toLowerCase(Locale.ROOT))) {
            log.warn("Email mismatch for subject {}", LogSanitizer.maskIdentifier(claims.subject()));
            throw new EmailMismatchException("Email mismatch", "Email does not match the verified token");
        }

        if (claims.nonce() != null && !claims.nonce().isBlank()
                && !replayGuardService.recordNonce(claims.nonce())) {
            throw new ReplayDetectedException("JWT replay detected", "This token has already been used");
        }

        UserRecord user = userDirectoryService.findByEmail(claims.email())
            .orElseThrow(() -> {
                log.warn("Access denied for unknown user {}", LogSanitizer.maskEmail(claims.email()));
                return UserAccessDeniedException.notAllowed();
            });
        if (user.isSuspended()) {
            log.warn("Access denied for suspended user {}", LogSanitizer.maskIdentifier(user.userId()));
            throw UserAccessDeniedException.suspended();
        }

        String token = sessionTokenService.issue(user.userId(), user.email(), user.roles());
        log.info("Session issued for user {}", LogSanitizer.maskIdentifier(user.userId()));
        return token;
    }
}
