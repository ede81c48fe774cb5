package decentralabs.handoff.service.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import decentralabs.handoff.exception.AssertionVerificationException;
import decentralabs.handoff.exception.ClaimValidationException;
import decentralabs.handoff.exception.EmailMismatchException;
import decentralabs.handoff.exception.ErrorCode;
import decentralabs.handoff.exception.ReplayDetectedException;
import decentralabs.handoff.exception.UserAccessDeniedException;
import decentralabs.handoff.model.AssertionClaims;
import decentralabs.handoff.model.UserRecord;
import decentralabs.handoff.model.UserStatus;
import decentralabs.handoff.service.persistence.ReplayGuardService;
import decentralabs.handoff.service.persistence.UserDirectoryService;
import decentralabs.handoff.service.session.SessionTokenService;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class HandoffServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    @Mock
    private AssertionVerifier assertionVerifier;
    @Mock
    private ClaimsValidator claimsValidator;
    @Mock
    private ReplayGuardService replayGuardService;
    @Mock
    private UserDirectoryService userDirectoryService;
    @Mock
    private SessionTokenService sessionTokenService;

    @InjectMocks
    private HandoffService handoffService;

    private static AssertionClaims claims(String email, String nonce) {
        return new AssertionClaims("iss", Set.of("aud"), "sub", email, NOW.plusSeconds(60), null, NOW, nonce);
    }

    private static UserRecord user(UserStatus status) {
        return new UserRecord("alice@example.com", "u1", status, "viewer,editor", NOW);
    }

    @Nested
    @DisplayName("Successful exchange")
    class Success {

        @Test
        @DisplayName("Issues a session for an active user, checks in order")
        void issuesSession() throws Exception {
            when(assertionVerifier.verify("jwt")).thenReturn(claims("Alice@Example.com", "n1"));
            when(replayGuardService.recordNonce("n1")).thenReturn(true);
            when(userDirectoryService.findByEmail("Alice@Example.com")).thenReturn(Optional.of(user(UserStatus.ACTIVE)));
            when(sessionTokenService.issue("u1", "alice@example.com", "viewer,editor")).thenReturn("session-token");

            String token = handoffService.exchange("jwt", "alice@EXAMPLE.com");

            assertThat(token).isEqualTo("session-token");
            InOrder order = inOrder(assertionVerifier, claimsValidator, replayGuardService, userDirectoryService, sessionTokenService);
            order.verify(assertionVerifier).verify("jwt");
            order.verify(claimsValidator).validate(any());
            order.verify(replayGuardService).recordNonce("n1");
            order.verify(userDirectoryService).findByEmail("Alice@Example.com");
            order.verify(sessionTokenService).issue("u1", "alice@example.com", "viewer,editor");
        }

        @Test
        @DisplayName("Assertion without nonce skips the replay guard")
        void skipsReplayGuardWithoutNonce() throws Exception {
            when(assertionVerifier.verify("jwt")).thenReturn(claims("alice@example.com", null));
            when(userDirectoryService.findByEmail("alice@example.com")).thenReturn(Optional.of(user(UserStatus.ACTIVE)));
            when(sessionTokenService.issue(anyString(), anyString(), anyString())).thenReturn("t");

            handoffService.exchange("jwt", "alice@example.com");

            verifyNoInteractions(replayGuardService);
        }
    }

    @Nested
    @DisplayName("Rejected exchange")
    class Rejections {

        @Test
        void signatureFailureStopsEverything() throws Exception {
            when(assertionVerifier.verify("jwt")).thenThrow(new AssertionVerificationException("Invalid JWT", "bad"));

            assertThatThrownBy(() -> handoffService.exchange("jwt", "alice@example.com"))
                .isInstanceOf(AssertionVerificationException.class);
            verifyNoInteractions(replayGuardService, userDirectoryService, sessionTokenService);
        }

        @Test
        void claimFailureStopsBeforeNonce() throws Exception {
            AssertionClaims claims = claims("alice@example.com", "n1");
            when(assertionVerifier.verify("jwt")).thenReturn(claims);
            doThrow(new ClaimValidationException("iss", "Invalid issuer")).when(claimsValidator).validate(claims);

            assertThatThrownBy(() -> handoffService.exchange("jwt", "alice@example.com"))
                .isInstanceOf(ClaimValidationException.class);
            verifyNoInteractions(replayGuardService);
        }

        @Test
        void emailMismatchDoesNotBurnNonce() throws Exception {
            when(assertionVerifier.verify("jwt")).thenReturn(claims("alice@example.com", "n1"));

            assertThatThrownBy(() -> handoffService.exchange("jwt", "bob@example.com"))
                .isInstanceOf(EmailMismatchException.class);
            verify(replayGuardService, never()).recordNonce(anyString());
        }

        @Test
        void replayedNonceIsRejected() throws Exception {
            when(assertionVerifier.verify("jwt")).thenReturn(claims("alice@example.com", "n1"));
            when(replayGuardService.recordNonce("n1")).thenReturn(false);

            assertThatThrownBy(() -> handoffService.exchange("jwt", "alice@example.com"))
                .isInstanceOf(ReplayDetectedException.class);
            verifyNoInteractions(userDirectoryService, sessionTokenService);
        }

        @Test
        void unknownUserStillBurnsNonce() throws Exception {
            when(assertionVerifier.verify("jwt")).thenReturn(claims("alice@example.com", "n1"));
            when(replayGuardService.recordNonce("n1")).thenReturn(true);
            when(userDirectoryService.findByEmail("alice@example.com")).thenReturn(Optional.empty());

            assertThatThrownBy(() -> handoffService.exchange("jwt", "alice@example.com"))
                .isInstanceOf(UserAccessDeniedException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.USER_NOT_ALLOWED);
            verify(replayGuardService).recordNonce("n1");
            verifyNoInteractions(sessionTokenService);
        }

        @Test
        void suspendedUserIsRejected() throws Exception {
            when(assertionVerifier.verify("jwt")).thenReturn(claims("alice@example.com", "n1"));
            when(replayGuardService.recordNonce("n1")).thenReturn(true);
            when(userDirectoryService.findByEmail("alice@example.com")).thenReturn(Optional.of(user(UserStatus.SUSPENDED)));

            assertThatThrownBy(() -> handoffService.exchange("jwt", "alice@example.com"))
                .hasFieldOrPropertyWithValue("code", ErrorCode.USER_SUSPENDED);
            verifyNoInteractions(sessionTokenService);
        }
    }
}
