package decentralabs.handoff.model;

import java.time.Instant;

/**
 * One row of the user directory, keyed by lower-cased email.
 */
public record UserRecord(String email, String userId, UserStatus status, String roles, Instant updatedAt) {

    public boolean isSuspended() {
        return status == UserStatus.SUSPENDED;
    }
}
