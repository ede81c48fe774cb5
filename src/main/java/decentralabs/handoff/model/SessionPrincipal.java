package decentralabs.handoff.model;

import java.security.Principal;
import java.time.Instant;

/**
 * Identity carried by a verified session token.
 */
public record SessionPrincipal(String userId, String email, String roles, Instant expiresAt) implements Principal {

    @Override
    public String getName() {
        return userId;
    }
}
