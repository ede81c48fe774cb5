package decentralabs.handoff.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import decentralabs.handoff.model.SessionPrincipal;

/**
 * Body of {@code GET /auth/me}.
 */
public record SessionInfoResponse(
    @JsonProperty("user_id") String userId,
    String email,
    String roles
) {
    public static SessionInfoResponse from(SessionPrincipal principal) {
        return new SessionInfoResponse(principal.userId(), principal.email(), principal.roles());
    }
}
