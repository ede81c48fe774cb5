package decentralabs.handoff.dto;

import decentralabs.handoff.model.UserRecord;

public record SsoUserResponse(String email, String userId, String status, String roles, long updatedAt) {

    public static SsoUserResponse from(UserRecord user) {
        return new SsoUserResponse(user.email(), user.userId(), user.status().getValue(),
            user.roles(), user.updatedAt().getEpochSecond());
    }
}
