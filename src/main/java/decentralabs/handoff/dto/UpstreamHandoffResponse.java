package decentralabs.handoff.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Reply of the upstream application to a session handoff request.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UpstreamHandoffResponse(boolean success, Data data) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Data(User user, String sessionId, String accessToken) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record User(String id) {
    }

    public String accessToken() {
        return data == null ? null : data.accessToken();
    }
}
