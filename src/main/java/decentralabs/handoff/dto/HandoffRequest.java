package decentralabs.handoff.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Body of {@code POST /auth/vibe-access}.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class HandoffRequest {
    private String jwt;
    private String email;

    public boolean isComplete() {
        return jwt != null && !jwt.isBlank() && email != null && !email.isBlank();
    }
}
