package decentralabs.handoff.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * Published JWKS document. Key order is preserved as served.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JsonWebKeySet(List<JsonWebKey> keys) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record JsonWebKey(String kty, String use, String kid, String alg, String n, String e) {
    }
}
