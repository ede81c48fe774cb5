package decentralabs.handoff.service.auth;

import decentralabs.handoff.config.HandoffProperties;
import decentralabs.handoff.dto.JsonWebKeySet;
import decentralabs.handoff.exception.AssertionVerificationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Fetches the JWKS document over HTTP.
 */
@Component
@Slf4j
public class RestJwksClient implements JwksClient {

    private final RestTemplate restTemplate;
    private final HandoffProperties properties;

    public RestJwksClient(RestTemplate restTemplate, HandoffProperties properties) {
        this.restTemplate = restTemplate;
        this.properties = properties;
    }

    @Override
    public JsonWebKeySet fetch() throws AssertionVerificationException {
        String jwksUrl = properties.getAssertion().getJwksUrl();
        if (jwksUrl == null || jwksUrl.isBlank()) {
            throw new AssertionVerificationException("Invalid JWT", "JWKS endpoint is not configured");
        }
        try {
            ResponseEntity<JsonWebKeySet> response = restTemplate.getForEntity(jwksUrl, JsonWebKeySet.class);
            JsonWebKeySet body = response.getBody();
            if (body == null || body.keys() == null) {
                throw new AssertionVerificationException("Invalid JWT", "JWKS response has no keys");
            }
            log.debug("Fetched JWKS with {} key(s)", body.keys().size());
            return body;
        } catch (HttpStatusCodeException e) {
            log.warn("JWKS fetch failed with status {}", e.getStatusCode().value());
            throw new AssertionVerificationException("Invalid JWT",
                "Failed to fetch JWKS: " + e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            log.warn("JWKS fetch failed: {}", e.getMessage());
            throw new AssertionVerificationException("Invalid JWT", "Failed to fetch JWKS", e);
        }
    }
}
