package decentralabs.handoff.service.gateway;

import decentralabs.handoff.config.HandoffProperties;
import decentralabs.handoff.dto.UpstreamHandoffResponse;
import decentralabs.handoff.exception.HandoffFailedException;
import decentralabs.handoff.model.SessionPrincipal;
import decentralabs.handoff.util.LogSanitizer;
import java.net.URI;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Asks the upstream application to open its own session for a gateway user and
 * builds the browser redirect that completes it.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class UpstreamHandoffClient {

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String USER_EMAIL_HEADER = "X-User-Email";
    public static final String USER_ROLES_HEADER = "X-User-Roles";

    private final RestTemplate restTemplate;
    private final HandoffProperties properties;

    /**
     * @param redirectPath path the upstream application lands the user on afterwards
     * @return absolute completion URL carrying the upstream access token
     */
    public URI beginSession(SessionPrincipal principal, String redirectPath) throws HandoffFailedException {
        HandoffProperties.Gateway gateway = properties.getGateway();
        URI handoffUri = UriComponentsBuilder.fromUriString(gateway.getUpstreamOrigin())
            .path(gateway.getHandoffPath())
            .build()
            .toUri();

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(USER_ID_HEADER, principal.userId());
        headers.set(USER_EMAIL_HEADER, nullToEmpty(principal.email()));
        headers.set(USER_ROLES_HEADER, nullToEmpty(principal.roles()));

        UpstreamHandoffResponse body;
        try {
            ResponseEntity<UpstreamHandoffResponse> response = restTemplate.exchange(
                handoffUri, HttpMethod.POST, new HttpEntity<>(headers), UpstreamHandoffResponse.class);
            body = response.getBody();
        } catch (HttpStatusCodeException e) {
            log.error("Upstream handoff refused for user {}: status {}",
                LogSanitizer.maskIdentifier(principal.userId()), e.getStatusCode().value());
            throw new HandoffFailedException("Authentication handoff failed",
                "Failed to create session in main application", e);
        } catch (RestClientException e) {
            log.error("Upstream handoff unreachable for user {}: {}",
                LogSanitizer.maskIdentifier(principal.userId()), e.getMessage());
            throw new HandoffFailedException("Authentication handoff failed",
                "Failed to create session in main application", e);
        }

        if (body == null || !body.success() || body.accessToken() == null || body.accessToken().isBlank()) {
            log.error("Upstream handoff returned an unusable response for user {}",
                LogSanitizer.maskIdentifier(principal.userId()));
            throw new HandoffFailedException("Invalid handoff response", "Main application returned an invalid session");
        }

        return UriComponentsBuilder.fromUriString(gateway.getUpstreamOrigin())
            .path(gateway.getCompletePath())
            .queryParam("token", "{token}")
            .queryParam("redirect", "{redirect}")
            .encode()
            .buildAndExpand(body.accessToken(), redirectPath)
            .toUri();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
