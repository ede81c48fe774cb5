package decentralabs.handoff.controller.auth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import decentralabs.handoff.dto.HandoffRequest;
import decentralabs.handoff.dto.SessionInfoResponse;
import decentralabs.handoff.exception.GatewayException;
import decentralabs.handoff.exception.InvalidRequestException;
import decentralabs.handoff.exception.SessionRejectedException;
import decentralabs.handoff.model.SessionPrincipal;
import decentralabs.handoff.service.auth.HandoffService;
import decentralabs.handoff.service.session.SessionCookieTransport;
import decentralabs.handoff.service.session.SessionTokenService;
import jakarta.servlet.http.HttpServletRequest;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Session lifecycle endpoints: assertion exchange, introspection, logout and liveness.
 */
@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
@Slf4j
public class HandoffController {

    private final HandoffService handoffService;
    private final SessionTokenService sessionTokenService;
    private final SessionCookieTransport cookieTransport;
    private final ObjectMapper objectMapper;

    /**
     * Exchanges an identity assertion for a session cookie.
     * Answers 204 with {@code Set-Cookie} on success.
     */
    @PostMapping("/vibe-access")
    public ResponseEntity<Void> exchange(HttpServletRequest request,
                                         @RequestBody(required = false) String body) throws GatewayException {
        if (!isJson(request.getContentType())) {
            throw InvalidRequestException.contentType();
        }
        HandoffRequest handoffRequest = parse(body);
        if (!handoffRequest.isComplete()) {
            throw InvalidRequestException.missingFields();
        }

        String token = handoffService.exchange(handoffRequest.getJwt(), handoffRequest.getEmail());
        return ResponseEntity.noContent()
            .header(HttpHeaders.SET_COOKIE, cookieTransport.sessionCookie(token, sessionTokenService.getTtl()))
            .build();
    }

    @GetMapping("/me")
    public ResponseEntity<SessionInfoResponse> me(@AuthenticationPrincipal SessionPrincipal principal)
            throws SessionRejectedException {
        if (principal == null) {
            throw new SessionRejectedException("Unauthorized", "No session cookie found");
        }
        return ResponseEntity.ok(SessionInfoResponse.from(principal));
    }

    @PostMapping("/logout")
    public ResponseEntity<Map<String, Object>> logout() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("message", "Logged out");
        return ResponseEntity.ok()
            .header(HttpHeaders.SET_COOKIE, cookieTransport.clearingCookie())
            .body(response);
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of("ok", true));
    }

    private HandoffRequest parse(String body) throws InvalidRequestException {
        if (body == null || body.isBlank()) {
            throw InvalidRequestException.malformedBody();
        }
        try {
            HandoffRequest parsed = objectMapper.readValue(body, HandoffRequest.class);
            if (parsed == null) {
                throw InvalidRequestException.malformedBody();
            }
            return parsed;
        } catch (JsonProcessingException e) {
            log.debug("Unparseable exchange body: {}", e.getOriginalMessage());
            throw InvalidRequestException.malformedBody();
        }
    }

    private static boolean isJson(String contentType) {
        if (contentType == null) {
            return false;
        }
        try {
            return MediaType.APPLICATION_JSON.isCompatibleWith(MediaType.parseMediaType(contentType));
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
