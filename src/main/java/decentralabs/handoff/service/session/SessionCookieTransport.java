package decentralabs.handoff.service.session;

import decentralabs.handoff.config.HandoffProperties;
import jakarta.servlet.http.HttpServletRequest;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.util.UriUtils;

/**
 * Writes and reads the session cookie. Cookies are always HttpOnly and Secure.
 */
@Component
@RequiredArgsConstructor
public class SessionCookieTransport {

    private final HandoffProperties properties;

    public String sessionCookie(String token, Duration maxAge) {
        return encode(properties.getCookie().getName(), token, maxAge);
    }

    /**
     * Same name, domain and path as the session cookie, with an immediate expiry.
     */
    public String clearingCookie() {
        return encode(properties.getCookie().getName(), "", Duration.ZERO);
    }

    public String encode(String name, String value, Duration maxAge) {
        HandoffProperties.Cookie settings = properties.getCookie();
        ResponseCookie.ResponseCookieBuilder builder = ResponseCookie
            .from(name, UriUtils.encode(value, StandardCharsets.UTF_8))
            .path(StringUtils.hasText(settings.getPath()) ? settings.getPath() : "/")
            .maxAge(maxAge)
            .httpOnly(true)
            .secure(true)
            .sameSite(settings.getSameSite());
        if (StringUtils.hasText(settings.getDomain())) {
            builder.domain(settings.getDomain());
        }
        return builder.build().toString();
    }

    public Optional<String> readSessionToken(HttpServletRequest request) {
        String value = parse(request.getHeader(HttpHeaders.COOKIE)).get(properties.getCookie().getName());
        return StringUtils.hasText(value) ? Optional.of(value) : Optional.empty();
    }

    /**
     * Parses a {@code Cookie} header. Pairs without {@code =} or with an undecodable
     * value are skipped; a repeated name keeps its last value.
     */
    public static Map<String, String> parse(String header) {
        Map<String, String> cookies = new LinkedHashMap<>();
        if (header == null || header.isBlank()) {
            return cookies;
        }
        for (String pair : header.split(";")) {
            int eq = pair.indexOf('=');
            if (eq < 0) {
                continue;
            }
            String name = pair.substring(0, eq).trim();
            if (name.isEmpty()) {
                continue;
            }
            try {
                cookies.put(name, UriUtils.decode(pair.substring(eq + 1).trim(), StandardCharsets.UTF_8));
            } catch (IllegalArgumentException malformed) {
                // undecodable pair, later pairs still count
                continue;
            }
        }
        return cookies;
    }
}
