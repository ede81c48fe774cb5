package decentralabs.handoff.service.gateway;

import decentralabs.handoff.config.HandoffProperties;
import decentralabs.handoff.exception.UpstreamUnavailableException;
import decentralabs.handoff.model.SessionPrincipal;
import decentralabs.handoff.util.LogSanitizer;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.net.URI;
import java.util.Collections;
import java.util.Locale;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Service;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

/**
 * Relays an authenticated request to the upstream origin and streams the
 * response back unchanged, apart from hop-by-hop headers. A header the upstream
 * sends wins over any value the gateway filters wrote for the same name.
 * Identity headers are always set from the session, never from the caller.
 */
@Service
@Slf4j
public class ReverseProxyService {

    private static final Set<String> HOP_BY_HOP_HEADERS = Set.of(
        "connection", "keep-alive", "proxy-authenticate", "proxy-authorization",
        "te", "trailer", "trailers", "transfer-encoding", "upgrade", "host", "content-length"
    );

    private static final Set<String> IDENTITY_HEADERS = Set.of(
        UpstreamHandoffClient.USER_ID_HEADER.toLowerCase(Locale.ROOT),
        UpstreamHandoffClient.USER_EMAIL_HEADER.toLowerCase(Locale.ROOT),
        UpstreamHandoffClient.USER_ROLES_HEADER.toLowerCase(Locale.ROOT)
    );

    private final RestTemplate proxyRestTemplate;
    private final HandoffProperties properties;

    public ReverseProxyService(@Qualifier("proxyRestTemplate") RestTemplate proxyRestTemplate,
                               HandoffProperties properties) {
        this.proxyRestTemplate = proxyRestTemplate;
        this.properties = properties;
    }

    public void forward(HttpServletRequest request, HttpServletResponse response, SessionPrincipal principal)
            throws UpstreamUnavailableException {
        URI target = targetUri(request);
        HttpMethod method = HttpMethod.valueOf(request.getMethod());
        try {
            proxyRestTemplate.execute(target, method, upstreamRequest -> {
                HttpHeaders headers = upstreamRequest.getHeaders();
                for (String name : Collections.list(request.getHeaderNames())) {
                    String lower = name.toLowerCase(Locale.ROOT);
                    if (HOP_BY_HOP_HEADERS.contains(lower) || IDENTITY_HEADERS.contains(lower)) {
                        continue;
                    }
                    for (String value : Collections.list(request.getHeaders(name))) {
                        headers.add(name, value);
                    }
                }
                headers.set(UpstreamHandoffClient.USER_ID_HEADER, principal.userId());
                headers.set(UpstreamHandoffClient.USER_EMAIL_HEADER, nullToEmpty(principal.email()));
                headers.set(UpstreamHandoffClient.USER_ROLES_HEADER, nullToEmpty(principal.roles()));
                if (hasBody(request)) {
                    StreamUtils.copy(request.getInputStream(), upstreamRequest.getBody());
                }
            }, upstreamResponse -> {
                response.setStatus(upstreamResponse.getStatusCode().value());
                upstreamResponse.getHeaders().forEach((name, values) -> {
                    if (!HOP_BY_HOP_HEADERS.contains(name.toLowerCase(Locale.ROOT)) && !values.isEmpty()) {
                        // Upstream values replace anything the filters already set, e.g. CORS headers
                        response.setHeader(name, values.get(0));
                        values.stream().skip(1).forEach(value -> response.addHeader(name, value));
                    }
                });
                StreamUtils.copy(upstreamResponse.getBody(), response.getOutputStream());
                response.flushBuffer();
                return null;
            });
        } catch (ResourceAccessException e) {
            log.error("Upstream unreachable for {} {}: {}", method, LogSanitizer.sanitize(target.getPath()), e.getMessage());
            throw new UpstreamUnavailableException("Upstream unavailable", "The upstream application could not be reached", e);
        }
    }

    URI targetUri(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        String query = request.getQueryString();
        String origin = properties.getGateway().getUpstreamOrigin();
        if (origin.endsWith("/")) {
            origin = origin.substring(0, origin.length() - 1);
        }
        return URI.create(origin + path + (query != null ? "?" + query : ""));
    }

    private static boolean hasBody(HttpServletRequest request) {
        return request.getContentLengthLong() > 0 || request.getHeader(HttpHeaders.TRANSFER_ENCODING) != null;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
