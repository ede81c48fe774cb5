package decentralabs.handoff.security;

import decentralabs.handoff.config.HandoffProperties;
import decentralabs.handoff.dto.ErrorResponse;
import decentralabs.handoff.exception.ErrorCode;
import decentralabs.handoff.util.LogSanitizer;
import jakarta.annotation.Nonnull;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.UrlPathHelper;

/**
 * Cross-origin policy for browser callers.
 * <p>
 * Requests without an {@code Origin} header pass untouched. A present origin must
 * be in {@code handoff.cors.allowed-origins}, otherwise the request is answered
 * with 403 before any body is read. Allowed origins get credentialed CORS headers
 * on every response and preflights are answered here with 204.
 * The migration and liveness endpoints are exempt.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
@Slf4j
@RequiredArgsConstructor
public class OriginGuardFilter extends OncePerRequestFilter {

    static final String ALLOWED_METHODS = "POST, GET, OPTIONS";
    static final String ALLOWED_HEADERS = "Content-Type, X-Requested-With, Authorization";
    static final String MAX_AGE_SECONDS = "86400";

    private static final Set<String> EXEMPT_PATHS = Set.of("/migrate", "/auth/health");
    private static final UrlPathHelper PATH_HELPER = new UrlPathHelper();

    private final HandoffProperties properties;

    @Override
    protected boolean shouldNotFilter(@Nonnull HttpServletRequest request) {
        return EXEMPT_PATHS.contains(PATH_HELPER.getPathWithinApplication(request));
    }

    @Override
    protected void doFilterInternal(
            @Nonnull HttpServletRequest request,
            @Nonnull HttpServletResponse response,
            @Nonnull FilterChain filterChain
    ) throws ServletException, IOException {
        String origin = request.getHeader(HttpHeaders.ORIGIN);
        if (origin == null) {
            filterChain.doFilter(request, response);
            return;
        }

        if (!isAllowed(origin)) {
            log.warn("Rejected request from origin {} to {}",
                LogSanitizer.sanitizeOrDefault(origin, "unknown"), LogSanitizer.sanitize(request.getRequestURI()));
            response.setStatus(HttpServletResponse.SC_FORBIDDEN);
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            response.getWriter().write(new ErrorResponse("Forbidden", ErrorCode.FORBIDDEN.name(), "Invalid origin").toJson());
            return;
        }

        response.setHeader(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, origin);
        response.setHeader(HttpHeaders.ACCESS_CONTROL_ALLOW_CREDENTIALS, "true");
        response.addHeader(HttpHeaders.VARY, HttpHeaders.ORIGIN);

        if (HttpMethod.OPTIONS.matches(request.getMethod())) {
            response.setHeader(HttpHeaders.ACCESS_CONTROL_ALLOW_METHODS, ALLOWED_METHODS);
            response.setHeader(HttpHeaders.ACCESS_CONTROL_ALLOW_HEADERS, ALLOWED_HEADERS);
            response.setHeader(HttpHeaders.ACCESS_CONTROL_MAX_AGE, MAX_AGE_SECONDS);
            response.setStatus(HttpServletResponse.SC_NO_CONTENT);
            return;
        }

        filterChain.doFilter(request, response);
    }

    private boolean isAllowed(String origin) {
        return properties.getCors().getAllowedOrigins().stream()
            .map(String::trim)
            .anyMatch(origin::equals);
    }
}
