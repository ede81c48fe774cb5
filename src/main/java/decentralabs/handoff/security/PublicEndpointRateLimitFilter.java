package decentralabs.handoff.security;

import decentralabs.handoff.dto.ErrorResponse;
import decentralabs.handoff.exception.ErrorCode;
import decentralabs.handoff.util.LogSanitizer;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import jakarta.annotation.Nonnull;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Per-client token bucket on the assertion exchange endpoint.
 * Runs after the origin guard so rejected origins never consume tokens.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 20)
@Slf4j
public class PublicEndpointRateLimitFilter extends OncePerRequestFilter {

    static final String EXCHANGE_PATH = "/auth/vibe-access";

    // Maximum buckets to prevent memory exhaustion
    private static final int MAX_BUCKETS = 50000;

    @Value("${rate.limit.exchange.requests.per.minute:30}")
    private int exchangeRequestsPerMinute;

    @Value("${rate.limit.exchange.burst:10}")
    private int exchangeBurst;

    @Value("${rate.limit.enabled:true}")
    private boolean rateLimitEnabled;

    private final Map<String, Bucket> exchangeBuckets = new ConcurrentHashMap<>();

    @Override
    protected boolean shouldNotFilter(@Nonnull HttpServletRequest request) {
        return !rateLimitEnabled
            || !EXCHANGE_PATH.equals(request.getRequestURI().substring(request.getContextPath().length()));
    }

    @Override
    protected void doFilterInternal(
            @Nonnull HttpServletRequest request,
            @Nonnull HttpServletResponse response,
            @Nonnull FilterChain filterChain
    ) throws ServletException, IOException {
        String clientIp = getClientIp(request);
        if (exchangeBuckets.size() > MAX_BUCKETS) {
            log.info("Cleaning up rate limit buckets, current size: {}", exchangeBuckets.size());
            exchangeBuckets.clear();
        }
        Bucket bucket = exchangeBuckets.computeIfAbsent(clientIp, k -> createBucket());
        if (!bucket.tryConsume(1)) {
            log.warn("Rate limit exceeded for exchange endpoint: ip={}", maskIp(clientIp));
            response.setStatus(429);
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            response.setHeader("Retry-After", "60");
            response.getWriter().write(ErrorResponse.of(ErrorCode.RATE_LIMITED,
                "Too many requests. Please try again later.").toJson());
            return;
        }
        filterChain.doFilter(request, response);
    }

    private Bucket createBucket() {
        return Bucket.builder()
            .addLimit(Bandwidth.builder()
                .capacity(exchangeBurst)
                .refillGreedy(exchangeRequestsPerMinute, Duration.ofMinutes(1))
                .build())
            .build();
    }

    private String getClientIp(HttpServletRequest request) {
        // First hop of X-Forwarded-For is the original client
        String forwardedFor = request.getHeader("X-Forwarded-For");
        if (forwardedFor != null && !forwardedFor.isEmpty()) {
            return forwardedFor.split(",")[0].trim();
        }
        String realIp = request.getHeader("X-Real-IP");
        if (realIp != null && !realIp.isEmpty()) {
            return realIp.trim();
        }
        return request.getRemoteAddr();
    }

    private String maskIp(String ip) {
        if (ip == null) {
            return "unknown";
        }
        int lastDot = ip.lastIndexOf('.');
        if (lastDot > 0) {
            return ip.substring(0, lastDot) + ".***";
        }
        return LogSanitizer.maskIdentifier(ip);
    }
}
