package decentralabs.handoff.security;

import decentralabs.handoff.exception.SessionRejectedException;
import decentralabs.handoff.model.SessionPrincipal;
import decentralabs.handoff.service.session.SessionCookieTransport;
import decentralabs.handoff.service.session.SessionTokenService;
import jakarta.annotation.Nonnull;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates requests carrying a valid session cookie. A missing or invalid
 * cookie leaves the request anonymous; the reason is kept for the entry point.
 * Not a bean: it is only ever added to the security filter chain.
 */
@Slf4j
public class SessionCookieAuthenticationFilter extends OncePerRequestFilter {

    public static final String REJECTION_ATTRIBUTE = SessionCookieAuthenticationFilter.class.getName() + ".REJECTION";

    private final SessionTokenService sessionTokenService;
    private final SessionCookieTransport cookieTransport;

    public SessionCookieAuthenticationFilter(SessionTokenService sessionTokenService,
                                             SessionCookieTransport cookieTransport) {
        this.sessionTokenService = sessionTokenService;
        this.cookieTransport = cookieTransport;
    }

    @Override
    protected void doFilterInternal(
            @Nonnull HttpServletRequest request,
            @Nonnull HttpServletResponse response,
            @Nonnull FilterChain filterChain
    ) throws ServletException, IOException {
        Optional<String> token = cookieTransport.readSessionToken(request);
        if (token.isPresent()) {
            try {
                SessionPrincipal principal = sessionTokenService.verify(token.get());
                UsernamePasswordAuthenticationToken authentication =
                    UsernamePasswordAuthenticationToken.authenticated(principal, null, authorities(principal.roles()));
                SecurityContext context = SecurityContextHolder.createEmptyContext();
                context.setAuthentication(authentication);
                SecurityContextHolder.setContext(context);
            } catch (SessionRejectedException e) {
                request.setAttribute(REJECTION_ATTRIBUTE, e.getMessage());
            }
        }
        filterChain.doFilter(request, response);
    }

    static List<GrantedAuthority> authorities(String roles) {
        if (roles == null || roles.isBlank()) {
            return List.of();
        }
        return Arrays.stream(roles.split(","))
            .map(String::trim)
            .filter(role -> !role.isEmpty())
            .map(role -> (GrantedAuthority) new SimpleGrantedAuthority("ROLE_" + role.toUpperCase(Locale.ROOT)))
            .toList();
    }
}
