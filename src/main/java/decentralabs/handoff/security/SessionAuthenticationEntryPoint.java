package decentralabs.handoff.security;

import decentralabs.handoff.dto.ErrorResponse;
import decentralabs.handoff.exception.ErrorCode;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;

/**
 * Answers unauthenticated access to session-gated routes with 401 {@code NO_SESSION}.
 */
public class SessionAuthenticationEntryPoint implements AuthenticationEntryPoint {

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response,
                         AuthenticationException authException) throws IOException {
        Object rejection = request.getAttribute(SessionCookieAuthenticationFilter.REJECTION_ATTRIBUTE);
        String message = rejection instanceof String text ? text : "No session cookie found";
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.getWriter().write(
            new ErrorResponse(ErrorCode.NO_SESSION.getTitle(), ErrorCode.NO_SESSION.name(), message).toJson());
    }
}
