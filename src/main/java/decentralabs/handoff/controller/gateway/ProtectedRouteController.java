package decentralabs.handoff.controller.gateway;

import decentralabs.handoff.config.HandoffProperties;
import decentralabs.handoff.exception.GatewayException;
import decentralabs.handoff.exception.SessionRejectedException;
import decentralabs.handoff.model.SessionPrincipal;
import decentralabs.handoff.service.gateway.ReverseProxyService;
import decentralabs.handoff.service.gateway.UpstreamHandoffClient;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.net.URI;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Entry point for the protected route prefix.
 * A GET on the prefix root starts a session handoff and redirects the browser to
 * the upstream completion URL; everything else is relayed to the upstream origin.
 */
@RestController
@RequiredArgsConstructor
public class ProtectedRouteController {

    private final HandoffProperties properties;
    private final UpstreamHandoffClient handoffClient;
    private final ReverseProxyService reverseProxyService;

    @RequestMapping("${handoff.gateway.protected-prefix:/apps}/**")
    public void route(HttpServletRequest request, HttpServletResponse response,
                      @AuthenticationPrincipal SessionPrincipal principal) throws GatewayException {
        if (principal == null) {
            throw new SessionRejectedException("Unauthorized", "No session cookie found");
        }
        String path = request.getRequestURI().substring(request.getContextPath().length());
        if (isHandoffEntry(request.getMethod(), path)) {
            URI location = handoffClient.beginSession(principal, path);
            response.setStatus(HttpServletResponse.SC_FOUND);
            response.setHeader(HttpHeaders.LOCATION, location.toString());
            return;
        }
        reverseProxyService.forward(request, response, principal);
    }

    private boolean isHandoffEntry(String method, String path) {
        String prefix = properties.getGateway().getProtectedPrefix();
        return HttpMethod.GET.matches(method) && (path.equals(prefix) || path.equals(prefix + "/"));
    }
}
