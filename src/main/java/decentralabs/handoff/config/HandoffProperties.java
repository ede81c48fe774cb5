package decentralabs.handoff.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Gateway settings bound from the {@code handoff.*} namespace.
 */
@Data
@Component
@ConfigurationProperties(prefix = "handoff")
public class HandoffProperties {

    private Assertion assertion = new Assertion();
    private Session session = new Session();
    private Cookie cookie = new Cookie();
    private Gateway gateway = new Gateway();
    private Cors cors = new Cors();
    private Migration migration = new Migration();
    private Replay replay = new Replay();

    /**
     * Trust settings for identity-provider assertions.
     */
    @Data
    public static class Assertion {
        private String issuer;
        private String audience;
        private String jwksUrl;
        private Duration jwksTtl = Duration.ofMinutes(10);
    }

    /**
     * Settings for the session tokens this gateway mints.
     */
    @Data
    public static class Session {
        private String issuer = "handoff-gateway";
        private String audience = "upstream-app";
        private String secret;
        private Duration ttl = Duration.ofSeconds(600);
    }

    @Data
    public static class Cookie {
        private String name = "handoff_access";
        private String domain;
        private String path = "/";
        private String sameSite = "None";
    }

    @Data
    public static class Gateway {
        private String protectedPrefix = "/apps";
        private String upstreamOrigin;
        private String handoffPath = "/api/auth/sso-handoff";
        private String completePath = "/api/auth/sso-complete";
    }

    @Data
    public static class Cors {
        private List<String> allowedOrigins = new ArrayList<>();
    }

    @Data
    public static class Migration {
        private boolean enabled = false;
    }

    @Data
    public static class Replay {
        private Duration retention = Duration.ofHours(24);
    }
}
