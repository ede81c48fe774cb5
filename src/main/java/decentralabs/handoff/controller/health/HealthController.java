package decentralabs.handoff.controller.health;

import decentralabs.handoff.service.auth.JwksKeyCache;
import decentralabs.handoff.service.persistence.SchemaMigrationService;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operational status. Degraded (503) when the database cannot be reached.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private final JwksKeyCache jwksKeyCache;
    private final SchemaMigrationService migrationService;
    private final ObjectProvider<JdbcTemplate> jdbcTemplateProvider;
    private final Clock clock;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        boolean databaseUp = isDatabaseUp();

        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", databaseUp ? "UP" : "DEGRADED");
        health.put("timestamp", clock.instant().toString());
        health.put("service", "handoff-gateway");
        health.put("jwks_cached", jwksKeyCache.isCached());
        health.put("jwks_keys", jwksKeyCache.cachedKeyCount());
        health.put("database_up", databaseUp);
        health.put("migration_enabled", migrationService.isEnabled());

        return ResponseEntity.status(databaseUp ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(health);
    }

    private boolean isDatabaseUp() {
        JdbcTemplate jdbcTemplate = jdbcTemplateProvider.getIfAvailable();
        if (jdbcTemplate == null) {
            return false;
        }
        try {
            jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            return true;
        } catch (DataAccessException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }
}
