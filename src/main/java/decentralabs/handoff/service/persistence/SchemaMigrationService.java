package decentralabs.handoff.service.persistence;

import decentralabs.handoff.config.HandoffProperties;
import decentralabs.handoff.exception.MigrationException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

/**
 * Idempotent bootstrap of the directory and nonce tables, gated by
 * {@code handoff.migration.enabled}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SchemaMigrationService {

    static final List<String> STATEMENTS = List.of(
        """
        CREATE TABLE IF NOT EXISTS sso_users (
            email VARCHAR(320) PRIMARY KEY,
            user_id VARCHAR(255) NOT NULL,
            status VARCHAR(32) NOT NULL DEFAULT 'active',
            roles VARCHAR(1024) NOT NULL DEFAULT 'viewer',
            updated_at BIGINT NOT NULL DEFAULT 0
        )""",
        "CREATE INDEX IF NOT EXISTS idx_sso_users_user_id ON sso_users(user_id)",
        "CREATE INDEX IF NOT EXISTS idx_sso_users_status ON sso_users(status)",
        """
        CREATE TABLE IF NOT EXISTS jwt_seen (
            jti VARCHAR(255) PRIMARY KEY,
            seen_at BIGINT NOT NULL
        )""",
        "CREATE INDEX IF NOT EXISTS idx_jwt_seen_at ON jwt_seen(seen_at)"
    );

    private final JdbcTemplate jdbcTemplate;
    private final HandoffProperties properties;

    public boolean isEnabled() {
        return properties.getMigration().isEnabled();
    }

    public void apply() throws MigrationException {
        if (!isEnabled()) {
            throw MigrationException.disabled();
        }
        try {
            for (String statement : STATEMENTS) {
                jdbcTemplate.execute(statement);
            }
        } catch (DataAccessException e) {
            log.error("Schema bootstrap failed", e);
            throw MigrationException.failed(e);
        }
        log.info("Schema bootstrap applied ({} statements)", STATEMENTS.size());
    }
}
