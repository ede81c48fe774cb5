package decentralabs.handoff.service.persistence;

import decentralabs.handoff.config.HandoffProperties;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

/**
 * Fresh in-memory database with the gateway schema applied.
 */
final class PersistenceTestSupport {

    private PersistenceTestSupport() {
    }

    static EmbeddedDatabase newDatabase() {
        return new EmbeddedDatabaseBuilder()
            .setType(EmbeddedDatabaseType.H2)
            .generateUniqueName(true)
            .build();
    }

    static JdbcTemplate migrated(EmbeddedDatabase database) throws Exception {
        JdbcTemplate jdbcTemplate = new JdbcTemplate(database);
        HandoffProperties properties = new HandoffProperties();
        properties.getMigration().setEnabled(true);
        new SchemaMigrationService(jdbcTemplate, properties).apply();
        return jdbcTemplate;
    }
}
