package decentralabs.handoff.service.persistence;

import decentralabs.handoff.model.UserRecord;
import decentralabs.handoff.model.UserStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

/**
 * Read access to the {@code sso_users} directory. Rows are maintained by
 * external tooling; the gateway never writes them.
 */
@Service
@RequiredArgsConstructor
public class UserDirectoryService {

    public static final int MAX_PAGE_SIZE = 500;

    private static final String COLUMNS = "SELECT email, user_id, status, roles, updated_at FROM sso_users";

    private final JdbcTemplate jdbcTemplate;

    /**
     * Looks a user up by email, ignoring case on both sides. Stored rows may
     * keep whatever casing the admin tooling wrote.
     */
    public Optional<UserRecord> findByEmail(String email) {
        if (email == null || email.isBlank()) {
            return Optional.empty();
        }
        return jdbcTemplate.query(COLUMNS + " WHERE LOWER(email) = ? LIMIT 1", this::mapRow, normalizeEmail(email))
            .stream().findFirst();
    }

    public Optional<UserRecord> findByUserId(String userId) {
        return jdbcTemplate.query(COLUMNS + " WHERE user_id = ? LIMIT 1", this::mapRow, userId)
            .stream().findFirst();
    }

    public List<UserRecord> findActive(int limit, int offset) {
        int pageSize = Math.max(1, Math.min(limit, MAX_PAGE_SIZE));
        return jdbcTemplate.query(COLUMNS + " WHERE status = 'active' ORDER BY updated_at DESC, email LIMIT ? OFFSET ?",
            this::mapRow, pageSize, Math.max(0, offset));
    }

    public boolean emailExists(String email) {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM sso_users WHERE LOWER(email) = ?",
            Integer.class, normalizeEmail(email));
        return count != null && count > 0;
    }

    public static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }

    private UserRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new UserRecord(
            rs.getString("email"),
            rs.getString("user_id"),
            UserStatus.fromValue(rs.getString("status")),
            rs.getString("roles"),
            Instant.ofEpochSecond(rs.getLong("updated_at")));
    }
}
