package decentralabs.handoff.service.persistence;

import decentralabs.handoff.config.HandoffProperties;
import decentralabs.handoff.util.LogSanitizer;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Records assertion nonces so each one is accepted at most once.
 * Uniqueness rests on the primary key of {@code jwt_seen}: of any number of
 * concurrent inserts for the same nonce exactly one succeeds.
 */
@Service
@Slf4j
public class ReplayGuardService {

    private final JdbcTemplate jdbcTemplate;
    private final Duration retention;
    private final Clock clock;
    private final AtomicBoolean tableMissingLogged = new AtomicBoolean(false);

    @Autowired
    public ReplayGuardService(JdbcTemplate jdbcTemplate, HandoffProperties properties, Clock clock) {
        this(jdbcTemplate, properties.getReplay().getRetention(), clock);
    }

    public ReplayGuardService(JdbcTemplate jdbcTemplate, Duration retention, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.retention = retention;
        this.clock = clock;
    }

    /**
     * @return true when the nonce was unseen and is now recorded, false on a replay
     */
    public boolean recordNonce(String nonce) {
        try {
            jdbcTemplate.update("INSERT INTO jwt_seen (jti, seen_at) VALUES (?, ?)",
                nonce, clock.instant().getEpochSecond());
            return true;
        } catch (DuplicateKeyException e) {
            log.warn("Replayed assertion nonce {}", LogSanitizer.maskIdentifier(nonce));
            return false;
        }
    }

    /**
     * Deletes nonces older than the retention window.
     *
     * @return number of rows removed
     */
    public int purgeOlderThan(Duration age) {
        long cutoff = clock.instant().minus(age).getEpochSecond();
        return jdbcTemplate.update("DELETE FROM jwt_seen WHERE seen_at < ?", cutoff);
    }

    @Scheduled(
        fixedDelayString = "${handoff.replay.purge-interval-ms:3600000}",
        initialDelayString = "${handoff.replay.purge-interval-ms:3600000}"
    )
    public void purgeExpired() {
        try {
            int removed = purgeOlderThan(retention);
            tableMissingLogged.set(false);
            if (removed > 0) {
                log.info("Purged {} expired assertion nonce(s)", removed);
            }
        } catch (DataAccessException e) {
            if (tableMissingLogged.compareAndSet(false, true)) {
                log.warn("Nonce purge skipped, jwt_seen not available: {}", e.getMessage());
            }
        }
    }
}
