package decentralabs.handoff.exception;

/**
 * Thrown by the schema bootstrap when it is disabled or a statement fails.
 */
public class MigrationException extends GatewayException {

    public static MigrationException disabled() {
        return new MigrationException(ErrorCode.FORBIDDEN, "Migrations disabled",
            "Set handoff.migration.enabled=true to enable", null);
    }

    public static MigrationException failed(Throwable cause) {
        return new MigrationException(ErrorCode.MIGRATION_FAILED, "Migration failed",
            "Schema bootstrap failed; see server logs", cause);
    }

    private MigrationException(ErrorCode code, String error, String message, Throwable cause) {
        super(code, error, message, cause);
    }
}
