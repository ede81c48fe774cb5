package decentralabs.handoff.exception;

import org.springframework.http.HttpStatus;

/**
 * Machine-readable error codes returned in every error body, each bound to
 * the HTTP status and default title it is reported with.
 */
public enum ErrorCode {
    INVALID_CONTENT_TYPE(HttpStatus.BAD_REQUEST, "Invalid Content-Type"),
    INVALID_BODY(HttpStatus.BAD_REQUEST, "Invalid request body"),
    JWT_INVALID(HttpStatus.UNAUTHORIZED, "Invalid JWT"),
    EMAIL_MISMATCH(HttpStatus.UNAUTHORIZED, "Email mismatch"),
    NO_SESSION(HttpStatus.UNAUTHORIZED, "Unauthorized"),
    FORBIDDEN(HttpStatus.FORBIDDEN, "Forbidden"),
    USER_NOT_ALLOWED(HttpStatus.FORBIDDEN, "User not allowed"),
    USER_SUSPENDED(HttpStatus.FORBIDDEN, "User suspended"),
    USER_NOT_FOUND(HttpStatus.NOT_FOUND, "User not found"),
    REPLAYED_JTI(HttpStatus.CONFLICT, "JWT replay detected"),
    RATE_LIMITED(HttpStatus.TOO_MANY_REQUESTS, "Too many requests"),
    SSO_HANDOFF_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "Authentication handoff failed"),
    MIGRATION_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "Migration failed"),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error"),
    UPSTREAM_UNAVAILABLE(HttpStatus.BAD_GATEWAY, "Upstream unavailable");

    private final HttpStatus status;
    private final String title;

    ErrorCode(HttpStatus status, String title) {
        this.status = status;
        this.title = title;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getTitle() {
        return title;
    }
}
