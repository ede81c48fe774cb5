package decentralabs.handoff.exception;

/**
 * Thrown when the claimed email differs from the verified one
 */
public class EmailMismatchException extends GatewayException {
    public EmailMismatchException(String message) {
        super(ErrorCode.EMAIL_MISMATCH, message);
    }

    public EmailMismatchException(String error, String message) {
        super(ErrorCode.EMAIL_MISMATCH, error, message);
    }

    public EmailMismatchException(String error, String message, Throwable cause) {
        super(ErrorCode.EMAIL_MISMATCH, error, message, cause);
    }
}
