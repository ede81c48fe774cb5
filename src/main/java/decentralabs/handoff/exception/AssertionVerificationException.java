package decentralabs.handoff.exception;

/**
 * Thrown when an identity assertion fails signature, algorithm or key checks
 */
public class AssertionVerificationException extends GatewayException {
    public AssertionVerificationException(String message) {
        super(ErrorCode.JWT_INVALID, message);
    }

    public AssertionVerificationException(String error, String message) {
        super(ErrorCode.JWT_INVALID, error, message);
    }

    public AssertionVerificationException(String error, String message, Throwable cause) {
        super(ErrorCode.JWT_INVALID, error, message, cause);
    }
}
