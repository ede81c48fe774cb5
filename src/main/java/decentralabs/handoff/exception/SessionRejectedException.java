package decentralabs.handoff.exception;

/**
 * Thrown when no valid session token accompanies a request
 */
public class SessionRejectedException extends GatewayException {
    public SessionRejectedException(String message) {
        super(ErrorCode.NO_SESSION, message);
    }

    public SessionRejectedException(String error, String message) {
        super(ErrorCode.NO_SESSION, error, message);
    }

    public SessionRejectedException(String error, String message, Throwable cause) {
        super(ErrorCode.NO_SESSION, error, message, cause);
    }
}
