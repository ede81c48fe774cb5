package decentralabs.handoff.exception;

/**
 * Thrown when the upstream application refuses or garbles a session handoff
 */
public class HandoffFailedException extends GatewayException {
    public HandoffFailedException(String message) {
        super(ErrorCode.SSO_HANDOFF_FAILED, message);
    }

    public HandoffFailedException(String error, String message) {
        super(ErrorCode.SSO_HANDOFF_FAILED, error, message);
    }

    public HandoffFailedException(String error, String message, Throwable cause) {
        super(ErrorCode.SSO_HANDOFF_FAILED, error, message, cause);
    }
}
