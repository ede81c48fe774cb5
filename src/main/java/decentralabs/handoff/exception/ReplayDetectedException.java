package decentralabs.handoff.exception;

/**
 * Thrown when an assertion nonce has already been recorded
 */
public class ReplayDetectedException extends GatewayException {
    public ReplayDetectedException(String message) {
        super(ErrorCode.REPLAYED_JTI, message);
    }

    public ReplayDetectedException(String error, String message) {
        super(ErrorCode.REPLAYED_JTI, error, message);
    }

    public ReplayDetectedException(String error, String message, Throwable cause) {
        super(ErrorCode.REPLAYED_JTI, error, message, cause);
    }
}
