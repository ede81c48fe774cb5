package decentralabs.handoff.exception;

/**
 * Thrown when a relayed request cannot reach the upstream origin
 */
public class UpstreamUnavailableException extends GatewayException {
    public UpstreamUnavailableException(String message) {
        super(ErrorCode.UPSTREAM_UNAVAILABLE, message);
    }

    public UpstreamUnavailableException(String error, String message) {
        super(ErrorCode.UPSTREAM_UNAVAILABLE, error, message);
    }

    public UpstreamUnavailableException(String error, String message, Throwable cause) {
        super(ErrorCode.UPSTREAM_UNAVAILABLE, error, message, cause);
    }
}
