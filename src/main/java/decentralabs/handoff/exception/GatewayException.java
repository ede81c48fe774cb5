package decentralabs.handoff.exception;

/**
 * Base exception for every failure the gateway reports to a caller.
 * The message is the client-facing detail and must never carry secrets or tokens.
 */
public abstract class GatewayException extends Exception {

    private final ErrorCode code;
    private final String error;

    protected GatewayException(ErrorCode code, String message) {
        this(code, code.getTitle(), message, null);
    }

    protected GatewayException(ErrorCode code, String error, String message) {
        this(code, error, message, null);
    }

    protected GatewayException(ErrorCode code, String error, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.error = error;
    }

    public ErrorCode getCode() {
        return code;
    }

    public String getError() {
        return error;
    }
}
