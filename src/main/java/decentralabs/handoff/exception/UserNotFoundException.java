package decentralabs.handoff.exception;

/**
 * Thrown by directory reads when no user matches
 */
public class UserNotFoundException extends GatewayException {
    public UserNotFoundException(String message) {
        super(ErrorCode.USER_NOT_FOUND, message);
    }

    public UserNotFoundException(String error, String message) {
        super(ErrorCode.USER_NOT_FOUND, error, message);
    }

    public UserNotFoundException(String error, String message, Throwable cause) {
        super(ErrorCode.USER_NOT_FOUND, error, message, cause);
    }
}
