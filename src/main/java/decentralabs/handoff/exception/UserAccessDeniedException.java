package decentralabs.handoff.exception;

/**
 * Thrown when a verified identity is unknown to the directory or suspended.
 */
public class UserAccessDeniedException extends GatewayException {

    public static UserAccessDeniedException notAllowed() {
        return new UserAccessDeniedException(ErrorCode.USER_NOT_ALLOWED,
            "User not allowed", "User is not provisioned for access");
    }

    public static UserAccessDeniedException suspended() {
        return new UserAccessDeniedException(ErrorCode.USER_SUSPENDED,
            "User suspended", "User account has been suspended");
    }

    private UserAccessDeniedException(ErrorCode code, String error, String message) {
        super(code, error, message);
    }
}
