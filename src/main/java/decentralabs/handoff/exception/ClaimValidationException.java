package decentralabs.handoff.exception;

/**
 * Thrown when a verified assertion carries claims that do not match the trust settings.
 * Reported with the same code as a bad signature.
 */
public class ClaimValidationException extends GatewayException {

    private final String claim;

    public ClaimValidationException(String claim, String message) {
        super(ErrorCode.JWT_INVALID, message);
        this.claim = claim;
    }

    public ClaimValidationException(String claim, String message, Throwable cause) {
        super(ErrorCode.JWT_INVALID, ErrorCode.JWT_INVALID.getTitle(), message, cause);
        this.claim = claim;
    }

    /**
     * Name of the offending claim, e.g. {@code iss} or {@code exp}.
     */
    public String getClaim() {
        return claim;
    }
}
