package decentralabs.handoff.exception;

/**
 * Thrown when a request is rejected before any credential is inspected.
 */
public class InvalidRequestException extends GatewayException {

    public static InvalidRequestException contentType() {
        return new InvalidRequestException(ErrorCode.INVALID_CONTENT_TYPE,
            "Invalid Content-Type", "Content-Type must be application/json");
    }

    public static InvalidRequestException malformedBody() {
        return new InvalidRequestException(ErrorCode.INVALID_BODY,
            "Invalid JSON body", "Request body must be a JSON object");
    }

    public static InvalidRequestException missingFields() {
        return new InvalidRequestException(ErrorCode.INVALID_BODY,
            "Missing jwt or email", "Both jwt and email fields are required");
    }

    public InvalidRequestException(ErrorCode code, String error, String message) {
        super(code, error, message);
    }
}
