package decentralabs.handoff.exception;

import decentralabs.handoff.dto.ErrorResponse;
import decentralabs.handoff.util.LogSanitizer;
import jakarta.servlet.ServletException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Global exception handler for all controllers.
 * Every failure leaves as {@code {error, code, message?}}.
 */
@ControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(GatewayException.class)
    public ResponseEntity<ErrorResponse> handleGatewayException(GatewayException ex) {
        HttpStatus status = ex.getCode().getStatus();
        if (status.is5xxServerError()) {
            log.error("Request failed [{}]: {}", ex.getCode(), ex.getMessage(), ex.getCause());
        } else {
            log.warn("Request rejected [{}]: {}", ex.getCode(), ex.getMessage());
        }
        return ResponseEntity.status(status).body(ErrorResponse.of(ex));
    }

    /**
     * Missing or malformed query parameters on the directory API.
     */
    @ExceptionHandler({MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleBadParameter(Exception ex) {
        log.warn("Invalid request parameter: {}", ex.getMessage());
        return ResponseEntity.badRequest()
            .body(new ErrorResponse("Invalid request", ErrorCode.INVALID_BODY.name(), "Missing or malformed parameter"));
    }

    /**
     * Spring MVC's own rejections (unknown route, unsupported method or media type)
     * keep the status the framework assigned.
     */
    @ExceptionHandler({ServletException.class, ErrorResponseException.class})
    public ResponseEntity<ErrorResponse> handleFrameworkException(Exception ex) {
        if (!(ex instanceof org.springframework.web.ErrorResponse frameworkError)) {
            return handleGenericException(ex);
        }
        HttpStatus status = HttpStatus.resolve(frameworkError.getStatusCode().value());
        if (status == null || status.is5xxServerError()) {
            return handleGenericException(ex);
        }
        log.warn("Request rejected by dispatcher [{}]: {}", status.value(), LogSanitizer.sanitize(ex.getMessage()));
        return ResponseEntity.status(status)
            .headers(frameworkError.getHeaders())
            .body(new ErrorResponse(status.getReasonPhrase(), status.name(), null));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        // Full stack trace stays in the log, never in the body
        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(ErrorResponse.of(ErrorCode.INTERNAL_ERROR, null));
    }
}
