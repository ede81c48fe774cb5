package decentralabs.handoff.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import decentralabs.handoff.exception.ErrorCode;
import decentralabs.handoff.exception.GatewayException;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Uniform error body: {@code {"error": ..., "code": ..., "message": ...}}.
 */
@Getter
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"error", "code", "message"})
public class ErrorResponse {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private String error;
    private String code;
    private String message;

    public static ErrorResponse of(GatewayException ex) {
        return new ErrorResponse(ex.getError(), ex.getCode().name(), ex.getMessage());
    }

    public static ErrorResponse of(ErrorCode code, String message) {
        return new ErrorResponse(code.getTitle(), code.name(), message);
    }

    /**
     * JSON body for filters that answer before the MVC layer.
     */
    public String toJson() {
        try {
            return OBJECT_MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize error response", e);
        }
    }
}
