package decentralabs.handoff.exception;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import decentralabs.handoff.dto.ErrorResponse;
import jakarta.servlet.ServletException;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void gatewayExceptionCarriesCodeAndStatus() {
        ResponseEntity<ErrorResponse> response = handler.handleGatewayException(
            new UpstreamUnavailableException("The upstream application could not be reached"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
        assertThat(response.getBody().getCode()).isEqualTo("UPSTREAM_UNAVAILABLE");
        assertThat(response.getBody().getError()).isEqualTo("Upstream unavailable");
    }

    @Test
    void unexpectedExceptionHidesDetails() {
        ResponseEntity<ErrorResponse> response = handler.handleGenericException(
            new IllegalStateException("connection string jdbc:secret"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().getCode()).isEqualTo("INTERNAL_ERROR");
        assertThat(response.getBody().getMessage()).isNull();
    }

    @Test
    void unknownRouteKeepsNotFound() {
        ResponseEntity<ErrorResponse> response = handler.handleFrameworkException(
            new NoResourceFoundException(HttpMethod.GET, "no-such-route"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody().getCode()).isEqualTo("NOT_FOUND");
        assertThat(response.getBody().getError()).isEqualTo("Not Found");
    }

    @Test
    void unsupportedMethodKeepsStatusAndAllowHeader() {
        ResponseEntity<ErrorResponse> response = handler.handleFrameworkException(
            new HttpRequestMethodNotSupportedException("GET", List.of("POST")));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.METHOD_NOT_ALLOWED);
        assertThat(response.getBody().getCode()).isEqualTo("METHOD_NOT_ALLOWED");
        assertThat(response.getHeaders().getFirst(HttpHeaders.ALLOW)).isEqualTo("POST");
    }

    @Test
    void plainServletExceptionIsInternalError() {
        ResponseEntity<ErrorResponse> response = handler.handleFrameworkException(new ServletException("boom"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().getCode()).isEqualTo("INTERNAL_ERROR");
    }

    @Test
    void filterJsonStaysValidWithControlCharacters() throws Exception {
        String json = new ErrorResponse("Forbidden", "FORBIDDEN", "line1\nline2\t\u0001end").toJson();

        JsonNode parsed = new ObjectMapper().readTree(json);
        assertThat(parsed.get("message").asText()).isEqualTo("line1\nline2\t\u0001end");
    }

    @Test
    void filterJsonEscapesQuotes() {
        assertThat(new ErrorResponse("Forbidden", "FORBIDDEN", "say \"hi\"").toJson())
            .isEqualTo("{\"error\":\"Forbidden\",\"code\":\"FORBIDDEN\",\"message\":\"say \\\"hi\\\"\"}");
        assertThat(ErrorResponse.of(ErrorCode.RATE_LIMITED, null).toJson())
            .isEqualTo("{\"error\":\"Too many requests\",\"code\":\"RATE_LIMITED\"}");
    }
}
