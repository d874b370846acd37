package com.fintech.candlesync.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import org.springframework.http.HttpStatus;

import java.time.Instant;
import java.util.List;

/**
 * Error body of the read API.
 *
 * @param error Stable machine-readable code, e.g. {@code STORE_UNAVAILABLE}
 * @param details Offending parameters, omitted when the failure is not tied to one
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Error returned by the candle read API")
public record ErrorResponse(

    @Schema(description = "HTTP status code", example = "503")
    int status,

    @Schema(description = "Error code", example = "STORE_UNAVAILABLE")
    String error,

    @Schema(description = "Human-readable explanation", example = "Candle store is temporarily unavailable. Retry later.")
    String message,

    @Schema(description = "Request path", example = "/api/v1/history")
    String path,

    @Schema(description = "When the error was produced (UTC)", example = "2024-03-11T12:00:03Z")
    Instant timestamp,

    @Schema(description = "Per-parameter problems, for request errors")
    List<ParameterError> details
) {

    static ErrorResponse of(HttpStatus status, String error, String message, String path) {
        return new ErrorResponse(status.value(), error, message, path, Instant.now(), null);
    }

    static ErrorResponse of(HttpStatus status, String error, String message, String path,
                            List<ParameterError> details) {
        return new ErrorResponse(status.value(), error, message, path, Instant.now(), details);
    }

    /**
     * One rejected request parameter.
     */
    @Schema(description = "Rejected request parameter")
    public record ParameterError(
        @Schema(description = "Parameter name", example = "timeframe")
        String parameter,

        @Schema(description = "Value as received", example = "7m")
        String rejectedValue,

        @Schema(description = "Why it was rejected", example = "Unsupported timeframe: 7 minutes")
        String reason
    ) {}
}
