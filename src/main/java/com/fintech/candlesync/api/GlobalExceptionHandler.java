package com.fintech.candlesync.api;

import com.fintech.candlesync.storage.StoreException;
import com.fintech.candlesync.storage.StoreUnavailableException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.List;

/**
 * Maps failures of the read API onto {@link ErrorResponse} bodies.
 *
 * Store outages answer 503 so clients retry while the collector reconnects;
 * bad requests answer 400 with the offending parameter where one is known.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleStoreUnavailable(StoreUnavailableException ex, WebRequest request) {
        log.warn("Store unavailable on {}: {}", path(request), ex.getMessage());
        return respond(ErrorResponse.of(HttpStatus.SERVICE_UNAVAILABLE, "STORE_UNAVAILABLE",
            "Candle store is temporarily unavailable. Retry later.", path(request)));
    }

    @ExceptionHandler(StoreException.class)
    public ResponseEntity<ErrorResponse> handleStoreFailure(StoreException ex, WebRequest request) {
        log.error("Store query failed on {}", path(request), ex);
        return respond(ErrorResponse.of(HttpStatus.INTERNAL_SERVER_ERROR, "STORE_ERROR",
            "Candle store query failed.", path(request)));
    }

    /**
     * Constraint annotations on query parameters ({@code @Positive from}, ...).
     */
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(ConstraintViolationException ex, WebRequest request) {
        List<ErrorResponse.ParameterError> details = ex.getConstraintViolations().stream()
            .map(violation -> new ErrorResponse.ParameterError(
                parameterName(violation),
                String.valueOf(violation.getInvalidValue()),
                violation.getMessage()))
            .toList();

        log.warn("Rejected request on {}: {}", path(request), details);
        return respond(ErrorResponse.of(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR",
            "Request validation failed", path(request), details));
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ErrorResponse> handleMethodValidation(HandlerMethodValidationException ex, WebRequest request) {
        List<ErrorResponse.ParameterError> details = ex.getAllValidationResults().stream()
            .flatMap(result -> result.getResolvableErrors().stream()
                .map(error -> new ErrorResponse.ParameterError(
                    result.getMethodParameter().getParameterName(),
                    String.valueOf(result.getArgument()),
                    error.getDefaultMessage())))
            .toList();

        log.warn("Rejected request on {}: {}", path(request), details);
        return respond(ErrorResponse.of(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR",
            "Request validation failed", path(request), details));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(MissingServletRequestParameterException ex,
                                                                WebRequest request) {
        log.warn("Missing parameter '{}' on {}", ex.getParameterName(), path(request));
        return respond(ErrorResponse.of(HttpStatus.BAD_REQUEST, "MISSING_PARAMETER",
            "Required parameter '" + ex.getParameterName() + "' is missing", path(request),
            List.of(new ErrorResponse.ParameterError(ex.getParameterName(), null, "required"))));
    }

    /**
     * Non-numeric {@code from} or {@code to}.
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex, WebRequest request) {
        String expected = ex.getRequiredType() != null ? ex.getRequiredType().getSimpleName() : "value";
        log.warn("Parameter '{}' on {} is not a {}: {}", ex.getName(), path(request), expected, ex.getValue());
        return respond(ErrorResponse.of(HttpStatus.BAD_REQUEST, "TYPE_MISMATCH",
            "Parameter '" + ex.getName() + "' must be a valid " + expected, path(request),
            List.of(new ErrorResponse.ParameterError(ex.getName(), String.valueOf(ex.getValue()),
                "expected " + expected))));
    }

    /**
     * Unknown instrument or timeframe, inverted or oversized range.
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex, WebRequest request) {
        log.warn("Invalid request on {}: {}", path(request), ex.getMessage());
        return respond(ErrorResponse.of(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage(), path(request)));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, WebRequest request) {
        log.error("Unexpected error on {}", path(request), ex);
        return respond(ErrorResponse.of(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR",
            "An unexpected error occurred.", path(request)));
    }

    private static ResponseEntity<ErrorResponse> respond(ErrorResponse body) {
        return ResponseEntity.status(body.status()).body(body);
    }

    private static String path(WebRequest request) {
        return request.getDescription(false).replace("uri=", "");
    }

    private static String parameterName(ConstraintViolation<?> violation) {
        // getHistory.from -> from
        String propertyPath = violation.getPropertyPath().toString();
        return propertyPath.substring(propertyPath.lastIndexOf('.') + 1);
    }
}
