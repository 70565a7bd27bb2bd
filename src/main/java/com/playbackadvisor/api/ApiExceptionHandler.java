package com.playbackadvisor.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;

/**
 * Maps failures of the advisor endpoints onto {@link ApiError} bodies.
 *
 * <ul>
 *   <li>{@code UNKNOWN_CLIENT} (404): a device id that never registered is looked up,
 *       recalibrated or asked for a policy.</li>
 *   <li>{@code BAD_REQUEST} (400): the body is not valid JSON, or a path or query value
 *       such as {@code hours} has the wrong type.</li>
 *   <li>{@code INVALID_ARGUMENT} (400): the JSON parsed but a required field such as
 *       {@code device_id} or {@code play_session_id} is missing.</li>
 *   <li>{@code INTERNAL_ERROR} (500): anything else. Policy computation itself never
 *       lands here because the engine falls back to pass-through.</li>
 * </ul>
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(UnknownClientException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public ApiError unknownClient(UnknownClientException ex) {
        log.debug("Rejected request for unregistered device: {}", ex.getMessage());
        return ApiError.of("UNKNOWN_CLIENT", ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ApiError unreadableBody(HttpMessageNotReadableException ex) {
        return ApiError.of("BAD_REQUEST", "request body could not be read: " + ex.getMostSpecificCause().getMessage());
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ApiError parameterTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return ApiError.of("BAD_REQUEST", "parameter '" + ex.getName() + "' has an invalid value: " + ex.getValue());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ApiError missingField(IllegalArgumentException ex) {
        log.debug("Invalid advisor request: {}", ex.getMessage());
        return ApiError.of("INVALID_ARGUMENT", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public ApiError unexpected(Exception ex) {
        log.error("Unhandled error in advisor API", ex);
        return ApiError.of("INTERNAL_ERROR", "an unexpected error occurred");
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record ApiError(String errorCode, String message, String timestamp) {

        static ApiError of(String errorCode, String message) {
            return new ApiError(errorCode, message, Instant.now().toString());
        }
    }
}
