package com.compass.evidencecollector.exception.handler;

import com.compass.evidencecollector.dto.common.ApiResponse;
import com.compass.evidencecollector.exception.BadRequestException;
import com.compass.evidencecollector.exception.ConflictException;
import com.compass.evidencecollector.exception.NotFoundException;
import com.compass.evidencecollector.exception.QueuePublishException;
import com.compass.evidencecollector.exception.json.JsonParsingException;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.NoHandlerFoundException;

import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A centralized exception handler for the REST API.
 * It intercepts exceptions thrown from controllers and converts them into a
 * standardized ApiResponse format with the semantically correct HTTP status code.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    // --- 4xx Client Error Handlers ---

    @ExceptionHandler({BadRequestException.class, JsonParsingException.class})
    public ResponseEntity<ApiResponse<Object>> handleBadRequest(RuntimeException ex) {
        log.warn("Bad Request Exception: {}", ex.getMessage());
        return respond(ApiResponse.error(ex.getMessage()), HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles malformed JSON or unreadable request bodies. (400 Bad Request)
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Object>> handleHttpMessageNotReadable(HttpMessageNotReadableException ex) {
        log.warn("Handling HttpMessageNotReadableException: {}", ex.getMessage());
        return respond(ApiResponse.error("Malformed request body.", "The request body is missing or could not be parsed."),
                       HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles validation errors from @Valid on request bodies. (400 Bad Request)
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Object>> handleValidationExceptions(MethodArgumentNotValidException ex) {
        String errors = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> String.format("'%s': %s", error.getField(), error.getDefaultMessage()))
                .collect(Collectors.joining(", "));
        String errorMessage = "Validation failed: " + errors;
        log.warn("Handling validation exception: {}", errorMessage);
        return respond(ApiResponse.error("Invalid input provided.", errorMessage), HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles validation errors from @Validated on path variables. (400 Bad Request)
     */
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiResponse<Object>> handleConstraintViolation(ConstraintViolationException ex) {
        String errors = ex.getConstraintViolations().stream()
                .map(violation -> {
                    String path = violation.getPropertyPath().toString();
                    return String.format("'%s': %s", path.substring(path.lastIndexOf('.') + 1), violation.getMessage());
                })
                .collect(Collectors.joining(", "));
        String errorMessage = "Validation failed: " + errors;
        log.warn("Handling constraint violation exception: {}", errorMessage);
        return respond(ApiResponse.error("Invalid input provided.", errorMessage), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ApiResponse<Object>> handleNotFound(NotFoundException ex) {
        log.warn("Resource Not Found Exception: {}", ex.getMessage());
        return respond(ApiResponse.error(ex.getMessage()), HttpStatus.NOT_FOUND);
    }

    /**
     * Handles invalid URLs that don't map to any controller. (404 Not Found)
     * NOTE: Requires 'spring.mvc.throw-exception-if-no-handler-found=true' in properties.
     */
    @ExceptionHandler(NoHandlerFoundException.class)
    public ResponseEntity<ApiResponse<Object>> handleNoHandlerFound(NoHandlerFoundException ex) {
        String errorMessage = String.format("No endpoint %s found for %s", ex.getHttpMethod(), ex.getRequestURL());
        log.warn("Handling NoHandlerFoundException: {}", errorMessage);
        return respond(ApiResponse.error("Resource not found.", errorMessage), HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiResponse<Object>> handleHttpRequestMethodNotSupported(HttpRequestMethodNotSupportedException ex) {
        String supportedMethods = String.join(", ", Objects.requireNonNull(ex.getSupportedMethods()));
        String errorMessage = String.format("Request method '%s' not supported. Supported methods are: %s", ex.getMethod(), supportedMethods);
        log.warn("Handling HttpRequestMethodNotSupportedException: {}", errorMessage);
        return respond(ApiResponse.error("Method not allowed.", errorMessage), HttpStatus.METHOD_NOT_ALLOWED);
    }

    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<ApiResponse<Object>> handleConflict(ConflictException ex) {
        log.warn("Conflict Exception: {}", ex.getMessage());
        return respond(ApiResponse.error(ex.getMessage()), HttpStatus.CONFLICT);
    }

    // --- 5xx Server Error Handlers ---

    /**
     * The job is stored but its message did not reach the queue. (503 Service Unavailable)
     */
    @ExceptionHandler(QueuePublishException.class)
    public ResponseEntity<ApiResponse<Object>> handleQueuePublish(QueuePublishException ex) {
        log.error("Queue Publish Exception: {}", ex.getMessage());
        return respond(ApiResponse.error("The job was saved but could not be queued. Please retry it.", ex.getMessage()),
                       HttpStatus.SERVICE_UNAVAILABLE);
    }

    /**
     * A final catch-all handler for any other unexpected exceptions. (500 Internal Server Error)
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Object>> handleGenericException(Exception ex) {
        log.error("An unexpected internal server error occurred", ex);
        return respond(ApiResponse.error("An unexpected internal error occurred. Please contact support.",
                                         ex.getClass().getSimpleName()), HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private static ResponseEntity<ApiResponse<Object>> respond(ApiResponse<Object> body, HttpStatus status) {
        ApiResponse<Object> response = ApiResponse.builder()
                .displayMessage(body.getDisplayMessage())
                .errorDetail(body.getErrorDetail())
                .showMessage(true)
                .statusCode(status.value())
                .build();
        return new ResponseEntity<>(response, status);
    }
}
