package com.scholary.vocal.coach.api;

import com.scholary.vocal.coach.service.InvalidAttemptException;
import java.time.Instant;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps exceptions at the REST boundary to {@link ApiError} responses.
 *
 * <p>Client mistakes get 400 with the reason. Anything else gets 500 without internal details.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(InvalidAttemptException.class)
  ResponseEntity<ApiError> handleInvalidAttempt(InvalidAttemptException ex) {
    LOGGER.warn("Invalid attempt: {}", ex.getMessage());
    return badRequest(ex.getClass().getSimpleName(), ex.getMessage());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  ResponseEntity<ApiError> handleConstraintViolation(MethodArgumentNotValidException ex) {
    String details =
        ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .collect(Collectors.joining("; "));
    LOGGER.warn("Request validation failed: {}", details);
    return badRequest("ValidationFailed", details);
  }

  // Malformed JSON, wrong types and unknown enum values such as practiceMode.
  @ExceptionHandler(HttpMessageNotReadableException.class)
  ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex) {
    LOGGER.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
    return badRequest("MalformedRequest", ex.getMostSpecificCause().getMessage());
  }

  @ExceptionHandler(Exception.class)
  ResponseEntity<ApiError> handleUnexpected(Exception ex) {
    LOGGER.error("Unexpected error", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(
            new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please retry or contact support with the attempt ID",
                Instant.now()));
  }

  private static ResponseEntity<ApiError> badRequest(String errorCode, String details) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiError(errorCode, "Invalid attempt", details, Instant.now()));
  }

  /** Error body returned to API clients. */
  public record ApiError(String errorCode, String message, String details, Instant timestamp) {}
}
