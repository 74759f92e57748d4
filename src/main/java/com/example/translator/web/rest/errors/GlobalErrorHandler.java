package com.example.translator.web.rest.errors;

import com.example.translator.exception.AuthException;
import com.example.translator.exception.ConfigurationException;
import com.example.translator.exception.CryptoException;
import com.example.translator.exception.RateLimitExceededException;
import com.example.translator.exception.UpstreamException;
import com.example.translator.exception.ValidationException;
import com.example.translator.security.filter.RateLimitFilter;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Global Error Handler
 *
 * Provides consistent error responses without exposing sensitive information
 */
@Slf4j
@RestControllerAdvice
public class GlobalErrorHandler {

  @ExceptionHandler(ConfigurationException.class)
  public ResponseEntity<Map<String, Object>> handleConfigurationException(
      ConfigurationException ex, WebRequest request) {
    log.error("Configuration error: {}", ex.getMessage());

    return respond(HttpStatus.INTERNAL_SERVER_ERROR, "configuration_error", ex.getMessage(), request);
  }

  @ExceptionHandler(AuthException.class)
  public ResponseEntity<Map<String, Object>> handleAuthException(
      AuthException ex, WebRequest request) {
    log.debug("Authentication error: {}", ex.getMessage());

    return respond(HttpStatus.UNAUTHORIZED, "unauthorized", ex.getMessage(), request);
  }

  /**
   * Tampered or undecryptable payloads look like any other bad session to the caller.
   */
  @ExceptionHandler(CryptoException.class)
  public ResponseEntity<Map<String, Object>> handleCryptoException(
      CryptoException ex, WebRequest request) {
    log.warn("Crypto error: {}", ex.getMessage());

    return respond(HttpStatus.UNAUTHORIZED, "unauthorized", AuthException.INVALID_SESSION, request);
  }

  @ExceptionHandler(RateLimitExceededException.class)
  public ResponseEntity<Map<String, Object>> handleRateLimitExceeded(
      RateLimitExceededException ex, WebRequest request) {
    HttpHeaders headers = new HttpHeaders();
    headers.set(RateLimitFilter.REMAINING_HEADER, String.valueOf(ex.getRemaining()));
    if (ex.getResetAt() != null) {
      headers.set(RateLimitFilter.RESET_HEADER, String.valueOf(ex.getResetAt().getEpochSecond()));
    }
    Map<String, Object> body = ErrorBody.of(
        HttpStatus.TOO_MANY_REQUESTS, "rate_limit_exceeded", ex.getMessage(), extractPath(request));

    return new ResponseEntity<>(body, headers, HttpStatus.TOO_MANY_REQUESTS);
  }

  /**
   * Only reachable before a stream has started; afterwards upstream failures are reported in-band.
   */
  @ExceptionHandler(UpstreamException.class)
  public ResponseEntity<Map<String, Object>> handleUpstreamException(
      UpstreamException ex, WebRequest request) {
    log.error("Upstream error", ex);

    return respond(HttpStatus.BAD_GATEWAY, "upstream_error", "Translation provider unavailable", request);
  }

  @ExceptionHandler(TaskRejectedException.class)
  public ResponseEntity<Map<String, Object>> handleTaskRejected(
      TaskRejectedException ex, WebRequest request) {
    log.warn("Relay pool saturated: {}", ex.getMessage());

    return respond(HttpStatus.SERVICE_UNAVAILABLE, "service_unavailable",
                   "Too many translations in progress, please retry", request);
  }

  @ExceptionHandler(ValidationException.class)
  public ResponseEntity<Map<String, Object>> handleValidationException(
      ValidationException ex, WebRequest request) {

    return respond(HttpStatus.BAD_REQUEST, "validation_error", ex.getMessage(), request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<Map<String, Object>> handleMethodArgumentNotValid(
      MethodArgumentNotValidException ex, WebRequest request) {

    String errors = ex.getBindingResult().getFieldErrors().stream()
        .map(FieldError::getDefaultMessage)
        .distinct()
        .collect(Collectors.joining(", "));

    return respond(HttpStatus.BAD_REQUEST, "validation_error", errors, request);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<Map<String, Object>> handleUnreadableBody(
      HttpMessageNotReadableException ex, WebRequest request) {

    return respond(HttpStatus.BAD_REQUEST, "validation_error", "Malformed request body", request);
  }

  @ExceptionHandler(AccessDeniedException.class)
  public ResponseEntity<Map<String, Object>> handleAccessDeniedException(
      AccessDeniedException ex, WebRequest request) {
    log.warn("Access denied: {}", ex.getMessage());

    return respond(HttpStatus.FORBIDDEN, "access_denied", "Access denied", request);
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<Map<String, Object>> handleMethodNotSupported(
      HttpRequestMethodNotSupportedException ex, WebRequest request) {

    return respond(HttpStatus.METHOD_NOT_ALLOWED, "method_not_allowed",
                   String.format("Method %s not supported", ex.getMethod()), request);
  }

  @ExceptionHandler(NoResourceFoundException.class)
  public ResponseEntity<Map<String, Object>> handleNoResource(
      NoResourceFoundException ex, WebRequest request) {

    return respond(HttpStatus.NOT_FOUND, "not_found", "Resource not found", request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> handleGenericException(
      Exception ex, WebRequest request) {
    log.error("Unexpected error", ex);

    return respond(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error",
                   "An error occurred processing your request", request);
  }

  private ResponseEntity<Map<String, Object>> respond(
      HttpStatus status, String error, String message, WebRequest request) {
    return new ResponseEntity<>(ErrorBody.of(status, error, message, extractPath(request)), status);
  }

  private String extractPath(WebRequest request) {
    String description = request.getDescription(false);
    return description.replace("uri=", "");
  }
}
