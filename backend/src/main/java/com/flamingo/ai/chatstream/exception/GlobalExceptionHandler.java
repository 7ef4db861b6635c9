package com.flamingo.ai.chatstream.exception;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Global exception handler for REST controllers.
 *
 * <p>Every response is written as JSON with an explicit content type, because the stream endpoints
 * are requested with {@code Accept: text/event-stream} and errors raised before the stream starts
 * must still reach the caller.
 */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(ValidationException.class)
  public ResponseEntity<ApiError> handleValidation(
      ValidationException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Validation error [{}]: {}", errorId, ex.getMessage());

    return respond(
        HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, ex.getMessage(), request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleInvalidArgument(
      MethodArgumentNotValidException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();

    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");

    log.warn("Validation error [{}]: {}", errorId, message);

    return respond(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
  }

  @ExceptionHandler({
    HttpMessageNotReadableException.class,
    MissingServletRequestParameterException.class,
    MethodArgumentTypeMismatchException.class
  })
  public ResponseEntity<ApiError> handleUnreadableRequest(
      Exception ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Unreadable request [{}]: {}", errorId, ex.getMessage());

    return respond(
        HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, "Invalid request", request);
  }

  @ExceptionHandler(AuthException.class)
  public ResponseEntity<ApiError> handleAuth(AuthException ex, HttpServletRequest request) {

    incrementErrorCounter("auth_error");
    String errorId = generateErrorId();
    log.warn("Auth error [{}]: {}", errorId, ex.getMessage());

    return respond(
        HttpStatus.UNAUTHORIZED, errorId, ApiError.AUTH_REQUIRED, ex.getMessage(), request);
  }

  @ExceptionHandler(ChatNotFoundException.class)
  public ResponseEntity<ApiError> handleChatNotFound(
      ChatNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("chat_not_found");
    String errorId = generateErrorId();
    log.warn("Chat not found [{}]: {}", errorId, ex.getChatId());

    return respond(
        HttpStatus.NOT_FOUND, errorId, ApiError.CHAT_NOT_FOUND, "Chat not found", request);
  }

  @ExceptionHandler(StreamConflictException.class)
  public ResponseEntity<ApiError> handleConflict(
      StreamConflictException ex, HttpServletRequest request) {

    incrementErrorCounter("stream_conflict");
    String errorId = generateErrorId();
    log.warn(
        "Stream conflict [{}]: chat={}, activeStream={}",
        errorId,
        ex.getChatId(),
        ex.getActiveStreamId());

    return respond(
        HttpStatus.CONFLICT,
        errorId,
        ApiError.STREAM_CONFLICT,
        "A response is already being generated for this chat",
        request);
  }

  @ExceptionHandler(RateLimitException.class)
  public ResponseEntity<ApiError> handleRateLimit(
      RateLimitException ex, HttpServletRequest request) {

    incrementErrorCounter("rate_limited");
    String errorId = generateErrorId();
    long retryAfter = ex.getRetryAfterSeconds();
    log.warn("Rate limited [{}]: {} (retry after {}s)", errorId, ex.getMessage(), retryAfter);

    return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
        .header(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfter))
        .contentType(MediaType.APPLICATION_JSON)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.RATE_LIMITED)
                .error(ex.getMessage())
                .retryAfter(retryAfter)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(UpstreamProviderException.class)
  public ResponseEntity<ApiError> handleUpstream(
      UpstreamProviderException ex, HttpServletRequest request) {

    incrementErrorCounter("upstream_error");
    String errorId = generateErrorId();
    log.error("Upstream provider error [{}]: {}", errorId, ex.getMessage(), ex);

    HttpStatusCode status =
        ex.getStatus() >= 400 && ex.getStatus() < 600
            ? HttpStatusCode.valueOf(ex.getStatus())
            : HttpStatus.BAD_GATEWAY;
    return respond(status, errorId, ApiError.UPSTREAM_ERROR, ex.getProviderMessage(), request);
  }

  @ExceptionHandler(CallNotPermittedException.class)
  public ResponseEntity<ApiError> handleCircuitOpen(
      CallNotPermittedException ex, HttpServletRequest request) {

    incrementErrorCounter("upstream_unavailable");
    String errorId = generateErrorId();
    log.warn("Upstream circuit open [{}]: {}", errorId, ex.getMessage());

    return respond(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.UPSTREAM_UNAVAILABLE,
        "AI service is temporarily unavailable. Please try again later.",
        request);
  }

  @ExceptionHandler(ConfigurationException.class)
  public ResponseEntity<ApiError> handleConfiguration(
      ConfigurationException ex, HttpServletRequest request) {

    incrementErrorCounter("configuration_error");
    String errorId = generateErrorId();
    log.error("Configuration error [{}]: {}", errorId, ex.getMessage());

    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.CONFIGURATION_ERROR,
        ex.getMessage(),
        request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        request);
  }

  private ResponseEntity<ApiError> respond(
      HttpStatusCode status,
      String errorId,
      String code,
      String message,
      HttpServletRequest request) {
    return ResponseEntity.status(status)
        .contentType(MediaType.APPLICATION_JSON)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .error(message)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
