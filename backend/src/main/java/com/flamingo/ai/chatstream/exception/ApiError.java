package com.flamingo.ai.chatstream.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {

  // Error codes
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String AUTH_REQUIRED = "AUTH_001";
  public static final String CHAT_NOT_FOUND = "CHAT_001";
  public static final String STREAM_CONFLICT = "STREAM_001";
  public static final String RATE_LIMITED = "RATE_001";
  public static final String UPSTREAM_ERROR = "UPSTREAM_001";
  public static final String UPSTREAM_UNAVAILABLE = "UPSTREAM_002";
  public static final String CONFIGURATION_ERROR = "CONFIG_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String error;

  /** Seconds the caller should wait before retrying (rate limits only). */
  private final Long retryAfter;

  /** Timestamp of the error. */
  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
