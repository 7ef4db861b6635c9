package com.flamingo.ai.chatstream.exception;

/** Exception thrown when the caller or the provider rate limit is exhausted. */
public class RateLimitException extends RuntimeException {

  private final long retryAfterMs;

  public RateLimitException(String message, long retryAfterMs) {
    super(message);
    this.retryAfterMs = Math.max(0, retryAfterMs);
  }

  public long getRetryAfterMs() {
    return retryAfterMs;
  }

  /** Retry hint rounded up to whole seconds, at least one. */
  public long getRetryAfterSeconds() {
    return Math.max(1, (retryAfterMs + 999) / 1000);
  }
}
