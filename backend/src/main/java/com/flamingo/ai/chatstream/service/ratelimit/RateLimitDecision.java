package com.flamingo.ai.chatstream.service.ratelimit;

/**
 * Result of a rate-limit check.
 *
 * @param allowed whether the request may proceed
 * @param retryAfterMs wait hint when denied, null when allowed
 */
public record RateLimitDecision(boolean allowed, Long retryAfterMs) {

  public static RateLimitDecision allow() {
    return new RateLimitDecision(true, null);
  }

  public static RateLimitDecision deny(long retryAfterMs) {
    return new RateLimitDecision(false, retryAfterMs);
  }
}
