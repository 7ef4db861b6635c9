package com.flamingo.ai.chatstream.service.ratelimit;

/** Admission gate consulted before a stream starts. */
public interface RateLimitGate {

  /** Consumes one permit from the bucket if available. */
  RateLimitDecision checkAndConsume(String bucketKey);
}
