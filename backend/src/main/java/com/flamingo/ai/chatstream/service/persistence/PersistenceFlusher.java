package com.flamingo.ai.chatstream.service.persistence;

import com.flamingo.ai.chatstream.relay.TokenUsage;
import java.util.UUID;

/**
 * Writes accumulated stream output to the message row. Every write replaces the content, so
 * repeating a call with the same values leaves the same state.
 */
public interface PersistenceFlusher {

  /** Periodic checkpoint. Ignored once the message reached a terminal status. */
  void checkpoint(UUID messageId, String content, String reasoning);

  /** Final commit of a normally finished stream. */
  void complete(
      UUID messageId, String content, String reasoning, Long thinkingTimeMs, TokenUsage usage);

  /** Partial commit of a cancelled, disconnected or timed out stream. */
  void markInterrupted(UUID messageId, String partialContent, String reasoning);

  /** Partial commit of a stream that failed upstream or in the read loop. */
  void markFailed(UUID messageId, String partialContent, String reasoning, String error);
}
