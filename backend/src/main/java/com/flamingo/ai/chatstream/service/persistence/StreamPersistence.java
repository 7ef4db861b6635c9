package com.flamingo.ai.chatstream.service.persistence;

import com.flamingo.ai.chatstream.relay.TokenUsage;

/**
 * The only mutations a running stream may perform on durable chat state, bound to one message and
 * one stream id.
 */
public interface StreamPersistence {

  void checkpoint(String content, String reasoning);

  void complete(String content, String reasoning, Long thinkingTimeMs, TokenUsage usage);

  void markInterrupted(String partialContent, String reasoning);

  void markFailed(String partialContent, String reasoning, String error);

  /** Clears the chat's active-stream pointer if it still names this stream. */
  void releaseActiveStream();

  /** Capability for ephemeral streams that have no chat or message row. */
  static StreamPersistence detached() {
    return DetachedStreamPersistence.INSTANCE;
  }
}
