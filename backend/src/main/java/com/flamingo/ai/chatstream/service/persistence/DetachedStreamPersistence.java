package com.flamingo.ai.chatstream.service.persistence;

import com.flamingo.ai.chatstream.relay.TokenUsage;

/** No-op capability used when a stream is not attached to a chat. */
enum DetachedStreamPersistence implements StreamPersistence {
  INSTANCE;

  @Override
  public void checkpoint(String content, String reasoning) {}

  @Override
  public void complete(String content, String reasoning, Long thinkingTimeMs, TokenUsage usage) {}

  @Override
  public void markInterrupted(String partialContent, String reasoning) {}

  @Override
  public void markFailed(String partialContent, String reasoning, String error) {}

  @Override
  public void releaseActiveStream() {}
}
