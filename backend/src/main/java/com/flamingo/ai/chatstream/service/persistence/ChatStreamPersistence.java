package com.flamingo.ai.chatstream.service.persistence;

import com.flamingo.ai.chatstream.relay.TokenUsage;
import com.flamingo.ai.chatstream.service.store.ChatStreamStore;
import java.util.UUID;

/** Stream persistence bound to a chat message and its stream id. */
public class ChatStreamPersistence implements StreamPersistence {

  private final PersistenceFlusher flusher;
  private final ChatStreamStore store;
  private final UUID chatId;
  private final UUID messageId;
  private final String streamId;

  public ChatStreamPersistence(
      PersistenceFlusher flusher,
      ChatStreamStore store,
      UUID chatId,
      UUID messageId,
      String streamId) {
    this.flusher = flusher;
    this.store = store;
    this.chatId = chatId;
    this.messageId = messageId;
    this.streamId = streamId;
  }

  @Override
  public void checkpoint(String content, String reasoning) {
    flusher.checkpoint(messageId, content, reasoning);
  }

  @Override
  public void complete(String content, String reasoning, Long thinkingTimeMs, TokenUsage usage) {
    flusher.complete(messageId, content, reasoning, thinkingTimeMs, usage);
  }

  @Override
  public void markInterrupted(String partialContent, String reasoning) {
    flusher.markInterrupted(messageId, partialContent, reasoning);
  }

  @Override
  public void markFailed(String partialContent, String reasoning, String error) {
    flusher.markFailed(messageId, partialContent, reasoning, error);
  }

  @Override
  public void releaseActiveStream() {
    store.clearActiveStream(chatId, streamId);
  }
}
