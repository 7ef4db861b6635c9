package com.flamingo.ai.chatstream.exception;

import java.util.UUID;

/** Exception thrown when a chat already has a live stream. */
public class StreamConflictException extends RuntimeException {

  private final UUID chatId;
  private final String activeStreamId;

  public StreamConflictException(UUID chatId, String activeStreamId) {
    super("Chat " + chatId + " already has an active stream " + activeStreamId);
    this.chatId = chatId;
    this.activeStreamId = activeStreamId;
  }

  public UUID getChatId() {
    return chatId;
  }

  public String getActiveStreamId() {
    return activeStreamId;
  }
}
