package com.flamingo.ai.chatstream.exception;

import java.util.UUID;

/** Exception thrown when a chat does not exist or is not owned by the caller. */
public class ChatNotFoundException extends RuntimeException {

  private final UUID chatId;

  public ChatNotFoundException(UUID chatId) {
    super("Chat not found: " + chatId);
    this.chatId = chatId;
  }

  public UUID getChatId() {
    return chatId;
  }
}
