package com.flamingo.ai.chatstream.service.store;

import com.flamingo.ai.chatstream.domain.entity.Chat;
import java.util.Optional;
import java.util.UUID;

/** Chat and message operations the stream lifecycle needs from the primary datastore. */
public interface ChatStreamStore {

  /**
   * Loads a chat owned by the user.
   *
   * @throws com.flamingo.ai.chatstream.exception.ChatNotFoundException if missing or not owned
   */
  Chat requireChat(UUID chatId, String userId);

  /** Creates the assistant message in STREAMING status and returns its id. */
  UUID createAssistantMessage(UUID chatId, String userId, String streamId, String model);

  /**
   * Points the chat at a new stream. Succeeds only while no other stream is active.
   *
   * @return false if another stream holds the pointer
   */
  boolean setActiveStream(UUID chatId, String userId, String streamId);

  /**
   * Clears the pointer if it still names {@code streamId}. A newer stream's pointer is never
   * touched.
   *
   * @return false if the pointer named something else
   */
  boolean clearActiveStream(UUID chatId, String streamId);

  /** Current pointer of a chat owned by the user; empty when idle, missing or not owned. */
  Optional<String> getActiveStream(UUID chatId, String userId);

  /** Marks a message left in STREAMING interrupted, keeping its checkpointed content. */
  void interruptOrphanedMessage(UUID messageId, String reason);
}
