package com.flamingo.ai.chatstream.domain.repository;

import com.flamingo.ai.chatstream.domain.entity.ChatMessage;
import com.flamingo.ai.chatstream.domain.enums.MessageStatus;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for ChatMessage entities. */
@Repository
public interface ChatMessageRepository extends JpaRepository<ChatMessage, UUID> {

  /** Finds all messages for a chat ordered by creation time ascending. */
  List<ChatMessage> findByChatIdOrderByCreatedAtAsc(UUID chatId);

  /** Finds messages left in the given status. */
  List<ChatMessage> findByStatus(MessageStatus status);

  /** Replaces the checkpointed content while the message is still streaming. */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      "UPDATE ChatMessage m SET m.content = :content, m.reasoning = :reasoning, "
          + "m.updatedAt = :now "
          + "WHERE m.id = :id AND m.status = com.flamingo.ai.chatstream.domain.enums"
          + ".MessageStatus.STREAMING")
  int checkpoint(
      @Param("id") UUID id,
      @Param("content") String content,
      @Param("reasoning") String reasoning,
      @Param("now") LocalDateTime now);

  /** Commits the final answer. Repeating it with the same values is a no-op in effect. */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      "UPDATE ChatMessage m SET m.content = :content, m.reasoning = :reasoning, "
          + "m.thinkingTimeMs = :thinkingTimeMs, m.promptTokens = :promptTokens, "
          + "m.completionTokens = :completionTokens, m.errorMessage = NULL, "
          + "m.status = com.flamingo.ai.chatstream.domain.enums.MessageStatus.COMPLETED, "
          + "m.updatedAt = :now "
          + "WHERE m.id = :id AND m.status IN ("
          + "com.flamingo.ai.chatstream.domain.enums.MessageStatus.STREAMING, "
          + "com.flamingo.ai.chatstream.domain.enums.MessageStatus.COMPLETED)")
  int complete(
      @Param("id") UUID id,
      @Param("content") String content,
      @Param("reasoning") String reasoning,
      @Param("thinkingTimeMs") Long thinkingTimeMs,
      @Param("promptTokens") Integer promptTokens,
      @Param("completionTokens") Integer completionTokens,
      @Param("now") LocalDateTime now);

  /** Commits a partial answer with a non-completed terminal status. */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      "UPDATE ChatMessage m SET m.content = :content, m.reasoning = :reasoning, "
          + "m.status = :status, m.errorMessage = :errorMessage, m.updatedAt = :now "
          + "WHERE m.id = :id AND m.status IN ("
          + "com.flamingo.ai.chatstream.domain.enums.MessageStatus.STREAMING, :status)")
  int markPartial(
      @Param("id") UUID id,
      @Param("content") String content,
      @Param("reasoning") String reasoning,
      @Param("status") MessageStatus status,
      @Param("errorMessage") String errorMessage,
      @Param("now") LocalDateTime now);

  /** Marks an orphaned streaming message interrupted, keeping whatever was checkpointed. */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      "UPDATE ChatMessage m SET "
          + "m.status = com.flamingo.ai.chatstream.domain.enums.MessageStatus.INTERRUPTED, "
          + "m.errorMessage = :reason, m.updatedAt = :now "
          + "WHERE m.id = :id AND m.status = "
          + "com.flamingo.ai.chatstream.domain.enums.MessageStatus.STREAMING")
  int interruptIfStreaming(
      @Param("id") UUID id, @Param("reason") String reason, @Param("now") LocalDateTime now);
}
