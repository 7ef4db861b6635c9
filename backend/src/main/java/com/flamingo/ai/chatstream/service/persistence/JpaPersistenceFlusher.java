package com.flamingo.ai.chatstream.service.persistence;

import com.flamingo.ai.chatstream.domain.enums.MessageStatus;
import com.flamingo.ai.chatstream.domain.repository.ChatMessageRepository;
import com.flamingo.ai.chatstream.exception.PersistenceException;
import com.flamingo.ai.chatstream.relay.TokenUsage;
import io.micrometer.core.annotation.Timed;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Persistence flusher writing to {@code chat_messages} through conditional JPQL updates. */
@Service
@RequiredArgsConstructor
@Slf4j
public class JpaPersistenceFlusher implements PersistenceFlusher {

  private final ChatMessageRepository chatMessageRepository;

  @Override
  @Transactional
  @Timed(value = "stream.flush.checkpoint", description = "Time to checkpoint a message")
  public void checkpoint(UUID messageId, String content, String reasoning) {
    try {
      int updated =
          chatMessageRepository.checkpoint(
              messageId, nullToEmpty(content), reasoning, LocalDateTime.now());
      if (updated == 0) {
        log.debug("Skipped checkpoint of message {}: not streaming", messageId);
      }
    } catch (DataAccessException e) {
      throw new PersistenceException("Checkpoint failed for message " + messageId, e);
    }
  }

  @Override
  @Transactional
  @Timed(value = "stream.flush.complete", description = "Time to commit a completed message")
  public void complete(
      UUID messageId, String content, String reasoning, Long thinkingTimeMs, TokenUsage usage) {
    try {
      int updated =
          chatMessageRepository.complete(
              messageId,
              nullToEmpty(content),
              reasoning,
              thinkingTimeMs,
              usage != null ? usage.promptTokens() : null,
              usage != null ? usage.completionTokens() : null,
              LocalDateTime.now());
      if (updated == 0) {
        log.warn("Message {} was not completed: already in another terminal status", messageId);
      }
    } catch (DataAccessException e) {
      throw new PersistenceException("Completion failed for message " + messageId, e);
    }
  }

  @Override
  @Transactional
  public void markInterrupted(UUID messageId, String partialContent, String reasoning) {
    writePartial(messageId, partialContent, reasoning, MessageStatus.INTERRUPTED, null);
  }

  @Override
  @Transactional
  public void markFailed(UUID messageId, String partialContent, String reasoning, String error) {
    writePartial(messageId, partialContent, reasoning, MessageStatus.ERROR, error);
  }

  private void writePartial(
      UUID messageId, String content, String reasoning, MessageStatus status, String error) {
    try {
      int updated =
          chatMessageRepository.markPartial(
              messageId, nullToEmpty(content), reasoning, status, error, LocalDateTime.now());
      if (updated == 0) {
        log.debug("Message {} already terminal, not marking {}", messageId, status);
      }
    } catch (DataAccessException e) {
      throw new PersistenceException("Marking message " + messageId + " " + status + " failed", e);
    }
  }

  private static String nullToEmpty(String value) {
    return value != null ? value : "";
  }
}
