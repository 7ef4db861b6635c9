package com.flamingo.ai.chatstream.service.store;

import com.flamingo.ai.chatstream.domain.entity.Chat;
import com.flamingo.ai.chatstream.domain.entity.ChatMessage;
import com.flamingo.ai.chatstream.domain.enums.MessageRole;
import com.flamingo.ai.chatstream.domain.enums.MessageStatus;
import com.flamingo.ai.chatstream.domain.repository.ChatMessageRepository;
import com.flamingo.ai.chatstream.domain.repository.ChatRepository;
import com.flamingo.ai.chatstream.exception.ChatNotFoundException;
import com.flamingo.ai.chatstream.exception.PersistenceException;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** JPA implementation of the ChatStreamStore. */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChatStreamStoreImpl implements ChatStreamStore {

  private final ChatRepository chatRepository;
  private final ChatMessageRepository chatMessageRepository;

  @Override
  @Transactional(readOnly = true)
  public Chat requireChat(UUID chatId, String userId) {
    return findOwned(chatId, userId).orElseThrow(() -> new ChatNotFoundException(chatId));
  }

  @Override
  @Transactional
  public UUID createAssistantMessage(UUID chatId, String userId, String streamId, String model) {
    Chat chat = requireChat(chatId, userId);
    ChatMessage message =
        ChatMessage.builder()
            .chat(chat)
            .role(MessageRole.ASSISTANT)
            .content("")
            .status(MessageStatus.STREAMING)
            .streamId(streamId)
            .model(model)
            .build();
    try {
      UUID id = chatMessageRepository.save(message).getId();
      log.debug("Created assistant message {} for chat {} (stream {})", id, chatId, streamId);
      return id;
    } catch (DataAccessException e) {
      throw new PersistenceException("Failed to create assistant message for chat " + chatId, e);
    }
  }

  @Override
  @Transactional
  public boolean setActiveStream(UUID chatId, String userId, String streamId) {
    requireChat(chatId, userId);
    return chatRepository.claimActiveStream(chatId, streamId, LocalDateTime.now()) > 0;
  }

  @Override
  @Transactional
  public boolean clearActiveStream(UUID chatId, String streamId) {
    try {
      boolean cleared =
          chatRepository.releaseActiveStream(chatId, streamId, LocalDateTime.now()) > 0;
      if (!cleared) {
        log.debug("Pointer of chat {} no longer names stream {}", chatId, streamId);
      }
      return cleared;
    } catch (DataAccessException e) {
      throw new PersistenceException("Failed to clear active stream of chat " + chatId, e);
    }
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<String> getActiveStream(UUID chatId, String userId) {
    return findOwned(chatId, userId).map(Chat::getActiveStreamId);
  }

  @Override
  @Transactional
  public void interruptOrphanedMessage(UUID messageId, String reason) {
    chatMessageRepository.interruptIfStreaming(messageId, reason, LocalDateTime.now());
  }

  private Optional<Chat> findOwned(UUID chatId, String userId) {
    // Ownership is only enforced when the caller identified itself.
    return userId != null
        ? chatRepository.findByIdAndUserId(chatId, userId)
        : chatRepository.findById(chatId);
  }
}
