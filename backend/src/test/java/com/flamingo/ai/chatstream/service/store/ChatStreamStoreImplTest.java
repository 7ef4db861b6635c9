package com.flamingo.ai.chatstream.service.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

@ExtendWith(MockitoExtension.class)
class ChatStreamStoreImplTest {

  @Mock private ChatRepository chatRepository;

  @Mock private ChatMessageRepository chatMessageRepository;

  private ChatStreamStoreImpl store;

  private final UUID chatId = UUID.randomUUID();
  private Chat chat;

  @BeforeEach
  void setUp() {
    store = new ChatStreamStoreImpl(chatRepository, chatMessageRepository);
    chat = Chat.builder().id(chatId).userId("user-1").title("Chat").build();
  }

  @Test
  void shouldCreateStreamingAssistantMessage() {
    // Given
    UUID messageId = UUID.randomUUID();
    when(chatRepository.findByIdAndUserId(chatId, "user-1")).thenReturn(Optional.of(chat));
    when(chatMessageRepository.save(any(ChatMessage.class)))
        .thenReturn(ChatMessage.builder().id(messageId).chat(chat).build());

    // When
    UUID result = store.createAssistantMessage(chatId, "user-1", "stream-1", "gpt-test");

    // Then
    assertThat(result).isEqualTo(messageId);
    ArgumentCaptor<ChatMessage> captor = ArgumentCaptor.forClass(ChatMessage.class);
    verify(chatMessageRepository).save(captor.capture());
    ChatMessage saved = captor.getValue();
    assertThat(saved.getRole()).isEqualTo(MessageRole.ASSISTANT);
    assertThat(saved.getStatus()).isEqualTo(MessageStatus.STREAMING);
    assertThat(saved.getContent()).isEmpty();
    assertThat(saved.getStreamId()).isEqualTo("stream-1");
    assertThat(saved.getModel()).isEqualTo("gpt-test");
  }

  @Test
  void shouldThrowChatNotFound_whenChatBelongsToSomeoneElse() {
    when(chatRepository.findByIdAndUserId(chatId, "intruder")).thenReturn(Optional.empty());

    assertThatThrownBy(() -> store.createAssistantMessage(chatId, "intruder", "stream-1", "m"))
        .isInstanceOf(ChatNotFoundException.class);
    verify(chatMessageRepository, never()).save(any());
  }

  @Test
  void shouldWrapDataAccessError_whenMessageCannotBeSaved() {
    when(chatRepository.findById(chatId)).thenReturn(Optional.of(chat));
    when(chatMessageRepository.save(any(ChatMessage.class)))
        .thenThrow(new DataIntegrityViolationException("constraint"));

    assertThatThrownBy(() -> store.createAssistantMessage(chatId, null, "stream-1", "m"))
        .isInstanceOf(PersistenceException.class)
        .hasMessageContaining(chatId.toString());
  }

  @Test
  void shouldReportClaimOutcome_fromConditionalUpdate() {
    when(chatRepository.findById(chatId)).thenReturn(Optional.of(chat));
    when(chatRepository.claimActiveStream(eq(chatId), eq("stream-1"), any(LocalDateTime.class)))
        .thenReturn(1);
    when(chatRepository.claimActiveStream(eq(chatId), eq("stream-2"), any(LocalDateTime.class)))
        .thenReturn(0);

    assertThat(store.setActiveStream(chatId, null, "stream-1")).isTrue();
    assertThat(store.setActiveStream(chatId, null, "stream-2")).isFalse();
  }

  @Test
  void shouldReportRelease_onlyWhenPointerStillNamesStream() {
    when(chatRepository.releaseActiveStream(eq(chatId), eq("stream-1"), any(LocalDateTime.class)))
        .thenReturn(0);

    assertThat(store.clearActiveStream(chatId, "stream-1")).isFalse();
  }

  @Test
  void shouldReturnActiveStream_ofOwnedChat() {
    chat.setActiveStreamId("stream-9");
    when(chatRepository.findByIdAndUserId(chatId, "user-1")).thenReturn(Optional.of(chat));
    when(chatRepository.findByIdAndUserId(chatId, "user-2")).thenReturn(Optional.empty());

    assertThat(store.getActiveStream(chatId, "user-1")).contains("stream-9");
    assertThat(store.getActiveStream(chatId, "user-2")).isEmpty();
  }
}
