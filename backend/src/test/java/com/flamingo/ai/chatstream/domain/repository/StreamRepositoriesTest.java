package com.flamingo.ai.chatstream.domain.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.chatstream.domain.entity.Chat;
import com.flamingo.ai.chatstream.domain.entity.ChatMessage;
import com.flamingo.ai.chatstream.domain.entity.StreamSession;
import com.flamingo.ai.chatstream.domain.enums.MessageRole;
import com.flamingo.ai.chatstream.domain.enums.MessageStatus;
import com.flamingo.ai.chatstream.domain.enums.StreamStatus;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

@DataJpaTest
@DisplayName("Conditional updates on chats, messages and stream sessions")
class StreamRepositoriesTest {

  @Autowired private ChatRepository chatRepository;
  @Autowired private ChatMessageRepository chatMessageRepository;
  @Autowired private StreamSessionRepository streamSessionRepository;

  private Chat chat;
  private ChatMessage message;

  @BeforeEach
  void setUp() {
    chat = chatRepository.save(Chat.builder().userId("user-1").title("Test chat").build());
    message =
        chatMessageRepository.save(
            ChatMessage.builder()
                .chat(chat)
                .role(MessageRole.ASSISTANT)
                .streamId("stream-1")
                .model("test-model")
                .build());
  }

  @Test
  void shouldClaimPointerOnlyWhenEmpty() {
    LocalDateTime now = LocalDateTime.now();

    assertThat(chatRepository.claimActiveStream(chat.getId(), "stream-1", now)).isEqualTo(1);
    assertThat(chatRepository.claimActiveStream(chat.getId(), "stream-2", now)).isZero();

    assertThat(chatRepository.findById(chat.getId()).orElseThrow().getActiveStreamId())
        .isEqualTo("stream-1");
  }

  @Test
  void shouldReleasePointerOnlyForOwningStream() {
    LocalDateTime now = LocalDateTime.now();
    chatRepository.claimActiveStream(chat.getId(), "stream-2", now);

    assertThat(chatRepository.releaseActiveStream(chat.getId(), "stream-1", now)).isZero();
    assertThat(chatRepository.findById(chat.getId()).orElseThrow().getActiveStreamId())
        .isEqualTo("stream-2");

    assertThat(chatRepository.releaseActiveStream(chat.getId(), "stream-2", now)).isEqualTo(1);
    assertThat(chatRepository.findById(chat.getId()).orElseThrow().getActiveStreamId()).isNull();
  }

  @Test
  void shouldFindChatByOwner() {
    assertThat(chatRepository.findByIdAndUserId(chat.getId(), "user-1")).isPresent();
    assertThat(chatRepository.findByIdAndUserId(chat.getId(), "someone-else")).isEmpty();
  }

  @Test
  void shouldIgnoreCheckpoint_afterMessageCompleted() {
    LocalDateTime now = LocalDateTime.now();
    chatMessageRepository.checkpoint(message.getId(), "Hel", null, now);

    int completed =
        chatMessageRepository.complete(message.getId(), "Hello", null, null, 3, 2, now);
    int lateCheckpoint = chatMessageRepository.checkpoint(message.getId(), "Hel", null, now);

    assertThat(completed).isEqualTo(1);
    assertThat(lateCheckpoint).isZero();
    ChatMessage stored = chatMessageRepository.findById(message.getId()).orElseThrow();
    assertThat(stored.getContent()).isEqualTo("Hello");
    assertThat(stored.getStatus()).isEqualTo(MessageStatus.COMPLETED);
    assertThat(stored.getPromptTokens()).isEqualTo(3);
    assertThat(stored.getCompletionTokens()).isEqualTo(2);
  }

  @Test
  void shouldApplyRepeatedCompleteWithSameResult() {
    LocalDateTime now = LocalDateTime.now();

    chatMessageRepository.complete(message.getId(), "Hello", "why", 40L, null, null, now);
    int again =
        chatMessageRepository.complete(message.getId(), "Hello", "why", 40L, null, null, now);

    assertThat(again).isEqualTo(1);
    ChatMessage stored = chatMessageRepository.findById(message.getId()).orElseThrow();
    assertThat(stored.getContent()).isEqualTo("Hello");
    assertThat(stored.getReasoning()).isEqualTo("why");
    assertThat(stored.getThinkingTimeMs()).isEqualTo(40L);
  }

  @Test
  void shouldNotInterruptCompletedMessage() {
    LocalDateTime now = LocalDateTime.now();
    chatMessageRepository.complete(message.getId(), "Hello", null, null, null, null, now);

    int partial =
        chatMessageRepository.markPartial(
            message.getId(), "He", null, MessageStatus.INTERRUPTED, null, now);
    int orphan = chatMessageRepository.interruptIfStreaming(message.getId(), "gone", now);

    assertThat(partial).isZero();
    assertThat(orphan).isZero();
    assertThat(chatMessageRepository.findById(message.getId()).orElseThrow().getStatus())
        .isEqualTo(MessageStatus.COMPLETED);
  }

  @Test
  void shouldKeepPartialContent_whenMarkedInterrupted() {
    LocalDateTime now = LocalDateTime.now();

    chatMessageRepository.markPartial(
        message.getId(), "Hel", null, MessageStatus.INTERRUPTED, null, now);

    ChatMessage stored = chatMessageRepository.findById(message.getId()).orElseThrow();
    assertThat(stored.getContent()).isEqualTo("Hel");
    assertThat(stored.getStatus()).isEqualTo(MessageStatus.INTERRUPTED);
    assertThat(chatMessageRepository.findByChatIdOrderByCreatedAtAsc(chat.getId())).hasSize(1);
  }

  @Test
  void shouldApplyOnlyFirstTerminalTransition_ofStreamSession() {
    streamSessionRepository.save(
        StreamSession.builder().streamId("stream-1").chatId(chat.getId()).build());
    LocalDateTime now = LocalDateTime.now();

    int first =
        streamSessionRepository.markTerminal("stream-1", StreamStatus.COMPLETED, null, 4, now);
    int second =
        streamSessionRepository.markTerminal(
            "stream-1", StreamStatus.INTERRUPTED, "late", 2, now);
    int touch = streamSessionRepository.touch("stream-1", 9, now);

    assertThat(first).isEqualTo(1);
    assertThat(second).isZero();
    assertThat(touch).isZero();
    StreamSession stored = streamSessionRepository.findById("stream-1").orElseThrow();
    assertThat(stored.getStatus()).isEqualTo(StreamStatus.COMPLETED);
    assertThat(stored.getLastOffset()).isEqualTo(4);
    assertThat(stored.getCompletedAt()).isNotNull();
  }

  @Test
  void shouldFindStaleAndEndedSessions() {
    streamSessionRepository.save(StreamSession.builder().streamId("live").build());
    streamSessionRepository.save(StreamSession.builder().streamId("done").build());
    streamSessionRepository.markTerminal(
        "done", StreamStatus.COMPLETED, null, 1, LocalDateTime.now().minusHours(2));

    LocalDateTime future = LocalDateTime.now().plusMinutes(1);
    List<StreamSession> stale =
        streamSessionRepository.findByStatusAndUpdatedAtBefore(StreamStatus.STREAMING, future);
    List<StreamSession> ended =
        streamSessionRepository.findByStatusInAndCompletedAtBefore(
            List.of(StreamStatus.COMPLETED), LocalDateTime.now().minusHours(1));

    assertThat(stale).extracting(StreamSession::getStreamId).containsExactly("live");
    assertThat(ended).extracting(StreamSession::getStreamId).containsExactly("done");
  }

  @Test
  void shouldNotTreatUnknownChatAsClaimable() {
    assertThat(
            chatRepository.claimActiveStream(UUID.randomUUID(), "stream-1", LocalDateTime.now()))
        .isZero();
  }
}
