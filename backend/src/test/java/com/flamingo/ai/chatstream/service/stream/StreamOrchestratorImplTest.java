package com.flamingo.ai.chatstream.service.stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.chatstream.api.dto.request.ChatMessageInput;
import com.flamingo.ai.chatstream.api.dto.request.StartStreamRequest;
import com.flamingo.ai.chatstream.buffer.StreamBuffer;
import com.flamingo.ai.chatstream.config.StreamConfig;
import com.flamingo.ai.chatstream.domain.entity.Chat;
import com.flamingo.ai.chatstream.domain.entity.StreamSession;
import com.flamingo.ai.chatstream.domain.enums.StreamStatus;
import com.flamingo.ai.chatstream.exception.AuthException;
import com.flamingo.ai.chatstream.exception.ChatNotFoundException;
import com.flamingo.ai.chatstream.exception.ConfigurationException;
import com.flamingo.ai.chatstream.exception.RateLimitException;
import com.flamingo.ai.chatstream.exception.StreamConflictException;
import com.flamingo.ai.chatstream.exception.ValidationException;
import com.flamingo.ai.chatstream.relay.UpstreamClient;
import com.flamingo.ai.chatstream.relay.UpstreamConnection;
import com.flamingo.ai.chatstream.relay.UpstreamRequest;
import com.flamingo.ai.chatstream.service.persistence.PersistenceFlusher;
import com.flamingo.ai.chatstream.service.ratelimit.RateLimitDecision;
import com.flamingo.ai.chatstream.service.ratelimit.RateLimitGate;
import com.flamingo.ai.chatstream.service.session.StreamSessionService;
import com.flamingo.ai.chatstream.service.store.ChatStreamStore;
import com.flamingo.ai.chatstream.service.tool.ToolRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class StreamOrchestratorImplTest {

  private static final String BUCKET = "user:user-1";

  @Mock private RateLimitGate rateLimitGate;
  @Mock private ChatStreamStore chatStreamStore;
  @Mock private StreamSessionService streamSessionService;
  @Mock private PersistenceFlusher persistenceFlusher;
  @Mock private StreamBuffer streamBuffer;
  @Mock private UpstreamClient upstreamClient;
  @Mock private UpstreamConnection connection;
  @Mock private StreamPump streamPump;
  @Mock private StaleStreamReaper staleStreamReaper;
  @Mock private ToolRegistry toolRegistry;

  private StreamConfig streamConfig;
  private SimpleMeterRegistry meterRegistry;
  private StreamOrchestratorImpl orchestrator;
  private UUID chatId;

  @BeforeEach
  void setUp() {
    streamConfig = new StreamConfig();
    StreamConfig.Provider osschat = new StreamConfig.Provider();
    osschat.setApiKey("server-key");
    StreamConfig.Provider openrouter = new StreamConfig.Provider();
    openrouter.setRequiresCallerCredential(true);
    StreamConfig.Provider unconfigured = new StreamConfig.Provider();
    streamConfig.setProviders(
        Map.of("osschat", osschat, "openrouter", openrouter, "local", unconfigured));
    meterRegistry = new SimpleMeterRegistry();

    orchestrator =
        new StreamOrchestratorImpl(
            new StreamRequestValidator(),
            rateLimitGate,
            new ProviderResolver(streamConfig),
            chatStreamStore,
            streamSessionService,
            persistenceFlusher,
            streamBuffer,
            upstreamClient,
            streamPump,
            staleStreamReaper,
            toolRegistry,
            streamConfig,
            meterRegistry);

    chatId = UUID.randomUUID();
    when(rateLimitGate.checkAndConsume(anyString())).thenReturn(RateLimitDecision.allow());
    when(chatStreamStore.requireChat(eq(chatId), any()))
        .thenReturn(Chat.builder().id(chatId).userId("user-1").build());
    when(chatStreamStore.createAssistantMessage(eq(chatId), any(), anyString(), anyString()))
        .thenReturn(UUID.randomUUID());
    when(chatStreamStore.setActiveStream(eq(chatId), any(), anyString())).thenReturn(true);
    when(upstreamClient.open(any(UpstreamRequest.class))).thenReturn(connection);
  }

  @Test
  void shouldRejectInvalidRequest_beforeAnySideEffect() {
    StartStreamRequest request = request(chatId);
    request.setMessages(List.of());

    assertThatThrownBy(() -> orchestrator.start(request, BUCKET))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("messages");
    verifyNoInteractions(rateLimitGate, upstreamClient, chatStreamStore, streamSessionService);
  }

  @Test
  void shouldRejectUnknownRole() {
    StartStreamRequest request = request(chatId);
    request.setMessages(
        List.of(ChatMessageInput.builder().role("robot").content("hi").build()));

    assertThatThrownBy(() -> orchestrator.start(request, BUCKET))
        .isInstanceOf(ValidationException.class);
    verifyNoInteractions(upstreamClient);
  }

  @Test
  void shouldRejectRateLimitedCaller_withRetryHint() {
    when(rateLimitGate.checkAndConsume(BUCKET)).thenReturn(RateLimitDecision.deny(4_200));

    assertThatThrownBy(() -> orchestrator.start(request(chatId), BUCKET))
        .isInstanceOf(RateLimitException.class)
        .satisfies(e -> assertThat(((RateLimitException) e).getRetryAfterSeconds()).isEqualTo(5));
    verifyNoInteractions(upstreamClient, chatStreamStore, streamSessionService);
    assertThat(meterRegistry.counter("stream.rejected", "reason", "rate_limited").count())
        .isEqualTo(1.0);
  }

  @Test
  void shouldRequireCallerCredential_forCallerKeyedProvider() {
    StartStreamRequest request = request(chatId);
    request.setProviderSelector("openrouter");

    assertThatThrownBy(() -> orchestrator.start(request, BUCKET))
        .isInstanceOf(AuthException.class);
    verifyNoInteractions(upstreamClient, streamSessionService);
  }

  @Test
  void shouldFailWithConfigurationError_whenServerKeyMissing() {
    StartStreamRequest request = request(chatId);
    request.setProviderSelector("local");

    assertThatThrownBy(() -> orchestrator.start(request, BUCKET))
        .isInstanceOf(ConfigurationException.class);
    verifyNoInteractions(upstreamClient);
  }

  @Test
  void shouldReturnNotFound_whenChatNotOwned() {
    when(chatStreamStore.requireChat(eq(chatId), any()))
        .thenThrow(new ChatNotFoundException(chatId));

    assertThatThrownBy(() -> orchestrator.start(request(chatId), BUCKET))
        .isInstanceOf(ChatNotFoundException.class);
    verifyNoInteractions(upstreamClient);
  }

  @Test
  void shouldRejectSecondStart_whileStreamIsLive() {
    StreamSession live = StreamSession.builder().streamId("live-1").chatId(chatId).build();
    when(chatStreamStore.requireChat(eq(chatId), any()))
        .thenReturn(Chat.builder().id(chatId).userId("user-1").activeStreamId("live-1").build());
    when(streamSessionService.find("live-1")).thenReturn(Optional.of(live));
    when(staleStreamReaper.isLive(live)).thenReturn(true);

    assertThatThrownBy(() -> orchestrator.start(request(chatId), BUCKET))
        .isInstanceOf(StreamConflictException.class)
        .satisfies(
            e -> assertThat(((StreamConflictException) e).getActiveStreamId()).isEqualTo("live-1"));
    verifyNoInteractions(upstreamClient);
    verify(chatStreamStore, never()).createAssistantMessage(any(), any(), any(), any());
  }

  @Test
  void shouldReclaimStalePointer_andStart() {
    StreamSession stale =
        StreamSession.builder()
            .streamId("old-1")
            .chatId(chatId)
            .status(StreamStatus.STREAMING)
            .build();
    when(chatStreamStore.requireChat(eq(chatId), any()))
        .thenReturn(Chat.builder().id(chatId).userId("user-1").activeStreamId("old-1").build());
    when(streamSessionService.find("old-1")).thenReturn(Optional.of(stale));
    when(staleStreamReaper.isLive(stale)).thenReturn(false);

    StreamHandle handle = orchestrator.start(request(chatId), BUCKET);

    verify(staleStreamReaper).reclaim(eq(chatId), eq("old-1"), eq(stale), anyString());
    assertThat(handle.streamId()).isNotEqualTo("old-1");
  }

  @Test
  void shouldWriteNothing_whenProviderRejectsCredentials() {
    when(upstreamClient.open(any(UpstreamRequest.class)))
        .thenThrow(new AuthException("Invalid API key"));

    assertThatThrownBy(() -> orchestrator.start(request(chatId), BUCKET))
        .isInstanceOf(AuthException.class)
        .hasMessage("Invalid API key");
    verify(chatStreamStore, never()).createAssistantMessage(any(), any(), any(), any());
    verify(chatStreamStore, never()).setActiveStream(any(), any(), any());
    verifyNoInteractions(streamSessionService, streamPump);
  }

  @Test
  void shouldOpenUpstreamBeforeWritingRows_thenStartPump() {
    StreamHandle handle = orchestrator.start(request(chatId), BUCKET);

    InOrder order = inOrder(upstreamClient, chatStreamStore, streamSessionService, streamPump);
    order.verify(upstreamClient).open(any(UpstreamRequest.class));
    order
        .verify(chatStreamStore)
        .createAssistantMessage(eq(chatId), eq("user-1"), eq(handle.streamId()), eq("test-model"));
    order.verify(streamSessionService).open(eq(handle.streamId()), eq(chatId), any(UUID.class));
    order.verify(chatStreamStore).setActiveStream(chatId, "user-1", handle.streamId());
    order.verify(streamPump).start(any(StreamWriter.class), eq(connection), any(), eq(1));
    assertThat(handle.messageId()).isNotNull();
    assertThat(handle.events()).isNotNull();
    assertThat(meterRegistry.counter("stream.started", "provider", "osschat").count())
        .isEqualTo(1.0);
  }

  @Test
  void shouldAbortConnection_whenPointerClaimLosesRace() {
    when(chatStreamStore.setActiveStream(eq(chatId), any(), anyString())).thenReturn(false);

    assertThatThrownBy(() -> orchestrator.start(request(chatId), BUCKET))
        .isInstanceOf(StreamConflictException.class);
    verify(connection).abort();
    verify(streamSessionService)
        .markTerminal(anyString(), eq(StreamStatus.INTERRUPTED), anyString(), anyLong());
    verify(persistenceFlusher).markInterrupted(any(UUID.class), eq(""), isNull());
    verifyNoInteractions(streamPump);
  }

  @Test
  void shouldStartEphemeralStream_withoutChatRows() {
    StreamHandle handle = orchestrator.start(request(null), BUCKET);

    assertThat(handle.messageId()).isNull();
    verify(streamSessionService).open(handle.streamId(), null, null);
    verifyNoInteractions(chatStreamStore);
    verify(streamPump).start(any(StreamWriter.class), eq(connection), any(), anyInt());
  }

  @Test
  void shouldSendToolsAndClampSteps_whenToolsEnabled() {
    when(toolRegistry.hasTools()).thenReturn(true);
    when(toolRegistry.definitions()).thenReturn(List.of(Map.of("type", "function")));
    StartStreamRequest request = request(chatId);
    request.setEnableTools(true);
    request.setMaxSteps(50);

    orchestrator.start(request, BUCKET);

    ArgumentCaptor<UpstreamRequest> sent = ArgumentCaptor.forClass(UpstreamRequest.class);
    verify(upstreamClient).open(sent.capture());
    assertThat(sent.getValue().tools()).hasSize(1);
    assertThat(sent.getValue().toBody()).containsEntry("tool_choice", "auto");
    verify(streamPump).start(any(StreamWriter.class), eq(connection), any(), eq(10));
  }

  private static StartStreamRequest request(UUID chatId) {
    return StartStreamRequest.builder()
        .messages(List.of(ChatMessageInput.builder().role("user").content("Say hello").build()))
        .model("test-model")
        .providerSelector("osschat")
        .chatId(chatId)
        .userId("user-1")
        .build();
  }
}
