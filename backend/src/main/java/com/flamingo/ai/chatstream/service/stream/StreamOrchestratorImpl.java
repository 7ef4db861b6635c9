package com.flamingo.ai.chatstream.service.stream;

import com.flamingo.ai.chatstream.api.dto.request.ChatMessageInput;
import com.flamingo.ai.chatstream.api.dto.request.StartStreamRequest;
import com.flamingo.ai.chatstream.api.dto.response.StreamEventResponse;
import com.flamingo.ai.chatstream.buffer.StreamBuffer;
import com.flamingo.ai.chatstream.config.StreamConfig;
import com.flamingo.ai.chatstream.domain.entity.Chat;
import com.flamingo.ai.chatstream.domain.entity.StreamSession;
import com.flamingo.ai.chatstream.domain.enums.StreamStatus;
import com.flamingo.ai.chatstream.exception.RateLimitException;
import com.flamingo.ai.chatstream.exception.StreamConflictException;
import com.flamingo.ai.chatstream.relay.ResolvedProvider;
import com.flamingo.ai.chatstream.relay.UpstreamClient;
import com.flamingo.ai.chatstream.relay.UpstreamConnection;
import com.flamingo.ai.chatstream.relay.UpstreamRequest;
import com.flamingo.ai.chatstream.service.persistence.ChatStreamPersistence;
import com.flamingo.ai.chatstream.service.persistence.PersistenceFlusher;
import com.flamingo.ai.chatstream.service.persistence.StreamPersistence;
import com.flamingo.ai.chatstream.service.ratelimit.RateLimitDecision;
import com.flamingo.ai.chatstream.service.ratelimit.RateLimitGate;
import com.flamingo.ai.chatstream.service.session.StreamSessionService;
import com.flamingo.ai.chatstream.service.store.ChatStreamStore;
import com.flamingo.ai.chatstream.service.tool.ToolRegistry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

/**
 * Implementation of the StreamOrchestrator.
 *
 * <p>Order of a start: validate, rate limit, resolve credentials, check the chat for a live stream,
 * open the upstream connection. Only after the provider answered 2xx are the message row, the
 * session row and the chat pointer written, in that order, and the pump started.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StreamOrchestratorImpl implements StreamOrchestrator {

  private final StreamRequestValidator requestValidator;
  private final RateLimitGate rateLimitGate;
  private final ProviderResolver providerResolver;
  private final ChatStreamStore chatStreamStore;
  private final StreamSessionService streamSessionService;
  private final PersistenceFlusher persistenceFlusher;
  private final StreamBuffer streamBuffer;
  private final UpstreamClient upstreamClient;
  private final StreamPump streamPump;
  private final StaleStreamReaper staleStreamReaper;
  private final ToolRegistry toolRegistry;
  private final StreamConfig streamConfig;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "stream.start", description = "Time to admit a stream and reach the provider")
  public StreamHandle start(StartStreamRequest request, String bucketKey) {
    requestValidator.validate(request);

    RateLimitDecision decision = rateLimitGate.checkAndConsume(bucketKey);
    if (!decision.allowed()) {
      meterRegistry.counter("stream.rejected", "reason", "rate_limited").increment();
      throw new RateLimitException(
          "Rate limit exceeded. Please try again later.", decision.retryAfterMs());
    }

    ResolvedProvider provider =
        providerResolver.resolve(request.getProviderSelector(), request.getCredentialMaterial());

    UUID chatId = request.getChatId();
    if (chatId != null) {
      Chat chat = chatStreamStore.requireChat(chatId, request.getUserId());
      ensureNoLiveStream(chat);
    }

    boolean toolsEnabled = Boolean.TRUE.equals(request.getEnableTools()) && toolRegistry.hasTools();
    int maxSteps = toolsEnabled ? clampSteps(request.getMaxSteps()) : 1;
    UpstreamRequest upstreamRequest =
        new UpstreamRequest(
            provider,
            request.getModel(),
            toWireMessages(request.getMessages()),
            request.getReasoningEffort(),
            toolsEnabled ? toolRegistry.definitions() : List.of());

    UpstreamConnection connection = upstreamClient.open(upstreamRequest);

    String streamId = UUID.randomUUID().toString();
    UUID messageId = null;
    StreamPersistence persistence = StreamPersistence.detached();
    try {
      if (chatId != null) {
        messageId =
            chatStreamStore.createAssistantMessage(
                chatId, request.getUserId(), streamId, request.getModel());
        persistence =
            new ChatStreamPersistence(
                persistenceFlusher, chatStreamStore, chatId, messageId, streamId);
      }
      streamSessionService.open(streamId, chatId, messageId);
      if (chatId != null
          && !chatStreamStore.setActiveStream(chatId, request.getUserId(), streamId)) {
        abandon(streamId, persistence, "Superseded by a concurrent request");
        throw new StreamConflictException(chatId, null);
      }
    } catch (RuntimeException e) {
      connection.abort();
      throw e;
    }

    StreamWriter writer =
        new StreamWriter(
            streamId,
            messageId,
            streamBuffer,
            persistence,
            streamSessionService,
            meterRegistry,
            streamConfig.getCheckpoint().getEveryDeltas(),
            streamConfig.getChannel().getCapacity());
    Flux<StreamEventResponse> events = writer.clientEvents();
    streamPump.start(writer, connection, upstreamRequest, maxSteps);

    meterRegistry.counter("stream.started", "provider", provider.name()).increment();
    log.info(
        "Started stream {} for chat {} (message {}, model {}, steps {})",
        streamId,
        chatId,
        messageId,
        request.getModel(),
        maxSteps);
    return new StreamHandle(streamId, messageId, events);
  }

  private void ensureNoLiveStream(Chat chat) {
    String current = chat.getActiveStreamId();
    if (current == null) {
      return;
    }
    Optional<StreamSession> session = streamSessionService.find(current);
    if (session.isPresent() && staleStreamReaper.isLive(session.get())) {
      meterRegistry.counter("stream.rejected", "reason", "conflict").increment();
      throw new StreamConflictException(chat.getId(), current);
    }
    staleStreamReaper.reclaim(
        chat.getId(), current, session.orElse(null), "Superseded by a new request");
  }

  private void abandon(String streamId, StreamPersistence persistence, String reason) {
    persistence.markInterrupted("", null);
    streamSessionService.markTerminal(streamId, StreamStatus.INTERRUPTED, reason, 0);
  }

  private int clampSteps(Integer requested) {
    StreamConfig.Tools tools = streamConfig.getTools();
    int steps = requested != null ? requested : tools.getDefaultMaxSteps();
    return Math.max(1, Math.min(steps, tools.getMaxStepsCeiling()));
  }

  private static List<Map<String, Object>> toWireMessages(List<ChatMessageInput> messages) {
    return messages.stream()
        .map(m -> Map.<String, Object>of("role", m.getRole(), "content", m.resolveText()))
        .toList();
  }
}
