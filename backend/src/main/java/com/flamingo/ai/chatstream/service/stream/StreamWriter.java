package com.flamingo.ai.chatstream.service.stream;

import com.flamingo.ai.chatstream.api.dto.response.StreamEventResponse;
import com.flamingo.ai.chatstream.buffer.StreamBuffer;
import com.flamingo.ai.chatstream.domain.enums.EntryKind;
import com.flamingo.ai.chatstream.domain.enums.StreamStatus;
import com.flamingo.ai.chatstream.exception.PersistenceException;
import com.flamingo.ai.chatstream.exception.UpstreamProviderException;
import com.flamingo.ai.chatstream.relay.TokenSink;
import com.flamingo.ai.chatstream.relay.TokenUsage;
import com.flamingo.ai.chatstream.service.persistence.StreamPersistence;
import com.flamingo.ai.chatstream.service.session.StreamSessionService;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.util.concurrent.Queues;

/**
 * The single writer of one stream. Appends each delta to the buffer, forwards it to the live client
 * if one is attached, accumulates content and checkpoints it, and runs exactly one terminal path.
 *
 * <p>All mutations are serialized on this object's monitor, so a cancellation arriving from a
 * client thread waits for an in-flight delta and then wins or loses cleanly against completion.
 */
@Slf4j
public class StreamWriter implements TokenSink {

  private final String streamId;
  private final UUID messageId;
  private final StreamBuffer streamBuffer;
  private final StreamPersistence persistence;
  private final StreamSessionService streamSessionService;
  private final MeterRegistry meterRegistry;
  private final int checkpointEvery;
  private final Sinks.Many<StreamEventResponse> clientSink;

  private final StringBuilder content = new StringBuilder();
  private final StringBuilder reasoning = new StringBuilder();
  private long reasoningStartedAt;
  private long reasoningEndedAt;
  private TokenUsage usage;
  private int deltasSinceCheckpoint;
  private long lastOffset;
  private boolean terminal;
  private volatile boolean clientAttached = true;
  private long lastClientOffset;
  private Runnable onClientCancel = () -> {};
  private Runnable onTerminal = () -> {};

  public StreamWriter(
      String streamId,
      UUID messageId,
      StreamBuffer streamBuffer,
      StreamPersistence persistence,
      StreamSessionService streamSessionService,
      MeterRegistry meterRegistry,
      int checkpointEvery,
      int clientCapacity) {
    this.streamId = streamId;
    this.messageId = messageId;
    this.streamBuffer = streamBuffer;
    this.persistence = persistence;
    this.streamSessionService = streamSessionService;
    this.meterRegistry = meterRegistry;
    this.checkpointEvery = Math.max(1, checkpointEvery);
    this.clientSink =
        Sinks.many()
            .unicast()
            .onBackpressureBuffer(Queues.<StreamEventResponse>get(clientCapacity).get());
  }

  public String getStreamId() {
    return streamId;
  }

  public UUID getMessageId() {
    return messageId;
  }

  /**
   * Events for the originating client. Cancelling it runs the registered disconnect hook. A client
   * that falls behind by more than its queue gets a final error event naming the offset to resume
   * from, while buffering continues.
   */
  public Flux<StreamEventResponse> clientEvents() {
    return clientSink
        .asFlux()
        .onErrorResume(
            ClientLaggedException.class,
            e -> Flux.just(StreamEventResponse.error(e.getMessage(), null)))
        .doOnCancel(
            () -> {
              detachClient("cancelled");
              onClientCancel.run();
            });
  }

  void setOnClientCancel(Runnable onClientCancel) {
    this.onClientCancel = onClientCancel;
  }

  void setOnTerminal(Runnable onTerminal) {
    this.onTerminal = onTerminal;
  }

  @Override
  public synchronized void onText(String text) {
    if (terminal) {
      return;
    }
    long offset = streamBuffer.append(streamId, EntryKind.TEXT, text);
    lastOffset = offset;
    content.append(text);
    emit(StreamEventResponse.text(text, offset));
    afterDelta();
  }

  @Override
  public synchronized void onReasoning(String text) {
    if (terminal) {
      return;
    }
    long now = System.currentTimeMillis();
    if (reasoningStartedAt == 0) {
      reasoningStartedAt = now;
    }
    reasoningEndedAt = now;
    long offset = streamBuffer.append(streamId, EntryKind.REASONING, text);
    lastOffset = offset;
    reasoning.append(text);
    emit(StreamEventResponse.reasoning(text, offset));
    afterDelta();
  }

  @Override
  public synchronized void onUsage(TokenUsage reported) {
    usage = TokenUsage.merge(usage, reported);
  }

  public synchronized boolean isTerminal() {
    return terminal;
  }

  /** Normal termination: done entry, final commit, pointer cleared. */
  public synchronized void complete() {
    if (terminal) {
      return;
    }
    terminal = true;
    Long offset = appendTerminal(EntryKind.DONE, null);
    try {
      persistence.complete(content.toString(), reasoningOrNull(), thinkingTimeMs(), usage);
    } catch (RuntimeException e) {
      log.warn("Final commit of stream {} failed: {}", streamId, e.getMessage());
    }
    finish(StreamStatus.COMPLETED, null);
    emit(StreamEventResponse.done(offset));
    clientSink.tryEmitComplete();
    log.info(
        "Stream {} completed: {} chars, {} reasoning chars",
        streamId,
        content.length(),
        reasoning.length());
  }

  /** Cancellation, disconnect or timeout: interruption entry, partial commit, pointer cleared. */
  public synchronized void interrupt(String reason) {
    if (terminal) {
      return;
    }
    terminal = true;
    Long offset = appendTerminal(EntryKind.ERROR, reason);
    try {
      persistence.markInterrupted(content.toString(), reasoningOrNull());
    } catch (RuntimeException e) {
      log.warn("Partial commit of interrupted stream {} failed: {}", streamId, e.getMessage());
    }
    finish(StreamStatus.INTERRUPTED, reason);
    emit(StreamEventResponse.error(reason, offset));
    clientSink.tryEmitComplete();
    log.info("Stream {} interrupted after {} chars: {}", streamId, content.length(), reason);
  }

  /** Upstream or read-loop failure: error entry, partial commit, pointer cleared. */
  public synchronized void fail(Throwable error) {
    if (terminal) {
      return;
    }
    terminal = true;
    String message = describe(error);
    Long offset = appendTerminal(EntryKind.ERROR, message);
    try {
      persistence.markFailed(content.toString(), reasoningOrNull(), message);
    } catch (RuntimeException e) {
      log.warn("Partial commit of failed stream {} failed: {}", streamId, e.getMessage());
    }
    finish(StreamStatus.ERROR, message);
    emit(StreamEventResponse.error(message, offset));
    clientSink.tryEmitComplete();
    log.error(
        "Stream {} failed after {} chars: {}",
        streamId,
        content.length(),
        error.getMessage(),
        error);
  }

  synchronized String contentSnapshot() {
    return content.toString();
  }

  private void afterDelta() {
    if (++deltasSinceCheckpoint < checkpointEvery) {
      return;
    }
    deltasSinceCheckpoint = 0;
    try {
      persistence.checkpoint(content.toString(), reasoningOrNull());
      streamSessionService.recordProgress(streamId, lastOffset);
    } catch (PersistenceException e) {
      // retried at the next cadence
      meterRegistry.counter("stream.checkpoint.failures").increment();
      log.warn("Checkpoint of stream {} failed: {}", streamId, e.getMessage());
    }
  }

  private Long appendTerminal(EntryKind kind, String payload) {
    try {
      long offset = streamBuffer.append(streamId, kind, payload);
      lastOffset = offset;
      return offset;
    } catch (RuntimeException e) {
      log.warn("Could not append {} marker to stream {}: {}", kind, streamId, e.getMessage());
      return null;
    }
  }

  private void finish(StreamStatus status, String errorMessage) {
    try {
      streamSessionService.markTerminal(streamId, status, errorMessage, lastOffset);
    } catch (RuntimeException e) {
      log.warn("Could not mark stream {} {}: {}", streamId, status, e.getMessage());
    }
    try {
      persistence.releaseActiveStream();
    } catch (RuntimeException e) {
      log.warn("Could not clear active stream {}: {}", streamId, e.getMessage());
    }
    meterRegistry.counter("stream.finished", "status", status.name().toLowerCase()).increment();
    onTerminal.run();
  }

  private void emit(StreamEventResponse event) {
    if (!clientAttached) {
      return;
    }
    Sinks.EmitResult result = clientSink.tryEmitNext(event);
    if (result == Sinks.EmitResult.OK) {
      if (event.getId() != null) {
        lastClientOffset = event.getId();
      }
    } else if (result == Sinks.EmitResult.FAIL_OVERFLOW) {
      detachClient(result.name());
      meterRegistry.counter("stream.client.overflow").increment();
      // Delivered after the queued events drain.
      clientSink.tryEmitError(new ClientLaggedException(lastClientOffset));
    } else if (result.isFailure()) {
      detachClient(result.name());
    }
  }

  private void detachClient(String why) {
    if (clientAttached) {
      clientAttached = false;
      log.debug("Client detached from stream {} ({}), buffering continues", streamId, why);
    }
  }

  private String reasoningOrNull() {
    return reasoning.length() > 0 ? reasoning.toString() : null;
  }

  private Long thinkingTimeMs() {
    return reasoningStartedAt == 0 ? null : reasoningEndedAt - reasoningStartedAt;
  }

  private static String describe(Throwable error) {
    if (error instanceof UpstreamProviderException upstream) {
      return upstream.getProviderMessage();
    }
    String message = error.getMessage();
    return message != null && !message.isBlank() ? message : "Stream failed";
  }

  /** Ends the live feed of a client whose queue overflowed. */
  private static final class ClientLaggedException extends RuntimeException {

    ClientLaggedException(long lastDeliveredOffset) {
      super(
          "Client fell behind the stream; reconnect with lastId=" + lastDeliveredOffset,
          null,
          false,
          false);
    }
  }
}
