package com.flamingo.ai.chatstream.api.sse;

import com.flamingo.ai.chatstream.api.dto.request.StartStreamRequest;
import com.flamingo.ai.chatstream.api.dto.response.StreamEventResponse;
import com.flamingo.ai.chatstream.config.StreamConfig;
import com.flamingo.ai.chatstream.service.stream.ResumeService;
import com.flamingo.ai.chatstream.service.stream.StreamHandle;
import com.flamingo.ai.chatstream.service.stream.StreamOrchestrator;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

/** Controller for starting and resuming generation streams over Server-Sent Events. */
@RestController
@RequestMapping("/stream")
@Slf4j
public class StreamController {

  public static final String STREAM_ID_HEADER = "X-Stream-Id";
  public static final String MESSAGE_ID_HEADER = "X-Message-Id";

  private static final ServerSentEvent<StreamEventResponse> KEEPALIVE =
      ServerSentEvent.<StreamEventResponse>builder().comment("keepalive").build();

  private final StreamOrchestrator streamOrchestrator;
  private final ResumeService resumeService;
  private final MeterRegistry meterRegistry;
  private final Duration keepAlive;

  private final AtomicInteger activeConnections = new AtomicInteger(0);

  public StreamController(
      StreamOrchestrator streamOrchestrator,
      ResumeService resumeService,
      MeterRegistry meterRegistry,
      StreamConfig streamConfig) {
    this.streamOrchestrator = streamOrchestrator;
    this.resumeService = resumeService;
    this.meterRegistry = meterRegistry;
    this.keepAlive = streamConfig.getResume().getKeepalive();
    meterRegistry.gauge("sse.connections.active", activeConnections);
  }

  /**
   * Starts a generation and streams its events.
   *
   * @param request the start request
   * @return SSE stream; the {@code id} of each event is its buffer offset
   */
  @PostMapping("/start")
  public ResponseEntity<Flux<ServerSentEvent<StreamEventResponse>>> start(
      @Valid @RequestBody StartStreamRequest request, HttpServletRequest httpRequest) {

    StreamHandle handle = streamOrchestrator.start(request, bucketKey(request, httpRequest));

    ResponseEntity.BodyBuilder response =
        ResponseEntity.ok()
            .contentType(MediaType.TEXT_EVENT_STREAM)
            .header(STREAM_ID_HEADER, handle.streamId());
    if (handle.messageId() != null) {
      response.header(MESSAGE_ID_HEADER, handle.messageId().toString());
    }
    return response.body(track(handle.streamId(), handle.events()));
  }

  /**
   * Resumes the chat's active stream from the buffer.
   *
   * @param chatId the chat
   * @param userId the caller, checked against the chat owner when present
   * @param lastId last event id the client received
   * @return SSE stream, or 204 when nothing is streaming
   */
  @GetMapping("/resume")
  public ResponseEntity<Flux<ServerSentEvent<StreamEventResponse>>> resume(
      @RequestParam UUID chatId,
      @RequestParam(required = false) String userId,
      @RequestParam(defaultValue = "0") long lastId) {

    Optional<ResumeService.ResumedStream> resumed = resumeService.resume(chatId, userId, lastId);
    if (resumed.isEmpty()) {
      return ResponseEntity.noContent().build();
    }
    String streamId = resumed.get().streamId();
    return ResponseEntity.ok()
        .contentType(MediaType.TEXT_EVENT_STREAM)
        .header(STREAM_ID_HEADER, streamId)
        .body(track(streamId, resumed.get().events()));
  }

  private Flux<ServerSentEvent<StreamEventResponse>> track(
      String streamId, Flux<StreamEventResponse> events) {
    Flux<ServerSentEvent<StreamEventResponse>> sse = events.map(StreamController::toSse);
    return sse.publish(
            shared ->
                Flux.merge(
                    shared,
                    Flux.interval(keepAlive)
                        .map(tick -> KEEPALIVE)
                        .takeUntilOther(shared.then())))
        .doOnSubscribe(subscription -> activeConnections.incrementAndGet())
        .doOnComplete(
            () -> {
              activeConnections.decrementAndGet();
              log.debug("Stream {} response completed", streamId);
            })
        .doOnError(
            e -> {
              activeConnections.decrementAndGet();
              log.error("Stream {} response error: {}", streamId, e.getMessage());
              meterRegistry.counter("sse.errors").increment();
            })
        .doOnCancel(
            () -> {
              activeConnections.decrementAndGet();
              log.debug("Stream {} response cancelled by client", streamId);
            });
  }

  private static ServerSentEvent<StreamEventResponse> toSse(StreamEventResponse event) {
    ServerSentEvent.Builder<StreamEventResponse> builder =
        ServerSentEvent.<StreamEventResponse>builder().data(event);
    if (event.getId() != null) {
      builder.id(String.valueOf(event.getId()));
    }
    return builder.build();
  }

  private static String bucketKey(StartStreamRequest request, HttpServletRequest httpRequest) {
    return request.getUserId() != null
        ? "user:" + request.getUserId()
        : "ip:" + httpRequest.getRemoteAddr();
  }
}
