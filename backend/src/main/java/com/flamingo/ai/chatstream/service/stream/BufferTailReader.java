package com.flamingo.ai.chatstream.service.stream;

import com.flamingo.ai.chatstream.api.dto.response.StreamEventResponse;
import com.flamingo.ai.chatstream.buffer.StreamBuffer;
import com.flamingo.ai.chatstream.buffer.StreamEntry;
import com.flamingo.ai.chatstream.config.StreamConfig;
import com.flamingo.ai.chatstream.domain.entity.StreamSession;
import com.flamingo.ai.chatstream.domain.enums.StreamStatus;
import com.flamingo.ai.chatstream.service.session.StreamSessionService;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * Replays a stream's buffer from an offset and then follows it until a terminal entry.
 *
 * <p>When a read returns nothing new, the reader re-checks the session row: a terminal session
 * whose writer died without a terminal entry yields a synthetic terminal event. Otherwise it waits
 * one poll interval before the next read.
 */
@Component
@Slf4j
public class BufferTailReader {

  static final String TIMEOUT_MESSAGE = "Stream timeout";

  private final StreamBuffer streamBuffer;
  private final StreamSessionService streamSessionService;
  private final Scheduler streamScheduler;
  private final StreamConfig streamConfig;

  public BufferTailReader(
      StreamBuffer streamBuffer,
      StreamSessionService streamSessionService,
      @Qualifier("streamScheduler") Scheduler streamScheduler,
      StreamConfig streamConfig) {
    this.streamBuffer = streamBuffer;
    this.streamSessionService = streamSessionService;
    this.streamScheduler = streamScheduler;
    this.streamConfig = streamConfig;
  }

  /** Events with an offset greater than {@code afterOffset}, ending with a terminal event. */
  public Flux<StreamEventResponse> tail(String streamId, long afterOffset) {
    return Flux.defer(
        () -> {
          Cursor cursor =
              new Cursor(
                  streamId,
                  Math.max(0, afterOffset),
                  System.nanoTime() + streamConfig.getResume().getMaxDuration().toNanos());
          Duration pollInterval = streamConfig.getResume().getPollInterval();
          return Mono.fromCallable(cursor::next)
              .subscribeOn(streamScheduler)
              .repeatWhen(
                  reads ->
                      reads.concatMap(
                          ignored ->
                              cursor.caughtUp ? Mono.delay(pollInterval) : Mono.just(0L)))
              .takeUntil(batch -> cursor.finished)
              .concatMapIterable(batch -> batch);
        });
  }

  /** Read position of one reader. Only touched from the reader's serialized read loop. */
  private final class Cursor {

    private final String streamId;
    private final long deadlineNanos;
    private long offset;
    private volatile boolean caughtUp;
    private volatile boolean finished;

    Cursor(String streamId, long offset, long deadlineNanos) {
      this.streamId = streamId;
      this.offset = offset;
      this.deadlineNanos = deadlineNanos;
    }

    List<StreamEventResponse> next() {
      List<StreamEventResponse> batch = read();
      if (!batch.isEmpty()) {
        return batch;
      }
      Optional<StreamSession> session = streamSessionService.find(streamId);
      if (session.isEmpty() || session.get().getStatus().isTerminal()) {
        // entries appended between the read and the status check
        batch = read();
        if (batch.isEmpty()) {
          finished = true;
          return List.of(syntheticTerminal(session.orElse(null)));
        }
        return batch;
      }
      if (System.nanoTime() > deadlineNanos) {
        finished = true;
        log.debug("Resume of stream {} hit the maximum duration", streamId);
        return List.of(StreamEventResponse.error(TIMEOUT_MESSAGE, null));
      }
      caughtUp = true;
      return List.of();
    }

    private List<StreamEventResponse> read() {
      List<StreamEntry> entries =
          streamBuffer.readFrom(streamId, offset, streamConfig.getBuffer().getReadBatchSize());
      caughtUp = false;
      List<StreamEventResponse> events = new ArrayList<>(entries.size());
      for (StreamEntry entry : entries) {
        offset = entry.offset();
        events.add(StreamEventResponse.fromEntry(entry));
        if (entry.isTerminal()) {
          finished = true;
          break;
        }
      }
      return events;
    }

    private StreamEventResponse syntheticTerminal(StreamSession session) {
      if (session == null) {
        return StreamEventResponse.error("Stream expired", null);
      }
      if (session.getStatus() == StreamStatus.COMPLETED) {
        return StreamEventResponse.done(null);
      }
      String message = session.getErrorMessage();
      return StreamEventResponse.error(
          message != null ? message : "Stream " + session.getStatus().name().toLowerCase(), null);
    }
  }
}
