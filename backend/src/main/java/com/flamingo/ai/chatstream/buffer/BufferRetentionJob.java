package com.flamingo.ai.chatstream.buffer;

import com.flamingo.ai.chatstream.config.StreamConfig;
import com.flamingo.ai.chatstream.domain.entity.StreamSession;
import com.flamingo.ai.chatstream.domain.enums.StreamStatus;
import com.flamingo.ai.chatstream.service.session.StreamSessionService;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.LocalDateTime;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Deletes buffered entries and session rows of streams that ended longer ago than their retention
 * period. Completed streams are kept longer than failed ones.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BufferRetentionJob {

  private final StreamBuffer streamBuffer;
  private final StreamSessionService streamSessionService;
  private final StreamConfig streamConfig;
  private final MeterRegistry meterRegistry;

  @Scheduled(
      fixedDelayString = "${stream.buffer.sweep-interval:PT1M}",
      initialDelayString = "${stream.buffer.sweep-interval:PT1M}")
  public void sweep() {
    LocalDateTime now = LocalDateTime.now();
    StreamConfig.Buffer buffer = streamConfig.getBuffer();

    int expired =
        expire(
            streamSessionService.findEndedBefore(
                List.of(StreamStatus.COMPLETED), now.minus(buffer.getRetentionCompleted())));
    expired +=
        expire(
            streamSessionService.findEndedBefore(
                List.of(StreamStatus.ERROR, StreamStatus.INTERRUPTED),
                now.minus(buffer.getRetentionFailed())));

    if (expired > 0) {
      log.info("Expired {} finished streams", expired);
      meterRegistry.counter("stream.buffer.expired").increment(expired);
    }
  }

  private int expire(List<StreamSession> sessions) {
    int count = 0;
    for (StreamSession session : sessions) {
      try {
        streamBuffer.expire(session.getStreamId());
        streamSessionService.delete(session.getStreamId());
        count++;
      } catch (RuntimeException e) {
        log.warn("Failed to expire stream {}: {}", session.getStreamId(), e.getMessage());
      }
    }
    return count;
  }
}
