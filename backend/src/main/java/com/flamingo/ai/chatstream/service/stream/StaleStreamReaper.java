package com.flamingo.ai.chatstream.service.stream;

import com.flamingo.ai.chatstream.config.StreamConfig;
import com.flamingo.ai.chatstream.domain.entity.StreamSession;
import com.flamingo.ai.chatstream.domain.enums.StreamStatus;
import com.flamingo.ai.chatstream.service.session.StreamSessionService;
import com.flamingo.ai.chatstream.service.store.ChatStreamStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Recovers streams whose writer died: sessions still STREAMING without recent progress and without
 * a writer in this process are interrupted, their message keeps its last checkpoint and the chat
 * pointer is released.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StaleStreamReaper {

  private final StreamSessionService streamSessionService;
  private final ChatStreamStore chatStreamStore;
  private final StreamRegistry streamRegistry;
  private final StreamConfig streamConfig;
  private final MeterRegistry meterRegistry;

  @Scheduled(
      fixedDelayString = "${stream.reaper-interval:PT1M}",
      initialDelayString = "${stream.reaper-interval:PT1M}")
  public void reap() {
    LocalDateTime cutoff = LocalDateTime.now().minus(streamConfig.getStaleAfter());
    int reaped = 0;
    for (StreamSession session : streamSessionService.findStale(cutoff)) {
      if (streamRegistry.isLive(session.getStreamId())) {
        continue;
      }
      try {
        reclaim(session.getChatId(), session.getStreamId(), session, "Stream timed out");
        reaped++;
      } catch (RuntimeException e) {
        log.warn("Failed to reap stream {}: {}", session.getStreamId(), e.getMessage());
      }
    }
    if (reaped > 0) {
      log.info("Interrupted {} stale streams", reaped);
      meterRegistry.counter("stream.reaped").increment(reaped);
    }
  }

  /** Whether the stream still has a writer, here or on another process. */
  public boolean isLive(StreamSession session) {
    if (session.getStatus() != StreamStatus.STREAMING) {
      return false;
    }
    if (streamRegistry.isLive(session.getStreamId())) {
      return true;
    }
    LocalDateTime cutoff = LocalDateTime.now().minus(streamConfig.getStaleAfter());
    return session.getUpdatedAt() != null && session.getUpdatedAt().isAfter(cutoff);
  }

  /**
   * Ends a stream that has no writer and releases the chat pointer.
   *
   * @param session the stream's session, or null when it has already expired
   */
  public void reclaim(UUID chatId, String streamId, StreamSession session, String reason) {
    if (session != null && session.getStatus() == StreamStatus.STREAMING) {
      boolean marked =
          streamSessionService.markTerminal(
              streamId, StreamStatus.INTERRUPTED, reason, session.getLastOffset());
      if (marked && session.getMessageId() != null) {
        chatStreamStore.interruptOrphanedMessage(session.getMessageId(), reason);
      }
    }
    if (chatId != null) {
      chatStreamStore.clearActiveStream(chatId, streamId);
    }
    log.info("Reclaimed stream {} of chat {}: {}", streamId, chatId, reason);
  }
}
