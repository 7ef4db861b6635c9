package com.flamingo.ai.chatstream.service.stream;

import com.flamingo.ai.chatstream.service.store.ChatStreamStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of the ResumeService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class ResumeServiceImpl implements ResumeService {

  private final ChatStreamStore chatStreamStore;
  private final BufferTailReader bufferTailReader;
  private final MeterRegistry meterRegistry;

  @Override
  public Optional<ResumedStream> resume(UUID chatId, String userId, long lastSeenOffset) {
    Optional<String> activeStream = chatStreamStore.getActiveStream(chatId, userId);
    if (activeStream.isEmpty()) {
      meterRegistry.counter("stream.resume.requests", "outcome", "idle").increment();
      log.debug("No active stream to resume for chat {}", chatId);
      return Optional.empty();
    }

    String streamId = activeStream.get();
    meterRegistry.counter("stream.resume.requests", "outcome", "resumed").increment();
    log.info("Resuming stream {} of chat {} after offset {}", streamId, chatId, lastSeenOffset);
    return Optional.of(
        new ResumedStream(streamId, bufferTailReader.tail(streamId, lastSeenOffset)));
  }
}
