package com.flamingo.ai.chatstream.service.stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.chatstream.api.dto.response.StreamEventResponse;
import com.flamingo.ai.chatstream.service.store.ChatStreamStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

@ExtendWith(MockitoExtension.class)
class ResumeServiceImplTest {

  @Mock private ChatStreamStore chatStreamStore;

  @Mock private BufferTailReader bufferTailReader;

  private SimpleMeterRegistry meterRegistry;
  private ResumeServiceImpl resumeService;
  private UUID chatId;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    resumeService = new ResumeServiceImpl(chatStreamStore, bufferTailReader, meterRegistry);
    chatId = UUID.randomUUID();
  }

  @Test
  void shouldReturnEmpty_whenChatHasNoActiveStream() {
    when(chatStreamStore.getActiveStream(chatId, "user-1")).thenReturn(Optional.empty());

    Optional<ResumeService.ResumedStream> result = resumeService.resume(chatId, "user-1", 0);

    assertThat(result).isEmpty();
    verifyNoInteractions(bufferTailReader);
    assertThat(meterRegistry.counter("stream.resume.requests", "outcome", "idle").count())
        .isEqualTo(1.0);
  }

  @Test
  void shouldTailActiveStream_fromLastSeenOffset() {
    when(chatStreamStore.getActiveStream(chatId, null)).thenReturn(Optional.of("stream-9"));
    when(bufferTailReader.tail("stream-9", 1))
        .thenReturn(Flux.just(StreamEventResponse.text("b", 2), StreamEventResponse.done(3L)));

    Optional<ResumeService.ResumedStream> result = resumeService.resume(chatId, null, 1);

    assertThat(result).isPresent();
    assertThat(result.get().streamId()).isEqualTo("stream-9");
    StepVerifier.create(result.get().events())
        .expectNext(StreamEventResponse.text("b", 2))
        .expectNext(StreamEventResponse.done(3L))
        .verifyComplete();
    verify(bufferTailReader).tail("stream-9", 1);
  }
}
