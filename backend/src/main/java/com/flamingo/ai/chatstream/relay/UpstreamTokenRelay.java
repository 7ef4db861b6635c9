package com.flamingo.ai.chatstream.relay;

import com.flamingo.ai.chatstream.config.StreamConfig;
import com.flamingo.ai.chatstream.exception.FrameParseException;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * Reads provider frames off an open connection and pushes typed deltas into a {@link TokenSink}.
 *
 * <p>Frames are handed from the network thread to the stream scheduler through a bounded queue, so
 * every delta of a stream is applied by one thread at a time and blocking buffer writes never run
 * on an event loop. Malformed frames are logged, counted and skipped.
 */
@Component
@Slf4j
public class UpstreamTokenRelay {

  private final ProviderFrameParser frameParser;
  private final MeterRegistry meterRegistry;
  private final Scheduler streamScheduler;
  private final int channelCapacity;

  public UpstreamTokenRelay(
      ProviderFrameParser frameParser,
      MeterRegistry meterRegistry,
      @Qualifier("streamScheduler") Scheduler streamScheduler,
      StreamConfig streamConfig) {
    this.frameParser = frameParser;
    this.meterRegistry = meterRegistry;
    this.streamScheduler = streamScheduler;
    this.channelCapacity = streamConfig.getChannel().getCapacity();
  }

  /**
   * Relays one upstream response until the provider's end sentinel or end of body.
   *
   * @return the step outcome; errors from the read loop are propagated
   */
  public Mono<StepResult> relay(UpstreamConnection connection, TokenSink sink) {
    return connection
        .frames()
        .publishOn(streamScheduler, channelCapacity)
        .concatMapIterable(this::parseSkippingMalformed)
        .takeUntil(TokenEvent::isDone)
        .reduceWith(
            StepAccumulator::new,
            (step, event) -> {
              step.apply(event, sink);
              return step;
            })
        .map(StepAccumulator::toResult);
  }

  private List<TokenEvent> parseSkippingMalformed(String frame) {
    try {
      return frameParser.parse(frame);
    } catch (FrameParseException e) {
      meterRegistry.counter("stream.frames.malformed").increment();
      log.warn("Skipping malformed provider frame: {}", abbreviate(e.getFrame()));
      return List.of();
    }
  }

  private static String abbreviate(String frame) {
    if (frame == null) {
      return "null";
    }
    return frame.length() > 200 ? frame.substring(0, 200) + "..." : frame;
  }

  /** Per-step state: finish reason, step text and tool-call fragments. */
  private static final class StepAccumulator {

    private final StringBuilder text = new StringBuilder();
    private final ToolCallAssembler toolCalls = new ToolCallAssembler();
    private String finishReason;

    void apply(TokenEvent event, TokenSink sink) {
      switch (event.type()) {
        case TEXT -> {
          text.append(event.text());
          sink.onText(event.text());
        }
        case REASONING -> sink.onReasoning(event.text());
        case TOOL_CALL -> toolCalls.add(event.toolCall());
        case USAGE -> sink.onUsage(event.usage());
        case FINISH -> finishReason = event.finishReason();
        case DONE -> {
          // end sentinel, nothing to apply
        }
        default -> throw new IllegalStateException("Unexpected event type: " + event.type());
      }
    }

    StepResult toResult() {
      return new StepResult(finishReason, text.toString(), toolCalls.build());
    }
  }
}
