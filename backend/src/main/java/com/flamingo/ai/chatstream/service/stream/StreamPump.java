package com.flamingo.ai.chatstream.service.stream;

import com.flamingo.ai.chatstream.config.StreamConfig;
import com.flamingo.ai.chatstream.relay.AssembledToolCall;
import com.flamingo.ai.chatstream.relay.StepResult;
import com.flamingo.ai.chatstream.relay.UpstreamClient;
import com.flamingo.ai.chatstream.relay.UpstreamConnection;
import com.flamingo.ai.chatstream.relay.UpstreamRequest;
import com.flamingo.ai.chatstream.relay.UpstreamTokenRelay;
import com.flamingo.ai.chatstream.service.tool.ToolRegistry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * Drives a stream from its first open upstream connection to its terminal path, independent of the
 * client's HTTP response. Runs the bounded tool loop: a step that ends asking for tools executes
 * them and opens the next upstream step, up to the step limit.
 */
@Component
@Slf4j
public class StreamPump {

  private final UpstreamTokenRelay relay;
  private final UpstreamClient upstreamClient;
  private final ToolRegistry toolRegistry;
  private final StreamRegistry streamRegistry;
  private final Scheduler streamScheduler;
  private final StreamConfig streamConfig;

  public StreamPump(
      UpstreamTokenRelay relay,
      UpstreamClient upstreamClient,
      ToolRegistry toolRegistry,
      StreamRegistry streamRegistry,
      @Qualifier("streamScheduler") Scheduler streamScheduler,
      StreamConfig streamConfig) {
    this.relay = relay;
    this.upstreamClient = upstreamClient;
    this.toolRegistry = toolRegistry;
    this.streamRegistry = streamRegistry;
    this.streamScheduler = streamScheduler;
    this.streamConfig = streamConfig;
  }

  /**
   * Starts relaying. Returns immediately; the writer runs its terminal path when the generation
   * ends, fails, times out or is cancelled.
   */
  public void start(
      StreamWriter writer, UpstreamConnection connection, UpstreamRequest request, int maxSteps) {
    String streamId = writer.getStreamId();

    writer.setOnTerminal(() -> streamRegistry.remove(streamId));
    if (streamConfig.getDisconnectPolicy() == StreamConfig.DisconnectPolicy.INTERRUPT) {
      writer.setOnClientCancel(() -> streamRegistry.cancel(streamId, "Client disconnected"));
    }

    Mono<Void> generation =
        runStep(writer, connection, request, 1, maxSteps)
            .timeout(streamConfig.getUpstream().getMaxDuration())
            .doOnCancel(() -> writer.interrupt("Stream cancelled"));

    Disposable.Swap subscription = Disposables.swap();
    streamRegistry.register(writer, subscription);
    subscription.update(
        generation.subscribe(
            ignored -> {}, error -> onGenerationError(writer, error), writer::complete));
    log.debug("Pump started for stream {} (max {} steps)", streamId, maxSteps);
  }

  private Mono<Void> runStep(
      StreamWriter writer,
      UpstreamConnection connection,
      UpstreamRequest request,
      int step,
      int maxSteps) {
    return relay
        .relay(connection, writer)
        .flatMap(
            result -> {
              if (!result.requestsTools() || writer.isTerminal()) {
                return Mono.<Void>empty();
              }
              if (step >= maxSteps) {
                log.info(
                    "Stream {} reached its step limit of {} with pending tool calls",
                    writer.getStreamId(),
                    maxSteps);
                return Mono.<Void>empty();
              }
              return Mono.fromCallable(() -> nextStepRequest(request, result))
                  .flatMap(
                      next ->
                          Mono.fromCallable(() -> upstreamClient.open(next))
                              .flatMap(
                                  nextConnection ->
                                      runStep(writer, nextConnection, next, step + 1, maxSteps)))
                  .subscribeOn(streamScheduler);
            });
  }

  private UpstreamRequest nextStepRequest(UpstreamRequest request, StepResult result) {
    List<Map<String, Object>> messages = new ArrayList<>(request.messages());

    Map<String, Object> assistant = new LinkedHashMap<>();
    assistant.put("role", "assistant");
    assistant.put("content", result.text());
    assistant.put(
        "tool_calls", result.toolCalls().stream().map(AssembledToolCall::toWire).toList());
    messages.add(assistant);

    for (AssembledToolCall call : result.toolCalls()) {
      log.debug("Executing tool {} ({})", call.name(), call.id());
      Map<String, Object> toolMessage = new LinkedHashMap<>();
      toolMessage.put("role", "tool");
      toolMessage.put("tool_call_id", call.id());
      toolMessage.put("content", toolRegistry.execute(call));
      messages.add(toolMessage);
    }
    return request.withMessages(messages);
  }

  private void onGenerationError(StreamWriter writer, Throwable error) {
    if (error instanceof TimeoutException) {
      writer.interrupt("Generation exceeded the maximum duration");
    } else {
      writer.fail(error);
    }
  }
}
