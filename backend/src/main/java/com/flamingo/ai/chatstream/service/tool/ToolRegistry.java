package com.flamingo.ai.chatstream.service.tool;

import com.flamingo.ai.chatstream.relay.AssembledToolCall;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Available tools and their execution. */
@Component
@RequiredArgsConstructor
@Slf4j
public class ToolRegistry {

  private final List<ToolExecutor> executors;
  private final MeterRegistry meterRegistry;

  public boolean hasTools() {
    return executors.stream().anyMatch(ToolExecutor::isAvailable);
  }

  /** Definitions of the available tools in provider wire shape. */
  public List<Map<String, Object>> definitions() {
    return executors.stream()
        .filter(ToolExecutor::isAvailable)
        .map(ToolExecutor::definition)
        .toList();
  }

  /**
   * Executes a call. Failures are reported to the model as the tool result instead of failing the
   * stream.
   */
  public String execute(AssembledToolCall call) {
    ToolExecutor executor =
        executors.stream()
            .filter(e -> e.isAvailable() && e.name().equals(call.name()))
            .findFirst()
            .orElse(null);
    if (executor == null) {
      log.warn("Model requested unknown tool {}", call.name());
      return "Error: unknown tool " + call.name();
    }
    try {
      String result = executor.execute(call.arguments());
      meterRegistry
          .counter("stream.tool.calls", "tool", call.name(), "outcome", "success")
          .increment();
      return result;
    } catch (RuntimeException e) {
      meterRegistry
          .counter("stream.tool.calls", "tool", call.name(), "outcome", "error")
          .increment();
      log.warn("Tool {} failed: {}", call.name(), e.getMessage());
      return "Error: " + e.getMessage();
    }
  }
}
