package com.flamingo.ai.chatstream.relay;

import java.util.List;

/**
 * Outcome of relaying one upstream response.
 *
 * @param finishReason last finish reason the provider sent, may be null
 * @param text answer text relayed during this step
 * @param toolCalls tool calls the model requested
 */
public record StepResult(String finishReason, String text, List<AssembledToolCall> toolCalls) {

  public boolean requestsTools() {
    return !toolCalls.isEmpty()
        && (finishReason == null || "tool_calls".equals(finishReason));
  }
}
