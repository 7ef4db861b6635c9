package com.flamingo.ai.chatstream.relay;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One streaming chat-completions call.
 *
 * @param provider endpoint and credential
 * @param model provider model id
 * @param messages conversation in provider wire shape
 * @param reasoningEffort none, low, medium or high; null leaves the provider default
 * @param tools tool definitions in provider wire shape; empty when tools are off
 */
public record UpstreamRequest(
    ResolvedProvider provider,
    String model,
    List<Map<String, Object>> messages,
    String reasoningEffort,
    List<Map<String, Object>> tools) {

  /** Request body for {@code POST /chat/completions}. */
  public Map<String, Object> toBody() {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("model", model);
    body.put("stream", true);
    body.put("stream_options", Map.of("include_usage", true));
    body.put("messages", messages);
    if (reasoningEffort != null && !"none".equals(reasoningEffort)) {
      body.put("reasoning", Map.of("effort", reasoningEffort));
    }
    if (tools != null && !tools.isEmpty()) {
      body.put("tools", tools);
      body.put("tool_choice", "auto");
    }
    return body;
  }

  /** Same call with a longer conversation, used for the next tool-loop step. */
  public UpstreamRequest withMessages(List<Map<String, Object>> nextMessages) {
    return new UpstreamRequest(provider, model, nextMessages, reasoningEffort, tools);
  }
}
