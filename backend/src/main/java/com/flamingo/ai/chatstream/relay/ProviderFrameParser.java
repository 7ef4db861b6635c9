package com.flamingo.ai.chatstream.relay;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.chatstream.exception.FrameParseException;
import com.flamingo.ai.chatstream.exception.UpstreamProviderException;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Decodes OpenAI-compatible {@code chat.completion.chunk} frames.
 *
 * <p>A frame may arrive with or without its {@code data:} prefix depending on how the response was
 * decoded. {@code [DONE]} becomes {@link TokenEvent.Type#DONE}. Both {@code reasoning} and {@code
 * reasoning_content} delta fields are read as reasoning.
 */
@Component
@RequiredArgsConstructor
public class ProviderFrameParser {

  private static final String DATA_PREFIX = "data:";
  private static final String DONE_SENTINEL = "[DONE]";

  private final ObjectMapper objectMapper;

  /**
   * Parses one frame into zero or more events.
   *
   * @throws FrameParseException if the frame is not valid JSON
   * @throws UpstreamProviderException if the provider reports an error inside the stream
   */
  public List<TokenEvent> parse(String frame) {
    String payload = normalize(frame);
    if (payload.isEmpty()) {
      return List.of();
    }
    if (DONE_SENTINEL.equals(payload)) {
      return List.of(TokenEvent.done());
    }

    JsonNode root;
    try {
      root = objectMapper.readTree(payload);
    } catch (JsonProcessingException e) {
      throw new FrameParseException(frame, e);
    }
    if (root == null || !root.isObject()) {
      throw new FrameParseException(frame, null);
    }

    JsonNode error = root.get("error");
    if (error != null && !error.isNull()) {
      String message = error.isObject() ? error.path("message").asText("") : error.asText("");
      int code = error.path("code").asInt(502);
      throw new UpstreamProviderException(
          code, message.isBlank() ? "Provider reported an error" : message);
    }

    List<TokenEvent> events = new ArrayList<>();
    JsonNode choice = root.path("choices").path(0);
    JsonNode delta = choice.path("delta");

    String reasoning = textOrNull(delta, "reasoning");
    if (reasoning == null) {
      reasoning = textOrNull(delta, "reasoning_content");
    }
    if (reasoning != null && !reasoning.isEmpty()) {
      events.add(TokenEvent.reasoning(reasoning));
    }

    String content = textOrNull(delta, "content");
    if (content != null && !content.isEmpty()) {
      events.add(TokenEvent.text(content));
    }

    JsonNode toolCalls = delta.path("tool_calls");
    if (toolCalls.isArray()) {
      for (JsonNode call : toolCalls) {
        JsonNode function = call.path("function");
        events.add(
            TokenEvent.toolCall(
                new ToolCallDelta(
                    call.path("index").asInt(0),
                    textOrNull(call, "id"),
                    textOrNull(function, "name"),
                    textOrNull(function, "arguments"))));
      }
    }

    String finishReason = textOrNull(choice, "finish_reason");
    if (finishReason != null) {
      events.add(TokenEvent.finish(finishReason));
    }

    JsonNode usage = root.get("usage");
    if (usage != null && usage.isObject()) {
      events.add(
          TokenEvent.usage(
              new TokenUsage(
                  intOrNull(usage, "prompt_tokens"), intOrNull(usage, "completion_tokens"))));
    }
    return events;
  }

  private static String normalize(String frame) {
    if (frame == null) {
      return "";
    }
    String trimmed = frame.trim();
    if (trimmed.startsWith(DATA_PREFIX)) {
      trimmed = trimmed.substring(DATA_PREFIX.length()).trim();
    }
    return trimmed;
  }

  private static String textOrNull(JsonNode node, String field) {
    JsonNode value = node.get(field);
    return value == null || value.isNull() ? null : value.asText();
  }

  private static Integer intOrNull(JsonNode node, String field) {
    JsonNode value = node.get(field);
    return value == null || !value.isNumber() ? null : value.asInt();
  }
}
