package com.flamingo.ai.chatstream.relay;

import java.util.LinkedHashMap;
import java.util.Map;

/** A complete tool call requested by the model. */
public record AssembledToolCall(String id, String name, String arguments) {

  /** Provider wire shape for the assistant message that carries the call. */
  public Map<String, Object> toWire() {
    Map<String, Object> function = new LinkedHashMap<>();
    function.put("name", name);
    function.put("arguments", arguments);
    Map<String, Object> call = new LinkedHashMap<>();
    call.put("id", id);
    call.put("type", "function");
    call.put("function", function);
    return call;
  }
}
