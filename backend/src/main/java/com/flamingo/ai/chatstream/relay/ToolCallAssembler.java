package com.flamingo.ai.chatstream.relay;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/** Joins streamed tool-call fragments by index. Not thread-safe; owned by one relay step. */
class ToolCallAssembler {

  private final Map<Integer, Builder> calls = new TreeMap<>();

  void add(ToolCallDelta delta) {
    Builder builder = calls.computeIfAbsent(delta.index(), i -> new Builder());
    if (delta.id() != null && !delta.id().isEmpty()) {
      builder.id = delta.id();
    }
    if (delta.name() != null && !delta.name().isEmpty()) {
      builder.name = delta.name();
    }
    if (delta.arguments() != null) {
      builder.arguments.append(delta.arguments());
    }
  }

  List<AssembledToolCall> build() {
    List<AssembledToolCall> result = new ArrayList<>();
    calls.forEach(
        (index, builder) -> {
          if (builder.name != null) {
            String id = builder.id != null ? builder.id : "call_" + index;
            String arguments = builder.arguments.length() > 0 ? builder.arguments.toString() : "{}";
            result.add(new AssembledToolCall(id, builder.name, arguments));
          }
        });
    return result;
  }

  private static final class Builder {
    private String id;
    private String name;
    private final StringBuilder arguments = new StringBuilder();
  }
}
