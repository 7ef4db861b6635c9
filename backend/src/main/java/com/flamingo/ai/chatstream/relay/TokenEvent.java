package com.flamingo.ai.chatstream.relay;

/** Typed event decoded from one provider frame. */
public record TokenEvent(
    Type type, String text, ToolCallDelta toolCall, TokenUsage usage, String finishReason) {

  /** Event type. */
  public enum Type {
    TEXT,
    REASONING,
    TOOL_CALL,
    USAGE,
    FINISH,
    /** Provider end-of-stream sentinel. */
    DONE
  }

  public static TokenEvent text(String text) {
    return new TokenEvent(Type.TEXT, text, null, null, null);
  }

  public static TokenEvent reasoning(String text) {
    return new TokenEvent(Type.REASONING, text, null, null, null);
  }

  public static TokenEvent toolCall(ToolCallDelta delta) {
    return new TokenEvent(Type.TOOL_CALL, null, delta, null, null);
  }

  public static TokenEvent usage(TokenUsage usage) {
    return new TokenEvent(Type.USAGE, null, null, usage, null);
  }

  public static TokenEvent finish(String finishReason) {
    return new TokenEvent(Type.FINISH, null, null, null, finishReason);
  }

  public static TokenEvent done() {
    return new TokenEvent(Type.DONE, null, null, null, null);
  }

  public boolean isDone() {
    return type == Type.DONE;
  }
}
