package com.flamingo.ai.chatstream.relay;

/** Token counts reported by the provider in its usage frame. */
public record TokenUsage(Integer promptTokens, Integer completionTokens) {

  /** Sums two usage reports, e.g. across tool-loop steps. Either side may be null. */
  public static TokenUsage merge(TokenUsage a, TokenUsage b) {
    if (a == null) {
      return b;
    }
    if (b == null) {
      return a;
    }
    return new TokenUsage(
        add(a.promptTokens, b.promptTokens), add(a.completionTokens, b.completionTokens));
  }

  private static Integer add(Integer x, Integer y) {
    if (x == null) {
      return y;
    }
    return y == null ? x : x + y;
  }
}
