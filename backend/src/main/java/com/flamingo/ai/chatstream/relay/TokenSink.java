package com.flamingo.ai.chatstream.relay;

/** Receiver of relayed deltas. Implementations append, forward and accumulate. */
public interface TokenSink {

  void onText(String text);

  void onReasoning(String text);

  void onUsage(TokenUsage usage);
}
