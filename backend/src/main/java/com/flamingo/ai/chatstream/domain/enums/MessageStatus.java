package com.flamingo.ai.chatstream.domain.enums;

/** Lifecycle of an assistant message produced by a stream. */
public enum MessageStatus {
  /** Tokens are still arriving; content is a checkpoint. */
  STREAMING,

  /** Generation finished normally. */
  COMPLETED,

  /** Upstream or read-loop failure; content holds the partial answer. */
  ERROR,

  /** Cancelled, disconnected or timed out; content holds the partial answer. */
  INTERRUPTED;

  public boolean isTerminal() {
    return this != STREAMING;
  }
}
