package com.flamingo.ai.chatstream.domain.enums;

/** Lifecycle of a single generation attempt. */
public enum StreamStatus {
  STREAMING,
  COMPLETED,
  ERROR,
  INTERRUPTED;

  public boolean isTerminal() {
    return this != STREAMING;
  }
}
