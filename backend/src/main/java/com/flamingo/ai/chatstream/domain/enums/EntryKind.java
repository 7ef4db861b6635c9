package com.flamingo.ai.chatstream.domain.enums;

/** Kind of a buffered stream entry. */
public enum EntryKind {
  /** Answer text delta. */
  TEXT,

  /** Reasoning delta. */
  REASONING,

  /** Stream finished normally. Always the last entry. */
  DONE,

  /** Stream ended with an error or interruption. Always the last entry. */
  ERROR;

  public boolean isTerminal() {
    return this == DONE || this == ERROR;
  }
}
