package com.flamingo.ai.chatstream.buffer;

import com.flamingo.ai.chatstream.domain.enums.EntryKind;

/**
 * A buffered stream entry as seen by readers.
 *
 * @param streamId stream the entry belongs to
 * @param offset 1-based position in the stream, no gaps
 * @param kind entry kind
 * @param payload delta text, or the error description for {@link EntryKind#ERROR}
 */
public record StreamEntry(String streamId, long offset, EntryKind kind, String payload) {

  public boolean isTerminal() {
    return kind.isTerminal();
  }
}
