package com.flamingo.ai.chatstream.buffer;

import com.flamingo.ai.chatstream.domain.enums.EntryKind;
import java.util.List;

/**
 * Append-only, per-stream ordered log. Exactly one writer appends to a stream; any number of
 * readers may read concurrently without locking.
 */
public interface StreamBuffer {

  /**
   * Appends an entry and returns its offset. Offsets start at 1 and increase by one per append.
   *
   * @throws com.flamingo.ai.chatstream.exception.PersistenceException if the write fails
   */
  long append(String streamId, EntryKind kind, String payload);

  /**
   * Reads up to {@code limit} entries with an offset strictly greater than {@code afterOffset}, in
   * offset order. An empty result means the reader is caught up.
   */
  List<StreamEntry> readFrom(String streamId, long afterOffset, int limit);

  /** Removes every entry of a stream. */
  void expire(String streamId);
}
