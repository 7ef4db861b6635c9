package com.flamingo.ai.chatstream.buffer;

import com.flamingo.ai.chatstream.domain.entity.BufferEntry;
import com.flamingo.ai.chatstream.domain.enums.EntryKind;
import com.flamingo.ai.chatstream.domain.repository.BufferEntryRepository;
import com.flamingo.ai.chatstream.exception.PersistenceException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Stream buffer backed by the shared {@code stream_buffer_entries} table, so a reader on any
 * process sees what the writer appended. The {@code (stream_id, seq)} unique key rejects a second
 * writer.
 */
@Component
@ConditionalOnProperty(
    prefix = "stream.buffer",
    name = "backend",
    havingValue = "jdbc",
    matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class JpaStreamBuffer implements StreamBuffer {

  private final BufferEntryRepository bufferEntryRepository;

  /**
   * Last allocated offset per stream written by this process. Appends to one stream are serialized
   * by its single writer.
   */
  private final Map<String, AtomicLong> lastOffsets = new ConcurrentHashMap<>();

  @Override
  public long append(String streamId, EntryKind kind, String payload) {
    AtomicLong last =
        lastOffsets.computeIfAbsent(
            streamId, id -> new AtomicLong(bufferEntryRepository.findLastSeq(id)));
    long offset = last.get() + 1;
    try {
      bufferEntryRepository.save(
          BufferEntry.builder().streamId(streamId).seq(offset).kind(kind).payload(payload).build());
      last.set(offset);
      return offset;
    } catch (DataAccessException e) {
      throw new PersistenceException(
          "Failed to append entry " + offset + " to stream " + streamId, e);
    } finally {
      // Nothing follows a terminal entry, written or not.
      if (kind.isTerminal()) {
        lastOffsets.remove(streamId);
      }
    }
  }

  @Override
  @Transactional(readOnly = true)
  public List<StreamEntry> readFrom(String streamId, long afterOffset, int limit) {
    return bufferEntryRepository
        .findByStreamIdAndSeqGreaterThanOrderBySeqAsc(
            streamId, afterOffset, Pageable.ofSize(Math.max(1, limit)))
        .stream()
        .map(e -> new StreamEntry(e.getStreamId(), e.getSeq(), e.getKind(), e.getPayload()))
        .toList();
  }

  @Override
  @Transactional
  public void expire(String streamId) {
    int removed = bufferEntryRepository.deleteByStreamId(streamId);
    lastOffsets.remove(streamId);
    log.debug("Expired {} buffer entries of stream {}", removed, streamId);
  }
}
