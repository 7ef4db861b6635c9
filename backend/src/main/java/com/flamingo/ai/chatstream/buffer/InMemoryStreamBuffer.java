package com.flamingo.ai.chatstream.buffer;

import com.flamingo.ai.chatstream.domain.enums.EntryKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Process-local stream buffer for development and tests. Readers on other processes cannot see it,
 * so it must not be used behind a load balancer.
 */
@Component
@ConditionalOnProperty(prefix = "stream.buffer", name = "backend", havingValue = "memory")
@Slf4j
public class InMemoryStreamBuffer implements StreamBuffer {

  private final Map<String, List<StreamEntry>> streams = new ConcurrentHashMap<>();

  public InMemoryStreamBuffer() {
    log.warn("Using in-memory stream buffer; resume only works on this process");
  }

  @Override
  public long append(String streamId, EntryKind kind, String payload) {
    List<StreamEntry> entries = streams.computeIfAbsent(streamId, id -> new ArrayList<>());
    synchronized (entries) {
      long offset = entries.size() + 1L;
      entries.add(new StreamEntry(streamId, offset, kind, payload));
      return offset;
    }
  }

  @Override
  public List<StreamEntry> readFrom(String streamId, long afterOffset, int limit) {
    List<StreamEntry> entries = streams.get(streamId);
    if (entries == null) {
      return List.of();
    }
    synchronized (entries) {
      // offsets are 1-based and gapless, so offset n sits at index n - 1
      int from = (int) Math.min(Math.max(afterOffset, 0), entries.size());
      int to = Math.min(entries.size(), from + Math.max(1, limit));
      return List.copyOf(entries.subList(from, to));
    }
  }

  @Override
  public void expire(String streamId) {
    streams.remove(streamId);
  }
}
