package com.flamingo.ai.chatstream.service.stream;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import jakarta.annotation.PreDestroy;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;

/** Streams whose writer runs in this process. */
@Component
@Slf4j
public class StreamRegistry {

  private final Map<String, LiveStream> live = new ConcurrentHashMap<>();

  public StreamRegistry(MeterRegistry meterRegistry) {
    meterRegistry.gaugeMapSize("stream.active", Tags.empty(), live);
  }

  void register(StreamWriter writer, Disposable generation) {
    live.put(writer.getStreamId(), new LiveStream(writer, generation));
  }

  void remove(String streamId) {
    live.remove(streamId);
  }

  public boolean isLive(String streamId) {
    return live.containsKey(streamId);
  }

  public int size() {
    return live.size();
  }

  /**
   * Interrupts a local stream and cancels its upstream subscription.
   *
   * @return false if the stream is not running here
   */
  public boolean cancel(String streamId, String reason) {
    LiveStream stream = live.get(streamId);
    if (stream == null) {
      return false;
    }
    stream.writer().interrupt(reason);
    stream.generation().dispose();
    return true;
  }

  @PreDestroy
  public void shutdown() {
    if (live.isEmpty()) {
      return;
    }
    log.info("Interrupting {} live streams on shutdown", live.size());
    for (String streamId : List.copyOf(live.keySet())) {
      cancel(streamId, "Server shutting down");
    }
  }

  private record LiveStream(StreamWriter writer, Disposable generation) {}
}
