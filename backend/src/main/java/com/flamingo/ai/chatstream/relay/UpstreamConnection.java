package com.flamingo.ai.chatstream.relay;

import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

/** An upstream response whose headers arrived with a 2xx status and whose body is not read yet. */
@Slf4j
public class UpstreamConnection {

  private final int status;
  private final Flux<String> frames;

  public UpstreamConnection(int status, Flux<String> frames) {
    this.status = status;
    this.frames = frames;
  }

  public int getStatus() {
    return status;
  }

  /** Body frames. May be subscribed once. */
  public Flux<String> frames() {
    return frames;
  }

  /** Releases a connection that will never be relayed. */
  public void abort() {
    Disposable subscription =
        frames.subscribe(
            frame -> {},
            error -> log.debug("Aborted upstream body failed: {}", error.getMessage()));
    subscription.dispose();
  }
}
