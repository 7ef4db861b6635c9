package com.flamingo.ai.chatstream.service.stream;

import com.flamingo.ai.chatstream.api.dto.response.StreamEventResponse;
import java.util.Optional;
import java.util.UUID;
import reactor.core.publisher.Flux;

/** Reattaches a client to a chat's live stream from the durable buffer. */
public interface ResumeService {

  /**
   * Replays and tails the chat's active stream. Never calls the provider.
   *
   * @param chatId the chat
   * @param userId caller; when present the chat must belong to it
   * @param lastSeenOffset last offset the client received, 0 for the start
   * @return empty when the chat has no active stream or is not visible to the caller
   */
  Optional<ResumedStream> resume(UUID chatId, String userId, long lastSeenOffset);

  /** A stream being replayed. */
  record ResumedStream(String streamId, Flux<StreamEventResponse> events) {}
}
