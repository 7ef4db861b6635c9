package com.flamingo.ai.chatstream.service.session;

import com.flamingo.ai.chatstream.domain.entity.StreamSession;
import com.flamingo.ai.chatstream.domain.enums.StreamStatus;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/** Service tracking the lifecycle of generation attempts on the primary datastore. */
public interface StreamSessionService {

  /** Creates the session row for a new stream in {@link StreamStatus#STREAMING}. */
  StreamSession open(String streamId, UUID chatId, UUID messageId);

  /** Records the last buffered offset of a live stream and refreshes its heartbeat. */
  void recordProgress(String streamId, long lastOffset);

  /**
   * Moves a live stream to a terminal status.
   *
   * @return false if the stream was already terminal
   */
  boolean markTerminal(String streamId, StreamStatus status, String errorMessage, long lastOffset);

  Optional<StreamSession> find(String streamId);

  /** Live sessions whose last heartbeat is older than the cutoff. */
  List<StreamSession> findStale(LocalDateTime cutoff);

  /** Terminal sessions with the given statuses that ended before the cutoff. */
  List<StreamSession> findEndedBefore(List<StreamStatus> statuses, LocalDateTime cutoff);

  void delete(String streamId);
}
