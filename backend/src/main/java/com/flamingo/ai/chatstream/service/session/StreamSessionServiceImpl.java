package com.flamingo.ai.chatstream.service.session;

import com.flamingo.ai.chatstream.domain.entity.StreamSession;
import com.flamingo.ai.chatstream.domain.enums.StreamStatus;
import com.flamingo.ai.chatstream.domain.repository.StreamSessionRepository;
import com.flamingo.ai.chatstream.exception.PersistenceException;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Implementation of the StreamSessionService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class StreamSessionServiceImpl implements StreamSessionService {

  private final StreamSessionRepository streamSessionRepository;

  @Override
  @Transactional
  public StreamSession open(String streamId, UUID chatId, UUID messageId) {
    StreamSession session =
        StreamSession.builder()
            .streamId(streamId)
            .chatId(chatId)
            .messageId(messageId)
            .status(StreamStatus.STREAMING)
            .build();
    try {
      return streamSessionRepository.save(session);
    } catch (DataAccessException e) {
      throw new PersistenceException("Failed to open stream session " + streamId, e);
    }
  }

  @Override
  @Transactional
  public void recordProgress(String streamId, long lastOffset) {
    try {
      streamSessionRepository.touch(streamId, lastOffset, LocalDateTime.now());
    } catch (DataAccessException e) {
      throw new PersistenceException("Failed to record progress of stream " + streamId, e);
    }
  }

  @Override
  @Transactional
  public boolean markTerminal(
      String streamId, StreamStatus status, String errorMessage, long lastOffset) {
    try {
      int updated =
          streamSessionRepository.markTerminal(
              streamId, status, errorMessage, lastOffset, LocalDateTime.now());
      if (updated == 0) {
        log.debug("Stream {} already terminal, ignoring {}", streamId, status);
      }
      return updated > 0;
    } catch (DataAccessException e) {
      throw new PersistenceException("Failed to mark stream " + streamId + " " + status, e);
    }
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<StreamSession> find(String streamId) {
    return streamSessionRepository.findById(streamId);
  }

  @Override
  @Transactional(readOnly = true)
  public List<StreamSession> findStale(LocalDateTime cutoff) {
    return streamSessionRepository.findByStatusAndUpdatedAtBefore(StreamStatus.STREAMING, cutoff);
  }

  @Override
  @Transactional(readOnly = true)
  public List<StreamSession> findEndedBefore(List<StreamStatus> statuses, LocalDateTime cutoff) {
    return streamSessionRepository.findByStatusInAndCompletedAtBefore(statuses, cutoff);
  }

  @Override
  @Transactional
  public void delete(String streamId) {
    streamSessionRepository.deleteById(streamId);
  }
}
