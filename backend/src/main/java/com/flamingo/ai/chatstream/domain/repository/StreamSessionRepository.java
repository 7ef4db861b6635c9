package com.flamingo.ai.chatstream.domain.repository;

import com.flamingo.ai.chatstream.domain.entity.StreamSession;
import com.flamingo.ai.chatstream.domain.enums.StreamStatus;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for StreamSession entities. */
@Repository
public interface StreamSessionRepository extends JpaRepository<StreamSession, String> {

  /** Records writer progress on a live session. */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      "UPDATE StreamSession s SET s.lastOffset = :lastOffset, s.updatedAt = :now "
          + "WHERE s.streamId = :streamId AND s.status = "
          + "com.flamingo.ai.chatstream.domain.enums.StreamStatus.STREAMING")
  int touch(
      @Param("streamId") String streamId,
      @Param("lastOffset") long lastOffset,
      @Param("now") LocalDateTime now);

  /** Moves a live session to a terminal status. Only the first terminal transition applies. */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      "UPDATE StreamSession s SET s.status = :status, s.errorMessage = :errorMessage, "
          + "s.lastOffset = CASE WHEN :lastOffset > s.lastOffset THEN :lastOffset "
          + "ELSE s.lastOffset END, "
          + "s.updatedAt = :now, s.completedAt = :now "
          + "WHERE s.streamId = :streamId AND s.status = "
          + "com.flamingo.ai.chatstream.domain.enums.StreamStatus.STREAMING")
  int markTerminal(
      @Param("streamId") String streamId,
      @Param("status") StreamStatus status,
      @Param("errorMessage") String errorMessage,
      @Param("lastOffset") long lastOffset,
      @Param("now") LocalDateTime now);

  /** Finds live sessions that have not reported progress since the cutoff. */
  List<StreamSession> findByStatusAndUpdatedAtBefore(StreamStatus status, LocalDateTime cutoff);

  /** Finds terminal sessions that ended before the cutoff. */
  List<StreamSession> findByStatusInAndCompletedAtBefore(
      Collection<StreamStatus> statuses, LocalDateTime cutoff);
}
