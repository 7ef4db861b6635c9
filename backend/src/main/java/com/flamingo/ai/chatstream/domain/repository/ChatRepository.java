package com.flamingo.ai.chatstream.domain.repository;

import com.flamingo.ai.chatstream.domain.entity.Chat;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for Chat entities and the active-stream pointer. */
@Repository
public interface ChatRepository extends JpaRepository<Chat, UUID> {

  /** Finds a chat owned by the given user. */
  Optional<Chat> findByIdAndUserId(UUID id, String userId);

  /** Sets the pointer only when it is currently empty. Returns the number of rows changed. */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      "UPDATE Chat c SET c.activeStreamId = :streamId, c.updatedAt = :now "
          + "WHERE c.id = :chatId AND c.activeStreamId IS NULL")
  int claimActiveStream(
      @Param("chatId") UUID chatId,
      @Param("streamId") String streamId,
      @Param("now") LocalDateTime now);

  /** Clears the pointer only when it still names the given stream. */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      "UPDATE Chat c SET c.activeStreamId = NULL, c.updatedAt = :now "
          + "WHERE c.id = :chatId AND c.activeStreamId = :streamId")
  int releaseActiveStream(
      @Param("chatId") UUID chatId,
      @Param("streamId") String streamId,
      @Param("now") LocalDateTime now);
}
