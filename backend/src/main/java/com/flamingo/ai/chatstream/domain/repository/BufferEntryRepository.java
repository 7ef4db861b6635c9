package com.flamingo.ai.chatstream.domain.repository;

import com.flamingo.ai.chatstream.domain.entity.BufferEntry;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for durable stream log entries. */
@Repository
public interface BufferEntryRepository extends JpaRepository<BufferEntry, Long> {

  /** Reads entries after the given offset in offset order. */
  List<BufferEntry> findByStreamIdAndSeqGreaterThanOrderBySeqAsc(
      String streamId, long seq, Pageable pageable);

  /** Highest offset written for a stream, 0 when empty. */
  @Query("SELECT COALESCE(MAX(e.seq), 0) FROM BufferEntry e WHERE e.streamId = :streamId")
  long findLastSeq(@Param("streamId") String streamId);

  /** Deletes every entry of a stream. */
  @Modifying
  @Query("DELETE FROM BufferEntry e WHERE e.streamId = :streamId")
  int deleteByStreamId(@Param("streamId") String streamId);
}
