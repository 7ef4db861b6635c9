package com.flamingo.ai.chatstream.domain.entity;

import com.flamingo.ai.chatstream.domain.enums.StreamStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One generation attempt. Readers on any process re-check this row to learn that a stream has
 * ended when no new buffer entries arrive.
 */
@Entity
@Table(
    name = "stream_sessions",
    indexes = @Index(name = "idx_stream_sessions_status", columnList = "status, updated_at"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StreamSession {

  @Id
  @Column(name = "stream_id", length = 64)
  private String streamId;

  /** Null for ephemeral streams. */
  private UUID chatId;

  private UUID messageId;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private StreamStatus status = StreamStatus.STREAMING;

  @Builder.Default private long lastOffset = 0;

  @Column(columnDefinition = "TEXT")
  private String errorMessage;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @Column(name = "updated_at", nullable = false)
  private LocalDateTime updatedAt;

  private LocalDateTime completedAt;

  @PrePersist
  protected void onCreate() {
    LocalDateTime now = LocalDateTime.now();
    createdAt = now;
    if (updatedAt == null) {
      updatedAt = now;
    }
  }
}
