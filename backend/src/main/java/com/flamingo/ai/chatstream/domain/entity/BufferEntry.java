package com.flamingo.ai.chatstream.domain.entity;

import com.flamingo.ai.chatstream.domain.enums.EntryKind;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** One immutable entry of a stream's durable log. {@code seq} is the 1-based offset. */
@Entity
@Table(
    name = "stream_buffer_entries",
    uniqueConstraints =
        @UniqueConstraint(
            name = "uk_stream_buffer_entries_stream_seq",
            columnNames = {"stream_id", "seq"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BufferEntry {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "stream_id", nullable = false, length = 64)
  private String streamId;

  @Column(nullable = false)
  private long seq;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private EntryKind kind;

  @Column(columnDefinition = "TEXT")
  private String payload;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @PrePersist
  protected void onCreate() {
    createdAt = LocalDateTime.now();
  }
}
