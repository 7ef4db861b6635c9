package com.flamingo.ai.chatstream.domain.entity;

import com.flamingo.ai.chatstream.domain.enums.MessageRole;
import com.flamingo.ai.chatstream.domain.enums.MessageStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Represents a single message in a chat. */
@Entity
@Table(name = "chat_messages")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChatMessage {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "chat_id", nullable = false)
  private Chat chat;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private MessageRole role;

  @Column(columnDefinition = "TEXT", nullable = false)
  @Builder.Default
  private String content = "";

  @Column(columnDefinition = "TEXT")
  private String reasoning;

  /** Time between the first and last reasoning delta. */
  private Long thinkingTimeMs;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private MessageStatus status = MessageStatus.STREAMING;

  /** Stream that produced this message (assistant messages only). */
  private String streamId;

  private String model;

  private Integer promptTokens;

  private Integer completionTokens;

  @Column(columnDefinition = "TEXT")
  private String errorMessage;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @Column(nullable = false)
  private LocalDateTime updatedAt;

  @PrePersist
  protected void onCreate() {
    LocalDateTime now = LocalDateTime.now();
    createdAt = now;
    updatedAt = now;
  }

  @PreUpdate
  protected void onUpdate() {
    updatedAt = LocalDateTime.now();
  }
}
