package com.storyforge.backend.conversation.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import org.hibernate.annotations.UuidGenerator;

/** One persisted message of a conversation. Never updated after insert. */
@Entity
@Table(name = "conversation_turn")
public class ConversationTurn {

  @Id @GeneratedValue @UuidGenerator private UUID id;

  @Column(name = "conversation_id", nullable = false, updatable = false)
  private UUID conversationId;

  @Enumerated(EnumType.STRING)
  @Column(name = "role", nullable = false, length = 32, updatable = false)
  private TurnRole role;

  @Column(name = "content", nullable = false, columnDefinition = "TEXT", updatable = false)
  private String text;

  @Column(name = "speaker", length = 128, updatable = false)
  private String speaker;

  @Column(name = "sequence_number", nullable = false, updatable = false)
  private Integer sequenceNumber;

  @Column(name = "provider", length = 64, updatable = false)
  private String provider;

  @Column(name = "model", length = 128, updatable = false)
  private String model;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected ConversationTurn() {}

  public ConversationTurn(
      UUID conversationId, TurnRole role, String text, String speaker, Integer sequenceNumber) {
    this(conversationId, role, text, speaker, sequenceNumber, null, null);
  }

  public ConversationTurn(
      UUID conversationId,
      TurnRole role,
      String text,
      String speaker,
      Integer sequenceNumber,
      String provider,
      String model) {
    this.conversationId = conversationId;
    this.role = role;
    this.text = text;
    this.speaker = speaker;
    this.sequenceNumber = sequenceNumber;
    this.provider = provider;
    this.model = model;
  }

  @PrePersist
  protected void onPersist() {
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getConversationId() {
    return conversationId;
  }

  public TurnRole getRole() {
    return role;
  }

  public boolean isAssistant() {
    return role == TurnRole.ASSISTANT;
  }

  public String getText() {
    return text;
  }

  public String getSpeaker() {
    return speaker;
  }

  public Integer getSequenceNumber() {
    return sequenceNumber;
  }

  public String getProvider() {
    return provider;
  }

  public String getModel() {
    return model;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
