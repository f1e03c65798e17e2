package com.storyforge.backend.conversation.domain;

import com.storyforge.backend.shared.json.StringListTextConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Compacted memory of a conversation: rolling summary, capped plot point list and the turn
 * counters that drive compaction. One row per conversation.
 *
 * <p>Invariant: {@code 0 <= lastCompactedAtTurn <= completedTurnCount}.
 */
@Entity
@Table(name = "conversation_memory")
public class ConversationMemory {

  @Id
  @Column(name = "conversation_id", nullable = false, updatable = false)
  private UUID conversationId;

  @Column(name = "summary_text", columnDefinition = "TEXT")
  private String summaryText;

  @Convert(converter = StringListTextConverter.class)
  @Column(name = "plot_points", columnDefinition = "TEXT")
  private List<String> plotPoints = new ArrayList<>();

  @Column(name = "completed_turn_count", nullable = false)
  private int completedTurnCount;

  @Column(name = "last_compacted_at_turn", nullable = false)
  private int lastCompactedAtTurn;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected ConversationMemory() {}

  public ConversationMemory(UUID conversationId) {
    this.conversationId = conversationId;
  }

  @PrePersist
  @PreUpdate
  protected void touch() {
    this.updatedAt = Instant.now();
  }

  public UUID getConversationId() {
    return conversationId;
  }

  public String getSummaryText() {
    return summaryText;
  }

  public List<String> getPlotPoints() {
    return plotPoints != null ? List.copyOf(plotPoints) : List.of();
  }

  public int getCompletedTurnCount() {
    return completedTurnCount;
  }

  public int getLastCompactedAtTurn() {
    return lastCompactedAtTurn;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public int recordCompletedTurn() {
    completedTurnCount++;
    return completedTurnCount;
  }

  /**
   * Removes one assistant turn from the count. When the turn was already covered by a compaction
   * the marker moves down with it, so it keeps pointing just past the last compacted reply.
   */
  public int forgetCompletedTurn(boolean compacted) {
    completedTurnCount = Math.max(0, completedTurnCount - 1);
    if (compacted) {
      lastCompactedAtTurn = Math.max(0, lastCompactedAtTurn - 1);
    }
    lastCompactedAtTurn = Math.min(lastCompactedAtTurn, completedTurnCount);
    return completedTurnCount;
  }

  public void applyCompaction(String summaryText, List<String> plotPoints, int compactedAtTurn) {
    this.summaryText = summaryText;
    this.plotPoints = new ArrayList<>(plotPoints);
    this.lastCompactedAtTurn = Math.max(0, Math.min(compactedAtTurn, completedTurnCount));
  }

  public void reset() {
    this.summaryText = null;
    this.plotPoints = new ArrayList<>();
    this.completedTurnCount = 0;
    this.lastCompactedAtTurn = 0;
  }

  public MemorySnapshot snapshot() {
    return new MemorySnapshot(
        conversationId, summaryText, getPlotPoints(), completedTurnCount, lastCompactedAtTurn);
  }
}
