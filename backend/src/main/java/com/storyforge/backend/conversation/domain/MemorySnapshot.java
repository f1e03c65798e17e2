package com.storyforge.backend.conversation.domain;

import java.util.List;
import java.util.UUID;

/** Detached copy of a {@link ConversationMemory} row, safe to hand to background work. */
public record MemorySnapshot(
    UUID conversationId,
    String summaryText,
    List<String> plotPoints,
    int completedTurnCount,
    int lastCompactedAtTurn) {

  public MemorySnapshot {
    plotPoints = plotPoints != null ? List.copyOf(plotPoints) : List.of();
  }

  public static MemorySnapshot empty(UUID conversationId) {
    return new MemorySnapshot(conversationId, null, List.of(), 0, 0);
  }
}
