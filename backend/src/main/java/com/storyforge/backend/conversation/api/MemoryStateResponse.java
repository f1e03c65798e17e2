package com.storyforge.backend.conversation.api;

import com.storyforge.backend.conversation.domain.MemorySnapshot;
import java.util.List;
import java.util.UUID;

public record MemoryStateResponse(
    UUID conversationId,
    String summary,
    List<String> keyPlotPoints,
    int completedTurnCount,
    int lastCompactedAtTurn) {

  public static MemoryStateResponse from(MemorySnapshot memory) {
    return new MemoryStateResponse(
        memory.conversationId(),
        memory.summaryText(),
        memory.plotPoints(),
        memory.completedTurnCount(),
        memory.lastCompactedAtTurn());
  }
}
