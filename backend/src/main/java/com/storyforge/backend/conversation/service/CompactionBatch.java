package com.storyforge.backend.conversation.service;

import com.storyforge.backend.conversation.domain.ConversationTurn;
import com.storyforge.backend.conversation.domain.MemorySnapshot;
import java.util.List;

/**
 * Assistant turns to summarize and the memory snapshot they were read against. The snapshot's
 * {@code completedTurnCount} becomes the new compaction marker when the batch is committed.
 */
public record CompactionBatch(MemorySnapshot memory, List<ConversationTurn> turns) {

  public CompactionBatch {
    turns = turns != null ? List.copyOf(turns) : List.of();
  }

  public boolean isEmpty() {
    return turns.isEmpty();
  }
}
