package com.storyforge.backend.conversation.service;

import com.storyforge.backend.conversation.domain.ConversationTurn;
import com.storyforge.backend.conversation.domain.MemorySnapshot;
import java.util.List;

/**
 * State captured when a user message is accepted: the stored user turn, the turns preceding it
 * (oldest first) and the memory to inject into the prompt.
 */
public record ConversationExchange(
    ConversationTurn userTurn, List<ConversationTurn> history, MemorySnapshot memory) {

  public ConversationExchange {
    history = history != null ? List.copyOf(history) : List.of();
  }
}
