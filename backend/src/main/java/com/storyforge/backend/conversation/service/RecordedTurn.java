package com.storyforge.backend.conversation.service;

import com.storyforge.backend.conversation.domain.ConversationTurn;
import com.storyforge.backend.conversation.domain.MemorySnapshot;

/** A stored assistant turn together with the memory counters right after it was counted. */
public record RecordedTurn(ConversationTurn turn, MemorySnapshot memory) {}
