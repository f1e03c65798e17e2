package com.storyforge.backend.conversation.api;

import java.util.List;
import java.util.UUID;

public record TurnDeletionResponse(
    List<UUID> deletedTurnIds, int completedTurnCount, int lastCompactedAtTurn) {}
