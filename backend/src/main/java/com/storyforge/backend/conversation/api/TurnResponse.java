package com.storyforge.backend.conversation.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.storyforge.backend.conversation.domain.ConversationTurn;
import java.time.Instant;
import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TurnResponse(
    UUID id,
    UUID conversationId,
    String role,
    String text,
    String speaker,
    Integer sequenceNumber,
    String provider,
    String model,
    Instant createdAt) {

  public static TurnResponse from(ConversationTurn turn) {
    return new TurnResponse(
        turn.getId(),
        turn.getConversationId(),
        turn.getRole().name().toLowerCase(),
        turn.getText(),
        turn.getSpeaker(),
        turn.getSequenceNumber(),
        turn.getProvider(),
        turn.getModel(),
        turn.getCreatedAt());
  }
}
