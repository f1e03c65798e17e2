package com.storyforge.backend.conversation.controller;

import com.storyforge.backend.conversation.api.TurnDeletionResponse;
import com.storyforge.backend.conversation.api.TurnResponse;
import com.storyforge.backend.conversation.domain.ConversationTurn;
import com.storyforge.backend.conversation.domain.MemorySnapshot;
import com.storyforge.backend.conversation.service.ConversationTurnService;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/conversations/{conversationId}/turns")
public class ConversationTurnController {

  private final ConversationTurnService turnService;

  public ConversationTurnController(ConversationTurnService turnService) {
    this.turnService = turnService;
  }

  @GetMapping
  public List<TurnResponse> list(
      @PathVariable UUID conversationId, @RequestParam(required = false) Integer limit) {
    return turnService.listTurns(conversationId, limit).stream().map(TurnResponse::from).toList();
  }

  @DeleteMapping("/latest")
  public TurnDeletionResponse deleteLatest(
      @PathVariable UUID conversationId,
      @RequestParam(name = "pair", defaultValue = "false") boolean pair) {
    List<ConversationTurn> deleted = turnService.deleteLatest(conversationId, pair);
    MemorySnapshot memory = turnService.memory(conversationId);
    return new TurnDeletionResponse(
        deleted.stream().map(ConversationTurn::getId).toList(),
        memory.completedTurnCount(),
        memory.lastCompactedAtTurn());
  }

  @DeleteMapping("/{turnId}")
  public TurnDeletionResponse delete(@PathVariable UUID conversationId, @PathVariable UUID turnId) {
    MemorySnapshot memory = turnService.deleteTurn(conversationId, turnId);
    return new TurnDeletionResponse(
        List.of(turnId), memory.completedTurnCount(), memory.lastCompactedAtTurn());
  }

  @DeleteMapping
  public ResponseEntity<Void> reset(@PathVariable UUID conversationId) {
    turnService.reset(conversationId);
    return ResponseEntity.noContent().build();
  }
}
