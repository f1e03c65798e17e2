package com.storyforge.backend.conversation.controller;

import com.storyforge.backend.conversation.api.CompactionRequest;
import com.storyforge.backend.conversation.api.CompactionResponse;
import com.storyforge.backend.conversation.api.MemoryStateResponse;
import com.storyforge.backend.conversation.memory.MemoryCompactionService;
import com.storyforge.backend.conversation.service.ConversationTurnService;
import jakarta.validation.Valid;
import java.util.UUID;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/conversations")
@Validated
public class MemoryCompactionController {

  private final MemoryCompactionService compactionService;
  private final ConversationTurnService turnService;

  public MemoryCompactionController(
      MemoryCompactionService compactionService, ConversationTurnService turnService) {
    this.compactionService = compactionService;
    this.turnService = turnService;
  }

  @PostMapping("/compaction")
  public CompactionResponse compact(@RequestBody @Valid CompactionRequest request) {
    return CompactionResponse.from(
        compactionService.compactNow(request.conversationId(), request.provider(), request.model()));
  }

  @GetMapping("/{conversationId}/memory")
  public MemoryStateResponse memory(@PathVariable UUID conversationId) {
    return MemoryStateResponse.from(turnService.memory(conversationId));
  }
}
