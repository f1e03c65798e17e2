package com.storyforge.backend.conversation.api;

import com.storyforge.backend.conversation.memory.CompactionResult;
import java.util.List;

public record CompactionResponse(
    boolean success,
    String summary,
    String newSummary,
    List<String> keyPlotPoints,
    int messageCount) {

  public static CompactionResponse from(CompactionResult result) {
    return new CompactionResponse(
        true, result.summary(), result.newSummary(), result.plotPoints(), result.messageCount());
  }
}
