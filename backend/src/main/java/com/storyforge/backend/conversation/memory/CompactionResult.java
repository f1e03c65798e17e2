package com.storyforge.backend.conversation.memory;

import java.util.List;

/**
 * Output of one summarizer run.
 *
 * @param summary merged summary to store
 * @param newSummary summary text proposed by the model in this run
 * @param plotPoints merged plot points, already capped
 * @param messageCount number of assistant turns that were summarized
 */
public record CompactionResult(
    String summary, String newSummary, List<String> plotPoints, int messageCount) {

  public CompactionResult {
    plotPoints = plotPoints != null ? List.copyOf(plotPoints) : List.of();
  }
}
