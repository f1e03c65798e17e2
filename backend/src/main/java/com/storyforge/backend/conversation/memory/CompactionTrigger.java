package com.storyforge.backend.conversation.memory;

import org.springframework.util.Assert;

/**
 * Decides whether a conversation is due for compaction, from its two turn counters only.
 *
 * <p>A compaction is scheduled every {@code interval} assistant turns. It is overdue once the
 * last successful compaction lags {@code interval} or more turns behind, which makes a failed
 * compaction retry on the next turn instead of waiting for the next multiple.
 */
public final class CompactionTrigger {

  public static final int DEFAULT_INTERVAL = 10;

  private final int interval;

  public CompactionTrigger() {
    this(DEFAULT_INTERVAL);
  }

  public CompactionTrigger(int interval) {
    Assert.isTrue(interval > 0, "interval must be positive");
    this.interval = interval;
  }

  public int interval() {
    return interval;
  }

  public boolean shouldCompact(int completedTurnCount, int lastCompactedAtTurn) {
    return completedTurnCount >= interval
        && (isScheduled(completedTurnCount) || isOverdue(completedTurnCount, lastCompactedAtTurn));
  }

  boolean isScheduled(int completedTurnCount) {
    return completedTurnCount % interval == 0;
  }

  boolean isOverdue(int completedTurnCount, int lastCompactedAtTurn) {
    return completedTurnCount - lastCompactedAtTurn >= interval;
  }
}
