package com.storyforge.backend.conversation.stream;

import java.util.EnumSet;
import java.util.Set;

/** Lifecycle of one streamed reply. */
public enum RelayState {
  IDLE,
  REQUESTING,
  STREAMING,
  FINALIZING,
  COMPLETED,
  FAILED,
  CANCELLED;

  private Set<RelayState> successors;

  static {
    IDLE.successors = EnumSet.of(REQUESTING, FAILED, CANCELLED);
    REQUESTING.successors = EnumSet.of(STREAMING, FAILED, CANCELLED);
    STREAMING.successors = EnumSet.of(FINALIZING, FAILED, CANCELLED);
    FINALIZING.successors = EnumSet.of(COMPLETED, FAILED);
    COMPLETED.successors = EnumSet.noneOf(RelayState.class);
    FAILED.successors = EnumSet.noneOf(RelayState.class);
    CANCELLED.successors = EnumSet.noneOf(RelayState.class);
  }

  public boolean canTransitionTo(RelayState next) {
    return successors.contains(next);
  }

  public boolean isTerminal() {
    return successors.isEmpty();
  }
}
