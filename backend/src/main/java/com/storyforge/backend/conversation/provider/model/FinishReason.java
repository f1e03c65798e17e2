package com.storyforge.backend.conversation.provider.model;

/** Provider independent reason a completion ended. */
public enum FinishReason {
  STOP,
  /** Output-length ceiling reached. */
  LENGTH,
  CONTENT_FILTER,
  OTHER
}
