package com.storyforge.backend.conversation.domain;

public enum TurnRole {
  USER,
  ASSISTANT
}
