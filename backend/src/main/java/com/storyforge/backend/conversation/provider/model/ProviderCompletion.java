package com.storyforge.backend.conversation.provider.model;

public record ProviderCompletion(String text, FinishReason finishReason) {

  public ProviderCompletion {
    text = text != null ? text : "";
  }
}
