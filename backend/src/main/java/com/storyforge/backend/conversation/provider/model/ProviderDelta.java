package com.storyforge.backend.conversation.provider.model;

/**
 * Normalized piece of a streamed completion. {@code text} may be empty when the provider chunk
 * only carries the finish reason.
 */
public record ProviderDelta(String text, FinishReason finishReason) {

  public ProviderDelta {
    text = text != null ? text : "";
  }

  public static ProviderDelta text(String text) {
    return new ProviderDelta(text, null);
  }

  public static ProviderDelta finish(FinishReason finishReason) {
    return new ProviderDelta("", finishReason);
  }

  public boolean hasText() {
    return !text.isEmpty();
  }
}
