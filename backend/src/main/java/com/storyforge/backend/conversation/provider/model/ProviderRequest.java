package com.storyforge.backend.conversation.provider.model;

import com.storyforge.backend.conversation.credential.ProviderCredential;
import java.util.List;
import java.util.Objects;

/**
 * Provider independent request. {@code history} is chronological and does not contain {@code
 * userMessage}.
 */
public record ProviderRequest(
    ProviderCredential credential,
    String systemPrompt,
    List<PromptMessage> history,
    String userMessage,
    Double temperature,
    Integer maxOutputTokens) {

  public ProviderRequest {
    Objects.requireNonNull(credential, "credential must not be null");
    history = history != null ? List.copyOf(history) : List.of();
  }

  public String modelId() {
    return credential.modelId();
  }
}
