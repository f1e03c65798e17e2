package com.storyforge.backend.conversation.credential;

import com.storyforge.backend.conversation.provider.ProviderId;
import java.util.Objects;

public record ProviderCredential(ProviderId providerId, String apiKey, String modelId) {

  public ProviderCredential {
    Objects.requireNonNull(providerId, "providerId must not be null");
  }

  public ProviderCredential withModel(String model) {
    return new ProviderCredential(providerId, apiKey, model);
  }

  @Override
  public String toString() {
    return "ProviderCredential[providerId=" + providerId.id() + ", modelId=" + modelId + "]";
  }
}
