package com.storyforge.backend.conversation.provider;

import com.storyforge.backend.conversation.error.ConversationErrorKind;
import com.storyforge.backend.conversation.error.ConversationException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public class ProviderAdapterRegistry {

  private final Map<ProviderId, ProviderAdapter> adapters = new EnumMap<>(ProviderId.class);

  public ProviderAdapterRegistry(List<ProviderAdapter> adapters) {
    for (ProviderAdapter adapter : adapters) {
      ProviderAdapter previous = this.adapters.put(adapter.providerId(), adapter);
      if (previous != null) {
        throw new IllegalStateException("Duplicate adapter for provider " + adapter.providerId().id());
      }
    }
  }

  public ProviderAdapter require(ProviderId providerId) {
    ProviderAdapter adapter = adapters.get(providerId);
    if (adapter == null) {
      throw new ConversationException(
          ConversationErrorKind.CREDENTIAL_MISSING,
          "Provider " + providerId.id() + " is not available");
    }
    return adapter;
  }
}
