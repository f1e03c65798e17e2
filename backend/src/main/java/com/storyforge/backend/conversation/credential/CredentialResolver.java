package com.storyforge.backend.conversation.credential;

import java.util.Optional;
import java.util.UUID;

/**
 * Resolves the key and model used for a conversation. Implementations decide between session
 * overrides, account defaults and fallback providers.
 */
public interface CredentialResolver {

  /**
   * @param requestedProvider provider named by the request, may be {@code null}
   * @param requestedModel model named by the request, may be {@code null}
   * @return a credential with a non-blank key and model, or empty when none is usable
   */
  Optional<ProviderCredential> resolve(
      UUID conversationId, String requestedProvider, String requestedModel);
}
