package com.storyforge.backend.conversation.credential;

import com.storyforge.backend.conversation.config.ConversationProvidersProperties;
import com.storyforge.backend.conversation.provider.ProviderId;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

/**
 * Reads keys from {@code app.conversation.providers.*}. Lookup order: requested provider,
 * configured default provider, then every other configured provider in declaration order.
 */
@Slf4j
public class ConfiguredCredentialResolver implements CredentialResolver {

  private final ConversationProvidersProperties properties;

  public ConfiguredCredentialResolver(ConversationProvidersProperties properties) {
    this.properties = properties;
  }

  @Override
  public Optional<ProviderCredential> resolve(
      UUID conversationId, String requestedProvider, String requestedModel) {
    Optional<ProviderId> requested = ProviderId.fromId(requestedProvider);
    for (ProviderId candidate : candidates(requested.orElse(null))) {
      ConversationProvidersProperties.Provider config = properties.getProviders().get(candidate.id());
      if (config == null || !StringUtils.hasText(config.getApiKey())) {
        continue;
      }
      String model =
          requested.isPresent() && requested.get() == candidate && StringUtils.hasText(requestedModel)
              ? requestedModel.trim()
              : config.getDefaultModel();
      if (!StringUtils.hasText(model)) {
        log.warn("Provider {} has a key but no default model, skipping", candidate.id());
        continue;
      }
      if (requested.isPresent() && requested.get() != candidate) {
        log.info(
            "No usable key for provider {} (conversation {}), falling back to {}",
            requested.get().id(),
            conversationId,
            candidate.id());
      }
      return Optional.of(new ProviderCredential(candidate, config.getApiKey(), model));
    }
    return Optional.empty();
  }

  private Set<ProviderId> candidates(ProviderId requested) {
    Set<ProviderId> ordered = new LinkedHashSet<>();
    if (requested != null) {
      ordered.add(requested);
    }
    ProviderId.fromId(properties.getDefaultProvider()).ifPresent(ordered::add);
    for (Map.Entry<String, ConversationProvidersProperties.Provider> entry :
        properties.getProviders().entrySet()) {
      ProviderId.fromId(entry.getKey()).ifPresent(ordered::add);
    }
    return ordered;
  }
}
