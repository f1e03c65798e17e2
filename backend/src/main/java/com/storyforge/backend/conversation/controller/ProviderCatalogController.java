package com.storyforge.backend.conversation.controller;

import com.storyforge.backend.conversation.api.ProvidersResponse;
import com.storyforge.backend.conversation.config.ConversationProvidersProperties;
import com.storyforge.backend.conversation.provider.ProviderId;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/conversations/providers")
public class ProviderCatalogController {

  private final ConversationProvidersProperties properties;

  public ProviderCatalogController(ConversationProvidersProperties properties) {
    this.properties = properties;
  }

  @GetMapping
  public ProvidersResponse listProviders() {
    List<ProvidersResponse.Provider> providers =
        properties.getProviders().entrySet().stream()
            .filter(entry -> ProviderId.fromId(entry.getKey()).isPresent())
            .map(this::toProviderResponse)
            .toList();
    return new ProvidersResponse(properties.getDefaultProvider(), providers);
  }

  private ProvidersResponse.Provider toProviderResponse(
      Map.Entry<String, ConversationProvidersProperties.Provider> entry) {
    ConversationProvidersProperties.Provider provider = entry.getValue();
    String displayName =
        StringUtils.hasText(provider.getDisplayName())
            ? provider.getDisplayName()
            : ProviderId.fromId(entry.getKey()).map(ProviderId::label).orElse(entry.getKey());
    List<ProvidersResponse.Model> models =
        provider.getModels().entrySet().stream()
            .map(
                model ->
                    new ProvidersResponse.Model(
                        model.getKey(),
                        Optional.ofNullable(model.getValue())
                            .map(ConversationProvidersProperties.Model::getDisplayName)
                            .orElse(model.getKey())))
            .toList();
    return new ProvidersResponse.Provider(
        entry.getKey(),
        displayName,
        provider.getDefaultModel(),
        StringUtils.hasText(provider.getApiKey()),
        models);
  }
}
