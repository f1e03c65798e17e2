package com.storyforge.backend.conversation.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storyforge.backend.conversation.credential.ConfiguredCredentialResolver;
import com.storyforge.backend.conversation.credential.CredentialResolver;
import com.storyforge.backend.conversation.provider.AnthropicProviderAdapter;
import com.storyforge.backend.conversation.provider.GeminiProviderAdapter;
import com.storyforge.backend.conversation.provider.OpenAiCompatibleProviderAdapter;
import com.storyforge.backend.conversation.provider.ProviderAdapter;
import com.storyforge.backend.conversation.provider.ProviderAdapterRegistry;
import com.storyforge.backend.conversation.provider.ProviderErrorTranslator;
import com.storyforge.backend.conversation.provider.ProviderId;
import java.time.Duration;
import java.util.List;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
@EnableConfigurationProperties({
  ConversationProvidersProperties.class,
  ConversationStreamProperties.class,
  ConversationPromptProperties.class
})
public class ConversationProviderConfiguration {

  @Bean
  public ProviderErrorTranslator providerErrorTranslator(ObjectMapper objectMapper) {
    return new ProviderErrorTranslator(objectMapper);
  }

  @Bean
  public List<ProviderAdapter> conversationProviderAdapters(
      ConversationProvidersProperties properties,
      ObjectProvider<WebClient.Builder> webClientBuilderProvider,
      ObjectProvider<RestClient.Builder> restClientBuilderProvider,
      ObjectMapper objectMapper,
      ProviderErrorTranslator errorTranslator) {
    WebClient.Builder webClientBuilder = webClientBuilderProvider.getIfAvailable(WebClient::builder);
    RestClient.Builder restClientBuilder = restClientBuilderProvider.getIfAvailable(RestClient::builder);

    return List.of(
        new GeminiProviderAdapter(
            webClientBuilder.clone().baseUrl(baseUrl(properties, ProviderId.GEMINI)).build(),
            objectMapper,
            errorTranslator,
            timeout(properties, ProviderId.GEMINI)),
        new AnthropicProviderAdapter(
            webClientBuilder.clone().baseUrl(baseUrl(properties, ProviderId.CLAUDE)).build(),
            objectMapper,
            errorTranslator,
            timeout(properties, ProviderId.CLAUDE)),
        new OpenAiCompatibleProviderAdapter(
            ProviderId.CHATGPT,
            baseUrl(properties, ProviderId.CHATGPT),
            restClientBuilder,
            webClientBuilder,
            errorTranslator,
            timeout(properties, ProviderId.CHATGPT)),
        new OpenAiCompatibleProviderAdapter(
            ProviderId.GROK,
            baseUrl(properties, ProviderId.GROK),
            restClientBuilder,
            webClientBuilder,
            errorTranslator,
            timeout(properties, ProviderId.GROK)));
  }

  @Bean
  public ProviderAdapterRegistry providerAdapterRegistry(List<ProviderAdapter> adapters) {
    return new ProviderAdapterRegistry(adapters);
  }

  @Bean
  @ConditionalOnMissingBean
  public CredentialResolver credentialResolver(ConversationProvidersProperties properties) {
    return new ConfiguredCredentialResolver(properties);
  }

  private static String baseUrl(ConversationProvidersProperties properties, ProviderId providerId) {
    ConversationProvidersProperties.Provider provider = properties.getProviders().get(providerId.id());
    return provider != null && StringUtils.hasText(provider.getBaseUrl())
        ? provider.getBaseUrl()
        : providerId.defaultBaseUrl();
  }

  private static Duration timeout(ConversationProvidersProperties properties, ProviderId providerId) {
    ConversationProvidersProperties.Provider provider = properties.getProviders().get(providerId.id());
    return provider != null ? provider.getTimeout() : null;
  }
}
