package com.storyforge.backend.conversation.config;

import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "app.conversation")
@Validated
public class ConversationProvidersProperties {

  /**
   * Identifier of the provider used when the request does not name one, and the first fallback
   * when the requested provider has no usable key.
   */
  @NotBlank private String defaultProvider = "gemini";

  /** Provider settings keyed by provider identifier ({@code gemini}, {@code chatgpt}, ...). */
  private Map<String, Provider> providers = new LinkedHashMap<>();

  public String getDefaultProvider() {
    return defaultProvider;
  }

  public void setDefaultProvider(String defaultProvider) {
    this.defaultProvider = defaultProvider;
  }

  public Map<String, Provider> getProviders() {
    return providers;
  }

  public void setProviders(Map<String, Provider> providers) {
    this.providers = providers;
  }

  public static class Provider {

    private String displayName;

    /** Overrides the public endpoint of the provider, mostly useful for proxies and tests. */
    private String baseUrl;

    private String apiKey;
    private String defaultModel;

    /** Maximum silence tolerated between two upstream chunks. */
    private Duration timeout = Duration.ofSeconds(60);

    private Integer maxOutputTokens;
    private Double temperature;
    private Map<String, Model> models = new LinkedHashMap<>();

    public String getDisplayName() {
      return displayName;
    }

    public void setDisplayName(String displayName) {
      this.displayName = displayName;
    }

    public String getBaseUrl() {
      return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
    }

    public String getApiKey() {
      return apiKey;
    }

    public void setApiKey(String apiKey) {
      this.apiKey = apiKey;
    }

    public String getDefaultModel() {
      return defaultModel;
    }

    public void setDefaultModel(String defaultModel) {
      this.defaultModel = defaultModel;
    }

    public Duration getTimeout() {
      return timeout;
    }

    public void setTimeout(Duration timeout) {
      this.timeout = timeout;
    }

    public Integer getMaxOutputTokens() {
      return maxOutputTokens;
    }

    public void setMaxOutputTokens(Integer maxOutputTokens) {
      this.maxOutputTokens = maxOutputTokens;
    }

    public Double getTemperature() {
      return temperature;
    }

    public void setTemperature(Double temperature) {
      this.temperature = temperature;
    }

    public Map<String, Model> getModels() {
      return models;
    }

    public void setModels(Map<String, Model> models) {
      this.models = models;
    }
  }

  public static class Model {
    private String displayName;

    public String getDisplayName() {
      return displayName;
    }

    public void setDisplayName(String displayName) {
      this.displayName = displayName;
    }
  }
}
