package com.storyforge.backend.conversation.provider;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import org.springframework.util.StringUtils;

/** Closed set of hosted chat-completion services the engine can talk to. */
public enum ProviderId {
  GEMINI("gemini", "Google Gemini", "https://generativelanguage.googleapis.com"),
  CHATGPT("chatgpt", "OpenAI ChatGPT", "https://api.openai.com"),
  CLAUDE("claude", "Anthropic Claude", "https://api.anthropic.com"),
  GROK("grok", "xAI Grok", "https://api.x.ai");

  private final String id;
  private final String label;
  private final String defaultBaseUrl;

  ProviderId(String id, String label, String defaultBaseUrl) {
    this.id = id;
    this.label = label;
    this.defaultBaseUrl = defaultBaseUrl;
  }

  public String id() {
    return id;
  }

  public String label() {
    return label;
  }

  public String defaultBaseUrl() {
    return defaultBaseUrl;
  }

  public static Optional<ProviderId> fromId(String value) {
    if (!StringUtils.hasText(value)) {
      return Optional.empty();
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values()).filter(provider -> provider.id.equals(normalized)).findFirst();
  }
}
