package com.storyforge.backend.conversation.config;

import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.conversation.prompt")
public class ConversationPromptProperties {

  /** System prompt used for stories without a dedicated entry. */
  private String defaultSystemPrompt =
      "You are the narrator of an interactive story. Continue the story from the reader's input,"
          + " keeping characters, tone and established facts consistent.";

  /** Story specific system prompts keyed by story identifier. */
  private Map<String, String> stories = new LinkedHashMap<>();

  public String getDefaultSystemPrompt() {
    return defaultSystemPrompt;
  }

  public void setDefaultSystemPrompt(String defaultSystemPrompt) {
    this.defaultSystemPrompt = defaultSystemPrompt;
  }

  public Map<String, String> getStories() {
    return stories;
  }

  public void setStories(Map<String, String> stories) {
    this.stories = stories;
  }
}
