package com.storyforge.backend.conversation.prompt;

import com.storyforge.backend.conversation.config.ConversationPromptProperties;
import java.util.Optional;
import org.springframework.util.StringUtils;

/** Reads story prompts from {@code app.conversation.prompt.*}. */
public class ConfiguredStoryPromptSource implements StoryPromptSource {

  private final ConversationPromptProperties properties;

  public ConfiguredStoryPromptSource(ConversationPromptProperties properties) {
    this.properties = properties;
  }

  @Override
  public Optional<String> systemPrompt(String storyId) {
    if (StringUtils.hasText(storyId)) {
      String configured = properties.getStories().get(storyId);
      if (StringUtils.hasText(configured)) {
        return Optional.of(configured);
      }
    }
    return Optional.ofNullable(properties.getDefaultSystemPrompt()).filter(StringUtils::hasText);
  }
}
