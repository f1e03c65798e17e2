package com.storyforge.backend.conversation.prompt;

import java.util.Optional;

/**
 * Supplies the fully substituted system prompt of a story. Story management and template
 * substitution live outside this service.
 */
public interface StoryPromptSource {

  Optional<String> systemPrompt(String storyId);
}
