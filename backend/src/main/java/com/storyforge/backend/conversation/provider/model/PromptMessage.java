package com.storyforge.backend.conversation.provider.model;

import com.storyforge.backend.conversation.domain.TurnRole;

public record PromptMessage(TurnRole role, String text) {}
