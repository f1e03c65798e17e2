package com.storyforge.backend.conversation.prompt;

import com.storyforge.backend.conversation.domain.MemorySnapshot;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/** Appends the compacted memory of a conversation to the story prompt. */
@Component
public class ConversationPromptAssembler {

  private final StoryPromptSource storyPromptSource;

  public ConversationPromptAssembler(StoryPromptSource storyPromptSource) {
    this.storyPromptSource = storyPromptSource;
  }

  public String systemPrompt(String storyId, MemorySnapshot memory) {
    StringBuilder prompt = new StringBuilder(storyPromptSource.systemPrompt(storyId).orElse(""));
    if (memory == null) {
      return prompt.toString();
    }
    if (StringUtils.hasText(memory.summaryText())) {
      appendSection(prompt, "[Story so far]");
      prompt.append(memory.summaryText().strip());
    }
    List<String> plotPoints = memory.plotPoints();
    if (plotPoints != null && !plotPoints.isEmpty()) {
      appendSection(prompt, "[Key plot points]");
      prompt.append(plotPoints.stream().map(point -> "- " + point).collect(Collectors.joining("\n")));
    }
    return prompt.toString();
  }

  private static void appendSection(StringBuilder prompt, String heading) {
    if (prompt.length() > 0) {
      prompt.append("\n\n");
    }
    prompt.append(heading).append('\n');
  }
}
