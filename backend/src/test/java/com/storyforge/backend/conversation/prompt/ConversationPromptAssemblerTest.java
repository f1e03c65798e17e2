package com.storyforge.backend.conversation.prompt;

import static org.assertj.core.api.Assertions.assertThat;

import com.storyforge.backend.conversation.config.ConversationPromptProperties;
import com.storyforge.backend.conversation.domain.MemorySnapshot;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ConversationPromptAssemblerTest {

  private ConversationPromptProperties properties;
  private ConversationPromptAssembler assembler;

  @BeforeEach
  void setUp() {
    properties = new ConversationPromptProperties();
    properties.setDefaultSystemPrompt("You narrate an interactive story.");
    properties.getStories().put("moonlit-inn", "You narrate the Moonlit Inn.");
    assembler = new ConversationPromptAssembler(new ConfiguredStoryPromptSource(properties));
  }

  @Test
  void appendsSummaryAndPlotPointsToTheStoryPrompt() {
    MemorySnapshot memory =
        new MemorySnapshot(
            UUID.randomUUID(), " The party met the innkeeper. ", List.of("Key found", "Cellar locked"), 12, 10);

    assertThat(assembler.systemPrompt("moonlit-inn", memory))
        .isEqualTo(
            "You narrate the Moonlit Inn.\n\n"
                + "[Story so far]\nThe party met the innkeeper.\n\n"
                + "[Key plot points]\n- Key found\n- Cellar locked");
  }

  @Test
  void unknownStoryUsesTheDefaultPrompt() {
    assertThat(assembler.systemPrompt("unknown", MemorySnapshot.empty(UUID.randomUUID())))
        .isEqualTo("You narrate an interactive story.");
  }

  @Test
  void emptyWithoutAnyPromptOrMemory() {
    properties.setDefaultSystemPrompt(null);

    assertThat(assembler.systemPrompt(null, null)).isEmpty();
  }

  @Test
  void memoryAloneStillProducesSections() {
    properties.setDefaultSystemPrompt(" ");
    MemorySnapshot memory = new MemorySnapshot(UUID.randomUUID(), "Summary", List.of(), 10, 10);

    assertThat(assembler.systemPrompt("unknown", memory)).isEqualTo("[Story so far]\nSummary");
  }
}
