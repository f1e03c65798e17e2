package com.storyforge.backend.conversation.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storyforge.backend.conversation.credential.CredentialResolver;
import com.storyforge.backend.conversation.memory.CompactionTrigger;
import com.storyforge.backend.conversation.memory.MemoryCompactionService;
import com.storyforge.backend.conversation.memory.MemorySummarizer;
import com.storyforge.backend.conversation.memory.SummaryReplyParser;
import com.storyforge.backend.conversation.prompt.ConfiguredStoryPromptSource;
import com.storyforge.backend.conversation.prompt.StoryPromptSource;
import com.storyforge.backend.conversation.provider.ProviderAdapterRegistry;
import com.storyforge.backend.conversation.service.ConversationTurnService;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ConversationMemoryProperties.class)
public class ConversationMemoryConfiguration {

  @Bean
  public CompactionTrigger compactionTrigger(ConversationMemoryProperties properties) {
    return new CompactionTrigger(properties.getCompactionInterval());
  }

  @Bean
  public SummaryReplyParser summaryReplyParser(ObjectMapper objectMapper) {
    return new SummaryReplyParser(objectMapper);
  }

  @Bean
  public MemorySummarizer memorySummarizer(
      ConversationMemoryProperties properties,
      ProviderAdapterRegistry adapterRegistry,
      SummaryReplyParser summaryReplyParser) {
    return new MemorySummarizer(properties, adapterRegistry, summaryReplyParser);
  }

  @Bean
  public MemoryCompactionService memoryCompactionService(
      ConversationMemoryProperties properties,
      CompactionTrigger compactionTrigger,
      MemorySummarizer memorySummarizer,
      ConversationTurnService turnService,
      CredentialResolver credentialResolver,
      ObjectProvider<MeterRegistry> meterRegistry) {
    return new MemoryCompactionService(
        properties,
        compactionTrigger,
        memorySummarizer,
        turnService,
        credentialResolver,
        meterRegistry.getIfAvailable());
  }

  @Bean
  @ConditionalOnMissingBean
  public StoryPromptSource storyPromptSource(ConversationPromptProperties properties) {
    return new ConfiguredStoryPromptSource(properties);
  }
}
