package com.storyforge.backend.conversation.controller;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.storyforge.backend.conversation.config.ConversationProvidersProperties;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(ProviderCatalogController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ProviderCatalogControllerTest.CatalogProperties.class)
class ProviderCatalogControllerTest {

  @Autowired private MockMvc mockMvc;

  @Test
  void listsConfiguredProvidersWithoutKeys() throws Exception {
    mockMvc
        .perform(get("/api/conversations/providers"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.defaultProvider").value("gemini"))
        .andExpect(jsonPath("$.providers.length()").value(2))
        .andExpect(jsonPath("$.providers[0].id").value("gemini"))
        .andExpect(jsonPath("$.providers[0].displayName").value("Gemini"))
        .andExpect(jsonPath("$.providers[0].configured").value(true))
        .andExpect(jsonPath("$.providers[0].defaultModel").value("gemini-2.5-flash"))
        .andExpect(jsonPath("$.providers[0].models[0].id").value("gemini-2.5-flash"))
        .andExpect(jsonPath("$.providers[0].models[0].displayName").value("Gemini 2.5 Flash"))
        .andExpect(jsonPath("$.providers[0].apiKey").doesNotExist())
        .andExpect(jsonPath("$.providers[1].id").value("claude"))
        .andExpect(jsonPath("$.providers[1].displayName").value("Anthropic Claude"))
        .andExpect(jsonPath("$.providers[1].configured").value(false));
  }

  @TestConfiguration
  static class CatalogProperties {

    @Bean
    ConversationProvidersProperties conversationProvidersProperties() {
      ConversationProvidersProperties properties = new ConversationProvidersProperties();
      properties.setDefaultProvider("gemini");

      ConversationProvidersProperties.Provider gemini = new ConversationProvidersProperties.Provider();
      gemini.setDisplayName("Gemini");
      gemini.setApiKey("secret");
      gemini.setDefaultModel("gemini-2.5-flash");
      ConversationProvidersProperties.Model flash = new ConversationProvidersProperties.Model();
      flash.setDisplayName("Gemini 2.5 Flash");
      gemini.getModels().put("gemini-2.5-flash", flash);
      properties.getProviders().put("gemini", gemini);

      ConversationProvidersProperties.Provider claude = new ConversationProvidersProperties.Provider();
      claude.setDefaultModel("claude-sonnet-4-5");
      properties.getProviders().put("claude", claude);

      ConversationProvidersProperties.Provider unknown = new ConversationProvidersProperties.Provider();
      unknown.setApiKey("x");
      properties.getProviders().put("mistral", unknown);
      return properties;
    }
  }
}
