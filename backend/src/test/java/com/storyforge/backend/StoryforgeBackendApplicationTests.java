package com.storyforge.backend;

import static org.assertj.core.api.Assertions.assertThat;

import com.storyforge.backend.conversation.memory.MemoryCompactionService;
import com.storyforge.backend.conversation.provider.ProviderAdapterRegistry;
import com.storyforge.backend.conversation.provider.ProviderId;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class StoryforgeBackendApplicationTests {

  @Autowired private ProviderAdapterRegistry adapterRegistry;
  @Autowired private MemoryCompactionService compactionService;

  @Test
  void contextLoadsWithAnAdapterPerProvider() {
    for (ProviderId providerId : ProviderId.values()) {
      assertThat(adapterRegistry.require(providerId).providerId()).isEqualTo(providerId);
    }
    assertThat(compactionService.isEnabled()).isFalse();
  }
}
