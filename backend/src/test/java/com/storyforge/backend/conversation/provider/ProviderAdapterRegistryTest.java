package com.storyforge.backend.conversation.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.storyforge.backend.conversation.error.ConversationErrorKind;
import com.storyforge.backend.conversation.error.ConversationException;
import java.util.List;
import org.junit.jupiter.api.Test;

class ProviderAdapterRegistryTest {

  @Test
  void returnsAdapterByProvider() {
    ProviderAdapter gemini = adapter(ProviderId.GEMINI);
    ProviderAdapter grok = adapter(ProviderId.GROK);

    ProviderAdapterRegistry registry = new ProviderAdapterRegistry(List.of(gemini, grok));

    assertThat(registry.require(ProviderId.GROK)).isSameAs(grok);
    assertThat(registry.require(ProviderId.GEMINI)).isSameAs(gemini);
  }

  @Test
  void missingAdapterIsReportedAsUnavailableProvider() {
    ProviderAdapterRegistry registry = new ProviderAdapterRegistry(List.of(adapter(ProviderId.GEMINI)));

    assertThatThrownBy(() -> registry.require(ProviderId.CLAUDE))
        .isInstanceOf(ConversationException.class)
        .extracting(error -> ((ConversationException) error).kind())
        .isEqualTo(ConversationErrorKind.CREDENTIAL_MISSING);
  }

  @Test
  void rejectsDuplicateAdapters() {
    List<ProviderAdapter> adapters = List.of(adapter(ProviderId.CHATGPT), adapter(ProviderId.CHATGPT));

    assertThatThrownBy(() -> new ProviderAdapterRegistry(adapters))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void parsesProviderIdentifiersLeniently() {
    assertThat(ProviderId.fromId(" GROK ")).contains(ProviderId.GROK);
    assertThat(ProviderId.fromId("openai")).isEmpty();
    assertThat(ProviderId.fromId(null)).isEmpty();
  }

  private static ProviderAdapter adapter(ProviderId providerId) {
    ProviderAdapter adapter = mock(ProviderAdapter.class);
    when(adapter.providerId()).thenReturn(providerId);
    return adapter;
  }
}
