package com.storyforge.backend.conversation.provider;

import com.storyforge.backend.conversation.provider.model.ProviderCompletion;
import com.storyforge.backend.conversation.provider.model.ProviderDelta;
import com.storyforge.backend.conversation.provider.model.ProviderRequest;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Uniform view over one provider wire format. Errors are signalled as {@link
 * com.storyforge.backend.conversation.error.ConversationException} carrying a taxonomy kind,
 * never as raw client exceptions.
 */
public interface ProviderAdapter {

  ProviderId providerId();

  /** Streams normalized deltas in upstream order. Completes when the provider ends the stream. */
  Flux<ProviderDelta> stream(ProviderRequest request);

  Mono<ProviderCompletion> complete(ProviderRequest request);
}
