package com.storyforge.backend.conversation.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storyforge.backend.conversation.error.ConversationErrorKind;
import com.storyforge.backend.conversation.error.ConversationException;
import com.storyforge.backend.conversation.provider.model.ProviderCompletion;
import com.storyforge.backend.conversation.provider.model.ProviderDelta;
import com.storyforge.backend.conversation.provider.model.ProviderRequest;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Base for providers spoken to directly over {@link WebClient}: posts a JSON body, decodes the
 * server-sent events of the response and leaves only the payload decoding to subclasses.
 */
abstract class AbstractSseProviderAdapter implements ProviderAdapter {

  private static final ParameterizedTypeReference<ServerSentEvent<String>> SSE_TYPE =
      new ParameterizedTypeReference<>() {};

  protected final ObjectMapper objectMapper;
  protected final ProviderErrorTranslator errorTranslator;
  private final WebClient webClient;
  private final Duration timeout;

  protected AbstractSseProviderAdapter(
      WebClient webClient,
      ObjectMapper objectMapper,
      ProviderErrorTranslator errorTranslator,
      Duration timeout) {
    this.webClient = webClient;
    this.objectMapper = objectMapper;
    this.errorTranslator = errorTranslator;
    this.timeout = timeout != null ? timeout : Duration.ofSeconds(60);
  }

  @Override
  public Flux<ProviderDelta> stream(ProviderRequest request) {
    requireKey(request);
    return webClient
        .post()
        .uri(streamPath(request))
        .headers(headers -> applyHeaders(headers, request))
        .contentType(MediaType.APPLICATION_JSON)
        .accept(MediaType.TEXT_EVENT_STREAM)
        .bodyValue(buildBody(request, true))
        .retrieve()
        .bodyToFlux(SSE_TYPE)
        .timeout(timeout)
        .map(event -> event.data() != null ? event.data() : "")
        .filter(StringUtils::hasText)
        .concatMapIterable(this::decodeStreamPayload)
        .onErrorMap(error -> errorTranslator.translate(error, providerId()));
  }

  @Override
  public Mono<ProviderCompletion> complete(ProviderRequest request) {
    requireKey(request);
    return webClient
        .post()
        .uri(completionPath(request))
        .headers(headers -> applyHeaders(headers, request))
        .contentType(MediaType.APPLICATION_JSON)
        .accept(MediaType.APPLICATION_JSON)
        .bodyValue(buildBody(request, false))
        .retrieve()
        .bodyToMono(String.class)
        .timeout(timeout)
        .map(this::decodeCompletionPayload)
        .onErrorMap(error -> errorTranslator.translate(error, providerId()));
  }

  protected abstract String streamPath(ProviderRequest request);

  protected abstract String completionPath(ProviderRequest request);

  protected abstract void applyHeaders(HttpHeaders headers, ProviderRequest request);

  protected abstract Object buildBody(ProviderRequest request, boolean stream);

  /** Decodes the data field of one server-sent event into zero or more deltas. */
  protected abstract List<ProviderDelta> decodeStreamPayload(String data);

  protected abstract ProviderCompletion decodeCompletionPayload(String body);

  protected JsonNode readJson(String payload) {
    try {
      return objectMapper.readTree(payload);
    } catch (IOException exception) {
      throw new ConversationException(
          ConversationErrorKind.UPSTREAM_MALFORMED,
          providerId().label() + " returned a malformed payload",
          exception);
    }
  }

  private void requireKey(ProviderRequest request) {
    if (!StringUtils.hasText(request.credential().apiKey())) {
      throw ConversationException.credentialMissing(
          "No API key configured for " + providerId().label());
    }
  }
}
