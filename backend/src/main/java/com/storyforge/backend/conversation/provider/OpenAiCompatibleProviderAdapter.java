package com.storyforge.backend.conversation.provider;

import com.storyforge.backend.conversation.domain.TurnRole;
import com.storyforge.backend.conversation.error.ConversationErrorKind;
import com.storyforge.backend.conversation.error.ConversationException;
import com.storyforge.backend.conversation.provider.model.FinishReason;
import com.storyforge.backend.conversation.provider.model.PromptMessage;
import com.storyforge.backend.conversation.provider.model.ProviderCompletion;
import com.storyforge.backend.conversation.provider.model.ProviderDelta;
import com.storyforge.backend.conversation.provider.model.ProviderRequest;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.ai.openai.api.OpenAiApi.ChatCompletion;
import org.springframework.ai.openai.api.OpenAiApi.ChatCompletionChunk;
import org.springframework.ai.openai.api.OpenAiApi.ChatCompletionFinishReason;
import org.springframework.ai.openai.api.OpenAiApi.ChatCompletionMessage;
import org.springframework.ai.openai.api.OpenAiApi.ChatCompletionMessage.Role;
import org.springframework.ai.openai.api.OpenAiApi.ChatCompletionRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Chat completions over the OpenAI wire format. Serves both OpenAI and xAI, which differ only in
 * base URL. One {@link OpenAiApi} is kept per API key since keys are resolved per conversation.
 */
public class OpenAiCompatibleProviderAdapter implements ProviderAdapter {

  private final ProviderId providerId;
  private final String baseUrl;
  private final RestClient.Builder restClientBuilder;
  private final WebClient.Builder webClientBuilder;
  private final ProviderErrorTranslator errorTranslator;
  private final Duration timeout;
  private final Map<String, OpenAiApi> apis = new ConcurrentHashMap<>();

  public OpenAiCompatibleProviderAdapter(
      ProviderId providerId,
      String baseUrl,
      RestClient.Builder restClientBuilder,
      WebClient.Builder webClientBuilder,
      ProviderErrorTranslator errorTranslator,
      Duration timeout) {
    Assert.state(
        providerId == ProviderId.CHATGPT || providerId == ProviderId.GROK,
        () -> "Provider does not speak the OpenAI wire format: " + providerId);
    this.providerId = providerId;
    this.baseUrl = StringUtils.hasText(baseUrl) ? baseUrl : providerId.defaultBaseUrl();
    this.restClientBuilder = restClientBuilder;
    this.webClientBuilder = webClientBuilder;
    this.errorTranslator = errorTranslator;
    this.timeout = timeout != null ? timeout : Duration.ofSeconds(60);
  }

  @Override
  public ProviderId providerId() {
    return providerId;
  }

  @Override
  public Flux<ProviderDelta> stream(ProviderRequest request) {
    OpenAiApi api = api(request);
    ChatCompletionRequest completionRequest =
        new ChatCompletionRequest(
            toMessages(request), request.modelId(), request.temperature(), true);
    return Flux.defer(() -> api.chatCompletionStream(completionRequest))
        .timeout(timeout)
        .concatMapIterable(this::decodeChunk)
        .onErrorMap(error -> errorTranslator.translate(error, providerId));
  }

  @Override
  public Mono<ProviderCompletion> complete(ProviderRequest request) {
    OpenAiApi api = api(request);
    ChatCompletionRequest completionRequest =
        new ChatCompletionRequest(toMessages(request), request.modelId(), request.temperature());
    return Mono.fromCallable(() -> decodeCompletion(api.chatCompletionEntity(completionRequest)))
        .subscribeOn(Schedulers.boundedElastic())
        .timeout(timeout)
        .onErrorMap(error -> errorTranslator.translate(error, providerId));
  }

  public List<ProviderDelta> decodeChunk(ChatCompletionChunk chunk) {
    if (chunk == null || chunk.choices() == null) {
      return List.of();
    }
    List<ProviderDelta> deltas = new ArrayList<>(2);
    for (ChatCompletionChunk.ChunkChoice choice : chunk.choices()) {
      if (choice.delta() != null && StringUtils.hasLength(choice.delta().content())) {
        deltas.add(ProviderDelta.text(choice.delta().content()));
      }
      if (choice.finishReason() != null) {
        deltas.add(ProviderDelta.finish(mapFinishReason(choice.finishReason())));
      }
    }
    return deltas;
  }

  private ProviderCompletion decodeCompletion(ResponseEntity<ChatCompletion> response) {
    ChatCompletion body = response != null ? response.getBody() : null;
    if (body == null || body.choices() == null || body.choices().isEmpty()) {
      throw new ConversationException(
          ConversationErrorKind.UPSTREAM_MALFORMED, providerId.label() + " returned no choices");
    }
    ChatCompletion.Choice choice = body.choices().get(0);
    String text = choice.message() != null ? choice.message().content() : null;
    FinishReason finishReason =
        choice.finishReason() != null ? mapFinishReason(choice.finishReason()) : null;
    return new ProviderCompletion(text != null ? text : "", finishReason);
  }

  static FinishReason mapFinishReason(ChatCompletionFinishReason finishReason) {
    return switch (finishReason) {
      case STOP -> FinishReason.STOP;
      case LENGTH -> FinishReason.LENGTH;
      case CONTENT_FILTER -> FinishReason.CONTENT_FILTER;
      default -> FinishReason.OTHER;
    };
  }

  private List<ChatCompletionMessage> toMessages(ProviderRequest request) {
    List<ChatCompletionMessage> messages = new ArrayList<>(request.history().size() + 2);
    if (StringUtils.hasText(request.systemPrompt())) {
      messages.add(new ChatCompletionMessage(request.systemPrompt(), Role.SYSTEM));
    }
    for (PromptMessage message : request.history()) {
      if (StringUtils.hasText(message.text())) {
        Role role = message.role() == TurnRole.ASSISTANT ? Role.ASSISTANT : Role.USER;
        messages.add(new ChatCompletionMessage(message.text(), role));
      }
    }
    messages.add(new ChatCompletionMessage(request.userMessage(), Role.USER));
    return messages;
  }

  private OpenAiApi api(ProviderRequest request) {
    String apiKey = request.credential().apiKey();
    if (!StringUtils.hasText(apiKey)) {
      throw ConversationException.credentialMissing(
          "No API key configured for " + providerId.label());
    }
    return apis.computeIfAbsent(
        apiKey,
        key ->
            OpenAiApi.builder()
                .baseUrl(baseUrl)
                .apiKey(key)
                .restClientBuilder(restClientBuilder.clone())
                .webClientBuilder(webClientBuilder.clone())
                .build());
  }
}
