package com.storyforge.backend.conversation.stream;

import com.storyforge.backend.conversation.api.StreamChatRequest;
import com.storyforge.backend.conversation.api.TurnResponse;
import com.storyforge.backend.conversation.config.ConversationProvidersProperties;
import com.storyforge.backend.conversation.config.ConversationStreamProperties;
import com.storyforge.backend.conversation.credential.CredentialResolver;
import com.storyforge.backend.conversation.credential.ProviderCredential;
import com.storyforge.backend.conversation.domain.ConversationTurn;
import com.storyforge.backend.conversation.error.ConversationErrorKind;
import com.storyforge.backend.conversation.error.ConversationException;
import com.storyforge.backend.conversation.extract.ResponseContentExtractor;
import com.storyforge.backend.conversation.memory.MemoryCompactionService;
import com.storyforge.backend.conversation.prompt.ConversationPromptAssembler;
import com.storyforge.backend.conversation.provider.ProviderAdapter;
import com.storyforge.backend.conversation.provider.ProviderAdapterRegistry;
import com.storyforge.backend.conversation.provider.model.FinishReason;
import com.storyforge.backend.conversation.provider.model.PromptMessage;
import com.storyforge.backend.conversation.provider.model.ProviderDelta;
import com.storyforge.backend.conversation.provider.model.ProviderRequest;
import com.storyforge.backend.conversation.service.ConversationExchange;
import com.storyforge.backend.conversation.service.ConversationTurnService;
import com.storyforge.backend.conversation.service.RecordedTurn;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

/**
 * Relays one reply from a provider to the client and stores it.
 *
 * <p>Partial events are forwarded as soon as they arrive and their texts concatenate to the
 * {@code fullText} of the terminal event, which is always the last event. The assistant turn is
 * stored only when the upstream completes with content and a finish reason; a stream that ends
 * without one was cut off. Failures and cancellations store nothing beyond the user turn.
 */
@Service
@Slf4j
public class StreamRelay {

  private static final String STREAM_DURATION_METRIC = "conversation_stream_duration_seconds";

  private final CredentialResolver credentialResolver;
  private final ProviderAdapterRegistry adapterRegistry;
  private final ConversationTurnService turnService;
  private final ConversationPromptAssembler promptAssembler;
  private final ResponseContentExtractor contentExtractor;
  private final MemoryCompactionService compactionService;
  private final ConversationProvidersProperties providersProperties;
  private final ConversationStreamProperties streamProperties;
  private final MeterRegistry meterRegistry;

  public StreamRelay(
      CredentialResolver credentialResolver,
      ProviderAdapterRegistry adapterRegistry,
      ConversationTurnService turnService,
      ConversationPromptAssembler promptAssembler,
      ResponseContentExtractor contentExtractor,
      MemoryCompactionService compactionService,
      ConversationProvidersProperties providersProperties,
      ConversationStreamProperties streamProperties,
      MeterRegistry meterRegistry) {
    this.credentialResolver = credentialResolver;
    this.adapterRegistry = adapterRegistry;
    this.turnService = turnService;
    this.promptAssembler = promptAssembler;
    this.contentExtractor = contentExtractor;
    this.compactionService = compactionService;
    this.providersProperties = providersProperties;
    this.streamProperties = streamProperties;
    this.meterRegistry = meterRegistry;
  }

  public RelaySession start(StreamChatRequest request, StreamEventSink sink) {
    RelaySession session = new RelaySession(request.conversationId());
    if (request.conversationId() == null
        || !StringUtils.hasText(request.userMessage())
        || !StringUtils.hasText(request.storyId())) {
      fail(session, sink, null, ConversationException.invalid(
          "conversationId, userMessage and storyId are required"));
      return session;
    }

    ProviderCredential credential =
        credentialResolver
            .resolve(request.conversationId(), request.provider(), request.model())
            .orElse(null);
    if (credential == null) {
      fail(
          session,
          sink,
          null,
          ConversationException.credentialMissing(
              "No API key is configured for "
                  + (StringUtils.hasText(request.provider()) ? request.provider() : "the default provider")
                  + " or any fallback provider"));
      return session;
    }

    Flux<ProviderDelta> upstream;
    try {
      ProviderAdapter adapter = adapterRegistry.require(credential.providerId());
      session.transition(RelayState.REQUESTING);
      ConversationExchange exchange =
          turnService.registerUserMessage(
              request.conversationId(),
              request.userMessage(),
              request.speaker(),
              streamProperties.getHistoryTurns());
      ProviderRequest providerRequest = buildRequest(request, credential, exchange);
      upstream = Flux.defer(() -> adapter.stream(providerRequest));
    } catch (RuntimeException exception) {
      fail(session, sink, credential, exception);
      return session;
    }

    log.info(
        "Streaming reply for conversation {} via {}:{}",
        request.conversationId(),
        credential.providerId().id(),
        credential.modelId());

    Disposable subscription =
        upstream
            .publishOn(Schedulers.boundedElastic())
            .subscribe(
                delta -> onDelta(session, sink, delta),
                error -> fail(session, sink, credential, error),
                () -> finish(session, sink, credential));
    session.attach(subscription);
    return session;
  }

  private ProviderRequest buildRequest(
      StreamChatRequest request, ProviderCredential credential, ConversationExchange exchange) {
    List<PromptMessage> history = new ArrayList<>(exchange.history().size());
    for (ConversationTurn turn : exchange.history()) {
      history.add(new PromptMessage(turn.getRole(), turn.getText()));
    }
    ConversationProvidersProperties.Provider config =
        providersProperties.getProviders().get(credential.providerId().id());
    return new ProviderRequest(
        credential,
        promptAssembler.systemPrompt(request.storyId(), exchange.memory()),
        history,
        request.userMessage(),
        config != null ? config.getTemperature() : null,
        config != null ? config.getMaxOutputTokens() : null);
  }

  private void onDelta(RelaySession session, StreamEventSink sink, ProviderDelta delta) {
    if (session.state() == RelayState.REQUESTING) {
      session.transition(RelayState.STREAMING);
    }
    if (session.state() != RelayState.STREAMING) {
      return;
    }
    if (delta.finishReason() != null) {
      session.finishReason(delta.finishReason());
    }
    if (!delta.hasText()) {
      return;
    }
    for (String chunk : split(delta.text(), streamProperties.getChunkSize())) {
      session.append(chunk);
      if (!send(session, sink, ConversationStreamEvent.partial(chunk))) {
        return;
      }
    }
  }

  private void finish(RelaySession session, StreamEventSink sink, ProviderCredential credential) {
    if (session.state() == RelayState.CANCELLED) {
      return;
    }
    String rawText = session.rawText();
    if (!StringUtils.hasText(rawText)) {
      fail(session, sink, credential, emptyCompletion(session.finishReason(), credential));
      return;
    }
    if (session.finishReason() == null) {
      fail(
          session,
          sink,
          credential,
          new ConversationException(
              ConversationErrorKind.UPSTREAM_UNAVAILABLE,
              credential.providerId().label()
                  + " connection closed before the reply was finished"));
      return;
    }
    String narrative = contentExtractor.extract(rawText);
    if (!StringUtils.hasText(narrative)) {
      fail(session, sink, credential, emptyCompletion(session.finishReason(), credential));
      return;
    }
    if (!session.transition(RelayState.FINALIZING)) {
      return;
    }

    RecordedTurn recorded;
    try {
      recorded =
          turnService.registerAssistantReply(
              session.conversationId(),
              narrative,
              credential.providerId().id(),
              credential.modelId());
    } catch (RuntimeException exception) {
      log.error("Failed to store reply of conversation {}", session.conversationId(), exception);
      fail(
          session,
          sink,
          credential,
          new ConversationException(
              ConversationErrorKind.UPSTREAM_UNAVAILABLE, "The reply could not be saved", exception));
      return;
    }

    session.transition(RelayState.COMPLETED);
    send(session, sink, ConversationStreamEvent.completed(rawText, TurnResponse.from(recorded.turn())));
    sink.complete();
    record(session, credential, "completed");
    log.info(
        "Stream of conversation {} completed via {}:{} in {} ms ({} chars, turn #{})",
        session.conversationId(),
        credential.providerId().id(),
        credential.modelId(),
        session.elapsedMillis(),
        rawText.length(),
        recorded.memory().completedTurnCount());

    compactionService.onAssistantTurn(recorded.memory(), credential.providerId().id());
  }

  private void fail(
      RelaySession session, StreamEventSink sink, ProviderCredential credential, Throwable error) {
    if (!session.transition(RelayState.FAILED)) {
      return;
    }
    session.disposeUpstream();
    ConversationException failure =
        error instanceof ConversationException conversationException
            ? conversationException
            : new ConversationException(
                ConversationErrorKind.UPSTREAM_UNAVAILABLE,
                error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName(),
                error);
    log.warn(
        "Stream of conversation {} failed via {}:{} after {} ms [{}]: {}",
        session.conversationId(),
        credential != null ? credential.providerId().id() : null,
        credential != null ? credential.modelId() : null,
        session.elapsedMillis(),
        failure.kind(),
        failure.getMessage());
    send(session, sink, ConversationStreamEvent.failed(failure.getMessage()));
    sink.complete();
    record(session, credential, failure.kind().name().toLowerCase());
  }

  private ConversationException emptyCompletion(
      FinishReason finishReason, ProviderCredential credential) {
    if (finishReason == FinishReason.LENGTH) {
      return new ConversationException(
          ConversationErrorKind.EMPTY_COMPLETION_TRUNCATED,
          "Model "
              + credential.modelId()
              + " reached its output limit before producing any text. Try another model.");
    }
    return new ConversationException(
        ConversationErrorKind.EMPTY_COMPLETION,
        "Model "
            + credential.modelId()
            + " returned an empty reply"
            + (finishReason != null ? " (finish reason " + finishReason + ")" : ""));
  }

  private boolean send(RelaySession session, StreamEventSink sink, ConversationStreamEvent event) {
    try {
      sink.send(event);
      return true;
    } catch (IOException | IllegalStateException exception) {
      log.debug(
          "Client of conversation {} is gone: {}", session.conversationId(), exception.getMessage());
      session.cancel();
      return false;
    }
  }

  private void record(RelaySession session, ProviderCredential credential, String outcome) {
    if (meterRegistry == null) {
      return;
    }
    Timer.builder(STREAM_DURATION_METRIC)
        .description("Duration of streamed replies")
        .tag("provider", credential != null ? credential.providerId().id() : "none")
        .tag("outcome", outcome)
        .register(meterRegistry)
        .record(session.elapsedMillis(), TimeUnit.MILLISECONDS);
  }

  /** Splits text into pieces of at most {@code size} characters without cutting surrogate pairs. */
  static List<String> split(String text, int size) {
    if (size <= 0 || text.length() <= size) {
      return List.of(text);
    }
    List<String> chunks = new ArrayList<>(text.length() / size + 1);
    int start = 0;
    while (start < text.length()) {
      int end = Math.min(text.length(), start + size);
      if (end < text.length() && Character.isHighSurrogate(text.charAt(end - 1)) && end - start > 1) {
        end--;
      }
      chunks.add(text.substring(start, end));
      start = end;
    }
    return chunks;
  }
}
