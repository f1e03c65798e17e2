package com.storyforge.backend.conversation.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storyforge.backend.conversation.credential.ProviderCredential;
import com.storyforge.backend.conversation.domain.TurnRole;
import com.storyforge.backend.conversation.error.ConversationErrorKind;
import com.storyforge.backend.conversation.error.ConversationException;
import com.storyforge.backend.conversation.provider.model.FinishReason;
import com.storyforge.backend.conversation.provider.model.PromptMessage;
import com.storyforge.backend.conversation.provider.model.ProviderCompletion;
import com.storyforge.backend.conversation.provider.model.ProviderDelta;
import com.storyforge.backend.conversation.provider.model.ProviderRequest;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.ai.openai.api.OpenAiApi.ChatCompletionChunk;
import org.springframework.ai.openai.api.OpenAiApi.ChatCompletionFinishReason;
import org.springframework.web.client.RestClient;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.test.StepVerifier;

class OpenAiCompatibleProviderAdapterTest {

  private final ObjectMapper objectMapper =
      new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  private MockWebServer server;
  private OpenAiCompatibleProviderAdapter adapter;

  @BeforeEach
  void setUp() throws IOException {
    server = new MockWebServer();
    server.start();
    adapter =
        new OpenAiCompatibleProviderAdapter(
            ProviderId.GROK,
            "http://" + server.getHostName() + ":" + server.getPort(),
            RestClient.builder(),
            WebClient.builder(),
            new ProviderErrorTranslator(objectMapper),
            Duration.ofSeconds(5));
  }

  @AfterEach
  void tearDown() throws IOException {
    server.shutdown();
  }

  @Test
  void streamsContentAndFinishReason() throws Exception {
    server.enqueue(
        new MockResponse()
            .addHeader("Content-Type", "text/event-stream")
            .setBody(
                chunk("{\"role\":\"assistant\",\"content\":\"The \"}", null)
                    + chunk("{\"content\":\"tower falls.\"}", null)
                    + chunk("{}", "\"stop\"")
                    + "data: [DONE]\n\n"));

    List<ProviderDelta> deltas = adapter.stream(request("xai-key")).collectList().block(Duration.ofSeconds(5));

    assertThat(deltas).isNotNull();
    assertThat(deltas.stream().map(ProviderDelta::text).collect(Collectors.joining()))
        .isEqualTo("The tower falls.");
    assertThat(deltas.get(deltas.size() - 1)).isEqualTo(ProviderDelta.finish(FinishReason.STOP));

    RecordedRequest recorded = server.takeRequest();
    assertThat(recorded.getPath()).isEqualTo("/v1/chat/completions");
    assertThat(recorded.getHeader("Authorization")).isEqualTo("Bearer xai-key");
    JsonNode body = objectMapper.readTree(recorded.getBody().readUtf8());
    assertThat(body.path("model").asText()).isEqualTo("grok-4-fast");
    assertThat(body.path("stream").asBoolean()).isTrue();
    assertThat(body.path("messages")).hasSize(4);
    assertThat(body.path("messages").path(0).path("role").asText()).isEqualTo("system");
    assertThat(body.path("messages").path(2).path("role").asText()).isEqualTo("assistant");
    assertThat(body.path("messages").path(3).path("content").asText()).isEqualTo("Climb the tower");
  }

  @Test
  void streamingAuthFailureIsClassified() {
    server.enqueue(
        new MockResponse()
            .setResponseCode(401)
            .addHeader("Content-Type", "application/json")
            .setBody("{\"error\":{\"message\":\"Incorrect API key provided\"}}"));

    StepVerifier.create(adapter.stream(request("wrong")))
        .expectErrorSatisfies(
            error -> {
              assertThat(((ConversationException) error).kind())
                  .isEqualTo(ConversationErrorKind.UPSTREAM_AUTH);
              assertThat(error.getMessage()).contains("Incorrect API key provided");
            })
        .verify();
  }

  @Test
  void completeReadsFirstChoice() {
    server.enqueue(
        new MockResponse()
            .addHeader("Content-Type", "application/json")
            .setBody(
                "{\"id\":\"c1\",\"object\":\"chat.completion\",\"created\":1,\"model\":\"grok-4-fast\","
                    + "\"choices\":[{\"index\":0,\"message\":{\"role\":\"assistant\",\"content\":\"Summary\"},"
                    + "\"finish_reason\":\"length\"}]}"));

    StepVerifier.create(adapter.complete(request("xai-key")))
        .expectNext(new ProviderCompletion("Summary", FinishReason.LENGTH))
        .verifyComplete();
  }

  @Test
  void completeRateLimitIsClassified() {
    server.enqueue(
        new MockResponse()
            .setResponseCode(429)
            .addHeader("Content-Type", "application/json")
            .setBody("{\"error\":{\"message\":\"Too many requests\"}}"));

    StepVerifier.create(adapter.complete(request("xai-key")))
        .expectErrorSatisfies(
            error ->
                assertThat(((ConversationException) error).kind())
                    .isEqualTo(ConversationErrorKind.UPSTREAM_RATE_LIMITED))
        .verify();
  }

  @Test
  void missingKeyFailsBeforeAnyRequest() {
    assertThatThrownBy(() -> adapter.stream(request("")))
        .isInstanceOf(ConversationException.class)
        .extracting(error -> ((ConversationException) error).kind())
        .isEqualTo(ConversationErrorKind.CREDENTIAL_MISSING);
    assertThat(server.getRequestCount()).isZero();
  }

  @Test
  void decodesChunkWithTextAndFinishReason() throws Exception {
    ChatCompletionChunk chunk =
        objectMapper.readValue(
            "{\"id\":\"c1\",\"object\":\"chat.completion.chunk\",\"created\":1,\"model\":\"m\","
                + "\"choices\":[{\"index\":0,\"delta\":{\"content\":\"end\"},\"finish_reason\":\"content_filter\"}]}",
            ChatCompletionChunk.class);

    assertThat(adapter.decodeChunk(chunk))
        .containsExactly(
            ProviderDelta.text("end"), ProviderDelta.finish(FinishReason.CONTENT_FILTER));
  }

  @Test
  void ignoresChunksWithoutChoices() throws Exception {
    ChatCompletionChunk usageOnly =
        objectMapper.readValue(
            "{\"id\":\"c1\",\"object\":\"chat.completion.chunk\",\"created\":1,\"model\":\"m\",\"choices\":[],"
                + "\"usage\":{\"prompt_tokens\":3,\"completion_tokens\":4,\"total_tokens\":7}}",
            ChatCompletionChunk.class);

    assertThat(adapter.decodeChunk(usageOnly)).isEmpty();
    assertThat(adapter.decodeChunk(null)).isEmpty();
  }

  @Test
  void mapsFinishReasons() {
    assertThat(OpenAiCompatibleProviderAdapter.mapFinishReason(ChatCompletionFinishReason.STOP))
        .isEqualTo(FinishReason.STOP);
    assertThat(OpenAiCompatibleProviderAdapter.mapFinishReason(ChatCompletionFinishReason.LENGTH))
        .isEqualTo(FinishReason.LENGTH);
    assertThat(OpenAiCompatibleProviderAdapter.mapFinishReason(ChatCompletionFinishReason.TOOL_CALLS))
        .isEqualTo(FinishReason.OTHER);
  }

  @Test
  void rejectsProvidersWithAnotherWireFormat() {
    assertThatThrownBy(
            () ->
                new OpenAiCompatibleProviderAdapter(
                    ProviderId.CLAUDE,
                    null,
                    RestClient.builder(),
                    WebClient.builder(),
                    new ProviderErrorTranslator(objectMapper),
                    null))
        .isInstanceOf(IllegalStateException.class);
  }

  private static String chunk(String delta, String finishReason) {
    return "data: {\"id\":\"c1\",\"object\":\"chat.completion.chunk\",\"created\":1,\"model\":\"grok-4-fast\","
        + "\"choices\":[{\"index\":0,\"delta\":"
        + delta
        + ",\"finish_reason\":"
        + (finishReason != null ? finishReason : "null")
        + "}]}\n\n";
  }

  private static ProviderRequest request(String apiKey) {
    return new ProviderRequest(
        new ProviderCredential(ProviderId.GROK, apiKey, "grok-4-fast"),
        "Narrate.",
        List.of(
            new PromptMessage(TurnRole.USER, "Start"),
            new PromptMessage(TurnRole.ASSISTANT, "A tower looms.")),
        "Climb the tower",
        0.7d,
        null);
  }
}
