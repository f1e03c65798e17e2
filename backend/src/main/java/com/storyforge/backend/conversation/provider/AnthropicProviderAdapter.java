package com.storyforge.backend.conversation.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.storyforge.backend.conversation.domain.TurnRole;
import com.storyforge.backend.conversation.error.ConversationErrorKind;
import com.storyforge.backend.conversation.error.ConversationException;
import com.storyforge.backend.conversation.provider.model.FinishReason;
import com.storyforge.backend.conversation.provider.model.PromptMessage;
import com.storyforge.backend.conversation.provider.model.ProviderCompletion;
import com.storyforge.backend.conversation.provider.model.ProviderDelta;
import com.storyforge.backend.conversation.provider.model.ProviderRequest;
import java.time.Duration;
import java.util.List;
import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;

/** Anthropic Messages API. */
public class AnthropicProviderAdapter extends AbstractSseProviderAdapter {

  static final String API_VERSION = "2023-06-01";
  private static final int DEFAULT_MAX_TOKENS = 4096;

  public AnthropicProviderAdapter(
      WebClient webClient,
      ObjectMapper objectMapper,
      ProviderErrorTranslator errorTranslator,
      Duration timeout) {
    super(webClient, objectMapper, errorTranslator, timeout);
  }

  @Override
  public ProviderId providerId() {
    return ProviderId.CLAUDE;
  }

  @Override
  protected String streamPath(ProviderRequest request) {
    return "/v1/messages";
  }

  @Override
  protected String completionPath(ProviderRequest request) {
    return "/v1/messages";
  }

  @Override
  protected void applyHeaders(HttpHeaders headers, ProviderRequest request) {
    headers.set("x-api-key", request.credential().apiKey());
    headers.set("anthropic-version", API_VERSION);
  }

  @Override
  protected ObjectNode buildBody(ProviderRequest request, boolean stream) {
    ObjectNode body = objectMapper.createObjectNode();
    body.put("model", request.modelId());
    body.put(
        "max_tokens",
        request.maxOutputTokens() != null ? request.maxOutputTokens() : DEFAULT_MAX_TOKENS);
    if (StringUtils.hasText(request.systemPrompt())) {
      body.put("system", request.systemPrompt());
    }
    if (request.temperature() != null) {
      body.put("temperature", request.temperature());
    }
    ArrayNode messages = body.putArray("messages");
    for (PromptMessage message : request.history()) {
      appendMessage(messages, message.role() == TurnRole.ASSISTANT ? "assistant" : "user", message.text());
    }
    appendMessage(messages, "user", request.userMessage());
    if (stream) {
      body.put("stream", true);
    }
    return body;
  }

  private void appendMessage(ArrayNode messages, String role, String text) {
    if (!StringUtils.hasText(text)) {
      return;
    }
    ObjectNode message = messages.addObject();
    message.put("role", role);
    message.put("content", text);
  }

  @Override
  protected List<ProviderDelta> decodeStreamPayload(String data) {
    JsonNode event = readJson(data);
    String type = event.path("type").asText("");
    switch (type) {
      case "content_block_delta":
        JsonNode delta = event.path("delta");
        if ("text_delta".equals(delta.path("type").asText()) && delta.path("text").isTextual()) {
          return List.of(ProviderDelta.text(delta.path("text").asText()));
        }
        return List.of();
      case "message_delta":
        String stopReason = event.path("delta").path("stop_reason").asText(null);
        return stopReason != null ? List.of(ProviderDelta.finish(mapStopReason(stopReason))) : List.of();
      case "error":
        throw toException(event.path("error"));
      default:
        return List.of();
    }
  }

  @Override
  protected ProviderCompletion decodeCompletionPayload(String body) {
    JsonNode root = readJson(body);
    if ("error".equals(root.path("type").asText())) {
      throw toException(root.path("error"));
    }
    StringBuilder text = new StringBuilder();
    for (JsonNode block : root.path("content")) {
      if ("text".equals(block.path("type").asText())) {
        text.append(block.path("text").asText(""));
      }
    }
    String stopReason = root.path("stop_reason").asText(null);
    return new ProviderCompletion(text.toString(), stopReason != null ? mapStopReason(stopReason) : null);
  }

  static FinishReason mapStopReason(String stopReason) {
    return switch (stopReason) {
      case "end_turn", "stop_sequence" -> FinishReason.STOP;
      case "max_tokens" -> FinishReason.LENGTH;
      case "refusal" -> FinishReason.CONTENT_FILTER;
      default -> FinishReason.OTHER;
    };
  }

  private ConversationException toException(JsonNode error) {
    String type = error.path("type").asText("");
    String message = error.path("message").asText("unknown error");
    ConversationErrorKind kind =
        switch (type) {
          case "authentication_error", "permission_error" -> ConversationErrorKind.UPSTREAM_AUTH;
          case "rate_limit_error" -> ConversationErrorKind.UPSTREAM_RATE_LIMITED;
          case "overloaded_error", "api_error" -> ConversationErrorKind.UPSTREAM_UNAVAILABLE;
          default -> ConversationErrorKind.UPSTREAM_MALFORMED;
        };
    return new ConversationException(kind, providerId().label() + " API error: " + message);
  }
}
