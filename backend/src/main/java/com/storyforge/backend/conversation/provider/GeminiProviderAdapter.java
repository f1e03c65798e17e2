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
import java.util.ArrayList;
import java.util.List;
import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;

/** Google Generative Language API ({@code generateContent} family). */
public class GeminiProviderAdapter extends AbstractSseProviderAdapter {

  private static final int GEMINI_25_THINKING_BUDGET = 1024;

  public GeminiProviderAdapter(
      WebClient webClient,
      ObjectMapper objectMapper,
      ProviderErrorTranslator errorTranslator,
      Duration timeout) {
    super(webClient, objectMapper, errorTranslator, timeout);
  }

  @Override
  public ProviderId providerId() {
    return ProviderId.GEMINI;
  }

  @Override
  protected String streamPath(ProviderRequest request) {
    return "/v1beta/models/" + request.modelId() + ":streamGenerateContent?alt=sse";
  }

  @Override
  protected String completionPath(ProviderRequest request) {
    return "/v1beta/models/" + request.modelId() + ":generateContent";
  }

  @Override
  protected void applyHeaders(HttpHeaders headers, ProviderRequest request) {
    headers.set("x-goog-api-key", request.credential().apiKey());
  }

  @Override
  protected ObjectNode buildBody(ProviderRequest request, boolean stream) {
    ObjectNode body = objectMapper.createObjectNode();
    ArrayNode contents = body.putArray("contents");
    for (PromptMessage message : request.history()) {
      appendContent(contents, message.role() == TurnRole.ASSISTANT ? "model" : "user", message.text());
    }
    appendContent(contents, "user", request.userMessage());
    if (StringUtils.hasText(request.systemPrompt())) {
      body.putObject("systemInstruction").putArray("parts").addObject().put("text", request.systemPrompt());
    }
    body.set("generationConfig", generationConfig(request));
    return body;
  }

  /** Gemini 3 models only accept the default temperature and a thinking level. */
  ObjectNode generationConfig(ProviderRequest request) {
    String model = request.modelId() != null ? request.modelId() : "";
    ObjectNode config = objectMapper.createObjectNode();
    if (model.contains("gemini-3")) {
      config.put("temperature", 1.0d);
      config.putObject("thinkingConfig").put("thinkingLevel", "low");
    } else {
      if (request.temperature() != null) {
        config.put("temperature", request.temperature());
      }
      if (model.contains("gemini-2.5")) {
        config.putObject("thinkingConfig").put("thinkingBudget", GEMINI_25_THINKING_BUDGET);
      }
    }
    if (request.maxOutputTokens() != null) {
      config.put("maxOutputTokens", request.maxOutputTokens());
    }
    return config;
  }

  private void appendContent(ArrayNode contents, String role, String text) {
    if (!StringUtils.hasText(text)) {
      return;
    }
    ObjectNode content = contents.addObject();
    content.put("role", role);
    content.putArray("parts").addObject().put("text", text);
  }

  @Override
  protected List<ProviderDelta> decodeStreamPayload(String data) {
    JsonNode root = readJson(data);
    ProviderCompletion completion = decode(root);
    List<ProviderDelta> deltas = new ArrayList<>(2);
    if (!completion.text().isEmpty()) {
      deltas.add(ProviderDelta.text(completion.text()));
    }
    if (completion.finishReason() != null) {
      deltas.add(ProviderDelta.finish(completion.finishReason()));
    }
    return deltas;
  }

  @Override
  protected ProviderCompletion decodeCompletionPayload(String body) {
    return decode(readJson(body));
  }

  private ProviderCompletion decode(JsonNode root) {
    if (root.isArray() && !root.isEmpty()) {
      root = root.get(0);
    }
    JsonNode error = root.path("error");
    if (error.isObject()) {
      throw errorTranslator.fromStatus(
          error.path("code").asInt(500), root.toString(), providerId().label(), null);
    }
    JsonNode candidate = root.path("candidates").path(0);
    if (candidate.isMissingNode()) {
      String blockReason = root.path("promptFeedback").path("blockReason").asText(null);
      if (blockReason != null) {
        throw new ConversationException(
            ConversationErrorKind.EMPTY_COMPLETION,
            providerId().label() + " blocked the prompt: " + blockReason);
      }
      return new ProviderCompletion("", null);
    }
    StringBuilder text = new StringBuilder();
    for (JsonNode part : candidate.path("content").path("parts")) {
      if (part.path("thought").asBoolean(false)) {
        continue;
      }
      text.append(part.path("text").asText(""));
    }
    String finishReason = candidate.path("finishReason").asText(null);
    return new ProviderCompletion(
        text.toString(), finishReason != null ? mapFinishReason(finishReason) : null);
  }

  static FinishReason mapFinishReason(String finishReason) {
    return switch (finishReason) {
      case "STOP" -> FinishReason.STOP;
      case "MAX_TOKENS" -> FinishReason.LENGTH;
      case "SAFETY", "RECITATION", "BLOCKLIST", "PROHIBITED_CONTENT", "SPII" ->
          FinishReason.CONTENT_FILTER;
      default -> FinishReason.OTHER;
    };
  }
}
