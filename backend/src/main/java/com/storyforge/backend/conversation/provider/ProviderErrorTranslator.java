package com.storyforge.backend.conversation.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storyforge.backend.conversation.error.ConversationErrorKind;
import com.storyforge.backend.conversation.error.ConversationException;
import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.core.codec.DecodingException;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/** Maps upstream failures of any adapter onto {@link ConversationErrorKind}. */
public class ProviderErrorTranslator {

  private static final Pattern LEADING_STATUS = Pattern.compile("^(\\d{3})\\s*-\\s*(.*)$", Pattern.DOTALL);
  private static final int MAX_MESSAGE_LENGTH = 500;

  private final ObjectMapper objectMapper;

  public ProviderErrorTranslator(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public ConversationException translate(Throwable error, ProviderId providerId) {
    if (error instanceof ConversationException conversationException) {
      return conversationException;
    }
    String provider = providerId.label();
    if (error instanceof WebClientResponseException responseException) {
      return fromStatus(
          responseException.getStatusCode().value(),
          responseException.getResponseBodyAsString(),
          provider,
          error);
    }
    if (error instanceof RestClientResponseException responseException) {
      return fromStatus(
          responseException.getStatusCode().value(),
          responseException.getResponseBodyAsString(),
          provider,
          error);
    }
    if (error instanceof NonTransientAiException || error instanceof TransientAiException) {
      Matcher matcher = LEADING_STATUS.matcher(String.valueOf(error.getMessage()));
      if (matcher.matches()) {
        return fromStatus(Integer.parseInt(matcher.group(1)), matcher.group(2), provider, error);
      }
      ConversationErrorKind kind =
          error instanceof TransientAiException
              ? ConversationErrorKind.UPSTREAM_UNAVAILABLE
              : ConversationErrorKind.UPSTREAM_MALFORMED;
      return new ConversationException(kind, provider + " request failed: " + error.getMessage(), error);
    }
    if (error instanceof TimeoutException) {
      return new ConversationException(
          ConversationErrorKind.UPSTREAM_UNAVAILABLE,
          provider + " did not respond in time",
          error);
    }
    if (error instanceof WebClientRequestException || error instanceof IOException) {
      return new ConversationException(
          ConversationErrorKind.UPSTREAM_UNAVAILABLE,
          provider + " connection failed: " + describe(error),
          error);
    }
    if (error instanceof DecodingException) {
      return new ConversationException(
          ConversationErrorKind.UPSTREAM_MALFORMED,
          provider + " returned a response that could not be decoded",
          error);
    }
    return new ConversationException(
        ConversationErrorKind.UPSTREAM_UNAVAILABLE,
        provider + " request failed: " + describe(error),
        error);
  }

  /** Classifies an HTTP status plus body. Also used for error payloads embedded in a stream. */
  public ConversationException fromStatus(int status, String body, String provider, Throwable cause) {
    String upstreamMessage = extractMessage(body);
    String detail = StringUtils.hasText(upstreamMessage) ? upstreamMessage : "HTTP " + status;
    ConversationErrorKind kind;
    if (status == 401 || status == 403) {
      kind = ConversationErrorKind.UPSTREAM_AUTH;
    } else if (status == 429) {
      kind = ConversationErrorKind.UPSTREAM_RATE_LIMITED;
    } else if (status >= 500) {
      kind = ConversationErrorKind.UPSTREAM_UNAVAILABLE;
    } else {
      kind = ConversationErrorKind.UPSTREAM_MALFORMED;
    }
    return new ConversationException(kind, provider + " API error: " + detail, cause);
  }

  String extractMessage(String body) {
    if (!StringUtils.hasText(body)) {
      return null;
    }
    JsonNode root = parse(body).orElse(null);
    if (root != null && root.isArray() && !root.isEmpty()) {
      root = root.get(0);
    }
    if (root != null && root.isObject()) {
      JsonNode error = root.path("error");
      if (error.isObject() && error.path("message").isTextual()) {
        return sanitize(error.path("message").asText());
      }
      if (error.isTextual()) {
        return sanitize(error.asText());
      }
      if (root.path("message").isTextual()) {
        return sanitize(root.path("message").asText());
      }
    }
    return sanitize(body);
  }

  private Optional<JsonNode> parse(String body) {
    try {
      return Optional.ofNullable(objectMapper.readTree(body));
    } catch (IOException exception) {
      return Optional.empty();
    }
  }

  static String sanitize(String value) {
    if (!StringUtils.hasText(value)) {
      return null;
    }
    String normalized = value.replaceAll("\\s+", " ").trim();
    if (normalized.length() <= MAX_MESSAGE_LENGTH) {
      return normalized;
    }
    return normalized.substring(0, MAX_MESSAGE_LENGTH) + "...";
  }

  private static String describe(Throwable error) {
    String message = error.getMessage();
    return StringUtils.hasText(message) ? message : error.getClass().getSimpleName();
  }
}
