package com.storyforge.backend.conversation.error;

import java.util.Objects;

public class ConversationException extends RuntimeException {

  private final ConversationErrorKind kind;

  public ConversationException(ConversationErrorKind kind, String message) {
    this(kind, message, null);
  }

  public ConversationException(ConversationErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind must not be null");
  }

  public ConversationErrorKind kind() {
    return kind;
  }

  public static ConversationException notFound(String message) {
    return new ConversationException(ConversationErrorKind.NOT_FOUND, message);
  }

  public static ConversationException invalid(String message) {
    return new ConversationException(ConversationErrorKind.INVALID_REQUEST, message);
  }

  public static ConversationException credentialMissing(String message) {
    return new ConversationException(ConversationErrorKind.CREDENTIAL_MISSING, message);
  }
}
