package com.storyforge.backend.conversation.error;

import org.springframework.http.HttpStatus;

/**
 * Failure classes surfaced by the conversation engine. Stream-phase kinds end the event stream
 * with a terminal error event; the HTTP status is used by the synchronous endpoints.
 */
public enum ConversationErrorKind {
  CREDENTIAL_MISSING(HttpStatus.BAD_REQUEST),
  UPSTREAM_AUTH(HttpStatus.BAD_GATEWAY),
  UPSTREAM_RATE_LIMITED(HttpStatus.TOO_MANY_REQUESTS),
  UPSTREAM_MALFORMED(HttpStatus.BAD_GATEWAY),
  UPSTREAM_UNAVAILABLE(HttpStatus.BAD_GATEWAY),
  /** Completion came back empty because the model hit its output-length ceiling. */
  EMPTY_COMPLETION_TRUNCATED(HttpStatus.BAD_GATEWAY),
  EMPTY_COMPLETION(HttpStatus.BAD_GATEWAY),
  COMPACTION_FAILED(HttpStatus.BAD_GATEWAY),
  NOT_FOUND(HttpStatus.NOT_FOUND),
  INVALID_REQUEST(HttpStatus.BAD_REQUEST);

  private final HttpStatus status;

  ConversationErrorKind(HttpStatus status) {
    this.status = status;
  }

  public HttpStatus status() {
    return status;
  }
}
