package com.storyforge.backend.conversation.stream;

import com.storyforge.backend.conversation.provider.model.FinishReason;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;

/** Mutable state of one relay run, shared between the upstream subscriber and the client side. */
@Slf4j
public class RelaySession {

  private final UUID conversationId;
  private final AtomicReference<RelayState> state = new AtomicReference<>(RelayState.IDLE);
  private final AtomicReference<Disposable> upstream = new AtomicReference<>();
  private final StringBuilder rawText = new StringBuilder();
  private final long startedAt = System.nanoTime();
  private volatile FinishReason finishReason;

  RelaySession(UUID conversationId) {
    this.conversationId = conversationId;
  }

  public UUID conversationId() {
    return conversationId;
  }

  public RelayState state() {
    return state.get();
  }

  /** Client went away or the stream timed out: stops reading upstream, nothing gets stored. */
  public void cancel() {
    if (transition(RelayState.CANCELLED)) {
      log.info("Stream of conversation {} cancelled by client", conversationId);
      disposeUpstream();
    }
  }

  boolean transition(RelayState next) {
    while (true) {
      RelayState current = state.get();
      if (current == next) {
        return false;
      }
      if (!current.canTransitionTo(next)) {
        return false;
      }
      if (state.compareAndSet(current, next)) {
        return true;
      }
    }
  }

  void attach(Disposable subscription) {
    upstream.set(subscription);
    if (state.get() == RelayState.CANCELLED) {
      disposeUpstream();
    }
  }

  void disposeUpstream() {
    Disposable disposable = upstream.getAndSet(null);
    if (disposable != null && !disposable.isDisposed()) {
      disposable.dispose();
    }
  }

  void append(String text) {
    rawText.append(text);
  }

  String rawText() {
    return rawText.toString();
  }

  void finishReason(FinishReason finishReason) {
    this.finishReason = finishReason;
  }

  FinishReason finishReason() {
    return finishReason;
  }

  long elapsedMillis() {
    return (System.nanoTime() - startedAt) / 1_000_000L;
  }
}
