package com.storyforge.backend.conversation.controller;

import com.storyforge.backend.conversation.api.StreamChatRequest;
import com.storyforge.backend.conversation.config.ConversationStreamProperties;
import com.storyforge.backend.conversation.stream.ConversationStreamEvent;
import com.storyforge.backend.conversation.stream.RelaySession;
import com.storyforge.backend.conversation.stream.StreamEventSink;
import com.storyforge.backend.conversation.stream.StreamRelay;
import jakarta.validation.Valid;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@RestController
@RequestMapping("/api/conversations")
@Validated
@Slf4j
public class ConversationStreamController {

  private final StreamRelay streamRelay;
  private final ConversationStreamProperties streamProperties;

  public ConversationStreamController(
      StreamRelay streamRelay, ConversationStreamProperties streamProperties) {
    this.streamRelay = streamRelay;
    this.streamProperties = streamProperties;
  }

  @PostMapping(
      value = "/stream",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public SseEmitter stream(@RequestBody @Valid StreamChatRequest request) {
    SseEmitter emitter = new SseEmitter(streamProperties.getEmitterTimeout().toMillis());
    AtomicReference<RelaySession> sessionRef = new AtomicReference<>();

    emitter.onCompletion(() -> cancel(sessionRef));
    emitter.onError(error -> cancel(sessionRef));
    emitter.onTimeout(
        () -> {
          log.warn("Stream of conversation {} timed out", request.conversationId());
          cancel(sessionRef);
          emitter.complete();
        });

    sessionRef.set(streamRelay.start(request, new EmitterSink(emitter)));
    return emitter;
  }

  private void cancel(AtomicReference<RelaySession> sessionRef) {
    RelaySession session = sessionRef.get();
    if (session != null && !session.state().isTerminal()) {
      session.cancel();
    }
  }

  private static final class EmitterSink implements StreamEventSink {

    private final SseEmitter emitter;

    private EmitterSink(SseEmitter emitter) {
      this.emitter = emitter;
    }

    @Override
    public void send(ConversationStreamEvent event) throws IOException {
      emitter.send(SseEmitter.event().data(event, MediaType.APPLICATION_JSON));
    }

    @Override
    public void complete() {
      emitter.complete();
    }
  }
}
