package com.storyforge.backend.conversation.stream;

import java.io.IOException;

/** Client side of a relay. An {@link IOException} from {@link #send} means the client is gone. */
public interface StreamEventSink {

  void send(ConversationStreamEvent event) throws IOException;

  void complete();
}
