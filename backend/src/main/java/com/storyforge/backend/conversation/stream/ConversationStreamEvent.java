package com.storyforge.backend.conversation.stream;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.storyforge.backend.conversation.api.TurnResponse;

/**
 * Payload of one {@code data:} line of the reply stream: a partial chunk, the terminal success
 * event or the terminal error event.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConversationStreamEvent(
    String text, Boolean done, String fullText, TurnResponse savedMessage, String error) {

  public static ConversationStreamEvent partial(String text) {
    return new ConversationStreamEvent(text, false, null, null, null);
  }

  public static ConversationStreamEvent completed(String fullText, TurnResponse savedMessage) {
    return new ConversationStreamEvent("", true, fullText, savedMessage, null);
  }

  public static ConversationStreamEvent failed(String error) {
    return new ConversationStreamEvent(null, null, null, null, error);
  }

  public boolean isTerminal() {
    return error != null || Boolean.TRUE.equals(done);
  }
}
