package com.storyforge.backend.conversation.api;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.UUID;

@Schema(
    description = "Payload for streaming the next narrator reply of a conversation.",
    example =
        """
        {
          "conversationId": "0d5c2f8e-5d7a-4d0b-9d3f-8c9b5a3c1e42",
          "userMessage": "I open the door of the inn.",
          "storyId": "moonlit-inn",
          "provider": "gemini"
        }
        """)
public record StreamChatRequest(
    @Schema(description = "Conversation identifier.", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull
        UUID conversationId,
    @Schema(description = "Reader input for this turn.", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank
        String userMessage,
    @Schema(description = "Story whose prompt frames the conversation.", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank
        String storyId,
    @Schema(description = "Preferred provider; falls back to the default provider without a key.")
        String provider,
    @Schema(description = "Model of the preferred provider; defaults to its default model.")
        String model,
    @Schema(description = "Name of the character speaking, if any.") String speaker) {

  public StreamChatRequest(UUID conversationId, String userMessage, String storyId) {
    this(conversationId, userMessage, storyId, null, null, null);
  }
}
