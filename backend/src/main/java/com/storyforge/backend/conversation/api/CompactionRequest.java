package com.storyforge.backend.conversation.api;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import java.util.UUID;

@Schema(description = "Request to compact the memory of a conversation right away.")
public record CompactionRequest(
    @Schema(description = "Conversation identifier.", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull
        UUID conversationId,
    @Schema(description = "Provider used for the summary; defaults to the configured one.") String provider,
    @Schema(description = "Model used for the summary.") String model) {}
