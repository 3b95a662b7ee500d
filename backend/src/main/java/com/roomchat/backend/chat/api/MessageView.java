package com.roomchat.backend.chat.api;

import com.roomchat.backend.chat.domain.MessageType;
import io.swagger.v3.oas.annotations.media.Schema;
import java.time.Instant;
import java.util.UUID;

@Schema(description = "Chat message as returned to clients, with the author's display name resolved.")
public record MessageView(
    @Schema(
            description = "Message identifier. Null only for a generated reply that could not be stored.",
            example = "1f0d7c2e-55a4-4a8e-9f0b-5d6d3c1f2a11")
        UUID id,
    @Schema(description = "Message text.", example = "hello") String content,
    @Schema(description = "Author id; null for generated replies.") UUID authorId,
    @Schema(description = "Room the message belongs to.") UUID roomId,
    @Schema(description = "Message kind.", allowableValues = {"user", "ai"}) MessageType messageType,
    @Schema(description = "Author display name.", example = "AI Assistant") String username,
    @Schema(description = "UTC creation timestamp.") Instant createdAt) {}
