package com.roomchat.backend.chat.api;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Result of an inline send: the stored user message and the generated reply.")
public record SendMessageResponse(
    @Schema(example = "Messages sent successfully") String message,
    @Schema(description = "The user's message as stored.") MessageView userMessage,
    @Schema(description = "Generated reply, or the fallback text when generation failed.")
        MessageView aiMessage,
    @Schema(description = "True when aiMessage carries fallback text instead of a generated reply.")
        boolean fallbackReply) {}
