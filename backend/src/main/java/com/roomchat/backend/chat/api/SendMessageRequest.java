package com.roomchat.backend.chat.api;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;

@Schema(
    description = "Message posted to a room.",
    example =
        """
        {
          "content": "hello"
        }
        """)
public record SendMessageRequest(
    @Schema(
            description = "Message text. Passed to the generator unchanged.",
            example = "hello",
            requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull
        String content) {}
