package com.roomchat.backend.chat.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;

@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Acknowledgement of an offloaded send; the reply is produced by a background worker.")
public record AsyncSendMessageResponse(
    @Schema(example = "Message accepted, reply pending") String message,
    @Schema(description = "The user's message as stored.") MessageView userMessage,
    @Schema(description = "Identifier of the queued reply job; absent when queuing failed.", example = "42")
        Long jobId) {}
