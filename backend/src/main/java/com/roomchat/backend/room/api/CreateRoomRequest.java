package com.roomchat.backend.room.api;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@Schema(description = "Payload for creating a room.")
public record CreateRoomRequest(
    @Schema(example = "general", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank
        @Size(max = 100)
        String name,
    @Schema(example = "Anything goes") @Size(max = 2000) String description) {}
