package com.roomchat.backend.room.api;

import io.swagger.v3.oas.annotations.media.Schema;

public record CreateRoomResponse(
    @Schema(example = "Room created successfully") String message, RoomSummary room) {}
