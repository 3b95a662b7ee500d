package com.roomchat.backend.room.api;

import com.roomchat.backend.room.domain.Room;
import io.swagger.v3.oas.annotations.media.Schema;
import java.time.Instant;
import java.util.UUID;

@Schema(description = "Room metadata with its current message count.")
public record RoomSummary(
    UUID id,
    String name,
    String description,
    UUID createdBy,
    Instant createdAt,
    @Schema(example = "12") long messageCount) {

  public static RoomSummary of(Room room, long messageCount) {
    return new RoomSummary(
        room.getId(),
        room.getName(),
        room.getDescription(),
        room.getCreatedBy(),
        room.getCreatedAt(),
        messageCount);
  }
}
