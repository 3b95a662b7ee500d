package com.roomchat.backend.room.api;

import com.roomchat.backend.chat.api.MessageView;
import io.swagger.v3.oas.annotations.media.Schema;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Schema(description = "Single room with its most recent messages, oldest first.")
public record RoomDetailsResponse(
    UUID id,
    String name,
    String description,
    UUID createdBy,
    Instant createdAt,
    long messageCount,
    List<MessageView> messages) {

  public RoomDetailsResponse {
    messages = messages != null ? List.copyOf(messages) : List.of();
  }
}
