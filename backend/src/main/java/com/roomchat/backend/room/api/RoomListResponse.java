package com.roomchat.backend.room.api;

import io.swagger.v3.oas.annotations.media.Schema;
import java.util.List;

@Schema(description = "All rooms, newest first.")
public record RoomListResponse(List<RoomSummary> rooms, int count) {

  public RoomListResponse {
    rooms = rooms != null ? List.copyOf(rooms) : List.of();
  }

  public static RoomListResponse of(List<RoomSummary> rooms) {
    List<RoomSummary> safe = rooms != null ? rooms : List.of();
    return new RoomListResponse(safe, safe.size());
  }
}
