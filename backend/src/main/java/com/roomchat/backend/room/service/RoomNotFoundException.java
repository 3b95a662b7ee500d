package com.roomchat.backend.room.service;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

public class RoomNotFoundException extends ResponseStatusException {

  private final UUID roomId;

  public RoomNotFoundException(UUID roomId) {
    super(HttpStatus.NOT_FOUND, "Room not found: " + roomId);
    this.roomId = roomId;
  }

  public UUID getRoomId() {
    return roomId;
  }
}
