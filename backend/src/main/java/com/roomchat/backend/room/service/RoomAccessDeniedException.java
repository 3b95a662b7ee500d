package com.roomchat.backend.room.service;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

public class RoomAccessDeniedException extends ResponseStatusException {

  public RoomAccessDeniedException(UUID roomId) {
    super(HttpStatus.FORBIDDEN, "Only the room creator can delete room " + roomId);
  }
}
