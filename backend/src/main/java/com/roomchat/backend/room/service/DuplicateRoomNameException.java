package com.roomchat.backend.room.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

public class DuplicateRoomNameException extends ResponseStatusException {

  public DuplicateRoomNameException(String name) {
    super(HttpStatus.CONFLICT, "Room name already taken: " + name);
  }
}
