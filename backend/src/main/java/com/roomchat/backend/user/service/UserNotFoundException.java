package com.roomchat.backend.user.service;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

public class UserNotFoundException extends ResponseStatusException {

  public UserNotFoundException(UUID userId) {
    super(HttpStatus.NOT_FOUND, "User not found: " + userId);
  }
}
