package com.roomchat.backend.chat.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/** The user's own message could not be stored; nothing else in the pipeline ran. */
public class MessagePersistenceException extends ResponseStatusException {

  public MessagePersistenceException(String reason, Throwable cause) {
    super(HttpStatus.INTERNAL_SERVER_ERROR, reason, cause);
  }
}
