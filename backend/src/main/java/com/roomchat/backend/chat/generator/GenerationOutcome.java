package com.roomchat.backend.chat.generator;

public enum GenerationOutcome {
  GENERATED,
  EMPTY_REPLY,
  HTTP_ERROR,
  MALFORMED_PAYLOAD,
  TRANSPORT_FAILURE,
  NOT_CONFIGURED;

  public boolean isFallback() {
    return this != GENERATED;
  }
}
