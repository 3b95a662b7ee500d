package com.roomchat.backend.chat.job;

import java.util.UUID;

public record ReplyJobPayload(
    UUID roomId, UUID userMessageId, String messageBody, UUID authorId, int attempt) {

  public ReplyJobPayload {
    if (roomId == null) {
      throw new IllegalArgumentException("roomId must not be null");
    }
    if (userMessageId == null) {
      throw new IllegalArgumentException("userMessageId must not be null");
    }
    if (messageBody == null) {
      throw new IllegalArgumentException("messageBody must not be null");
    }
    attempt = attempt <= 0 ? 1 : attempt;
  }

  public ReplyJobPayload nextAttempt() {
    return new ReplyJobPayload(roomId, userMessageId, messageBody, authorId, attempt + 1);
  }
}
