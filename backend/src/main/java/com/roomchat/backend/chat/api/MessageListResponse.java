package com.roomchat.backend.chat.api;

import io.swagger.v3.oas.annotations.media.Schema;
import java.util.List;

@Schema(description = "Most recent messages of a room, newest first.")
public record MessageListResponse(List<MessageView> messages, int count) {

  public static MessageListResponse of(List<MessageView> messages) {
    List<MessageView> copy = messages != null ? List.copyOf(messages) : List.of();
    return new MessageListResponse(copy, copy.size());
  }
}
