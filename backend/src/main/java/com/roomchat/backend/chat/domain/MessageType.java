package com.roomchat.backend.chat.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum MessageType {
  USER,
  AI;

  @JsonValue
  public String wireValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static MessageType fromWireValue(String value) {
    if (value == null) {
      return null;
    }
    return MessageType.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
