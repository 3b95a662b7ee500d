package com.roomchat.backend.chat.context;

/** One rendered line of conversation context: who spoke and what they said. */
public record ConversationTurn(String speaker, String text) {

  public ConversationTurn {
    speaker = speaker != null && !speaker.isBlank() ? speaker : "User";
    text = text != null ? text : "";
  }
}
