package com.roomchat.backend.chat.service;

import com.roomchat.backend.chat.api.MessageView;
import com.roomchat.backend.chat.domain.ChatMessage;
import com.roomchat.backend.chat.generator.GeneratedReply;
import java.util.Objects;

/**
 * Outcome of producing a reply. {@code storedMessage} is null when the reply could not be
 * persisted; {@code view} is then an unsaved view of the generated text.
 */
public record ReplyResult(GeneratedReply reply, ChatMessage storedMessage, MessageView view) {

  public ReplyResult {
    Objects.requireNonNull(reply, "reply must not be null");
    Objects.requireNonNull(view, "view must not be null");
  }

  public boolean persisted() {
    return storedMessage != null;
  }
}
