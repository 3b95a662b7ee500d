package com.roomchat.backend.chat.service;

import com.roomchat.backend.chat.api.MessageView;

public record SendMessageResult(MessageView userMessage, ReplyResult reply) {

  public MessageView aiMessage() {
    return reply.view();
  }
}
