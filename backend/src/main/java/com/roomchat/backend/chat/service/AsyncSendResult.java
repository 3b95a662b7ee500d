package com.roomchat.backend.chat.service;

import com.roomchat.backend.chat.api.MessageView;

/** {@code jobId} is null when the reply job could not be queued. */
public record AsyncSendResult(MessageView userMessage, Long jobId) {

  public boolean queued() {
    return jobId != null;
  }
}
