package com.roomchat.backend.chat.cache;

import com.roomchat.backend.chat.api.MessageView;
import java.util.List;

/**
 * Cached tail of a room's history, newest first. {@code complete} marks a page that holds the
 * room's entire history, so it can answer any limit.
 */
public record CachedMessagePage(List<MessageView> messages, boolean complete) {

  public CachedMessagePage {
    messages = messages != null ? List.copyOf(messages) : List.of();
  }

  public boolean covers(int limit) {
    return complete || messages.size() >= limit;
  }

  public List<MessageView> newest(int limit) {
    return messages.subList(0, Math.min(Math.max(limit, 0), messages.size()));
  }
}
