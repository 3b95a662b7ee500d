package com.roomchat.backend.chat.cache;

import java.time.Duration;
import java.util.Optional;

public interface ChatCache {

  /** Returns the cached payload, or empty on a miss or any backend failure. */
  Optional<String> get(String key);

  CacheOutcome set(String key, String value, Duration ttl);

  /** Deleting an absent key is applied, not failed. */
  CacheOutcome delete(String key);

  boolean isEnabled();

  static ChatCache noOp() {
    return NoOpChatCache.INSTANCE;
  }
}
