package com.roomchat.backend.chat.cache;

import java.time.Duration;
import java.util.Optional;

enum NoOpChatCache implements ChatCache {
  INSTANCE;

  @Override
  public Optional<String> get(String key) {
    return Optional.empty();
  }

  @Override
  public CacheOutcome set(String key, String value, Duration ttl) {
    return CacheOutcome.skipped("set", key);
  }

  @Override
  public CacheOutcome delete(String key) {
    return CacheOutcome.skipped("delete", key);
  }

  @Override
  public boolean isEnabled() {
    return false;
  }
}
