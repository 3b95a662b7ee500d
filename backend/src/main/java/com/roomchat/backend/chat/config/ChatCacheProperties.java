package com.roomchat.backend.chat.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "app.chat.cache")
@Validated
public class ChatCacheProperties {

  /**
   * Enables the Redis-backed cache in front of room and message reads. When disabled, or when Redis
   * does not answer at startup, every lookup goes straight to the database.
   */
  private boolean enabled = true;

  /**
   * TTL applied to every cached room, room list and message page. Writes invalidate explicitly, so
   * the TTL only bounds staleness after a missed invalidation.
   */
  private Duration ttl = Duration.ofSeconds(60);

  /** Prefix prepended to every cache key. */
  private String keyPrefix = "";

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public Duration getTtl() {
    return ttl;
  }

  public void setTtl(Duration ttl) {
    if (ttl != null && !ttl.isNegative() && !ttl.isZero()) {
      this.ttl = ttl;
    }
  }

  public String getKeyPrefix() {
    return keyPrefix;
  }

  public void setKeyPrefix(String keyPrefix) {
    this.keyPrefix = keyPrefix != null ? keyPrefix : "";
  }
}
