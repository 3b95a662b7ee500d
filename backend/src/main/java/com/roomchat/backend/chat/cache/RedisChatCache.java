package com.roomchat.backend.chat.cache;

import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.util.StringUtils;

public final class RedisChatCache implements ChatCache {

  private static final Logger log = LoggerFactory.getLogger(RedisChatCache.class);

  private final StringRedisTemplate redisTemplate;
  private final ValueOperations<String, String> valueOperations;
  private final ChatCacheMetrics metrics;

  public RedisChatCache(StringRedisTemplate redisTemplate, ChatCacheMetrics metrics) {
    this.redisTemplate = redisTemplate;
    this.valueOperations = redisTemplate.opsForValue();
    this.metrics = metrics;
  }

  @Override
  public Optional<String> get(String key) {
    if (!StringUtils.hasText(key)) {
      return Optional.empty();
    }
    long start = System.nanoTime();
    try {
      String value = valueOperations.get(key);
      if (!StringUtils.hasText(value)) {
        record("get", "miss", start);
        return Optional.empty();
      }
      record("get", "hit", start);
      return Optional.of(value);
    } catch (RuntimeException exception) {
      log.warn("Failed to read key {} from Redis cache: {}", key, exception.getMessage());
      record("get", "error", start);
      return Optional.empty();
    }
  }

  @Override
  public CacheOutcome set(String key, String value, Duration ttl) {
    if (!StringUtils.hasText(key) || value == null) {
      return CacheOutcome.skipped("set", key);
    }
    long start = System.nanoTime();
    try {
      if (ttl != null && !ttl.isZero() && !ttl.isNegative()) {
        valueOperations.set(key, value, ttl);
      } else {
        valueOperations.set(key, value);
      }
      record("set", "write", start);
      return CacheOutcome.applied("set", key);
    } catch (RuntimeException exception) {
      record("set", "error", start);
      return CacheOutcome.failed("set", key, exception);
    }
  }

  @Override
  public CacheOutcome delete(String key) {
    if (!StringUtils.hasText(key)) {
      return CacheOutcome.skipped("delete", key);
    }
    long start = System.nanoTime();
    try {
      redisTemplate.delete(key);
      record("delete", "write", start);
      return CacheOutcome.applied("delete", key);
    } catch (RuntimeException exception) {
      record("delete", "error", start);
      return CacheOutcome.failed("delete", key, exception);
    }
  }

  @Override
  public boolean isEnabled() {
    return true;
  }

  private void record(String operation, String result, long startNanos) {
    if (metrics == null) {
      return;
    }
    metrics.recordRequest(operation, result, System.nanoTime() - startNanos);
  }
}
