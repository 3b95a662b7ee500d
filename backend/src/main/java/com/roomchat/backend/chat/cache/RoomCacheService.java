package com.roomchat.backend.chat.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cache-aside access to room listings, single rooms and room message pages.
 *
 * <p>The cache is never consulted for correctness: a miss, a corrupt entry or an unreachable
 * backend all fall through to the loader. Writers call the {@code invalidate*} methods only after
 * their store mutation has committed, otherwise a concurrent reader could repopulate the entry with
 * pre-mutation data.
 */
public class RoomCacheService {

  private static final Logger log = LoggerFactory.getLogger(RoomCacheService.class);

  private final ChatCache cache;
  private final ObjectMapper objectMapper;
  private final RoomCacheKeys keys;
  private final Duration defaultTtl;
  private final ChatCacheMetrics metrics;

  public RoomCacheService(
      ChatCache cache,
      ObjectMapper objectMapper,
      RoomCacheKeys keys,
      Duration defaultTtl,
      ChatCacheMetrics metrics) {
    this.cache = cache != null ? cache : ChatCache.noOp();
    this.objectMapper = objectMapper;
    this.keys = keys;
    this.defaultTtl = defaultTtl;
    this.metrics = metrics;
  }

  public RoomCacheKeys keys() {
    return keys;
  }

  public <T> T getOrLoad(String key, Class<T> type, Supplier<T> loader) {
    return getOrLoad(key, type, loader, defaultTtl);
  }

  public <T> T getOrLoad(String key, Class<T> type, Supplier<T> loader, Duration ttl) {
    return getOrLoad(key, type, cachedValue -> true, loader, ttl);
  }

  /**
   * Variant for entries that may be too small for the request: a cached value rejected by {@code
   * usable} is treated as a miss and overwritten with the loader's result.
   */
  public <T> T getOrLoad(String key, Class<T> type, Predicate<T> usable, Supplier<T> loader) {
    return getOrLoad(key, type, usable, loader, defaultTtl);
  }

  private <T> T getOrLoad(
      String key, Class<T> type, Predicate<T> usable, Supplier<T> loader, Duration ttl) {
    Optional<T> cached = peek(key, type).filter(usable);
    if (cached.isPresent()) {
      recordLookup(type, "hit");
      return cached.get();
    }
    recordLookup(type, "miss");
    T loaded = loader.get();
    if (loaded != null) {
      store(key, loaded, ttl);
    }
    return loaded;
  }

  /** Reads and decodes an entry without loading or populating anything. */
  public <T> Optional<T> peek(String key, Class<T> type) {
    Optional<String> payload = cache.get(key);
    if (payload.isEmpty()) {
      return Optional.empty();
    }
    try {
      return Optional.ofNullable(objectMapper.readValue(payload.get(), type));
    } catch (JsonProcessingException ex) {
      log.warn("Dropping undecodable cache entry {}: {}", key, ex.getOriginalMessage());
      report(cache.delete(key));
      return Optional.empty();
    }
  }

  public CacheOutcome invalidate(String key) {
    CacheOutcome outcome = cache.delete(key);
    report(outcome);
    return outcome;
  }

  public CacheOutcome invalidateRoomList() {
    return invalidate(keys.roomList());
  }

  public List<CacheOutcome> invalidateRoom(UUID roomId) {
    return List.of(invalidate(keys.room(roomId)), invalidate(keys.roomMessages(roomId)));
  }

  private void store(String key, Object value, Duration ttl) {
    String payload;
    try {
      payload = objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      log.warn("Failed to serialize value for cache key {}", key, ex);
      return;
    }
    report(cache.set(key, payload, ttl));
  }

  private void report(CacheOutcome outcome) {
    if (outcome.isFailure()) {
      log.warn(
          "Cache {} failed for key {}: {}",
          outcome.operation(),
          outcome.key(),
          outcome.failure() != null ? outcome.failure().getMessage() : "unknown error");
    }
  }

  private void recordLookup(Class<?> type, String result) {
    if (metrics != null && cache.isEnabled()) {
      metrics.recordLoad(type.getSimpleName(), result);
    }
  }
}
