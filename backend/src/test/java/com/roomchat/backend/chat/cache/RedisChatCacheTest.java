package com.roomchat.backend.chat.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

class RedisChatCacheTest {

  private ValueOperations<String, String> valueOps;
  private StringRedisTemplate template;
  private SimpleMeterRegistry meterRegistry;
  private RedisChatCache cache;

  @BeforeEach
  @SuppressWarnings("unchecked")
  void setUp() {
    valueOps = mock(ValueOperations.class);
    template = mock(StringRedisTemplate.class);
    when(template.opsForValue()).thenReturn(valueOps);
    meterRegistry = new SimpleMeterRegistry();
    cache = new RedisChatCache(template, new ChatCacheMetrics(meterRegistry));
  }

  @Test
  void getReturnsStoredValue() {
    when(valueOps.get("room-list")).thenReturn("{\"rooms\":[]}");

    assertThat(cache.get("room-list")).contains("{\"rooms\":[]}");
    assertThat(meterRegistry.counter("chat.cache.requests", "operation", "get", "result", "hit").count())
        .isEqualTo(1.0d);
  }

  @Test
  void getTreatsMissingAndBlankValuesAsMiss() {
    when(valueOps.get("missing")).thenReturn(null);
    when(valueOps.get("blank")).thenReturn(" ");

    assertThat(cache.get("missing")).isEmpty();
    assertThat(cache.get("blank")).isEmpty();
  }

  @Test
  void getSwallowsRedisErrors() {
    when(valueOps.get(anyString())).thenThrow(new RedisConnectionFailureException("down"));

    assertThat(cache.get("room-list")).isEmpty();
    assertThat(meterRegistry.counter("chat.cache.requests", "operation", "get", "result", "error").count())
        .isEqualTo(1.0d);
  }

  @Test
  void setStoresWithTtl() {
    Duration ttl = Duration.ofSeconds(60);

    CacheOutcome outcome = cache.set("room-list", "{}", ttl);

    assertThat(outcome.status()).isEqualTo(CacheOutcome.Status.APPLIED);
    verify(valueOps).set("room-list", "{}", ttl);
  }

  @Test
  void setWithoutTtlStoresPlainValue() {
    cache.set("room-list", "{}", null);

    verify(valueOps).set("room-list", "{}");
  }

  @Test
  void setReportsFailureInsteadOfThrowing() {
    doThrow(new RedisConnectionFailureException("down"))
        .when(valueOps)
        .set("room-list", "{}", Duration.ofSeconds(5));

    CacheOutcome outcome = cache.set("room-list", "{}", Duration.ofSeconds(5));

    assertThat(outcome.isFailure()).isTrue();
    assertThat(outcome.failure()).isInstanceOf(RedisConnectionFailureException.class);
  }

  @Test
  void deleteReportsFailureInsteadOfThrowing() {
    when(template.delete("room:1")).thenThrow(new RedisConnectionFailureException("down"));

    CacheOutcome outcome = cache.delete("room:1");

    assertThat(outcome.isFailure()).isTrue();
    assertThat(outcome.key()).isEqualTo("room:1");
  }

  @Test
  void blankKeysAreSkipped() {
    assertThat(cache.delete(" ").status()).isEqualTo(CacheOutcome.Status.SKIPPED);
    assertThat(cache.set("", "v", null).status()).isEqualTo(CacheOutcome.Status.SKIPPED);
  }
}
