package com.roomchat.backend.chat.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.roomchat.backend.chat.cache.ChatCache;
import com.roomchat.backend.chat.cache.ChatCacheMetrics;
import com.roomchat.backend.chat.cache.RedisChatCache;
import com.roomchat.backend.chat.cache.RoomCacheKeys;
import com.roomchat.backend.chat.cache.RoomCacheService;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

@Configuration
@EnableConfigurationProperties(ChatCacheProperties.class)
public class ChatCacheConfiguration {

  private static final Logger log = LoggerFactory.getLogger(ChatCacheConfiguration.class);

  @Bean
  public ChatCacheMetrics chatCacheMetrics(MeterRegistry meterRegistry) {
    return new ChatCacheMetrics(meterRegistry);
  }

  @Bean
  public ChatCache chatCache(
      ChatCacheProperties properties,
      ObjectProvider<StringRedisTemplate> redisTemplateProvider,
      ChatCacheMetrics metrics) {
    if (!properties.isEnabled()) {
      log.info("Room cache disabled by configuration");
      return ChatCache.noOp();
    }
    StringRedisTemplate redisTemplate = redisTemplateProvider.getIfAvailable();
    if (redisTemplate == null) {
      log.warn("No Redis template available, room cache disabled");
      return ChatCache.noOp();
    }
    if (!ping(redisTemplate)) {
      return ChatCache.noOp();
    }
    return new RedisChatCache(redisTemplate, metrics);
  }

  @Bean
  public RoomCacheService roomCacheService(
      ChatCache chatCache,
      ObjectMapper objectMapper,
      ChatCacheProperties properties,
      ChatCacheMetrics metrics) {
    return new RoomCacheService(
        chatCache,
        objectMapper,
        new RoomCacheKeys(properties.getKeyPrefix()),
        properties.getTtl(),
        metrics);
  }

  private boolean ping(StringRedisTemplate redisTemplate) {
    try {
      String reply = redisTemplate.execute((RedisCallback<String>) RedisConnection::ping);
      log.debug("Redis answered {} at startup, room cache enabled", reply);
      return true;
    } catch (RuntimeException ex) {
      log.warn(
          "Redis ping failed at startup, room cache disabled for this process: {}",
          ex.getMessage());
      return false;
    }
  }
}
