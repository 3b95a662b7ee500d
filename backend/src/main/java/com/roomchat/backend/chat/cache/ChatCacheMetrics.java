package com.roomchat.backend.chat.cache;

import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.TimeUnit;

public class ChatCacheMetrics {

  private final MeterRegistry meterRegistry;

  public ChatCacheMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordRequest(String operation, String result, long durationNanos) {
    meterRegistry
        .counter("chat.cache.requests", "operation", operation, "result", result)
        .increment();
    meterRegistry
        .timer("chat.cache.latency", "operation", operation, "result", result)
        .record(durationNanos, TimeUnit.NANOSECONDS);
  }

  public void recordLoad(String kind, String result) {
    meterRegistry.counter("chat.cache.lookups", "kind", kind, "result", result).increment();
  }
}
