package com.roomchat.backend.chat.generator;

import io.micrometer.core.instrument.MeterRegistry;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

public class GeneratorMetrics {

  private final MeterRegistry meterRegistry;

  public GeneratorMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void record(GenerationOutcome outcome, long durationNanos) {
    String tag = outcome.name().toLowerCase(Locale.ROOT);
    meterRegistry.counter("chat.generator.requests", "outcome", tag).increment();
    meterRegistry
        .timer("chat.generator.latency", "outcome", tag)
        .record(durationNanos, TimeUnit.NANOSECONDS);
  }
}
