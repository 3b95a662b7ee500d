package com.roomchat.backend.chat.worker;

import com.roomchat.backend.chat.job.ReplyJob;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
@ConditionalOnProperty(
    prefix = "app.chat.worker",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class ReplyJobWorker {

  private static final Logger log = LoggerFactory.getLogger(ReplyJobWorker.class);

  private final ReplyJobProcessor processor;
  private final ReplyWorkerProperties properties;
  private final MeterRegistry meterRegistry;
  private final ExecutorService executorService;
  private final String workerIdPrefix;
  private final AtomicInteger inFlight = new AtomicInteger();

  public ReplyJobWorker(
      ReplyJobProcessor processor,
      ReplyWorkerProperties properties,
      MeterRegistry meterRegistry,
      @Qualifier("replyWorkerExecutor") ExecutorService executorService) {
    this.processor = processor;
    this.properties = properties;
    this.meterRegistry = meterRegistry;
    this.executorService = executorService;
    this.workerIdPrefix =
        StringUtils.hasText(properties.getWorkerIdPrefix())
            ? properties.getWorkerIdPrefix()
            : resolveDefaultWorkerId();
  }

  @Scheduled(fixedDelayString = "${app.chat.worker.poll-delay:PT0.5S}")
  public void pollQueue() {
    if (!properties.isEnabled()) {
      return;
    }
    // at most one queued poll per pool thread
    if (inFlight.incrementAndGet() > properties.getMaxConcurrency()) {
      inFlight.decrementAndGet();
      return;
    }
    try {
      executorService.submit(this::processSafely);
    } catch (RejectedExecutionException ex) {
      inFlight.decrementAndGet();
      log.debug("Reply worker executor rejected poll task", ex);
    }
  }

  private void processSafely() {
    String workerId = workerIdPrefix + "-" + Thread.currentThread().getName();
    long start = System.nanoTime();
    String result = "empty";
    try {
      Optional<ReplyJob> jobOptional = processor.processNextJob(workerId);
      if (jobOptional.isPresent()) {
        result = "processed";
        log.debug("Worker {} processed reply job {}", workerId, jobOptional.get().getId());
      } else {
        log.trace("Worker {} polled queue: no pending jobs", workerId);
      }
    } catch (Exception ex) {
      result = "error";
      log.error("Worker {} failed to process reply job", workerId, ex);
    } finally {
      inFlight.decrementAndGet();
      long elapsed = System.nanoTime() - start;
      meterRegistry.counter("chat.reply.job.poll.count", "result", result).increment();
      meterRegistry
          .timer("chat.reply.job.poll.duration", "result", result)
          .record(Duration.ofNanos(elapsed));
    }
  }

  private String resolveDefaultWorkerId() {
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException ex) {
      log.warn("Unable to resolve hostname for worker id, falling back to default", ex);
      return "reply-worker";
    }
  }

  @PreDestroy
  public void shutdown() {
    executorService.shutdown();
    try {
      if (!executorService.awaitTermination(2, TimeUnit.SECONDS)) {
        executorService.shutdownNow();
      }
    } catch (InterruptedException interruptedException) {
      Thread.currentThread().interrupt();
      executorService.shutdownNow();
    }
  }
}
