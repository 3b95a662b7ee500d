package com.roomchat.backend.chat.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.roomchat.backend.chat.job.ReplyJob;
import com.roomchat.backend.chat.job.ReplyJobPayload;
import com.roomchat.backend.chat.job.ReplyJobQueuePort;
import com.roomchat.backend.chat.job.ReplyJobStatus;
import com.roomchat.backend.chat.service.ReplyContinuation;
import com.roomchat.backend.chat.service.ReplyResult;
import com.roomchat.backend.chat.store.ChatStorePort;
import com.roomchat.backend.room.domain.Room;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Claims one pending reply job and runs the reply continuation for it. Failures never escape:
 * the job is either requeued with a backoff or marked failed, with the cause kept in {@code
 * last_error}.
 */
@Component
public class ReplyJobProcessor {

  private static final Logger log = LoggerFactory.getLogger(ReplyJobProcessor.class);
  private static final int MAX_ERROR_LENGTH = 2000;

  private final ReplyJobQueuePort jobQueuePort;
  private final ChatStorePort store;
  private final ReplyContinuation continuation;
  private final ObjectMapper objectMapper;
  private final ReplyWorkerProperties properties;
  private final MeterRegistry meterRegistry;

  public ReplyJobProcessor(
      ReplyJobQueuePort jobQueuePort,
      ChatStorePort store,
      ReplyContinuation continuation,
      ObjectMapper objectMapper,
      ReplyWorkerProperties properties,
      MeterRegistry meterRegistry) {
    this.jobQueuePort = jobQueuePort;
    this.store = store;
    this.continuation = continuation;
    this.objectMapper = objectMapper;
    this.properties = properties;
    this.meterRegistry = meterRegistry;
  }

  public Optional<ReplyJob> processNextJob(String workerId) {
    Optional<ReplyJob> jobOptional = jobQueuePort.lockNextPending(workerId, Instant.now());
    jobOptional.ifPresent(this::executeJob);
    return jobOptional;
  }

  void executeJob(ReplyJob job) {
    ReplyJobPayload payload;
    try {
      payload = objectMapper.treeToValue(job.getPayload(), ReplyJobPayload.class);
    } catch (Exception exception) {
      log.error("Failed to deserialize reply job payload {}", job.getId(), exception);
      markFailed(job, "Undecodable payload: " + exception.getMessage());
      return;
    }

    Optional<Room> room = store.findRoom(payload.roomId());
    if (room.isEmpty()) {
      log.warn("Reply job {} dropped: room {} no longer exists", job.getId(), payload.roomId());
      markFailed(job, "Room not found: " + payload.roomId());
      return;
    }

    try {
      ReplyResult result = continuation.continueAfter(room.get(), payload.messageBody());
      if (!result.persisted()) {
        retryOrFail(job, payload, "Generated reply could not be stored");
        return;
      }
      job.setStatus(ReplyJobStatus.COMPLETED);
      job.setLastError(null);
      jobQueuePort.save(job);
      record(ReplyJobStatus.COMPLETED);
      if (log.isDebugEnabled()) {
        log.debug(
            "Reply job {} completed for room {} (outcome {})",
            job.getId(),
            payload.roomId(),
            result.reply().outcome());
      }
    } catch (RuntimeException exception) {
      log.error("Reply job {} failed for room {}", job.getId(), payload.roomId(), exception);
      retryOrFail(job, payload, exception.toString());
    }
  }

  private void retryOrFail(ReplyJob job, ReplyJobPayload payload, String error) {
    if (payload.attempt() >= properties.getMaxAttempts()) {
      log.error(
          "Reply job {} failed after {} attempt(s): {}", job.getId(), payload.attempt(), error);
      markFailed(job, error);
      return;
    }
    ReplyJobPayload next = payload.nextAttempt();
    job.setPayload(objectMapper.valueToTree(next));
    job.setRetryCount(next.attempt() - 1);
    job.setStatus(ReplyJobStatus.PENDING);
    job.setScheduledAt(Instant.now().plus(properties.getRetryBackoff()));
    job.setLockedAt(null);
    job.setLockedBy(null);
    job.setLastError(truncate(error));
    jobQueuePort.save(job);
    record(ReplyJobStatus.PENDING);
    log.warn(
        "Reply job {} requeued as attempt {} of {}: {}",
        job.getId(),
        next.attempt(),
        properties.getMaxAttempts(),
        error);
  }

  private void markFailed(ReplyJob job, String error) {
    job.setStatus(ReplyJobStatus.FAILED);
    job.setLastError(truncate(error));
    jobQueuePort.save(job);
    record(ReplyJobStatus.FAILED);
  }

  private void record(ReplyJobStatus status) {
    meterRegistry
        .counter("chat.reply.job.transitions", "status", status.name().toLowerCase())
        .increment();
  }

  private static String truncate(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH);
  }
}
