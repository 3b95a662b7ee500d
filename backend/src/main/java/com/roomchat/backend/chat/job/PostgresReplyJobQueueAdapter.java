package com.roomchat.backend.chat.job;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.util.Optional;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
public class PostgresReplyJobQueueAdapter implements ReplyJobQueuePort {

  private final ReplyJobRepository replyJobRepository;
  private final ObjectMapper objectMapper;

  public PostgresReplyJobQueueAdapter(
      ReplyJobRepository replyJobRepository, ObjectMapper objectMapper) {
    this.replyJobRepository = replyJobRepository;
    this.objectMapper = objectMapper;
  }

  @Override
  @Transactional
  public ReplyJob enqueue(ReplyJobPayload payload, Instant scheduledAt) {
    ObjectNode payloadNode = objectMapper.valueToTree(payload);
    ReplyJob job =
        new ReplyJob(
            payload.roomId(), payload.userMessageId(), payloadNode, ReplyJobStatus.PENDING);
    job.setScheduledAt(scheduledAt);
    job.setRetryCount(payload.attempt() - 1);
    return replyJobRepository.save(job);
  }

  @Override
  @Transactional
  public Optional<ReplyJob> lockNextPending(String workerId, Instant now) {
    Optional<ReplyJob> jobOptional = replyJobRepository.lockNextJob(ReplyJobStatus.PENDING, now);
    jobOptional.ifPresent(
        job -> {
          job.setStatus(ReplyJobStatus.RUNNING);
          job.setLockedAt(now);
          job.setLockedBy(workerId);
          replyJobRepository.save(job);
        });
    return jobOptional;
  }

  @Override
  @Transactional
  public ReplyJob save(ReplyJob job) {
    return replyJobRepository.save(job);
  }
}
