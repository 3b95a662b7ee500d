package com.roomchat.backend.chat.job;

import java.time.Instant;
import java.util.Optional;

public interface ReplyJobQueuePort {

  ReplyJob enqueue(ReplyJobPayload payload, Instant scheduledAt);

  default ReplyJob enqueue(ReplyJobPayload payload) {
    return enqueue(payload, Instant.now());
  }

  Optional<ReplyJob> lockNextPending(String workerId, Instant now);

  ReplyJob save(ReplyJob job);
}
