package com.roomchat.backend.chat.job;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ReplyJobRepository extends JpaRepository<ReplyJob, Long> {

  List<ReplyJob> findByUserMessageIdOrderByIdAsc(UUID userMessageId);

  @Query(
      value =
          """
          SELECT rj.*
          FROM reply_job rj
          WHERE rj.status = :status
            AND (rj.scheduled_at IS NULL OR rj.scheduled_at <= :now)
          ORDER BY rj.scheduled_at NULLS FIRST, rj.id
          FOR UPDATE SKIP LOCKED
          LIMIT 1
          """,
      nativeQuery = true)
  Optional<ReplyJob> lockNextJob(@Param("status") String statusValue, @Param("now") Instant now);

  default Optional<ReplyJob> lockNextJob(ReplyJobStatus status, Instant now) {
    return lockNextJob(status.name(), now);
  }
}
