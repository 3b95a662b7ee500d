package com.roomchat.backend.chat.job;

public enum ReplyJobStatus {
  PENDING,
  RUNNING,
  COMPLETED,
  FAILED
}
