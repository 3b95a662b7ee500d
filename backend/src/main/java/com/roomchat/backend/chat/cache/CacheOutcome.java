package com.roomchat.backend.chat.cache;

/**
 * Result of a best-effort cache write or delete. Cache operations never throw; callers inspect the
 * outcome and decide whether it is worth a log line.
 */
public record CacheOutcome(String operation, String key, Status status, Throwable failure) {

  public enum Status {
    APPLIED,
    SKIPPED,
    FAILED
  }

  public static CacheOutcome applied(String operation, String key) {
    return new CacheOutcome(operation, key, Status.APPLIED, null);
  }

  public static CacheOutcome skipped(String operation, String key) {
    return new CacheOutcome(operation, key, Status.SKIPPED, null);
  }

  public static CacheOutcome failed(String operation, String key, Throwable failure) {
    return new CacheOutcome(operation, key, Status.FAILED, failure);
  }

  public boolean isFailure() {
    return status == Status.FAILED;
  }
}
