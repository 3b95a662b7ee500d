package com.roomchat.backend.chat.worker;

import jakarta.validation.constraints.Min;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.chat.worker")
public class ReplyWorkerProperties {

  private boolean enabled = true;
  private Duration pollDelay = Duration.ofMillis(500);

  @Min(1)
  private int maxConcurrency = 2;

  private String workerIdPrefix;

  /** Total attempts per job, the first one included. 1 disables retries. */
  @Min(1)
  private int maxAttempts = 1;

  private Duration retryBackoff = Duration.ofSeconds(5);

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public Duration getPollDelay() {
    return pollDelay;
  }

  public void setPollDelay(Duration pollDelay) {
    if (pollDelay != null && !pollDelay.isNegative() && !pollDelay.isZero()) {
      this.pollDelay = pollDelay;
    }
  }

  public int getMaxConcurrency() {
    return Math.max(1, maxConcurrency);
  }

  public void setMaxConcurrency(int maxConcurrency) {
    this.maxConcurrency = Math.max(1, maxConcurrency);
  }

  public String getWorkerIdPrefix() {
    return workerIdPrefix;
  }

  public void setWorkerIdPrefix(String workerIdPrefix) {
    this.workerIdPrefix = workerIdPrefix;
  }

  public int getMaxAttempts() {
    return Math.max(1, maxAttempts);
  }

  public void setMaxAttempts(int maxAttempts) {
    this.maxAttempts = Math.max(1, maxAttempts);
  }

  public Duration getRetryBackoff() {
    return retryBackoff;
  }

  public void setRetryBackoff(Duration retryBackoff) {
    if (retryBackoff != null && !retryBackoff.isNegative()) {
      this.retryBackoff = retryBackoff;
    }
  }
}
