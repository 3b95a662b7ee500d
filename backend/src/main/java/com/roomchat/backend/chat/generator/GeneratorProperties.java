package com.roomchat.backend.chat.generator;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "app.chat.generator")
@Validated
public class GeneratorProperties {

  @NotBlank private String baseUrl = "https://generativelanguage.googleapis.com";

  @NotBlank private String model = "gemini-2.0-flash";

  /** Pre-shared key appended to each request. Never logged. */
  private String apiKey;

  private Duration timeout = Duration.ofSeconds(30);

  private Duration connectTimeout = Duration.ofSeconds(10);

  @DecimalMin("0.0")
  @DecimalMax("2.0")
  private double temperature = 0.2;

  @Min(1)
  private int maxOutputTokens = 512;

  /** How many of the most recent context turns are rendered into the prompt. */
  @Min(0)
  private int historyLimit = 5;

  /** Returned when the upstream answered but no usable text could be extracted. */
  @NotBlank private String emptyReplyFallback = "I'm sorry, I couldn't process that.";

  /** Returned on transport errors, timeouts, non-2xx statuses and malformed payloads. */
  @NotBlank
  private String failureFallback =
      "I'm experiencing technical difficulties. Please try again later.";

  public String getBaseUrl() {
    return baseUrl;
  }

  public void setBaseUrl(String baseUrl) {
    this.baseUrl = baseUrl;
  }

  public String getModel() {
    return model;
  }

  public void setModel(String model) {
    this.model = model;
  }

  public String getApiKey() {
    return apiKey;
  }

  public void setApiKey(String apiKey) {
    this.apiKey = apiKey;
  }

  public Duration getTimeout() {
    return timeout;
  }

  public void setTimeout(Duration timeout) {
    if (timeout != null && !timeout.isNegative() && !timeout.isZero()) {
      this.timeout = timeout;
    }
  }

  public Duration getConnectTimeout() {
    return connectTimeout;
  }

  public void setConnectTimeout(Duration connectTimeout) {
    if (connectTimeout != null && !connectTimeout.isNegative() && !connectTimeout.isZero()) {
      this.connectTimeout = connectTimeout;
    }
  }

  public double getTemperature() {
    return temperature;
  }

  public void setTemperature(double temperature) {
    this.temperature = temperature;
  }

  public int getMaxOutputTokens() {
    return maxOutputTokens;
  }

  public void setMaxOutputTokens(int maxOutputTokens) {
    this.maxOutputTokens = maxOutputTokens;
  }

  public int getHistoryLimit() {
    return historyLimit;
  }

  public void setHistoryLimit(int historyLimit) {
    this.historyLimit = Math.max(0, historyLimit);
  }

  public String getEmptyReplyFallback() {
    return emptyReplyFallback;
  }

  public void setEmptyReplyFallback(String emptyReplyFallback) {
    this.emptyReplyFallback = emptyReplyFallback;
  }

  public String getFailureFallback() {
    return failureFallback;
  }

  public void setFailureFallback(String failureFallback) {
    this.failureFallback = failureFallback;
  }
}
