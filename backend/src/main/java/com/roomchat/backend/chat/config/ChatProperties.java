package com.roomchat.backend.chat.config;

import jakarta.validation.constraints.Min;
import java.util.UUID;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "app.chat")
@Validated
public class ChatProperties {

  /** Number of recent messages handed to the generator as conversation context. */
  @Min(1)
  private int contextWindowSize = 10;

  /** Default number of messages returned by the room message listing. */
  @Min(1)
  private int displayLimit = 50;

  /** Upper bound accepted for the {@code limit} query parameter. */
  @Min(1)
  private int maxDisplayLimit = 200;

  /** Number of messages embedded in the single-room view. */
  @Min(0)
  private int roomPreviewSize = 10;

  /**
   * Optional user id that generated replies are attributed to. When unset, AI messages carry no
   * author.
   */
  private UUID aiAuthorId;

  private String aiDisplayName = "AI Assistant";

  public int getContextWindowSize() {
    return contextWindowSize;
  }

  public void setContextWindowSize(int contextWindowSize) {
    this.contextWindowSize = contextWindowSize;
  }

  public int getDisplayLimit() {
    return displayLimit;
  }

  public void setDisplayLimit(int displayLimit) {
    this.displayLimit = displayLimit;
  }

  public int getMaxDisplayLimit() {
    return Math.max(maxDisplayLimit, displayLimit);
  }

  public void setMaxDisplayLimit(int maxDisplayLimit) {
    this.maxDisplayLimit = maxDisplayLimit;
  }

  public int getRoomPreviewSize() {
    return roomPreviewSize;
  }

  public void setRoomPreviewSize(int roomPreviewSize) {
    this.roomPreviewSize = roomPreviewSize;
  }

  public UUID getAiAuthorId() {
    return aiAuthorId;
  }

  public void setAiAuthorId(UUID aiAuthorId) {
    this.aiAuthorId = aiAuthorId;
  }

  public String getAiDisplayName() {
    return aiDisplayName;
  }

  public void setAiDisplayName(String aiDisplayName) {
    this.aiDisplayName = aiDisplayName;
  }
}
