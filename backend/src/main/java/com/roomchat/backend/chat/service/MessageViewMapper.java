package com.roomchat.backend.chat.service;

import com.roomchat.backend.chat.api.MessageView;
import com.roomchat.backend.chat.config.ChatProperties;
import com.roomchat.backend.chat.domain.ChatMessage;
import com.roomchat.backend.chat.domain.MessageType;
import com.roomchat.backend.chat.store.ChatStorePort;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import org.springframework.stereotype.Component;

@Component
public class MessageViewMapper {

  static final String UNKNOWN_AUTHOR = "User";

  private final ChatStorePort store;
  private final ChatProperties properties;

  public MessageViewMapper(ChatStorePort store, ChatProperties properties) {
    this.store = store;
    this.properties = properties;
  }

  public List<MessageView> toViews(List<ChatMessage> messages) {
    if (messages == null || messages.isEmpty()) {
      return List.of();
    }
    List<UUID> authorIds =
        messages.stream()
            .filter(message -> !isMachineGenerated(message.getMessageType(), message.getAuthorId()))
            .map(ChatMessage::getAuthorId)
            .filter(Objects::nonNull)
            .distinct()
            .toList();
    Map<UUID, String> usernames = store.resolveUsernames(authorIds);
    return messages.stream().map(message -> toView(message, usernames)).toList();
  }

  public MessageView toView(ChatMessage message, Map<UUID, String> usernames) {
    return toView(message, displayName(message.getMessageType(), message.getAuthorId(), usernames));
  }

  public MessageView toView(ChatMessage message, String username) {
    return new MessageView(
        message.getId(),
        message.getContent(),
        message.getAuthorId(),
        message.getRoomId(),
        message.getMessageType(),
        username,
        message.getCreatedAt());
  }

  /** View for a generated reply that exists only in memory because storing it failed. */
  public MessageView unsavedReply(UUID roomId, String text) {
    return new MessageView(
        null,
        text,
        properties.getAiAuthorId(),
        roomId,
        MessageType.AI,
        properties.getAiDisplayName(),
        Instant.now());
  }

  public String aiDisplayName() {
    return properties.getAiDisplayName();
  }

  public String displayName(MessageType type, UUID authorId, Map<UUID, String> usernames) {
    if (isMachineGenerated(type, authorId)) {
      return properties.getAiDisplayName();
    }
    String username = usernames != null ? usernames.get(authorId) : null;
    return username != null ? username : UNKNOWN_AUTHOR;
  }

  private boolean isMachineGenerated(MessageType type, UUID authorId) {
    return type == MessageType.AI
        || authorId == null
        || authorId.equals(properties.getAiAuthorId());
  }
}
