package com.roomchat.backend.chat.store;

import com.roomchat.backend.chat.domain.ChatMessage;
import com.roomchat.backend.chat.domain.MessageType;
import com.roomchat.backend.chat.persistence.ChatMessageRepository;
import com.roomchat.backend.chat.persistence.ChatMessageRepository.RoomMessageCount;
import com.roomchat.backend.room.domain.Room;
import com.roomchat.backend.room.persistence.RoomRepository;
import com.roomchat.backend.user.domain.ChatUser;
import com.roomchat.backend.user.persistence.ChatUserRepository;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
public class JpaChatStoreAdapter implements ChatStorePort {

  private final RoomRepository roomRepository;
  private final ChatUserRepository chatUserRepository;
  private final ChatMessageRepository chatMessageRepository;

  public JpaChatStoreAdapter(
      RoomRepository roomRepository,
      ChatUserRepository chatUserRepository,
      ChatMessageRepository chatMessageRepository) {
    this.roomRepository = roomRepository;
    this.chatUserRepository = chatUserRepository;
    this.chatMessageRepository = chatMessageRepository;
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<Room> findRoom(UUID roomId) {
    if (roomId == null) {
      return Optional.empty();
    }
    return roomRepository.findById(roomId);
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<ChatUser> findUser(UUID userId) {
    if (userId == null) {
      return Optional.empty();
    }
    return chatUserRepository.findById(userId);
  }

  @Override
  @Transactional
  public ChatMessage insertMessage(
      Room room, UUID authorId, String content, MessageType messageType) {
    Objects.requireNonNull(room, "room must not be null");
    Objects.requireNonNull(messageType, "messageType must not be null");
    return chatMessageRepository.saveAndFlush(
        new ChatMessage(room, authorId, content, messageType));
  }

  @Override
  @Transactional(readOnly = true)
  public List<ChatMessage> listRecentMessages(UUID roomId, int limit) {
    if (roomId == null || limit <= 0) {
      return List.of();
    }
    List<ChatMessage> newestFirst =
        chatMessageRepository.findLatestByRoom(roomId, PageRequest.of(0, limit));
    List<ChatMessage> ascending = new ArrayList<>(newestFirst);
    Collections.reverse(ascending);
    return ascending;
  }

  @Override
  @Transactional(readOnly = true)
  public long countMessages(UUID roomId) {
    return chatMessageRepository.countByRoom(roomId);
  }

  @Override
  @Transactional(readOnly = true)
  public Map<UUID, Long> countMessagesByRoom() {
    Map<UUID, Long> counts = new HashMap<>();
    for (RoomMessageCount row : chatMessageRepository.countGroupedByRoom()) {
      counts.put(row.getRoomId(), row.getMessageCount());
    }
    return counts;
  }

  @Override
  @Transactional(readOnly = true)
  public Map<UUID, String> resolveUsernames(Collection<UUID> userIds) {
    if (userIds == null || userIds.isEmpty()) {
      return Map.of();
    }
    List<UUID> distinct = userIds.stream().filter(Objects::nonNull).distinct().toList();
    return chatUserRepository.findAllById(distinct).stream()
        .collect(Collectors.toMap(ChatUser::getId, ChatUser::getUsername, (left, right) -> left));
  }
}
