package com.roomchat.backend.chat.store;

import com.roomchat.backend.chat.domain.ChatMessage;
import com.roomchat.backend.chat.domain.MessageType;
import com.roomchat.backend.room.domain.Room;
import com.roomchat.backend.user.domain.ChatUser;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Source of truth for rooms and their message history. Every method runs in its own transaction so
 * a returned write is durable by the time the caller sees it.
 */
public interface ChatStorePort {

  Optional<Room> findRoom(UUID roomId);

  Optional<ChatUser> findUser(UUID userId);

  ChatMessage insertMessage(Room room, UUID authorId, String content, MessageType messageType);

  /** Most recent {@code limit} messages of the room, oldest first. */
  List<ChatMessage> listRecentMessages(UUID roomId, int limit);

  long countMessages(UUID roomId);

  Map<UUID, Long> countMessagesByRoom();

  Map<UUID, String> resolveUsernames(Collection<UUID> userIds);
}
