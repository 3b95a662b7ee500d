package com.roomchat.backend.support;

import com.roomchat.backend.chat.domain.ChatMessage;
import com.roomchat.backend.chat.domain.MessageType;
import com.roomchat.backend.room.domain.Room;
import com.roomchat.backend.user.domain.ChatUser;
import java.time.Instant;
import java.util.UUID;
import org.springframework.test.util.ReflectionTestUtils;

/** Detached entities with ids and timestamps set, for unit tests that mock the store. */
public final class ChatFixtures {

  private ChatFixtures() {}

  public static Room room(String name, UUID createdBy) {
    Room room = new Room(name, "", createdBy);
    ReflectionTestUtils.setField(room, "id", UUID.randomUUID());
    ReflectionTestUtils.setField(room, "createdAt", Instant.parse("2024-01-01T00:00:00Z"));
    return room;
  }

  public static ChatUser user(String username) {
    ChatUser user = new ChatUser(username, username + "@example.com");
    ReflectionTestUtils.setField(user, "id", UUID.randomUUID());
    return user;
  }

  public static ChatMessage message(
      Room room, UUID authorId, String content, MessageType type, Instant createdAt) {
    ChatMessage message = new ChatMessage(room, authorId, content, type);
    ReflectionTestUtils.setField(message, "id", UUID.randomUUID());
    ReflectionTestUtils.setField(message, "createdAt", createdAt);
    return message;
  }
}
