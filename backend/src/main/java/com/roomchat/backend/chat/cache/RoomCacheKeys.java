package com.roomchat.backend.chat.cache;

import java.util.UUID;

public final class RoomCacheKeys {

  public static final String ROOM_LIST = "room-list";

  private final String prefix;

  public RoomCacheKeys(String prefix) {
    this.prefix = prefix != null ? prefix : "";
  }

  public String roomList() {
    return prefix + ROOM_LIST;
  }

  public String room(UUID roomId) {
    return prefix + "room:" + roomId;
  }

  public String roomMessages(UUID roomId) {
    return prefix + "room:" + roomId + ":messages";
  }
}
