package com.roomchat.backend.chat.service;

import com.roomchat.backend.chat.api.MessageListResponse;
import com.roomchat.backend.chat.api.MessageView;
import com.roomchat.backend.chat.cache.CachedMessagePage;
import com.roomchat.backend.chat.cache.RoomCacheService;
import com.roomchat.backend.chat.config.ChatProperties;
import com.roomchat.backend.chat.store.ChatStorePort;
import com.roomchat.backend.room.service.RoomNotFoundException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import org.springframework.stereotype.Service;

@Service
public class RoomMessageQueryService {

  private final ChatStorePort store;
  private final RoomCacheService cacheService;
  private final MessageViewMapper viewMapper;
  private final ChatProperties properties;

  public RoomMessageQueryService(
      ChatStorePort store,
      RoomCacheService cacheService,
      MessageViewMapper viewMapper,
      ChatProperties properties) {
    this.store = store;
    this.cacheService = cacheService;
    this.viewMapper = viewMapper;
    this.properties = properties;
  }

  /** Latest messages of the room, newest first. A null limit means the configured default. */
  public MessageListResponse listRoomMessages(UUID roomId, Integer limit) {
    int effectiveLimit = resolveLimit(limit);
    CachedMessagePage page =
        cacheService.getOrLoad(
            cacheService.keys().roomMessages(roomId),
            CachedMessagePage.class,
            cached -> cached.covers(effectiveLimit),
            () -> loadPage(roomId, Math.max(effectiveLimit, properties.getDisplayLimit())));
    return MessageListResponse.of(page.newest(effectiveLimit));
  }

  int resolveLimit(Integer limit) {
    if (limit == null) {
      return properties.getDisplayLimit();
    }
    return Math.min(Math.max(limit, 1), properties.getMaxDisplayLimit());
  }

  private CachedMessagePage loadPage(UUID roomId, int size) {
    if (store.findRoom(roomId).isEmpty()) {
      throw new RoomNotFoundException(roomId);
    }
    List<MessageView> views = new ArrayList<>(viewMapper.toViews(store.listRecentMessages(roomId, size)));
    Collections.reverse(views);
    return new CachedMessagePage(views, views.size() < size);
  }
}
