package com.roomchat.backend.chat.context;

import com.roomchat.backend.chat.api.MessageView;
import com.roomchat.backend.chat.cache.CachedMessagePage;
import com.roomchat.backend.chat.cache.RoomCacheService;
import com.roomchat.backend.chat.service.MessageViewMapper;
import com.roomchat.backend.chat.store.ChatStorePort;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Loads the tail of a room's history as generation context. Uses a cached message page when one
 * covers the requested size, otherwise reads the store. Never writes to the cache.
 */
@Component
public class ConversationWindowBuilder {

  private static final Logger log = LoggerFactory.getLogger(ConversationWindowBuilder.class);

  private final ChatStorePort store;
  private final RoomCacheService cacheService;
  private final MessageViewMapper viewMapper;

  public ConversationWindowBuilder(
      ChatStorePort store, RoomCacheService cacheService, MessageViewMapper viewMapper) {
    this.store = store;
    this.cacheService = cacheService;
    this.viewMapper = viewMapper;
  }

  /** Most recent {@code limit} messages of the room as turns, oldest first. */
  public List<ConversationTurn> buildWindow(UUID roomId, int limit) {
    if (roomId == null || limit <= 0) {
      return List.of();
    }
    Optional<CachedMessagePage> cached =
        cacheService
            .peek(cacheService.keys().roomMessages(roomId), CachedMessagePage.class)
            .filter(page -> page.covers(limit));

    List<MessageView> ascending;
    if (cached.isPresent()) {
      ascending = new ArrayList<>(cached.get().newest(limit));
      Collections.reverse(ascending);
      log.trace("Context window for room {} served from cache ({} turns)", roomId, ascending.size());
    } else {
      ascending = viewMapper.toViews(store.listRecentMessages(roomId, limit));
    }
    return ascending.stream().map(view -> new ConversationTurn(view.username(), view.content())).toList();
  }
}
