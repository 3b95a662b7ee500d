package com.roomchat.backend.chat.service;

import com.roomchat.backend.chat.api.MessageView;
import com.roomchat.backend.chat.cache.RoomCacheService;
import com.roomchat.backend.chat.config.ChatProperties;
import com.roomchat.backend.chat.context.ConversationTurn;
import com.roomchat.backend.chat.context.ConversationWindowBuilder;
import com.roomchat.backend.chat.domain.ChatMessage;
import com.roomchat.backend.chat.domain.MessageType;
import com.roomchat.backend.chat.generator.GeneratedReply;
import com.roomchat.backend.chat.generator.GenerationOutcome;
import com.roomchat.backend.chat.generator.GeneratorProperties;
import com.roomchat.backend.chat.generator.ReplyGenerator;
import com.roomchat.backend.chat.store.ChatStorePort;
import com.roomchat.backend.room.domain.Room;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Everything that happens once the user's message is durable: build the context window, generate
 * a reply, store it and invalidate the room's cache entries. Shared by the inline pipeline and the
 * reply worker.
 */
@Component
public class ReplyContinuation {

  private static final Logger log = LoggerFactory.getLogger(ReplyContinuation.class);

  private final ChatStorePort store;
  private final ConversationWindowBuilder windowBuilder;
  private final ReplyGenerator replyGenerator;
  private final RoomCacheService cacheService;
  private final MessageViewMapper viewMapper;
  private final ChatProperties chatProperties;
  private final GeneratorProperties generatorProperties;

  public ReplyContinuation(
      ChatStorePort store,
      ConversationWindowBuilder windowBuilder,
      ReplyGenerator replyGenerator,
      RoomCacheService cacheService,
      MessageViewMapper viewMapper,
      ChatProperties chatProperties,
      GeneratorProperties generatorProperties) {
    this.store = store;
    this.windowBuilder = windowBuilder;
    this.replyGenerator = replyGenerator;
    this.cacheService = cacheService;
    this.viewMapper = viewMapper;
    this.chatProperties = chatProperties;
    this.generatorProperties = generatorProperties;
  }

  public ReplyResult continueAfter(Room room, String prompt) {
    UUID roomId = room.getId();
    List<ConversationTurn> window = loadWindow(roomId);
    GeneratedReply reply = generate(roomId, prompt, window);
    Optional<ChatMessage> stored = storeReply(room, reply.text());
    invalidate(roomId);

    MessageView view =
        stored
            .map(message -> viewMapper.toView(message, viewMapper.aiDisplayName()))
            .orElseGet(() -> viewMapper.unsavedReply(roomId, reply.text()));
    return new ReplyResult(reply, stored.orElse(null), view);
  }

  private List<ConversationTurn> loadWindow(UUID roomId) {
    try {
      return windowBuilder.buildWindow(roomId, chatProperties.getContextWindowSize());
    } catch (RuntimeException ex) {
      log.warn("Failed to load conversation window for room {}, generating without history", roomId, ex);
      return List.of();
    }
  }

  private GeneratedReply generate(UUID roomId, String prompt, List<ConversationTurn> window) {
    try {
      GeneratedReply reply = replyGenerator.generate(prompt, window);
      if (reply != null) {
        return reply;
      }
      log.warn("Generator returned no reply for room {}", roomId);
    } catch (RuntimeException ex) {
      log.error("Generator failed unexpectedly for room {}", roomId, ex);
    }
    return GeneratedReply.fallback(
        generatorProperties.getFailureFallback(), GenerationOutcome.TRANSPORT_FAILURE);
  }

  private Optional<ChatMessage> storeReply(Room room, String text) {
    try {
      return Optional.of(
          store.insertMessage(room, chatProperties.getAiAuthorId(), text, MessageType.AI));
    } catch (RuntimeException ex) {
      log.warn("Failed to store generated reply for room {}", room.getId(), ex);
      return Optional.empty();
    }
  }

  private void invalidate(UUID roomId) {
    cacheService.invalidateRoomList();
    cacheService.invalidateRoom(roomId);
  }
}
