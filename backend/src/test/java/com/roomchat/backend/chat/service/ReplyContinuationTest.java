package com.roomchat.backend.chat.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.roomchat.backend.chat.cache.ChatCacheMetrics;
import com.roomchat.backend.chat.cache.RoomCacheKeys;
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
import com.roomchat.backend.support.ChatFixtures;
import com.roomchat.backend.support.InMemoryChatCache;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class ReplyContinuationTest {

  @Mock private ChatStorePort store;
  @Mock private ConversationWindowBuilder windowBuilder;
  @Mock private ReplyGenerator replyGenerator;

  private InMemoryChatCache cache;
  private RoomCacheService cacheService;
  private ReplyContinuation continuation;
  private Room room;

  @BeforeEach
  void setUp() {
    cache = new InMemoryChatCache();
    cacheService =
        new RoomCacheService(
            cache,
            JsonMapper.builder().addModule(new JavaTimeModule()).build(),
            new RoomCacheKeys(""),
            Duration.ofSeconds(60),
            new ChatCacheMetrics(new SimpleMeterRegistry()));
    ChatProperties chatProperties = new ChatProperties();
    continuation =
        new ReplyContinuation(
            store,
            windowBuilder,
            replyGenerator,
            cacheService,
            new MessageViewMapper(store, chatProperties),
            chatProperties,
            new GeneratorProperties());
    room = ChatFixtures.room("general", UUID.randomUUID());
    cache.put("room-list", "{}");
    cache.put("room:" + room.getId(), "{}");
    cache.put("room:" + room.getId() + ":messages", "{}");
  }

  @Test
  void storesGeneratedReplyAndInvalidatesRoomKeys() {
    List<ConversationTurn> window = List.of(new ConversationTurn("alice", "hello"));
    when(windowBuilder.buildWindow(room.getId(), 10)).thenReturn(window);
    when(replyGenerator.generate("hello", window)).thenReturn(GeneratedReply.generated("hi there"));
    ChatMessage stored = aiMessage("hi there");
    when(store.insertMessage(room, null, "hi there", MessageType.AI)).thenReturn(stored);

    ReplyResult result = continuation.continueAfter(room, "hello");

    assertThat(result.persisted()).isTrue();
    assertThat(result.view().content()).isEqualTo("hi there");
    assertThat(result.view().messageType()).isEqualTo(MessageType.AI);
    assertThat(result.view().username()).isEqualTo("AI Assistant");
    assertThat(result.view().id()).isEqualTo(stored.getId());
    assertThat(cache.contains("room-list")).isFalse();
    assertThat(cache.contains("room:" + room.getId())).isFalse();
    assertThat(cache.contains("room:" + room.getId() + ":messages")).isFalse();
  }

  @Test
  void generatorExceptionBecomesFailureFallback() {
    when(windowBuilder.buildWindow(room.getId(), 10)).thenReturn(List.of());
    when(replyGenerator.generate(eq("hello"), anyList())).thenThrow(new IllegalStateException("bug"));
    String fallback = "I'm experiencing technical difficulties. Please try again later.";
    when(store.insertMessage(room, null, fallback, MessageType.AI)).thenReturn(aiMessage(fallback));

    ReplyResult result = continuation.continueAfter(room, "hello");

    assertThat(result.reply().outcome()).isEqualTo(GenerationOutcome.TRANSPORT_FAILURE);
    assertThat(result.view().content()).isEqualTo(fallback);
    assertThat(result.persisted()).isTrue();
  }

  @Test
  void windowFailureStillGeneratesWithoutHistory() {
    when(windowBuilder.buildWindow(any(), anyInt())).thenThrow(new IllegalStateException("db"));
    when(replyGenerator.generate("hello", List.of())).thenReturn(GeneratedReply.generated("ok"));
    when(store.insertMessage(room, null, "ok", MessageType.AI)).thenReturn(aiMessage("ok"));

    ReplyResult result = continuation.continueAfter(room, "hello");

    assertThat(result.view().content()).isEqualTo("ok");
    verify(replyGenerator).generate("hello", List.of());
  }

  @Test
  void replyThatCannotBeStoredIsReturnedUnsaved() {
    when(windowBuilder.buildWindow(room.getId(), 10)).thenReturn(List.of());
    when(replyGenerator.generate("hello", List.of())).thenReturn(GeneratedReply.generated("hi there"));
    when(store.insertMessage(eq(room), isNull(), eq("hi there"), eq(MessageType.AI)))
        .thenThrow(new DataAccessResourceFailureException("db down"));

    ReplyResult result = continuation.continueAfter(room, "hello");

    assertThat(result.persisted()).isFalse();
    assertThat(result.storedMessage()).isNull();
    assertThat(result.view().id()).isNull();
    assertThat(result.view().content()).isEqualTo("hi there");
    assertThat(result.view().roomId()).isEqualTo(room.getId());
    assertThat(cache.contains("room-list")).isFalse();
  }

  private ChatMessage aiMessage(String text) {
    return ChatFixtures.message(room, null, text, MessageType.AI, Instant.now());
  }
}
