package com.roomchat.backend.chat.cache;

import static org.assertj.core.api.Assertions.assertThat;

import com.roomchat.backend.chat.job.ReplyJobRepository;
import com.roomchat.backend.chat.persistence.ChatMessageRepository;
import com.roomchat.backend.room.api.CreateRoomRequest;
import com.roomchat.backend.room.api.RoomDetailsResponse;
import com.roomchat.backend.room.api.RoomSummary;
import com.roomchat.backend.room.persistence.RoomRepository;
import com.roomchat.backend.room.service.RoomService;
import com.roomchat.backend.support.PostgresTestContainer;
import com.roomchat.backend.user.domain.ChatUser;
import com.roomchat.backend.user.persistence.ChatUserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.wait.strategy.Wait;
import org.testcontainers.junit.jupiter.Container;

@SpringBootTest
class RoomCacheRedisIntegrationTest extends PostgresTestContainer {

  @Container
  private static final GenericContainer<?> REDIS =
      new GenericContainer<>("redis:7.4-alpine")
          .withExposedPorts(6379)
          .waitingFor(Wait.forListeningPort());

  @DynamicPropertySource
  static void configureRedis(DynamicPropertyRegistry registry) {
    registry.add("spring.data.redis.host", REDIS::getHost);
    registry.add("spring.data.redis.port", () -> REDIS.getMappedPort(6379));
    registry.add("app.chat.cache.enabled", () -> "true");
    registry.add("app.chat.cache.key-prefix", () -> "it:");
  }

  @Autowired private ChatCache chatCache;
  @Autowired private RoomService roomService;
  @Autowired private StringRedisTemplate redisTemplate;
  @Autowired private ChatUserRepository chatUserRepository;
  @Autowired private RoomRepository roomRepository;
  @Autowired private ChatMessageRepository chatMessageRepository;
  @Autowired private ReplyJobRepository replyJobRepository;

  private ChatUser alice;

  @BeforeEach
  void setUp() {
    redisTemplate.delete(redisTemplate.keys("it:*"));
    replyJobRepository.deleteAll();
    chatMessageRepository.deleteAll();
    roomRepository.deleteAll();
    chatUserRepository.deleteAll();
    alice = chatUserRepository.save(new ChatUser("alice", "alice@example.com"));
  }

  @Test
  void roomListIsCachedAndDroppedOnCreate() {
    assertThat(chatCache.isEnabled()).isTrue();

    roomService.listRooms();
    assertThat(redisTemplate.hasKey("it:room-list")).isTrue();
    Long ttl = redisTemplate.getExpire("it:room-list");
    assertThat(ttl).isNotNull().isPositive().isLessThanOrEqualTo(60L);

    RoomSummary created = roomService.createRoom(alice.getId(), new CreateRoomRequest("general", null));
    assertThat(redisTemplate.hasKey("it:room-list")).isFalse();
    assertThat(roomService.listRooms().rooms()).extracting(RoomSummary::id).containsExactly(created.id());
  }

  @Test
  void roomDetailsRoundTripThroughRedis() {
    RoomSummary created = roomService.createRoom(alice.getId(), new CreateRoomRequest("general", "d"));

    RoomDetailsResponse loaded = roomService.getRoom(created.id());
    RoomDetailsResponse cached = roomService.getRoom(created.id());

    assertThat(redisTemplate.hasKey("it:room:" + created.id())).isTrue();
    assertThat(cached).isEqualTo(loaded);
  }
}
