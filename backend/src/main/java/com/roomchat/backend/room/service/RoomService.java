package com.roomchat.backend.room.service;

import com.roomchat.backend.chat.cache.RoomCacheService;
import com.roomchat.backend.chat.config.ChatProperties;
import com.roomchat.backend.chat.service.MessageViewMapper;
import com.roomchat.backend.chat.store.ChatStorePort;
import com.roomchat.backend.room.api.CreateRoomRequest;
import com.roomchat.backend.room.api.RoomDetailsResponse;
import com.roomchat.backend.room.api.RoomListResponse;
import com.roomchat.backend.room.api.RoomSummary;
import com.roomchat.backend.room.domain.Room;
import com.roomchat.backend.room.persistence.RoomRepository;
import com.roomchat.backend.user.service.UserNotFoundException;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Room lifecycle with cache-aside reads. Mutations commit through the repository before the
 * affected cache entries are invalidated.
 */
@Service
public class RoomService {

  private static final Logger log = LoggerFactory.getLogger(RoomService.class);

  private final RoomRepository roomRepository;
  private final ChatStorePort store;
  private final RoomCacheService cacheService;
  private final MessageViewMapper viewMapper;
  private final ChatProperties properties;

  public RoomService(
      RoomRepository roomRepository,
      ChatStorePort store,
      RoomCacheService cacheService,
      MessageViewMapper viewMapper,
      ChatProperties properties) {
    this.roomRepository = roomRepository;
    this.store = store;
    this.cacheService = cacheService;
    this.viewMapper = viewMapper;
    this.properties = properties;
  }

  public RoomSummary createRoom(UUID creatorId, CreateRoomRequest request) {
    if (store.findUser(creatorId).isEmpty()) {
      throw new UserNotFoundException(creatorId);
    }
    String name = request.name().trim();
    if (roomRepository.existsByNameIgnoreCase(name)) {
      throw new DuplicateRoomNameException(name);
    }
    Room room = roomRepository.save(new Room(name, request.description(), creatorId));
    cacheService.invalidateRoomList();
    log.info("Room {} '{}' created by {}", room.getId(), room.getName(), creatorId);
    return RoomSummary.of(room, 0);
  }

  public RoomListResponse listRooms() {
    return cacheService.getOrLoad(
        cacheService.keys().roomList(), RoomListResponse.class, this::loadRoomList);
  }

  public RoomDetailsResponse getRoom(UUID roomId) {
    return cacheService.getOrLoad(
        cacheService.keys().room(roomId), RoomDetailsResponse.class, () -> loadRoom(roomId));
  }

  public void deleteRoom(UUID roomId, UUID requesterId) {
    Room room = roomRepository.findById(roomId).orElseThrow(() -> new RoomNotFoundException(roomId));
    if (!room.getCreatedBy().equals(requesterId)) {
      throw new RoomAccessDeniedException(roomId);
    }
    roomRepository.delete(room);
    cacheService.invalidateRoomList();
    cacheService.invalidateRoom(roomId);
    log.info("Room {} deleted by {}", roomId, requesterId);
  }

  private RoomListResponse loadRoomList() {
    Map<UUID, Long> counts = store.countMessagesByRoom();
    return RoomListResponse.of(
        roomRepository.findAllByOrderByCreatedAtDesc().stream()
            .map(room -> RoomSummary.of(room, counts.getOrDefault(room.getId(), 0L)))
            .toList());
  }

  private RoomDetailsResponse loadRoom(UUID roomId) {
    Room room = store.findRoom(roomId).orElseThrow(() -> new RoomNotFoundException(roomId));
    return new RoomDetailsResponse(
        room.getId(),
        room.getName(),
        room.getDescription(),
        room.getCreatedBy(),
        room.getCreatedAt(),
        store.countMessages(roomId),
        viewMapper.toViews(store.listRecentMessages(roomId, properties.getRoomPreviewSize())));
  }
}
