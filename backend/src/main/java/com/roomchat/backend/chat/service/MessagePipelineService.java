package com.roomchat.backend.chat.service;

import com.roomchat.backend.chat.api.MessageView;
import com.roomchat.backend.chat.cache.RoomCacheService;
import com.roomchat.backend.chat.domain.ChatMessage;
import com.roomchat.backend.chat.domain.MessageType;
import com.roomchat.backend.chat.job.ReplyJob;
import com.roomchat.backend.chat.job.ReplyJobPayload;
import com.roomchat.backend.chat.job.ReplyJobQueuePort;
import com.roomchat.backend.chat.store.ChatStorePort;
import com.roomchat.backend.room.domain.Room;
import com.roomchat.backend.room.service.RoomNotFoundException;
import com.roomchat.backend.user.domain.ChatUser;
import com.roomchat.backend.user.service.UserNotFoundException;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for posting a message to a room. The user's message is stored first; the reply is
 * produced either inline or by the reply worker. Only a missing room or author, or a failure to
 * store the user's message, reaches the caller as an error.
 */
@Service
public class MessagePipelineService {

  private static final Logger log = LoggerFactory.getLogger(MessagePipelineService.class);

  private final ChatStorePort store;
  private final ReplyContinuation continuation;
  private final ReplyJobQueuePort jobQueuePort;
  private final RoomCacheService cacheService;
  private final MessageViewMapper viewMapper;

  public MessagePipelineService(
      ChatStorePort store,
      ReplyContinuation continuation,
      ReplyJobQueuePort jobQueuePort,
      RoomCacheService cacheService,
      MessageViewMapper viewMapper) {
    this.store = store;
    this.continuation = continuation;
    this.jobQueuePort = jobQueuePort;
    this.cacheService = cacheService;
    this.viewMapper = viewMapper;
  }

  public SendMessageResult sendMessage(UUID roomId, UUID authorId, String body) {
    AcceptedMessage accepted = acceptUserMessage(roomId, authorId, body);
    ReplyResult reply = continuation.continueAfter(accepted.room(), body);
    if (reply.reply().isFallback()) {
      log.info(
          "Room {} received fallback reply ({}) for message {}",
          roomId,
          reply.reply().outcome(),
          accepted.message().getId());
    }
    return new SendMessageResult(accepted.view(), reply);
  }

  public AsyncSendResult sendMessageAsync(UUID roomId, UUID authorId, String body) {
    AcceptedMessage accepted = acceptUserMessage(roomId, authorId, body);
    ReplyJobPayload payload =
        new ReplyJobPayload(roomId, accepted.message().getId(), body, authorId, 1);
    try {
      ReplyJob job = jobQueuePort.enqueue(payload);
      log.debug("Queued reply job {} for message {}", job.getId(), accepted.message().getId());
      return new AsyncSendResult(accepted.view(), job.getId());
    } catch (RuntimeException ex) {
      log.error(
          "Failed to queue reply job for message {} in room {}",
          accepted.message().getId(),
          roomId,
          ex);
      return new AsyncSendResult(accepted.view(), null);
    }
  }

  private AcceptedMessage acceptUserMessage(UUID roomId, UUID authorId, String body) {
    Objects.requireNonNull(body, "body must not be null");
    Room room = store.findRoom(roomId).orElseThrow(() -> new RoomNotFoundException(roomId));
    ChatUser author = store.findUser(authorId).orElseThrow(() -> new UserNotFoundException(authorId));

    ChatMessage message;
    try {
      message = store.insertMessage(room, author.getId(), body, MessageType.USER);
    } catch (RuntimeException ex) {
      log.error("Failed to store message from user {} in room {}", authorId, roomId, ex);
      throw new MessagePersistenceException("Failed to store message", ex);
    }

    cacheService.invalidateRoomList();
    cacheService.invalidateRoom(roomId);
    return new AcceptedMessage(room, message, viewMapper.toView(message, author.getUsername()));
  }

  private record AcceptedMessage(Room room, ChatMessage message, MessageView view) {}
}
