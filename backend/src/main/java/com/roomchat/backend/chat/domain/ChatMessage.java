package com.roomchat.backend.chat.domain;

import com.roomchat.backend.room.domain.Room;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "chat_message")
public class ChatMessage {

  @Id @GeneratedValue @UuidGenerator private UUID id;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "room_id", nullable = false, updatable = false)
  private Room room;

  @Column(name = "author_id", updatable = false)
  private UUID authorId;

  @Column(name = "content", nullable = false, updatable = false, columnDefinition = "TEXT")
  private String content;

  @Enumerated(EnumType.STRING)
  @Column(name = "message_type", nullable = false, updatable = false, length = 16)
  private MessageType messageType;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected ChatMessage() {}

  public ChatMessage(Room room, UUID authorId, String content, MessageType messageType) {
    this.room = room;
    this.authorId = authorId;
    this.content = content;
    this.messageType = messageType;
  }

  @PrePersist
  protected void onPersist() {
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public Room getRoom() {
    return room;
  }

  public UUID getRoomId() {
    return room != null ? room.getId() : null;
  }

  public UUID getAuthorId() {
    return authorId;
  }

  public String getContent() {
    return content;
  }

  public MessageType getMessageType() {
    return messageType;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
