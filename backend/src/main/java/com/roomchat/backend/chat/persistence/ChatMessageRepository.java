package com.roomchat.backend.chat.persistence;

import com.roomchat.backend.chat.domain.ChatMessage;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface ChatMessageRepository extends JpaRepository<ChatMessage, UUID> {

  @Query(
      """
      SELECT m FROM ChatMessage m
      WHERE m.room.id = :roomId
      ORDER BY m.createdAt DESC, m.id DESC
      """)
  List<ChatMessage> findLatestByRoom(@Param("roomId") UUID roomId, Pageable pageable);

  @Query("SELECT COUNT(m) FROM ChatMessage m WHERE m.room.id = :roomId")
  long countByRoom(@Param("roomId") UUID roomId);

  @Query(
      """
      SELECT m.room.id AS roomId, COUNT(m) AS messageCount
      FROM ChatMessage m
      GROUP BY m.room.id
      """)
  List<RoomMessageCount> countGroupedByRoom();

  interface RoomMessageCount {

    UUID getRoomId();

    long getMessageCount();
  }
}
