package com.roomchat.backend.room.persistence;

import com.roomchat.backend.room.domain.Room;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface RoomRepository extends JpaRepository<Room, UUID> {

  boolean existsByNameIgnoreCase(String name);

  List<Room> findAllByOrderByCreatedAtDesc();
}
