package com.roomchat.backend.user.persistence;

import com.roomchat.backend.user.domain.ChatUser;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ChatUserRepository extends JpaRepository<ChatUser, UUID> {}
