package com.roomchat.backend.user.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import org.hibernate.annotations.UuidGenerator;

/**
 * Account record owned by the authentication service. This backend only reads it to validate
 * message authors and to resolve display names.
 */
@Entity
@Table(name = "chat_user")
public class ChatUser {

  @Id @GeneratedValue @UuidGenerator private UUID id;

  @Column(name = "username", nullable = false, unique = true, length = 80)
  private String username;

  @Column(name = "email", nullable = false, length = 120)
  private String email;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected ChatUser() {}

  public ChatUser(String username, String email) {
    this.username = username;
    this.email = email;
  }

  @PrePersist
  protected void onPersist() {
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getUsername() {
    return username;
  }

  public String getEmail() {
    return email;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
