package com.roomchat.backend.support;

import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.utility.DockerImageName;

public final class SingletonPostgresContainer
    extends PostgreSQLContainer<SingletonPostgresContainer> {

  private static final DockerImageName IMAGE = DockerImageName.parse("postgres:15-alpine");

  private static SingletonPostgresContainer container;

  private SingletonPostgresContainer() {
    super(IMAGE);
    withDatabaseName("room_chat_test");
    withUsername("room_chat");
    withPassword("room_chat");
    withReuse(true);
  }

  public static synchronized SingletonPostgresContainer getInstance() {
    if (container == null) {
      container = new SingletonPostgresContainer();
      container.start();
    }
    return container;
  }
}
