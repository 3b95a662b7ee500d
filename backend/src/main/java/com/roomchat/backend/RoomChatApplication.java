package com.roomchat.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class RoomChatApplication {

  public static void main(String[] args) {
    SpringApplication.run(RoomChatApplication.class, args);
  }
}
