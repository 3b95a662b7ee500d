package com.roomchat.backend.room.controller;

import com.roomchat.backend.common.web.RequestHeaders;
import com.roomchat.backend.room.api.CreateRoomRequest;
import com.roomchat.backend.room.api.CreateRoomResponse;
import com.roomchat.backend.room.api.RoomDetailsResponse;
import com.roomchat.backend.room.api.RoomListResponse;
import com.roomchat.backend.room.api.RoomSummary;
import com.roomchat.backend.room.service.RoomService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/rooms")
@Validated
@Tag(name = "Rooms", description = "Create, list and delete chat rooms.")
public class RoomController {

  private final RoomService roomService;

  public RoomController(RoomService roomService) {
    this.roomService = roomService;
  }

  @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Create a room owned by the calling user.")
  public ResponseEntity<CreateRoomResponse> createRoom(
      @RequestHeader(RequestHeaders.USER_ID) UUID userId,
      @Valid @RequestBody CreateRoomRequest request) {
    RoomSummary room = roomService.createRoom(userId, request);
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(new CreateRoomResponse("Room created successfully", room));
  }

  @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "List all rooms with their message counts.")
  public RoomListResponse listRooms() {
    return roomService.listRooms();
  }

  @GetMapping(value = "/{roomId}", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Fetch a room together with its most recent messages.")
  public RoomDetailsResponse getRoom(@PathVariable UUID roomId) {
    return roomService.getRoom(roomId);
  }

  @DeleteMapping("/{roomId}")
  @Operation(summary = "Delete a room and its messages. Only the creator may do this.")
  public ResponseEntity<Void> deleteRoom(
      @PathVariable UUID roomId, @RequestHeader(RequestHeaders.USER_ID) UUID userId) {
    roomService.deleteRoom(roomId, userId);
    return ResponseEntity.noContent().build();
  }
}
