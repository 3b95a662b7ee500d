package com.roomchat.backend.chat.controller;

import com.roomchat.backend.chat.api.AsyncSendMessageResponse;
import com.roomchat.backend.chat.api.MessageListResponse;
import com.roomchat.backend.chat.api.SendMessageRequest;
import com.roomchat.backend.chat.api.SendMessageResponse;
import com.roomchat.backend.chat.service.AsyncSendResult;
import com.roomchat.backend.chat.service.MessagePipelineService;
import com.roomchat.backend.chat.service.RoomMessageQueryService;
import com.roomchat.backend.chat.service.SendMessageResult;
import com.roomchat.backend.common.web.RequestHeaders;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/rooms/{roomId}/messages")
@Validated
@Tag(name = "Room Messages", description = "Post messages to a room and read its history.")
public class RoomMessageController {

  private final MessagePipelineService pipelineService;
  private final RoomMessageQueryService queryService;

  public RoomMessageController(
      MessagePipelineService pipelineService, RoomMessageQueryService queryService) {
    this.pipelineService = pipelineService;
    this.queryService = queryService;
  }

  @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Post a message and wait for the generated reply.",
      description =
          "Stores the message, generates a reply from the recent conversation and stores it. Generator failures yield a fallback reply instead of an error.")
  @ApiResponse(
      responseCode = "201",
      description = "Both messages; aiMessage may carry fallback text.",
      content =
          @Content(
              mediaType = MediaType.APPLICATION_JSON_VALUE,
              schema = @Schema(implementation = SendMessageResponse.class)))
  @ApiResponse(responseCode = "404", description = "Room or user does not exist.")
  public ResponseEntity<SendMessageResponse> sendMessage(
      @PathVariable UUID roomId,
      @RequestHeader(RequestHeaders.USER_ID) UUID userId,
      @Valid @RequestBody SendMessageRequest request) {
    SendMessageResult result = pipelineService.sendMessage(roomId, userId, request.content());
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(
            new SendMessageResponse(
                "Messages sent successfully",
                result.userMessage(),
                result.aiMessage(),
                result.reply().reply().isFallback()));
  }

  @PostMapping(
      value = "/async",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Post a message and let a background worker produce the reply.",
      description = "Returns as soon as the message is stored and the reply job is queued.")
  @ApiResponse(
      responseCode = "202",
      description = "Message stored; reply pending.",
      content =
          @Content(
              mediaType = MediaType.APPLICATION_JSON_VALUE,
              schema = @Schema(implementation = AsyncSendMessageResponse.class)))
  public ResponseEntity<AsyncSendMessageResponse> sendMessageAsync(
      @PathVariable UUID roomId,
      @RequestHeader(RequestHeaders.USER_ID) UUID userId,
      @Valid @RequestBody SendMessageRequest request) {
    AsyncSendResult result = pipelineService.sendMessageAsync(roomId, userId, request.content());
    String message =
        result.queued() ? "Message sent, reply pending" : "Message sent, reply could not be queued";
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(new AsyncSendMessageResponse(message, result.userMessage(), result.jobId()));
  }

  @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Latest messages of the room, newest first.")
  public MessageListResponse listMessages(
      @PathVariable UUID roomId,
      @RequestParam(name = "limit", required = false) @Min(1) @Max(200) Integer limit) {
    return queryService.listRoomMessages(roomId, limit);
  }
}
