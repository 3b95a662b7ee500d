package com.roomchat.backend.chat.generator;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Optional;

/** Pulls reply text out of a decoded generator payload, or reports that its shape did not match. */
@FunctionalInterface
public interface ReplyExtractionStrategy {

  Optional<String> extract(JsonNode payload);
}
