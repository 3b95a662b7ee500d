package com.roomchat.backend.chat.generator;

import java.util.Objects;

/** Reply text together with how it was obtained. {@code text} is never blank. */
public record GeneratedReply(String text, GenerationOutcome outcome) {

  public GeneratedReply {
    Objects.requireNonNull(outcome, "outcome must not be null");
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("reply text must not be blank");
    }
  }

  public static GeneratedReply generated(String text) {
    return new GeneratedReply(text, GenerationOutcome.GENERATED);
  }

  public static GeneratedReply fallback(String text, GenerationOutcome outcome) {
    return new GeneratedReply(text, outcome);
  }

  public boolean isFallback() {
    return outcome.isFallback();
  }
}
