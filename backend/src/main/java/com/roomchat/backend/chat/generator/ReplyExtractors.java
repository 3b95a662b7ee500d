package com.roomchat.backend.chat.generator;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Ordered extraction strategies for generator payloads whose schema is not fixed. The chain is
 * tried front to back and the first non-blank string wins:
 *
 * <ol>
 *   <li>{@link #candidateList()}: first element of {@code candidates}, {@code outputs} or {@code
 *       output};
 *   <li>{@link #topLevelText()}: a known text field at the top level;
 *   <li>{@link #firstString()}: depth-first search of the whole payload.
 * </ol>
 */
public final class ReplyExtractors {

  static final List<String> CANDIDATE_LIST_FIELDS = List.of("candidates", "outputs", "output");
  static final List<String> CANDIDATE_TEXT_FIELDS = List.of("content", "text", "output");
  static final List<String> TOP_LEVEL_TEXT_FIELDS =
      List.of("content", "generated_text", "response", "text");

  private static final List<ReplyExtractionStrategy> DEFAULT_CHAIN =
      List.of(candidateList(), topLevelText(), firstString());

  private ReplyExtractors() {}

  public static List<ReplyExtractionStrategy> defaultChain() {
    return DEFAULT_CHAIN;
  }

  public static Optional<String> extract(JsonNode payload, List<ReplyExtractionStrategy> chain) {
    if (payload == null || payload.isNull() || payload.isMissingNode()) {
      return Optional.empty();
    }
    for (ReplyExtractionStrategy strategy : chain) {
      Optional<String> text = strategy.extract(payload).filter(ReplyExtractors::hasText);
      if (text.isPresent()) {
        return text;
      }
    }
    return Optional.empty();
  }

  /**
   * Looks at the first non-empty list among the candidate fields. A textual element is used as is;
   * an object element yields its first textual {@code content}/{@code text}/{@code output} field,
   * or else the first string nested inside it (the Gemini {@code content.parts[].text} shape).
   */
  public static ReplyExtractionStrategy candidateList() {
    return payload -> {
      if (!payload.isObject()) {
        return Optional.empty();
      }
      for (String field : CANDIDATE_LIST_FIELDS) {
        JsonNode list = payload.get(field);
        if (list == null || !list.isArray() || list.isEmpty()) {
          continue;
        }
        JsonNode first = list.get(0);
        if (first.isTextual()) {
          return nonBlank(first.asText());
        }
        if (first.isObject()) {
          for (String textField : CANDIDATE_TEXT_FIELDS) {
            JsonNode value = first.get(textField);
            if (value != null && value.isTextual() && hasText(value.asText())) {
              return Optional.of(value.asText());
            }
          }
        }
        return findFirstString(first);
      }
      return Optional.empty();
    };
  }

  public static ReplyExtractionStrategy topLevelText() {
    return payload -> {
      if (!payload.isObject()) {
        return Optional.empty();
      }
      for (String field : TOP_LEVEL_TEXT_FIELDS) {
        JsonNode value = payload.get(field);
        if (value != null && value.isTextual() && hasText(value.asText())) {
          return Optional.of(value.asText());
        }
      }
      return Optional.empty();
    };
  }

  public static ReplyExtractionStrategy firstString() {
    return ReplyExtractors::findFirstString;
  }

  private static Optional<String> findFirstString(JsonNode node) {
    if (node == null) {
      return Optional.empty();
    }
    if (node.isTextual()) {
      return nonBlank(node.asText());
    }
    if (node.isContainerNode()) {
      Iterator<JsonNode> children = node.elements();
      while (children.hasNext()) {
        Optional<String> nested = findFirstString(children.next());
        if (nested.isPresent()) {
          return nested;
        }
      }
    }
    return Optional.empty();
  }

  private static Optional<String> nonBlank(String value) {
    return hasText(value) ? Optional.of(value) : Optional.empty();
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
