package com.roomchat.backend.chat.generator;

import com.roomchat.backend.chat.context.ConversationTurn;
import java.util.List;

/** Flattens the conversation window and the new message into the single text the model reads. */
public class ConversationPromptRenderer {

  static final String HISTORY_HEADER = "Previous conversation:\n";

  private final int historyLimit;

  public ConversationPromptRenderer(int historyLimit) {
    this.historyLimit = Math.max(0, historyLimit);
  }

  public String render(String prompt, List<ConversationTurn> history) {
    String message = prompt != null ? prompt : "";
    List<ConversationTurn> recent = mostRecent(history);
    if (recent.isEmpty()) {
      return "User: " + message + "\nAI:";
    }
    StringBuilder context = new StringBuilder(HISTORY_HEADER);
    for (ConversationTurn turn : recent) {
      context.append(turn.speaker()).append(": ").append(turn.text()).append('\n');
    }
    context.append("\nUser: ").append(message).append("\nAI:");
    return context.toString();
  }

  private List<ConversationTurn> mostRecent(List<ConversationTurn> history) {
    if (history == null || history.isEmpty() || historyLimit == 0) {
      return List.of();
    }
    int from = Math.max(0, history.size() - historyLimit);
    return history.subList(from, history.size());
  }
}
