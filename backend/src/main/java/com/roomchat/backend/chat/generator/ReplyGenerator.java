package com.roomchat.backend.chat.generator;

import com.roomchat.backend.chat.context.ConversationTurn;
import java.util.List;

public interface ReplyGenerator {

  /**
   * Produces a reply for {@code prompt} given the preceding conversation. Implementations never
   * throw: every failure is converted into a fallback reply.
   */
  GeneratedReply generate(String prompt, List<ConversationTurn> history);
}
