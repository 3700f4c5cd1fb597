package com.flamingo.ai.museumguide.domain.model;

import com.flamingo.ai.museumguide.domain.enums.MessageRole;
import java.time.Instant;

/**
 * One message of a session's conversation history.
 *
 * @param role who sent the message
 * @param content message text
 * @param timestamp when the message was recorded
 */
public record ChatTurn(MessageRole role, String content, Instant timestamp) {

  public static ChatTurn user(String content) {
    return new ChatTurn(MessageRole.USER, content, Instant.now());
  }

  public static ChatTurn assistant(String content) {
    return new ChatTurn(MessageRole.ASSISTANT, content, Instant.now());
  }
}
