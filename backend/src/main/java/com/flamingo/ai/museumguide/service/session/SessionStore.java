package com.flamingo.ai.museumguide.service.session;

import com.flamingo.ai.museumguide.domain.enums.MessageRole;
import com.flamingo.ai.museumguide.domain.model.ChatTurn;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Conversation history per session id.
 *
 * <p>Sessions are created implicitly on first reference. Operations on one session are serialized;
 * operations on different sessions never wait on each other.
 */
public interface SessionStore {

  /**
   * Gets a snapshot of the session's history, oldest first.
   *
   * @param sessionId the session ID
   * @return an immutable copy; empty for an unknown session
   */
  List<ChatTurn> getHistory(String sessionId);

  /**
   * Appends one message to the session.
   *
   * @param sessionId the session ID
   * @param role who sent the message
   * @param content the message text
   */
  void append(String sessionId, MessageRole role, String content);

  /**
   * Appends a completed exchange (user message then assistant reply) atomically.
   *
   * @param sessionId the session ID
   * @param userMessage the user message
   * @param assistantMessage the final assistant reply
   */
  void appendExchange(String sessionId, String userMessage, String assistantMessage);

  /**
   * Removes all messages; the session id stays valid.
   *
   * @param sessionId the session ID
   * @return number of messages removed
   */
  int clear(String sessionId);

  /**
   * Destroys the session.
   *
   * @param sessionId the session ID
   * @return number of messages removed
   */
  int close(String sessionId);

  boolean exists(String sessionId);

  Optional<Instant> lastActivity(String sessionId);
}
