package com.flamingo.ai.museumguide.api.rest;

import com.flamingo.ai.museumguide.api.dto.response.ChatTurnResponse;
import com.flamingo.ai.museumguide.api.dto.response.SessionClearResponse;
import com.flamingo.ai.museumguide.api.dto.response.SessionHistoryResponse;
import com.flamingo.ai.museumguide.domain.enums.MessageRole;
import com.flamingo.ai.museumguide.domain.model.ChatTurn;
import com.flamingo.ai.museumguide.service.session.SessionStore;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for session history. */
@RestController
@RequestMapping("/api/rag/sessions/{sessionId}")
@RequiredArgsConstructor
@Slf4j
public class SessionController {

  private final SessionStore sessionStore;

  /** Gets the conversation history of a session. */
  @GetMapping("/history")
  public ResponseEntity<SessionHistoryResponse> getHistory(@PathVariable String sessionId) {
    List<ChatTurn> history = sessionStore.getHistory(sessionId);
    int exchanges = (int) history.stream().filter(t -> t.role() == MessageRole.USER).count();
    return ResponseEntity.ok(
        SessionHistoryResponse.builder()
            .sessionId(sessionId)
            .messages(history.stream().map(ChatTurnResponse::fromTurn).toList())
            .exchangeCount(exchanges)
            .lastActivity(sessionStore.lastActivity(sessionId).orElse(null))
            .build());
  }

  /** Clears the history; the session stays usable. */
  @DeleteMapping("/history")
  public ResponseEntity<SessionClearResponse> clearHistory(@PathVariable String sessionId) {
    int removed = sessionStore.clear(sessionId);
    log.info("Cleared history of session {} ({} messages)", sessionId, removed);
    return ResponseEntity.ok(new SessionClearResponse(sessionId, removed, true));
  }

  /** Destroys the session. */
  @PostMapping("/close")
  public ResponseEntity<SessionClearResponse> close(@PathVariable String sessionId) {
    int removed = sessionStore.close(sessionId);
    return ResponseEntity.ok(new SessionClearResponse(sessionId, removed, false));
  }
}
