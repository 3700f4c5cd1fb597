package com.flamingo.ai.museumguide.api.dto.response;

import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a session's conversation history. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionHistoryResponse {

  private String sessionId;
  private List<ChatTurnResponse> messages;

  /** Number of question-answer exchanges in the history. */
  private int exchangeCount;

  private Instant lastActivity;
}
