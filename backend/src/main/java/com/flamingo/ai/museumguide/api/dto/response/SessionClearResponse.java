package com.flamingo.ai.museumguide.api.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for clearing or closing a session. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionClearResponse {

  private String sessionId;
  private int removedMessages;

  /** False after a close: the session no longer exists. */
  private boolean active;
}
