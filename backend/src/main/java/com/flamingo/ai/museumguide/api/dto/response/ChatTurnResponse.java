package com.flamingo.ai.museumguide.api.dto.response;

import com.flamingo.ai.museumguide.domain.enums.MessageRole;
import com.flamingo.ai.museumguide.domain.model.ChatTurn;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for one history message. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatTurnResponse {

  private MessageRole role;
  private String content;
  private Instant timestamp;

  /** Creates a ChatTurnResponse from a history turn. */
  public static ChatTurnResponse fromTurn(ChatTurn turn) {
    return ChatTurnResponse.builder()
        .role(turn.role())
        .content(turn.content())
        .timestamp(turn.timestamp())
        .build();
  }
}
