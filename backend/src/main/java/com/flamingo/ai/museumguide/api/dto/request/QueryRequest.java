package com.flamingo.ai.museumguide.api.dto.request;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for a streaming visitor query. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryRequest {

  public static final String DEFAULT_SESSION_ID = "default";

  @NotBlank(message = "Query text is required")
  @Size(max = 10000, message = "Query text must not exceed 10000 characters")
  @JsonAlias("query")
  private String text;

  @Builder.Default
  @Size(max = 200, message = "Session ID must not exceed 200 characters")
  @JsonAlias("session_id")
  private String sessionId = DEFAULT_SESSION_ID;

  /** Whether earlier exchanges of the session are sent to the model. */
  @Builder.Default
  @JsonAlias("include_history")
  private boolean includeHistory = true;

  /**
   * Explicit description of the visitor. When present it is used instead of asking the vision
   * context service.
   */
  @JsonAlias({"user_description", "auxiliary_context"})
  private String auxiliaryContext;

  /** Whether the answer is rewritten in the visitor's tone before it is streamed. */
  @Builder.Default
  @JsonAlias("apply_tone_conversion")
  private boolean applyStyleConversion = false;

  /** Session id to use, falling back to {@value #DEFAULT_SESSION_ID} when blank. */
  public String effectiveSessionId() {
    return sessionId == null || sessionId.isBlank() ? DEFAULT_SESSION_ID : sessionId.trim();
  }
}
