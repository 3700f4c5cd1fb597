package com.flamingo.ai.museumguide.api.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a model warmup run. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WarmupResponse {

  private StepResult embeddingModel;
  private StepResult chatModel;
  private boolean overallSuccess;

  /** Outcome of warming one model. */
  @Data
  @AllArgsConstructor
  public static class StepResult {
    /** One of {@code success}, {@code failed}, {@code skipped}. */
    private String status;

    private String message;
    private long timeMs;
  }
}
