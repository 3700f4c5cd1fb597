package com.flamingo.ai.museumguide.api.dto.request;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for rewriting a text in a given tone without retrieval. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToneConversionRequest {

  @NotBlank(message = "Text is required")
  @Size(max = 20000, message = "Text must not exceed 20000 characters")
  private String text;

  /** Wire name of the target tone, e.g. {@code elder_friendly}. */
  @Builder.Default private String tone = "child_friendly";

  @Builder.Default private boolean stream = true;

  @JsonAlias("user_description")
  private String userDescription;

  @JsonAlias("user_msg")
  private String userMessage;

  /** Forces the rewrite to open with a reference to the visitor's appearance. */
  @JsonAlias("first_message")
  private boolean firstMessage;
}
