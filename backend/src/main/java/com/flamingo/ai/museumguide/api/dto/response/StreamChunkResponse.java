package com.flamingo.ai.museumguide.api.dto.response;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.flamingo.ai.museumguide.domain.model.RetrievalResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for SSE streaming chunks. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StreamChunkResponse {

  public static final String CONTEXT = "context";
  public static final String TOKEN = "token";
  public static final String DONE = "done";
  public static final String ERROR = "error";

  /** Event type: context, token, done, error. */
  private String eventType;

  /** Event data (JSON object). */
  private Object data;

  /** Creates a context event for one retrieved passage. */
  public static StreamChunkResponse context(int rank, RetrievalResult result) {
    return StreamChunkResponse.builder()
        .eventType(CONTEXT)
        .data(
            new ContextData(
                rank,
                result.chunkId(),
                result.source(),
                result.title(),
                result.text(),
                result.combinedScore()))
        .build();
  }

  /** Creates a token event. */
  public static StreamChunkResponse token(String content) {
    return StreamChunkResponse.builder().eventType(TOKEN).data(new TokenData(content)).build();
  }

  /** Creates the end-of-stream event. */
  public static StreamChunkResponse done(String tone, boolean degraded, int tokenCount) {
    return StreamChunkResponse.builder()
        .eventType(DONE)
        .data(new DoneData(tone, degraded, tokenCount))
        .build();
  }

  /** Creates an error event. */
  public static StreamChunkResponse error(String errorId, String message) {
    return StreamChunkResponse.builder()
        .eventType(ERROR)
        .data(new ErrorData(errorId, message))
        .build();
  }

  @JsonIgnore
  public boolean isTerminal() {
    return DONE.equals(eventType) || ERROR.equals(eventType);
  }

  /** Context event data. */
  @Data
  @AllArgsConstructor
  public static class ContextData {
    private int rank;
    private String chunkId;
    private String source;
    private String title;
    private String text;
    private double score;
  }

  /** Token event data. */
  @Data
  @AllArgsConstructor
  public static class TokenData {
    private String content;
  }

  /** Done event data. */
  @Data
  @AllArgsConstructor
  public static class DoneData {
    /** Wire name of the tone the answer was delivered in. */
    private String tone;

    /** True when retrieval was unavailable and the answer was generated without context. */
    private boolean degraded;

    private int tokenCount;
  }

  /** Error event data. */
  @Data
  @AllArgsConstructor
  public static class ErrorData {
    private String errorId;
    private String message;
  }
}
