package com.flamingo.ai.museumguide.api.dto.response;

import com.flamingo.ai.museumguide.service.rag.index.IndexStatus;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO describing the active index. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexBuildResponse {

  private boolean ready;
  private long generation;
  private int chunkCount;
  private int vocabularySize;
  private String vectorStore;
  private Instant builtAt;

  /** Creates an IndexBuildResponse from the index status. */
  public static IndexBuildResponse fromStatus(IndexStatus status) {
    return IndexBuildResponse.builder()
        .ready(status.ready())
        .generation(status.generation())
        .chunkCount(status.chunkCount())
        .vocabularySize(status.vocabularySize())
        .vectorStore(status.vectorStore())
        .builtAt(status.builtAt())
        .build();
  }
}
