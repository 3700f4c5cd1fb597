package com.flamingo.ai.museumguide.domain.model;

import java.util.Map;

/**
 * A chunk returned by hybrid retrieval with the scores that ranked it.
 *
 * <p>{@code combinedScore} is the weighted sum of the two normalised scores; raw scores are kept
 * for diagnostics. {@code denseRank} is the 0-based position in the dense candidate list, or
 * {@code -1} for chunks only the sparse index found.
 */
public record RetrievalResult(
    String chunkId,
    String text,
    Map<String, String> metadata,
    double denseScore,
    double sparseScore,
    double normalizedDenseScore,
    double normalizedSparseScore,
    double combinedScore,
    int denseRank) {

  public String source() {
    return metadata.getOrDefault(Chunk.META_SOURCE, "");
  }

  public String title() {
    return metadata.getOrDefault(Chunk.META_TITLE, "");
  }
}
