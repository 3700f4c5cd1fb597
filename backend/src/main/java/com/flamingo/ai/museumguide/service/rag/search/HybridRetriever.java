package com.flamingo.ai.museumguide.service.rag.search;

import com.flamingo.ai.museumguide.config.RagConfig;
import com.flamingo.ai.museumguide.domain.model.Chunk;
import com.flamingo.ai.museumguide.domain.model.RetrievalResult;
import com.flamingo.ai.museumguide.exception.RetrievalUnavailableException;
import com.flamingo.ai.museumguide.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.museumguide.service.rag.index.IndexBuildService;
import com.flamingo.ai.museumguide.service.rag.index.IndexLease;
import com.flamingo.ai.museumguide.service.rag.index.IndexSnapshot;
import com.flamingo.ai.museumguide.service.rag.sparse.SparseIndex;
import com.flamingo.ai.museumguide.service.rag.sparse.TextTokenizer;
import com.flamingo.ai.museumguide.vectorstore.VectorMatch;
import com.flamingo.ai.museumguide.vectorstore.VectorStore;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Hybrid dense + sparse retrieval over the active index snapshot.
 *
 * <p>Both indexes fetch their own over-sized candidate lists; the union is scored on both sides,
 * each score type is min-max normalised within the union, and the weighted sum ranks the result.
 * Duplicates collapse to their best score, ties keep the dense ranking, and verbatim
 * question-answer chunks are dropped when the query itself is a question.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HybridRetriever {

  private final IndexBuildService indexBuildService;
  private final EmbeddingService embeddingService;
  private final VectorStore vectorStore;
  private final TextTokenizer tokenizer;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Retrieves with the configured top-k.
   *
   * @param query the visitor query
   * @return ranked results, at most {@code rag.retrieval.top-k}
   */
  @Timed(value = "rag.search", description = "Time for hybrid search")
  public List<RetrievalResult> search(String query) {
    return search(query, ragConfig.getRetrieval().getTopK());
  }

  /**
   * Retrieves the best chunks for a query.
   *
   * @param query the visitor query
   * @param topK maximum number of results
   * @return ranked results, best first
   * @throws RetrievalUnavailableException if no index is active or a backend call fails
   */
  @Timed(value = "rag.search", description = "Time for hybrid search")
  public List<RetrievalResult> search(String query, int topK) {
    RagConfig.Retrieval config = ragConfig.getRetrieval();
    double denseWeight = config.getDenseWeight();
    double sparseWeight = config.getSparseWeight();
    Preconditions.checkState(
        Math.abs(denseWeight + sparseWeight - 1.0) < 1e-6,
        "Dense and sparse weights must sum to 1 (dense=%s, sparse=%s)",
        denseWeight,
        sparseWeight);
    if (query == null || query.isBlank() || topK <= 0) {
      return List.of();
    }

    try (IndexLease lease =
        indexBuildService
            .acquire()
            .orElseThrow(() -> new RetrievalUnavailableException("Retrieval index is not built"))) {
      return searchSnapshot(query, topK, lease.snapshot(), config, denseWeight);
    }
  }

  private List<RetrievalResult> searchSnapshot(
      String query,
      int topK,
      IndexSnapshot snapshot,
      RagConfig.Retrieval config,
      double denseWeight) {
    int fetchSize = topK * Math.max(2, config.getOverFetchFactor());

    List<Float> queryEmbedding = embeddingService.embedQuery(query);
    List<VectorMatch> denseMatches;
    try {
      denseMatches =
          vectorStore.queryByVector(snapshot.denseCollection(), queryEmbedding, fetchSize);
    } catch (RuntimeException e) {
      meterRegistry.counter("rag.search.failures", "stage", "dense").increment();
      throw new RetrievalUnavailableException("Dense search failed: " + e.getMessage(), e);
    }

    SparseIndex sparseIndex = snapshot.sparseIndex();
    Map<Integer, Double> sparseQuery =
        sparseIndex.vectorize(tokenizer.terms(query, sparseIndex.ngramMax()));
    List<SparseIndex.SparseMatch> sparseMatches = sparseIndex.search(sparseQuery, fetchSize);

    Map<String, Candidate> candidates = new LinkedHashMap<>();
    for (int rank = 0; rank < denseMatches.size(); rank++) {
      VectorMatch match = denseMatches.get(rank);
      Candidate existing = candidates.get(match.chunkId());
      if (existing != null) {
        existing.denseScore = Math.max(existing.denseScore, match.score());
        continue;
      }
      Chunk chunk = sparseIndex.chunk(match.chunkId());
      Candidate candidate =
          chunk != null
              ? new Candidate(chunk.id(), chunk.text(), chunk.metadata())
              : new Candidate(match.chunkId(), match.text(), match.metadata());
      candidate.hasDense = true;
      candidate.denseScore = match.score();
      candidate.denseRank = rank;
      candidates.put(candidate.chunkId, candidate);
    }
    for (int rank = 0; rank < sparseMatches.size(); rank++) {
      SparseIndex.SparseMatch match = sparseMatches.get(rank);
      Candidate candidate = candidates.get(match.chunkId());
      if (candidate == null) {
        Chunk chunk = sparseIndex.chunk(match.chunkId());
        if (chunk == null) {
          continue;
        }
        candidate = new Candidate(chunk.id(), chunk.text(), chunk.metadata());
        candidates.put(candidate.chunkId, candidate);
      }
      candidate.sparseRank = Math.min(candidate.sparseRank, rank);
    }
    for (Candidate candidate : candidates.values()) {
      candidate.sparseScore = sparseIndex.score(sparseQuery, candidate.chunkId);
    }

    List<RetrievalResult> results = fuse(new ArrayList<>(candidates.values()), denseWeight);

    boolean question = QuestionDetector.isQuestion(query);
    if (question && config.isExcludeQaPairsForQuestions()) {
      results =
          results.stream()
              .filter(r -> !Boolean.parseBoolean(r.metadata().get(Chunk.META_QA_PAIR)))
              .toList();
    }
    if (results.size() > topK) {
      results = results.subList(0, topK);
    }

    meterRegistry.counter("rag.search.requests").increment();
    log.debug(
        "Hybrid search: dense={}, sparse={}, union={}, question={}, returned={}",
        denseMatches.size(),
        sparseMatches.size(),
        candidates.size(),
        question,
        results.size());
    return List.copyOf(results);
  }

  @VisibleForTesting
  static List<RetrievalResult> fuse(List<Candidate> candidates, double denseWeight) {
    double sparseWeight = 1.0 - denseWeight;
    double denseMin = Double.POSITIVE_INFINITY;
    double denseMax = Double.NEGATIVE_INFINITY;
    double sparseMin = Double.POSITIVE_INFINITY;
    double sparseMax = Double.NEGATIVE_INFINITY;
    for (Candidate c : candidates) {
      if (c.hasDense) {
        denseMin = Math.min(denseMin, c.denseScore);
        denseMax = Math.max(denseMax, c.denseScore);
      }
      sparseMin = Math.min(sparseMin, c.sparseScore);
      sparseMax = Math.max(sparseMax, c.sparseScore);
    }

    List<RetrievalResult> results = new ArrayList<>(candidates.size());
    for (Candidate c : candidates) {
      double normalizedDense = c.hasDense ? minMax(c.denseScore, denseMin, denseMax) : 0.0;
      double normalizedSparse = minMax(c.sparseScore, sparseMin, sparseMax);
      results.add(
          new RetrievalResult(
              c.chunkId,
              c.text,
              c.metadata,
              c.denseScore,
              c.sparseScore,
              normalizedDense,
              normalizedSparse,
              denseWeight * normalizedDense + sparseWeight * normalizedSparse,
              c.hasDense ? c.denseRank : -1));
    }

    // ties: dense order first, then sparse-only candidates in sparse order
    Map<String, Long> tieOrder = new HashMap<>();
    for (Candidate c : candidates) {
      tieOrder.put(c.chunkId, c.hasDense ? c.denseRank : (long) Integer.MAX_VALUE + c.sparseRank);
    }
    results.sort(
        Comparator.comparingDouble(RetrievalResult::combinedScore)
            .reversed()
            .thenComparing(r -> tieOrder.get(r.chunkId())));
    return results;
  }

  /** Min-max normalisation; a constant score maps to 1 when positive, 0 otherwise. */
  @VisibleForTesting
  static double minMax(double value, double min, double max) {
    if (max - min < 1e-12) {
      return value > 0 ? 1.0 : 0.0;
    }
    return (value - min) / (max - min);
  }

  /**
   * Renders retrieved passages as prompt context, bounded by {@code
   * rag.retrieval.max-context-chars}.
   *
   * @param results ranked results
   * @return the context block, empty when there are no results
   */
  public String buildContext(List<RetrievalResult> results) {
    if (results.isEmpty()) {
      return "";
    }
    int budget = ragConfig.getRetrieval().getMaxContextChars();
    StringBuilder context = new StringBuilder();
    for (int i = 0; i < results.size(); i++) {
      RetrievalResult result = results.get(i);
      String header = String.format("[Source %d: %s]%n", i + 1, sourceLabel(result));
      int remaining = budget - context.length() - header.length();
      if (remaining <= 0) {
        break;
      }
      context.append(header);
      if (result.text().length() > remaining) {
        context.append(result.text(), 0, remaining);
        break;
      }
      context.append(result.text()).append("\n\n");
    }
    return context.toString().trim();
  }

  private static String sourceLabel(RetrievalResult result) {
    String title = result.title();
    String source = result.source();
    if (!title.isEmpty() && !title.equals(source)) {
      return source.isEmpty() ? title : source + " - " + title;
    }
    return source.isEmpty() ? result.chunkId() : source;
  }

  /** Mutable scoring state of one union member. */
  @VisibleForTesting
  static final class Candidate {
    final String chunkId;
    final String text;
    final Map<String, String> metadata;
    boolean hasDense;
    double denseScore;
    int denseRank = Integer.MAX_VALUE;
    double sparseScore;
    int sparseRank = Integer.MAX_VALUE;

    Candidate(String chunkId, String text, Map<String, String> metadata) {
      this.chunkId = chunkId;
      this.text = text;
      this.metadata = metadata;
    }
  }
}
