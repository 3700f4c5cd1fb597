package com.flamingo.ai.museumguide.service.rag.sparse;

import com.flamingo.ai.museumguide.domain.model.Chunk;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable TF-IDF index over the chunk corpus.
 *
 * <p>Every chunk is stored as an L2-normalised weight vector over the fitted vocabulary, so the
 * cosine similarity with a query vector is a plain dot product. The index also keeps its own copy
 * of the chunks it was fitted on; it is replaced as a whole on every rebuild.
 */
public final class SparseIndex {

  private final Map<String, Integer> vocabulary;
  private final double[] idf;
  private final int ngramMax;
  private final Map<String, Map<Integer, Double>> vectors;
  private final Map<String, Chunk> chunks;
  private final Instant builtAt;

  SparseIndex(
      Map<String, Integer> vocabulary,
      double[] idf,
      int ngramMax,
      Map<String, Map<Integer, Double>> vectors,
      Map<String, Chunk> chunks) {
    this.vocabulary = Collections.unmodifiableMap(new HashMap<>(vocabulary));
    this.idf = idf.clone();
    this.ngramMax = ngramMax;
    this.vectors = Collections.unmodifiableMap(new LinkedHashMap<>(vectors));
    this.chunks = Collections.unmodifiableMap(new LinkedHashMap<>(chunks));
    this.builtAt = Instant.now();
  }

  public static SparseIndex empty() {
    return new SparseIndex(Map.of(), new double[0], 1, Map.of(), Map.of());
  }

  public int vocabularySize() {
    return vocabulary.size();
  }

  public int chunkCount() {
    return chunks.size();
  }

  public int ngramMax() {
    return ngramMax;
  }

  public Instant builtAt() {
    return builtAt;
  }

  public boolean containsTerm(String term) {
    return vocabulary.containsKey(term);
  }

  public Chunk chunk(String chunkId) {
    return chunks.get(chunkId);
  }

  /**
   * Projects query terms onto the vocabulary; out-of-vocabulary terms are ignored.
   *
   * @param terms query terms, as produced by {@link TextTokenizer#terms(String, int)}
   * @return L2-normalised sparse vector, empty when no term is known
   */
  public Map<Integer, Double> vectorize(List<String> terms) {
    Map<Integer, Double> counts = new HashMap<>();
    for (String term : terms) {
      Integer column = vocabulary.get(term);
      if (column != null) {
        counts.merge(column, 1.0, Double::sum);
      }
    }
    counts.replaceAll((column, tf) -> tf * idf[column]);
    return normalize(counts);
  }

  /** Cosine similarity between a query vector and one chunk; 0 for unknown chunks. */
  public double score(Map<Integer, Double> queryVector, String chunkId) {
    Map<Integer, Double> chunkVector = vectors.get(chunkId);
    if (chunkVector == null || queryVector.isEmpty()) {
      return 0.0;
    }
    Map<Integer, Double> smaller =
        queryVector.size() <= chunkVector.size() ? queryVector : chunkVector;
    Map<Integer, Double> larger = smaller == queryVector ? chunkVector : queryVector;
    double dot = 0.0;
    for (Map.Entry<Integer, Double> entry : smaller.entrySet()) {
      Double other = larger.get(entry.getKey());
      if (other != null) {
        dot += entry.getValue() * other;
      }
    }
    return dot;
  }

  /**
   * Top chunks by cosine similarity with a positive score, best first; ties keep corpus order.
   *
   * @param queryVector vector from {@link #vectorize(List)}
   * @param limit maximum number of matches
   * @return ranked matches
   */
  public List<SparseMatch> search(Map<Integer, Double> queryVector, int limit) {
    if (queryVector.isEmpty() || limit <= 0) {
      return List.of();
    }
    List<SparseMatch> matches = new ArrayList<>();
    for (String chunkId : vectors.keySet()) {
      double score = score(queryVector, chunkId);
      if (score > 0) {
        matches.add(new SparseMatch(chunkId, score));
      }
    }
    matches.sort(Comparator.comparingDouble(SparseMatch::score).reversed());
    return matches.size() > limit ? List.copyOf(matches.subList(0, limit)) : matches;
  }

  static Map<Integer, Double> normalize(Map<Integer, Double> weights) {
    double norm = 0.0;
    for (double w : weights.values()) {
      norm += w * w;
    }
    if (norm == 0.0) {
      return Map.of();
    }
    double length = Math.sqrt(norm);
    Map<Integer, Double> normalized = new HashMap<>(weights.size());
    weights.forEach((column, w) -> normalized.put(column, w / length));
    return normalized;
  }

  /**
   * A chunk found by the sparse index.
   *
   * @param chunkId chunk identifier
   * @param score cosine similarity in (0, 1]
   */
  public record SparseMatch(String chunkId, double score) {}
}
