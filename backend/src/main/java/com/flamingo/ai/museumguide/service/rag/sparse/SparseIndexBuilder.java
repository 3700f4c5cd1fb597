package com.flamingo.ai.museumguide.service.rag.sparse;

import com.flamingo.ai.museumguide.config.RagConfig;
import com.flamingo.ai.museumguide.domain.model.Chunk;
import io.micrometer.core.annotation.Timed;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Fits a {@link SparseIndex} on a chunk corpus.
 *
 * <p>Terms are uni- and bi-grams of {@link TextTokenizer} tokens. Terms in fewer than {@code
 * minDf} chunks or in more than {@code maxDfRatio} of all chunks are pruned (the latter is
 * skipped below {@code minChunksForDfPruning} chunks, a single chunk by default); the
 * vocabulary keeps the {@code maxFeatures} terms with the highest corpus frequency (ties
 * alphabetical). IDF is smoothed: {@code ln((1 + n) / (1 + df)) + 1}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SparseIndexBuilder {

  private final TextTokenizer tokenizer;
  private final RagConfig ragConfig;

  /**
   * Builds a fresh index over all chunks. Deterministic for the same chunk list.
   *
   * @param chunks the full corpus
   * @return the fitted index
   */
  @Timed(value = "sparse.index.build", description = "Time to fit the TF-IDF index")
  public SparseIndex build(List<Chunk> chunks) {
    RagConfig.Sparse config = ragConfig.getSparse();
    int ngramMax = Math.max(1, config.getNgramMax());
    int n = chunks.size();

    Map<String, Map<String, Integer>> termCounts = new LinkedHashMap<>();
    Map<String, Integer> documentFrequency = new HashMap<>();
    Map<String, Long> corpusFrequency = new HashMap<>();
    for (Chunk chunk : chunks) {
      Map<String, Integer> counts = new HashMap<>();
      for (String term : tokenizer.terms(chunk.text(), ngramMax)) {
        counts.merge(term, 1, Integer::sum);
      }
      termCounts.put(chunk.id(), counts);
      for (Map.Entry<String, Integer> entry : counts.entrySet()) {
        documentFrequency.merge(entry.getKey(), 1, Integer::sum);
        corpusFrequency.merge(entry.getKey(), (long) entry.getValue(), Long::sum);
      }
    }

    Set<String> kept = new HashSet<>();
    boolean pruneCommon = n >= config.getMinChunksForDfPruning();
    double maxDocCount = config.getMaxDfRatio() * n;
    for (Map.Entry<String, Integer> entry : documentFrequency.entrySet()) {
      int df = entry.getValue();
      if (df < config.getMinDf()) {
        continue;
      }
      if (pruneCommon && df > maxDocCount) {
        continue;
      }
      kept.add(entry.getKey());
    }

    List<String> ranked = new ArrayList<>(kept);
    ranked.sort(
        Comparator.comparing((String term) -> corpusFrequency.get(term))
            .reversed()
            .thenComparing(Comparator.naturalOrder()));
    if (ranked.size() > config.getMaxFeatures()) {
      ranked = ranked.subList(0, config.getMaxFeatures());
    }
    ranked.sort(Comparator.naturalOrder());

    Map<String, Integer> vocabulary = new HashMap<>();
    double[] idf = new double[ranked.size()];
    for (int column = 0; column < ranked.size(); column++) {
      String term = ranked.get(column);
      vocabulary.put(term, column);
      idf[column] = Math.log((1.0 + n) / (1.0 + documentFrequency.get(term))) + 1.0;
    }

    Map<String, Map<Integer, Double>> vectors = new LinkedHashMap<>();
    Map<String, Chunk> byId = new LinkedHashMap<>();
    for (Chunk chunk : chunks) {
      Map<Integer, Double> weights = new HashMap<>();
      termCounts
          .get(chunk.id())
          .forEach(
              (term, tf) -> {
                Integer column = vocabulary.get(term);
                if (column != null) {
                  weights.put(column, tf * idf[column]);
                }
              });
      vectors.put(chunk.id(), SparseIndex.normalize(weights));
      byId.put(chunk.id(), chunk);
    }

    log.info(
        "Fitted sparse index: chunks={}, candidateTerms={}, vocabulary={}, dfPruning={}",
        n,
        documentFrequency.size(),
        vocabulary.size(),
        pruneCommon);
    return new SparseIndex(vocabulary, idf, ngramMax, vectors, byId);
  }
}
