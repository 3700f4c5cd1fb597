package com.flamingo.ai.museumguide.service.rag.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.museumguide.config.RagConfig;
import com.flamingo.ai.museumguide.domain.model.Chunk;
import com.flamingo.ai.museumguide.domain.model.RetrievalResult;
import com.flamingo.ai.museumguide.exception.RetrievalUnavailableException;
import com.flamingo.ai.museumguide.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.museumguide.service.rag.index.IndexBuildService;
import com.flamingo.ai.museumguide.service.rag.index.IndexLease;
import com.flamingo.ai.museumguide.service.rag.index.IndexSnapshot;
import com.flamingo.ai.museumguide.service.rag.sparse.SparseIndex;
import com.flamingo.ai.museumguide.service.rag.sparse.SparseIndexBuilder;
import com.flamingo.ai.museumguide.service.rag.sparse.TextTokenizer;
import com.flamingo.ai.museumguide.vectorstore.VectorMatch;
import com.flamingo.ai.museumguide.vectorstore.VectorStore;
import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import org.assertj.core.data.Offset;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.aop.aspectj.annotation.AspectJProxyFactory;

@ExtendWith(MockitoExtension.class)
@DisplayName("HybridRetriever Tests")
class HybridRetrieverTest {

  private static final String COLLECTION = "museum-guide-chunks-1";
  private static final List<Float> QUERY_VECTOR = List.of(0.1f, 0.2f, 0.3f);

  @Mock private IndexBuildService indexBuildService;
  @Mock private EmbeddingService embeddingService;
  @Mock private VectorStore vectorStore;

  private TextTokenizer tokenizer;
  private RagConfig ragConfig;
  private SimpleMeterRegistry meterRegistry;
  private HybridRetriever retriever;
  private AtomicInteger releasedLeases;

  private final Chunk founding =
      chunk("itri_0", "ITRI was founded in 1973 to lead industrial research.", Map.of());
  private final Chunk robots =
      chunk("robots_0", "The robot hall shows industrial arms assembling chips.", Map.of());
  private final Chunk cafe = chunk("cafe_0", "The museum cafe opens at nine.", Map.of());
  private final Chunk qaPair =
      chunk(
          "faq_0",
          "Q: When was ITRI founded? A: ITRI was founded in 1973.",
          Map.of(Chunk.META_QA_PAIR, "true"));

  @BeforeEach
  void setUp() {
    tokenizer = new TextTokenizer();
    ragConfig = new RagConfig();
    meterRegistry = new SimpleMeterRegistry();
    releasedLeases = new AtomicInteger();
    retriever =
        new HybridRetriever(
            indexBuildService, embeddingService, vectorStore, tokenizer, ragConfig, meterRegistry);
  }

  @AfterEach
  void tearDown() {
    tokenizer.close();
  }

  private static Chunk chunk(String id, String text, Map<String, String> extra) {
    Map<String, String> metadata = new HashMap<>(extra);
    metadata.put(Chunk.META_SOURCE, id.substring(0, id.indexOf('_')) + ".txt");
    return Chunk.builder()
        .id(id)
        .text(text)
        .sourceFile(metadata.get(Chunk.META_SOURCE))
        .index(0)
        .language("en")
        .metadata(metadata)
        .build();
  }

  private void activate(List<Chunk> chunks) {
    SparseIndex sparseIndex = new SparseIndexBuilder(tokenizer, ragConfig).build(chunks);
    IndexSnapshot snapshot =
        new IndexSnapshot(1, COLLECTION, sparseIndex, chunks.size(), Instant.now());
    lenient()
        .when(indexBuildService.acquire())
        .thenAnswer(
            inv -> Optional.of(new IndexLease(snapshot, releasedLeases::incrementAndGet)));
    lenient().when(embeddingService.embedQuery(anyString())).thenReturn(QUERY_VECTOR);
  }

  private static VectorMatch dense(Chunk chunk, double score) {
    return new VectorMatch(chunk.id(), chunk.text(), chunk.metadata(), score);
  }

  @Nested
  @DisplayName("search")
  class Search {

    @Test
    @DisplayName("should rank the founding passage first for the founding-year question")
    void shouldRankFoundingPassageFirst() {
      activate(List.of(founding, robots, cafe));
      when(vectorStore.queryByVector(eq(COLLECTION), eq(QUERY_VECTOR), anyInt()))
          .thenReturn(List.of(dense(founding, 0.82), dense(robots, 0.61), dense(cafe, 0.40)));

      List<RetrievalResult> results = retriever.search("When was ITRI founded?");

      assertThat(results).isNotEmpty();
      assertThat(results.get(0).chunkId()).isEqualTo("itri_0");
      assertThat(results.get(0).text()).contains("1973");
    }

    @Test
    @DisplayName("should return unique chunks with non-increasing combined scores")
    void shouldReturnUniqueRankedResults() {
      activate(List.of(founding, robots, cafe));
      when(vectorStore.queryByVector(eq(COLLECTION), eq(QUERY_VECTOR), anyInt()))
          .thenReturn(
              List.of(
                  dense(robots, 0.90),
                  dense(founding, 0.70),
                  dense(robots, 0.65),
                  dense(cafe, 0.30)));

      List<RetrievalResult> results = retriever.search("industrial research history");

      assertThat(results).extracting(RetrievalResult::chunkId).doesNotHaveDuplicates();
      for (int i = 1; i < results.size(); i++) {
        assertThat(results.get(i).combinedScore())
            .isLessThanOrEqualTo(results.get(i - 1).combinedScore());
      }
      assertThat(results)
          .allSatisfy(
              r -> {
                assertThat(r.normalizedDenseScore()).isBetween(0.0, 1.0);
                assertThat(r.normalizedSparseScore()).isBetween(0.0, 1.0);
              });
    }

    @Test
    @DisplayName("should over-fetch candidates from the vector store")
    void shouldOverFetch() {
      activate(List.of(founding, robots, cafe));
      when(vectorStore.queryByVector(COLLECTION, QUERY_VECTOR, 6)).thenReturn(List.of());

      retriever.search("robot arms", 3);

      verify(vectorStore).queryByVector(COLLECTION, QUERY_VECTOR, 6);
    }

    @Test
    @DisplayName("should include chunks found only by the sparse index")
    void shouldIncludeSparseOnlyChunks() {
      activate(List.of(founding, robots, cafe));
      when(vectorStore.queryByVector(eq(COLLECTION), eq(QUERY_VECTOR), anyInt()))
          .thenReturn(List.of(dense(robots, 0.5)));

      List<RetrievalResult> results = retriever.search("museum cafe");

      assertThat(results)
          .filteredOn(r -> r.chunkId().equals("cafe_0"))
          .singleElement()
          .satisfies(
              r -> {
                assertThat(r.denseRank()).isEqualTo(-1);
                assertThat(r.normalizedDenseScore()).isZero();
                assertThat(r.normalizedSparseScore()).isPositive();
              });
    }

    @Test
    @DisplayName("should drop question-answer chunks when the query is a question")
    void shouldExcludeQaPairsForQuestions() {
      activate(List.of(founding, qaPair, robots));
      when(vectorStore.queryByVector(eq(COLLECTION), eq(QUERY_VECTOR), anyInt()))
          .thenReturn(List.of(dense(qaPair, 0.95), dense(founding, 0.80)));

      List<RetrievalResult> results = retriever.search("When was ITRI founded?");

      assertThat(results).extracting(RetrievalResult::chunkId).doesNotContain("faq_0");
      assertThat(results.get(0).chunkId()).isEqualTo("itri_0");
    }

    @Test
    @DisplayName("should keep question-answer chunks for statements")
    void shouldKeepQaPairsForStatements() {
      activate(List.of(founding, qaPair, robots));
      when(vectorStore.queryByVector(eq(COLLECTION), eq(QUERY_VECTOR), anyInt()))
          .thenReturn(List.of(dense(qaPair, 0.95), dense(founding, 0.80)));

      List<RetrievalResult> results = retriever.search("ITRI founding year");

      assertThat(results).extracting(RetrievalResult::chunkId).contains("faq_0");
    }

    @Test
    @DisplayName("should truncate to topK")
    void shouldTruncateToTopK() {
      activate(List.of(founding, robots, cafe));
      when(vectorStore.queryByVector(eq(COLLECTION), eq(QUERY_VECTOR), anyInt()))
          .thenReturn(List.of(dense(founding, 0.9), dense(robots, 0.8), dense(cafe, 0.7)));

      assertThat(retriever.search("industrial museum", 2)).hasSize(2);
    }

    @Test
    @DisplayName("should return nothing for a blank query without touching the index")
    void shouldReturnEmptyForBlankQuery() {
      assertThat(retriever.search("   ")).isEmpty();
    }

    @Test
    @DisplayName("should fail as unavailable when no index is active")
    void shouldFailWithoutIndex() {
      when(indexBuildService.acquire()).thenReturn(Optional.empty());

      assertThatThrownBy(() -> retriever.search("When was ITRI founded?"))
          .isInstanceOf(RetrievalUnavailableException.class);
    }

    @Test
    @DisplayName("should fail as unavailable when the vector store fails")
    void shouldFailWhenDenseSearchFails() {
      activate(List.of(founding));
      when(vectorStore.queryByVector(anyString(), anyList(), anyInt()))
          .thenThrow(new IllegalStateException("connection refused"));

      assertThatThrownBy(() -> retriever.search("ITRI"))
          .isInstanceOf(RetrievalUnavailableException.class)
          .hasMessageContaining("connection refused");
      assertThat(meterRegistry.counter("rag.search.failures", "stage", "dense").count())
          .isEqualTo(1.0);
      assertThat(releasedLeases).hasValue(1);
    }

    @Test
    @DisplayName("should release the index lease after a search")
    void shouldReleaseLease() {
      activate(List.of(founding, robots, cafe));
      when(vectorStore.queryByVector(eq(COLLECTION), eq(QUERY_VECTOR), anyInt()))
          .thenReturn(List.of(dense(founding, 0.82)));

      retriever.search("ITRI");
      retriever.search("robot arms");

      assertThat(releasedLeases).hasValue(2);
    }

    @Test
    @DisplayName("should record the search timer for the default top-k overload")
    void shouldTimeDefaultOverload() {
      activate(List.of(founding, robots, cafe));
      when(vectorStore.queryByVector(eq(COLLECTION), eq(QUERY_VECTOR), anyInt()))
          .thenReturn(List.of(dense(founding, 0.82)));
      AspectJProxyFactory factory = new AspectJProxyFactory(retriever);
      factory.setProxyTargetClass(true);
      factory.addAspect(new TimedAspect(meterRegistry));
      HybridRetriever proxied = factory.getProxy();

      proxied.search("When was ITRI founded?");

      Timer timer = meterRegistry.find("rag.search").timer();
      assertThat(timer).isNotNull();
      assertThat(timer.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("should reject weights that do not sum to one")
    void shouldRejectInvalidWeights() {
      ragConfig.getRetrieval().setSparseWeight(0.5);

      assertThatThrownBy(() -> retriever.search("ITRI")).isInstanceOf(IllegalStateException.class);
    }
  }

  @Nested
  @DisplayName("fuse")
  class Fuse {

    private HybridRetriever.Candidate candidate(String id, Double dense, int rank, double sparse) {
      HybridRetriever.Candidate c = new HybridRetriever.Candidate(id, id, Map.of());
      if (dense != null) {
        c.hasDense = true;
        c.denseScore = dense;
        c.denseRank = rank;
      } else {
        c.sparseRank = rank;
      }
      c.sparseScore = sparse;
      return c;
    }

    @Test
    @DisplayName("should weight normalised dense and sparse scores 0.7 / 0.3")
    void shouldWeightScores() {
      List<HybridRetriever.Candidate> candidates = new ArrayList<>();
      candidates.add(candidate("a", 0.9, 0, 0.0));
      candidates.add(candidate("b", 0.5, 1, 0.8));

      List<RetrievalResult> results = HybridRetriever.fuse(candidates, 0.7);

      assertThat(results.get(0).chunkId()).isEqualTo("a");
      assertThat(results.get(0).combinedScore()).isCloseTo(0.7, within());
      assertThat(results.get(1).combinedScore()).isCloseTo(0.3, within());
    }

    @Test
    @DisplayName("should keep dense order for equal combined scores")
    void shouldBreakTiesByDenseRank() {
      List<HybridRetriever.Candidate> candidates = new ArrayList<>();
      candidates.add(candidate("second", 0.5, 1, 0.0));
      candidates.add(candidate("first", 0.5, 0, 0.0));
      candidates.add(candidate("sparse-only", null, 0, 0.0));

      List<RetrievalResult> results = HybridRetriever.fuse(candidates, 0.7);

      assertThat(results)
          .extracting(RetrievalResult::chunkId)
          .containsExactly("first", "second", "sparse-only");
    }

    private Offset<Double> within() {
      return Offset.offset(1e-9);
    }
  }

  @Test
  @DisplayName("minMax should map constant scores to 1 when positive and 0 otherwise")
  void minMaxShouldHandleConstantScores() {
    assertThat(HybridRetriever.minMax(0.4, 0.4, 0.4)).isEqualTo(1.0);
    assertThat(HybridRetriever.minMax(0.0, 0.0, 0.0)).isEqualTo(0.0);
    assertThat(HybridRetriever.minMax(0.5, 0.0, 1.0)).isEqualTo(0.5);
  }

  @Nested
  @DisplayName("buildContext")
  class BuildContext {

    private RetrievalResult result(String id, String text) {
      return new RetrievalResult(
          id, text, Map.of(Chunk.META_SOURCE, id + ".txt"), 0.5, 0.5, 1, 1, 1, 0);
    }

    @Test
    @DisplayName("should label each passage with its source")
    void shouldLabelSources() {
      String context =
          retriever.buildContext(
              List.of(result("itri", "Founded 1973."), result("hall", "Robots.")));

      assertThat(context)
          .startsWith("[Source 1: itri.txt]")
          .contains("Founded 1973.")
          .contains("[Source 2: hall.txt]");
    }

    @Test
    @DisplayName("should stay within the context character budget")
    void shouldRespectBudget() {
      ragConfig.getRetrieval().setMaxContextChars(120);

      String context =
          retriever.buildContext(
              List.of(result("a", "x".repeat(100)), result("b", "y".repeat(100))));

      assertThat(context.length()).isLessThanOrEqualTo(120);
      assertThat(context).doesNotContain("[Source 2");
    }

    @Test
    @DisplayName("should be empty without results")
    void shouldBeEmptyWithoutResults() {
      assertThat(retriever.buildContext(List.of())).isEmpty();
    }
  }
}
