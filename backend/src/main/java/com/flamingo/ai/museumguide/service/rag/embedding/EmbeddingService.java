package com.flamingo.ai.museumguide.service.rag.embedding;

import com.flamingo.ai.museumguide.exception.RetrievalUnavailableException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Service for generating text embeddings through the configured embedding model. */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  // bge-m3 accepts 8192 tokens; dense CJK text can be close to one char per token
  private static final int MAX_CHARS_PER_EMBEDDING = 5000;

  private final EmbeddingModel embeddingModel;
  private final MeterRegistry meterRegistry;

  /**
   * Embeds a visitor query.
   *
   * @param query the query text
   * @return embedding vector
   * @throws RetrievalUnavailableException if the embedding backend fails
   */
  @Timed(value = "embedding.embedQuery", description = "Time to embed query")
  @CircuitBreaker(name = "inference", fallbackMethod = "embedQueryFallback")
  @Retry(name = "inference")
  public List<Float> embedQuery(String query) {
    log.debug("embedQuery called, input length: {} chars", query.length());
    try {
      List<Float> vector = embed(truncate(query, "Query"));
      meterRegistry.counter("embedding.requests.success", "type", "query").increment();
      return vector;
    } catch (RetrievalUnavailableException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new RetrievalUnavailableException("Query embedding failed: " + e.getMessage(), e);
    }
  }

  /**
   * Embeds a corpus passage (chunk) for the dense index.
   *
   * @param passage the passage text
   * @return embedding vector
   */
  @Timed(value = "embedding.embedPassage", description = "Time to embed passage")
  @CircuitBreaker(name = "inference")
  @Retry(name = "inference")
  public List<Float> embedPassage(String passage) {
    log.debug("embedPassage called, input length: {} chars", passage.length());
    List<Float> vector = embed(truncate(passage, "Passage"));
    meterRegistry.counter("embedding.requests.success", "type", "passage").increment();
    return vector;
  }

  private List<Float> embed(String text) {
    Response<Embedding> response = embeddingModel.embed(text);
    if (response == null
        || response.content() == null
        || response.content().vector().length == 0) {
      throw new IllegalStateException("Embedding model returned an empty vector");
    }
    return toFloatList(response.content().vector());
  }

  private String truncate(String text, String kind) {
    if (text.length() > MAX_CHARS_PER_EMBEDDING) {
      log.warn(
          "{} too long for embedding, truncating from {} chars to {} chars",
          kind,
          text.length(),
          MAX_CHARS_PER_EMBEDDING);
      return text.substring(0, MAX_CHARS_PER_EMBEDDING);
    }
    return text;
  }

  /** Converts float array to Float list. */
  private List<Float> toFloatList(float[] vector) {
    List<Float> result = new ArrayList<>(vector.length);
    for (float f : vector) {
      result.add(f);
    }
    return result;
  }

  @SuppressWarnings("unused")
  private List<Float> embedQueryFallback(String query, Throwable t) {
    log.error("Query embedding failed, circuit breaker fallback: {}", t.getMessage());
    meterRegistry.counter("embedding.requests.failure", "type", "query").increment();
    if (t instanceof RetrievalUnavailableException rue) {
      throw rue;
    }
    throw new RetrievalUnavailableException("Embedding backend unavailable: " + t.getMessage(), t);
  }
}
