package com.flamingo.ai.museumguide.vectorstore;

import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Vector store kept in process memory, one LangChain4j in-memory store per collection. */
@Component
@ConditionalOnProperty(
    name = "rag.vector-store.type",
    havingValue = "in-memory",
    matchIfMissing = true)
@Slf4j
public class InMemoryVectorStore implements VectorStore {

  private final Map<String, InMemoryEmbeddingStore<TextSegment>> collections =
      new ConcurrentHashMap<>();

  @Override
  public String createCollection(String name) {
    collections.put(name, new InMemoryEmbeddingStore<>());
    log.debug("Created in-memory collection {}", name);
    return name;
  }

  @Override
  public void upsert(String collection, List<VectorRecord> records) {
    InMemoryEmbeddingStore<TextSegment> store = require(collection);
    for (VectorRecord record : records) {
      store.remove(record.chunkId());
      TextSegment segment = TextSegment.from(record.text(), Metadata.from(record.metadata()));
      store.addAll(
          List.of(record.chunkId()), List.of(toEmbedding(record.embedding())), List.of(segment));
    }
  }

  @Override
  public List<VectorMatch> queryByVector(String collection, List<Float> vector, int topK) {
    EmbeddingSearchRequest request =
        EmbeddingSearchRequest.builder()
            .queryEmbedding(toEmbedding(vector))
            .maxResults(topK)
            .minScore(0.0)
            .build();
    List<VectorMatch> matches = new ArrayList<>();
    for (EmbeddingMatch<TextSegment> match : require(collection).search(request).matches()) {
      TextSegment segment = match.embedded();
      Map<String, String> metadata = new HashMap<>();
      segment.metadata().toMap().forEach((k, v) -> metadata.put(k, String.valueOf(v)));
      matches.add(new VectorMatch(match.embeddingId(), segment.text(), metadata, match.score()));
    }
    return matches;
  }

  @Override
  public void dropCollection(String collection) {
    if (collections.remove(collection) != null) {
      log.debug("Dropped in-memory collection {}", collection);
    }
  }

  @Override
  public String type() {
    return "in-memory";
  }

  private InMemoryEmbeddingStore<TextSegment> require(String collection) {
    InMemoryEmbeddingStore<TextSegment> store = collections.get(collection);
    if (store == null) {
      throw new IllegalStateException("Unknown vector collection: " + collection);
    }
    return store;
  }

  private static Embedding toEmbedding(List<Float> vector) {
    float[] values = new float[vector.size()];
    for (int i = 0; i < values.length; i++) {
      values[i] = vector.get(i);
    }
    return Embedding.from(values);
  }
}
