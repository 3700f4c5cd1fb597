package com.flamingo.ai.museumguide.vectorstore;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import com.flamingo.ai.museumguide.config.RagConfig;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Vector store backed by Elasticsearch kNN search. Each collection is its own index with a cosine
 * {@code dense_vector} field; undeclared fields are not mapped.
 */
@Component
@ConditionalOnProperty(name = "rag.vector-store.type", havingValue = "elasticsearch")
@Slf4j
public class ElasticsearchVectorStore implements VectorStore {

  private static final String FIELD_CHUNK_ID = "chunkId";
  private static final String FIELD_CONTENT = "content";
  private static final String FIELD_METADATA = "metadata";
  private static final String FIELD_EMBEDDING = "embedding";

  private final ElasticsearchClient elasticsearchClient;
  private final MeterRegistry meterRegistry;
  private final String indexPrefix;
  private final int vectorDimensions;

  public ElasticsearchVectorStore(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry, RagConfig ragConfig) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
    this.indexPrefix = ragConfig.getVectorStore().getIndexPrefix();
    this.vectorDimensions = ragConfig.getVectorStore().getDimensions();
  }

  @Override
  public String createCollection(String name) {
    String indexName = (indexPrefix + "-" + name).toLowerCase(Locale.ROOT);
    CreateIndexRequest request =
        CreateIndexRequest.of(
            c ->
                c.index(indexName)
                    .mappings(
                        m -> m.dynamic(DynamicMapping.False).properties(defineIndexProperties())));
    try {
      elasticsearchClient.indices().create(request);
      log.info("Created Elasticsearch index: {}", indexName);
      return indexName;
    } catch (IOException e) {
      log.error("Failed to create index {}: {}", indexName, e.getMessage(), e);
      throw new UncheckedIOException("Failed to create index " + indexName, e);
    }
  }

  private Map<String, Property> defineIndexProperties() {
    Map<String, Property> properties = new HashMap<>();
    properties.put(FIELD_CHUNK_ID, Property.of(p -> p.keyword(k -> k)));
    properties.put(FIELD_CONTENT, Property.of(p -> p.text(t -> t.index(false))));
    properties.put(FIELD_METADATA, Property.of(p -> p.object(o -> o.enabled(false))));
    properties.put(
        FIELD_EMBEDDING,
        Property.of(
            p ->
                p.denseVector(
                    DenseVectorProperty.of(
                        d ->
                            d.dims(vectorDimensions)
                                .index(true)
                                .similarity(DenseVectorSimilarity.Cosine)))));
    return properties;
  }

  @Override
  @Timed(value = "elasticsearch.index", description = "Time to index chunk vectors")
  public void upsert(String collection, List<VectorRecord> records) {
    if (records.isEmpty()) {
      return;
    }
    try {
      BulkRequest.Builder bulkBuilder = new BulkRequest.Builder();
      for (VectorRecord record : records) {
        Map<String, Object> docMap = new HashMap<>();
        docMap.put(FIELD_CHUNK_ID, record.chunkId());
        docMap.put(FIELD_CONTENT, record.text());
        docMap.put(FIELD_METADATA, record.metadata());
        docMap.put(FIELD_EMBEDDING, record.embedding());
        bulkBuilder.operations(
            op -> op.index(idx -> idx.index(collection).id(record.chunkId()).document(docMap)));
      }

      BulkResponse response = elasticsearchClient.bulk(bulkBuilder.build());
      if (response.errors()) {
        meterRegistry.counter("vector_store.index.errors").increment();
        throw new IllegalStateException(
            "Bulk indexing into " + collection + " reported errors: " + response.items());
      }
      elasticsearchClient.indices().refresh(r -> r.index(collection));
      log.debug("Indexed {} vectors into {}", records.size(), collection);
      meterRegistry.counter("vector_store.indexed").increment(records.size());
    } catch (IOException e) {
      log.error("Failed to index vectors into {}: {}", collection, e.getMessage(), e);
      throw new UncheckedIOException("Failed to index vectors into " + collection, e);
    }
  }

  @Override
  @Timed(value = "elasticsearch.vector_search", description = "Time for vector search")
  @SuppressWarnings("unchecked")
  public List<VectorMatch> queryByVector(String collection, List<Float> vector, int topK) {
    SearchRequest request =
        SearchRequest.of(
            s ->
                s.index(collection)
                    .knn(
                        k ->
                            k.field(FIELD_EMBEDDING)
                                .queryVector(vector)
                                .k(topK)
                                .numCandidates(topK * 2))
                    .size(topK));
    try {
      SearchResponse<Map> response = elasticsearchClient.search(request, Map.class);
      List<VectorMatch> matches = new ArrayList<>();
      for (Hit<Map> hit : response.hits().hits()) {
        Map<String, Object> source = hit.source();
        if (source == null) {
          continue;
        }
        Map<String, String> metadata = new HashMap<>();
        Object rawMetadata = source.get(FIELD_METADATA);
        if (rawMetadata instanceof Map<?, ?> m) {
          m.forEach((key, value) -> metadata.put(String.valueOf(key), String.valueOf(value)));
        }
        matches.add(
            new VectorMatch(
                hit.id(),
                String.valueOf(source.get(FIELD_CONTENT)),
                metadata,
                hit.score() != null ? hit.score() : 0.0));
      }
      log.debug("[vectorSearch] index={} returned={}", collection, matches.size());
      meterRegistry.counter("vector_store.vector_search").increment();
      return matches;
    } catch (IOException e) {
      log.error("Vector search failed for {}: {}", collection, e.getMessage(), e);
      throw new UncheckedIOException("Vector search failed for " + collection, e);
    }
  }

  @Override
  public void dropCollection(String collection) {
    try {
      boolean exists = elasticsearchClient.indices().exists(e -> e.index(collection)).value();
      if (exists) {
        elasticsearchClient.indices().delete(d -> d.index(collection));
        log.info("Deleted Elasticsearch index: {}", collection);
      }
    } catch (IOException e) {
      log.error("Failed to delete index {}: {}", collection, e.getMessage(), e);
      throw new UncheckedIOException("Failed to delete index " + collection, e);
    }
  }

  @Override
  public String type() {
    return "elasticsearch";
  }
}
