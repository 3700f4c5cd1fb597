package com.flamingo.ai.museumguide.vectorstore;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("InMemoryVectorStore Tests")
class InMemoryVectorStoreTest {

  private InMemoryVectorStore store;

  @BeforeEach
  void setUp() {
    store = new InMemoryVectorStore();
  }

  private static VectorRecord record(String id, float x, float y) {
    return new VectorRecord(id, "text " + id, Map.of("source", id + ".txt"), List.of(x, y));
  }

  @Test
  @DisplayName("should return nearest neighbours best first with their metadata")
  void shouldRankByCosine() {
    String collection = store.createCollection("gen-1");
    store.upsert(
        collection, List.of(record("east", 1f, 0f), record("north", 0f, 1f), record("ne", 1f, 1f)));

    List<VectorMatch> matches = store.queryByVector(collection, List.of(1f, 0.1f), 2);

    assertThat(matches).extracting(VectorMatch::chunkId).containsExactly("east", "ne");
    assertThat(matches.get(0).metadata()).containsEntry("source", "east.txt");
    assertThat(matches.get(0).score()).isGreaterThan(matches.get(1).score());
  }

  @Test
  @DisplayName("should replace a record upserted twice")
  void shouldReplaceOnUpsert() {
    String collection = store.createCollection("gen-1");
    store.upsert(collection, List.of(record("a", 1f, 0f)));
    store.upsert(collection, List.of(record("a", 0f, 1f)));

    List<VectorMatch> matches = store.queryByVector(collection, List.of(0f, 1f), 10);

    assertThat(matches).singleElement().extracting(VectorMatch::chunkId).isEqualTo("a");
    assertThat(matches.get(0).score()).isGreaterThan(0.99);
  }

  @Test
  @DisplayName("should keep collections apart and forget dropped ones")
  void shouldIsolateCollections() {
    String first = store.createCollection("gen-1");
    String second = store.createCollection("gen-2");
    store.upsert(first, List.of(record("a", 1f, 0f)));

    assertThat(store.queryByVector(second, List.of(1f, 0f), 10)).isEmpty();

    store.dropCollection(first);
    store.dropCollection("never-created");

    assertThatThrownBy(() -> store.queryByVector(first, List.of(1f, 0f), 10))
        .isInstanceOf(IllegalStateException.class);
  }
}
