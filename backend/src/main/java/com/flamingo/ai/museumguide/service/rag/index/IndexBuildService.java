package com.flamingo.ai.museumguide.service.rag.index;

import com.flamingo.ai.museumguide.config.RagConfig;
import com.flamingo.ai.museumguide.domain.model.Chunk;
import com.flamingo.ai.museumguide.domain.model.SourceDocument;
import com.flamingo.ai.museumguide.exception.IndexBuildFailedException;
import com.flamingo.ai.museumguide.service.rag.chunking.DocumentChunker;
import com.flamingo.ai.museumguide.service.rag.corpus.CorpusLoader;
import com.flamingo.ai.museumguide.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.museumguide.service.rag.sparse.SparseIndex;
import com.flamingo.ai.museumguide.service.rag.sparse.SparseIndexBuilder;
import com.flamingo.ai.museumguide.vectorstore.VectorRecord;
import com.flamingo.ai.museumguide.vectorstore.VectorStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Builds the dense and sparse indexes and publishes them as one {@link IndexSnapshot}.
 *
 * <p>A build writes into a fresh vector store collection. The active snapshot is replaced only
 * after every chunk has been embedded and stored and the sparse index has been fitted; on any
 * failure the new collection is dropped and the previous snapshot stays active. Builds run one at
 * a time; readers always see a complete snapshot.
 *
 * <p>Readers hold a snapshot through an {@link IndexLease}. A replaced snapshot's collection is
 * dropped once the swap has happened and the last lease on it is closed, so a search that started
 * before a rebuild finishes against the collection it began with.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IndexBuildService {

  private static final int UPSERT_BATCH_SIZE = 32;

  private final DocumentChunker chunker;
  private final CorpusLoader corpusLoader;
  private final EmbeddingService embeddingService;
  private final SparseIndexBuilder sparseIndexBuilder;
  private final VectorStore vectorStore;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  private final AtomicReference<Generation> active = new AtomicReference<>();
  private final AtomicLong generations = new AtomicLong();
  private final ReentrantLock buildLock = new ReentrantLock();

  /**
   * Loads, chunks and indexes the configured corpus directory.
   *
   * @return the new active snapshot
   * @throws IndexBuildFailedException if loading, embedding or storing fails
   */
  public IndexSnapshot rebuildFromCorpus() {
    Path corpus = Path.of(ragConfig.getIndex().getCorpusPath());
    log.info("Rebuilding index from corpus {}", corpus.toAbsolutePath());
    List<SourceDocument> documents = corpusLoader.load(corpus);
    return build(chunkAll(documents));
  }

  /**
   * Chunks documents in order with the configured window.
   *
   * @param documents source documents
   * @return all chunks, in document order
   */
  public List<Chunk> chunkAll(List<SourceDocument> documents) {
    List<Chunk> chunks = new ArrayList<>();
    for (SourceDocument document : documents) {
      chunks.addAll(chunker.chunk(document));
    }
    return chunks;
  }

  /**
   * Indexes the given chunks and makes them the active index.
   *
   * @param chunks chunks with unique ids
   * @return the new active snapshot
   * @throws IndexBuildFailedException if the input is invalid or any indexing step fails
   */
  @Timed(value = "index.build", description = "Time to build dense and sparse indexes")
  public IndexSnapshot build(List<Chunk> chunks) {
    validate(chunks);
    buildLock.lock();
    try {
      long generation = generations.incrementAndGet();
      String collection;
      try {
        collection =
            vectorStore.createCollection("gen-" + System.currentTimeMillis() + "-" + generation);
      } catch (RuntimeException e) {
        meterRegistry.counter("index.build.failures").increment();
        throw new IndexBuildFailedException("Could not create vector collection", e);
      }

      SparseIndex sparseIndex;
      try {
        indexDense(collection, chunks);
        sparseIndex = sparseIndexBuilder.build(chunks);
      } catch (RuntimeException e) {
        log.error(
            "Index build generation {} failed, discarding collection {}: {}",
            generation,
            collection,
            e.getMessage(),
            e);
        discard(collection, e);
        meterRegistry.counter("index.build.failures").increment();
        throw new IndexBuildFailedException("Index build failed: " + e.getMessage(), e);
      }

      IndexSnapshot snapshot =
          new IndexSnapshot(generation, collection, sparseIndex, chunks.size(), Instant.now());
      Generation previous = active.getAndSet(new Generation(snapshot));
      if (previous != null) {
        // gives up the active reference; open leases keep the collection alive
        release(previous);
      }
      meterRegistry.counter("index.build.success").increment();
      log.info(
          "Index generation {} active: chunks={}, vocabulary={}, collection={}",
          generation,
          chunks.size(),
          sparseIndex.vocabularySize(),
          collection);
      return snapshot;
    } finally {
      buildLock.unlock();
    }
  }

  /** The active snapshot, empty before the first successful build. */
  public Optional<IndexSnapshot> current() {
    return Optional.ofNullable(active.get()).map(g -> g.snapshot);
  }

  /**
   * Leases the active snapshot. The caller must close the lease when it no longer reads the
   * snapshot's collection.
   *
   * @return the lease, empty before the first successful build
   */
  public Optional<IndexLease> acquire() {
    while (true) {
      Generation generation = active.get();
      if (generation == null) {
        return Optional.empty();
      }
      int holders = generation.holders.get();
      // zero means retired and drained; the next read sees the replacement
      if (holders > 0 && generation.holders.compareAndSet(holders, holders + 1)) {
        return Optional.of(new IndexLease(generation.snapshot, () -> release(generation)));
      }
    }
  }

  public boolean isReady() {
    return active.get() != null;
  }

  public IndexStatus status() {
    IndexSnapshot snapshot = current().orElse(null);
    if (snapshot == null) {
      return new IndexStatus(false, 0, 0, 0, vectorStore.type(), null);
    }
    return new IndexStatus(
        true,
        snapshot.generation(),
        snapshot.chunkCount(),
        snapshot.sparseIndex().vocabularySize(),
        vectorStore.type(),
        snapshot.builtAt());
  }

  private void indexDense(String collection, List<Chunk> chunks) {
    List<VectorRecord> batch = new ArrayList<>(UPSERT_BATCH_SIZE);
    for (Chunk chunk : chunks) {
      List<Float> embedding = embeddingService.embedPassage(chunk.text());
      batch.add(new VectorRecord(chunk.id(), chunk.text(), chunk.metadata(), embedding));
      if (batch.size() >= UPSERT_BATCH_SIZE) {
        vectorStore.upsert(collection, batch);
        batch = new ArrayList<>(UPSERT_BATCH_SIZE);
      }
    }
    if (!batch.isEmpty()) {
      vectorStore.upsert(collection, batch);
    }
  }

  private void release(Generation generation) {
    if (generation.holders.decrementAndGet() != 0) {
      return;
    }
    String collection = generation.snapshot.denseCollection();
    try {
      vectorStore.dropCollection(collection);
      log.debug(
          "Dropped collection {} of replaced generation {}",
          collection,
          generation.snapshot.generation());
    } catch (RuntimeException e) {
      log.warn("Could not drop previous collection {}: {}", collection, e.getMessage());
    }
  }

  private void discard(String collection, RuntimeException cause) {
    try {
      vectorStore.dropCollection(collection);
    } catch (RuntimeException dropFailure) {
      cause.addSuppressed(dropFailure);
      log.warn("Could not drop staging collection {}: {}", collection, dropFailure.getMessage());
    }
  }

  private static void validate(List<Chunk> chunks) {
    if (chunks == null || chunks.isEmpty()) {
      throw new IndexBuildFailedException("Cannot build an index from an empty corpus");
    }
    Set<String> ids = new HashSet<>();
    for (Chunk chunk : chunks) {
      if (!ids.add(chunk.id())) {
        throw new IndexBuildFailedException("Duplicate chunk id: " + chunk.id());
      }
    }
  }

  /** Active or replaced snapshot plus its holder count; the active slot counts as one holder. */
  private static final class Generation {
    private final IndexSnapshot snapshot;
    private final AtomicInteger holders = new AtomicInteger(1);

    private Generation(IndexSnapshot snapshot) {
      this.snapshot = snapshot;
    }
  }
}
