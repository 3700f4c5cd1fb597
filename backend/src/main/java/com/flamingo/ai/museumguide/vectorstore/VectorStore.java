package com.flamingo.ai.museumguide.vectorstore;

import java.util.List;

/**
 * Port to the dense vector store. A collection holds one build generation of the dense index;
 * the index builder fills a new collection and switches over only once it is complete.
 */
public interface VectorStore {

  /**
   * Creates an empty collection.
   *
   * @param name collection name, unique per build generation
   * @return handle to pass to the other operations
   */
  String createCollection(String name);

  /**
   * Inserts or replaces records in a collection.
   *
   * @param collection collection handle
   * @param records records to write
   */
  void upsert(String collection, List<VectorRecord> records);

  /**
   * Nearest neighbours of a query vector, best first.
   *
   * @param collection collection handle
   * @param vector query vector
   * @param topK maximum number of matches
   * @return ranked matches; higher score means more similar
   */
  List<VectorMatch> queryByVector(String collection, List<Float> vector, int topK);

  /**
   * Deletes a collection; dropping a missing collection is a no-op.
   *
   * @param collection collection handle
   */
  void dropCollection(String collection);

  /** Short name of the backing store, for logs and readiness output. */
  String type();
}
