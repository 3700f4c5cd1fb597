package com.flamingo.ai.museumguide.service.rag.index;

import java.time.Instant;

/**
 * Readiness of the retrieval indexes.
 *
 * @param ready whether both dense and sparse index are loaded
 * @param generation active build generation, 0 before the first build
 * @param chunkCount chunks in the active index
 * @param vocabularySize sparse vocabulary size
 * @param vectorStore backing vector store type
 * @param builtAt completion time of the active build, null before the first build
 */
public record IndexStatus(
    boolean ready,
    long generation,
    int chunkCount,
    int vocabularySize,
    String vectorStore,
    Instant builtAt) {}
