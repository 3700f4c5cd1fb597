package com.flamingo.ai.museumguide.service.rag.index;

import com.flamingo.ai.museumguide.service.rag.sparse.SparseIndex;
import java.time.Instant;

/**
 * The dense and sparse index of one completed build, always swapped in together.
 *
 * @param generation build generation number, increasing per successful build
 * @param denseCollection vector store collection holding this generation's embeddings
 * @param sparseIndex TF-IDF index fitted on the same chunks
 * @param chunkCount number of chunks indexed
 * @param builtAt completion time
 */
public record IndexSnapshot(
    long generation,
    String denseCollection,
    SparseIndex sparseIndex,
    int chunkCount,
    Instant builtAt) {}
