package com.flamingo.ai.museumguide.vectorstore;

import java.util.List;
import java.util.Map;

/**
 * One chunk with its embedding, as written to the vector store.
 *
 * @param chunkId chunk identifier, used as the record id
 * @param text chunk text
 * @param metadata chunk metadata
 * @param embedding passage embedding
 */
public record VectorRecord(
    String chunkId, String text, Map<String, String> metadata, List<Float> embedding) {}
