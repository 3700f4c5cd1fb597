package com.flamingo.ai.museumguide.vectorstore;

import java.util.Map;

/**
 * A record returned by a vector query.
 *
 * @param chunkId chunk identifier
 * @param text chunk text
 * @param metadata chunk metadata
 * @param score similarity reported by the store (higher is closer)
 */
public record VectorMatch(
    String chunkId, String text, Map<String, String> metadata, double score) {}
