package com.flamingo.ai.museumguide.domain.model;

import java.util.Map;

/**
 * A raw corpus entry before chunking.
 *
 * @param sourceFile identifier of the origin, used as chunk id prefix
 * @param text full text
 * @param metadata document-level metadata copied to every chunk
 * @param qaPair whether the text is a verbatim question-answer pair (never split)
 */
public record SourceDocument(
    String sourceFile, String text, Map<String, String> metadata, boolean qaPair) {

  public SourceDocument {
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }

  public static SourceDocument of(String sourceFile, String text) {
    return new SourceDocument(sourceFile, text, Map.of(), false);
  }
}
