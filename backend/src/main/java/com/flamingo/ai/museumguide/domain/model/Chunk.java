package com.flamingo.ai.museumguide.domain.model;

import java.util.Map;
import java.util.Objects;
import lombok.Builder;

/**
 * A sentence-aligned span of source text, the unit that is embedded, scored and returned by
 * retrieval.
 *
 * @param id stable identifier, {@code <sourceFile>_<index>}
 * @param text non-blank chunk text
 * @param sourceFile origin of the text (file name, optionally with an entry suffix)
 * @param index position of the chunk within its source document (0-based)
 * @param language {@code zh} or {@code en}
 * @param metadata string metadata (source, title, url, language, qa_pair, question ...)
 */
@Builder
public record Chunk(
    String id,
    String text,
    String sourceFile,
    int index,
    String language,
    Map<String, String> metadata) {

  public static final String META_SOURCE = "source";
  public static final String META_TITLE = "title";
  public static final String META_URL = "url";
  public static final String META_LANGUAGE = "language";
  public static final String META_LENGTH = "length";
  public static final String META_SENTENCE_COUNT = "sentence_count";
  public static final String META_QA_PAIR = "qa_pair";
  public static final String META_QUESTION = "question";

  public Chunk {
    Objects.requireNonNull(id, "id");
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("Chunk text must not be blank: " + id);
    }
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }

  /** Whether this chunk is a verbatim question-answer pair from the corpus. */
  public boolean isQaPair() {
    return Boolean.parseBoolean(metadata.get(META_QA_PAIR));
  }

  public static String idFor(String sourceFile, int index) {
    return sourceFile + "_" + index;
  }
}
