package com.flamingo.ai.museumguide.service.rag.chunking;

import com.flamingo.ai.museumguide.domain.model.Chunk;
import com.flamingo.ai.museumguide.domain.model.SourceDocument;
import java.util.List;

/**
 * Splits a {@link SourceDocument} into {@link Chunk}s ready for embedding and sparse scoring.
 *
 * <p>Implementations must be stateless, deterministic and safe for concurrent use.
 */
public interface DocumentChunker {

  /**
   * Produces chunks using the configured window size and overlap.
   *
   * @param document the source document
   * @return ordered list of chunks, empty for blank input
   */
  List<Chunk> chunk(SourceDocument document);

  /**
   * Produces chunks with an explicit window size and overlap.
   *
   * @param document the source document
   * @param chunkSize maximum chunk length in characters
   * @param overlap how far back (in characters) the next window may start
   * @return ordered list of chunks, empty for blank input
   */
  List<Chunk> chunk(SourceDocument document, int chunkSize, int overlap);
}
