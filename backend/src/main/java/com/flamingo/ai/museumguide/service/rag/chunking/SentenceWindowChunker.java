package com.flamingo.ai.museumguide.service.rag.chunking;

import com.flamingo.ai.museumguide.config.RagConfig;
import com.flamingo.ai.museumguide.domain.model.Chunk;
import com.flamingo.ai.museumguide.domain.model.SourceDocument;
import com.google.common.annotations.VisibleForTesting;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Sliding-window chunker that never splits a sentence.
 *
 * <p>Sentences are accumulated until the next one would push the window past the chunk size; the
 * window is then emitted and the next one starts with the trailing sentences of the emitted window
 * that fit in the overlap budget. A single sentence longer than the chunk size is emitted on its
 * own, unmodified. Question-answer documents always become exactly one chunk.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SentenceWindowChunker implements DocumentChunker {

  private final RagConfig ragConfig;

  @Override
  public List<Chunk> chunk(SourceDocument document) {
    RagConfig.Chunking chunking = ragConfig.getChunking();
    return chunk(document, chunking.getSize(), chunking.getOverlap());
  }

  @Override
  public List<Chunk> chunk(SourceDocument document, int chunkSize, int overlap) {
    if (chunkSize <= 0) {
      throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
    }
    if (overlap < 0 || overlap >= chunkSize) {
      throw new IllegalArgumentException(
          "overlap must be in [0, chunkSize): overlap=" + overlap + ", chunkSize=" + chunkSize);
    }
    if (document.text() == null || document.text().isBlank()) {
      return List.of();
    }

    if (document.qaPair()) {
      String text = document.text().trim();
      return List.of(toChunk(document, 0, text, 1));
    }

    List<String> sentences = SentenceSplitter.split(document.text());
    List<List<String>> windows = slidingWindow(sentences, chunkSize, overlap);
    List<Chunk> chunks = new ArrayList<>(windows.size());
    for (int i = 0; i < windows.size(); i++) {
      List<String> window = windows.get(i);
      chunks.add(toChunk(document, i, join(window), window.size()));
    }
    log.debug(
        "Chunked {} into {} chunks (size={}, overlap={})",
        document.sourceFile(),
        chunks.size(),
        chunkSize,
        overlap);
    return chunks;
  }

  @VisibleForTesting
  static List<List<String>> slidingWindow(List<String> sentences, int chunkSize, int overlap) {
    List<List<String>> windows = new ArrayList<>();
    List<String> window = new ArrayList<>();

    for (String sentence : sentences) {
      if (!window.isEmpty() && joinedLength(window, sentence) > chunkSize) {
        windows.add(List.copyOf(window));
        window = overlapTail(window, overlap, sentence, chunkSize);
      }
      if (window.isEmpty() && sentence.length() > chunkSize) {
        windows.add(List.of(sentence));
        continue;
      }
      window.add(sentence);
    }
    if (!window.isEmpty()) {
      windows.add(List.copyOf(window));
    }
    return windows;
  }

  /**
   * Trailing whole sentences of {@code window} whose joined length is at most {@code overlap} and
   * which still leave room for {@code next} within {@code chunkSize}.
   */
  private static List<String> overlapTail(
      List<String> window, int overlap, String next, int chunkSize) {
    List<String> tail = new ArrayList<>();
    for (int i = window.size() - 1; i >= 0; i--) {
      List<String> candidate = new ArrayList<>();
      candidate.add(window.get(i));
      candidate.addAll(tail);
      if (join(candidate).length() > overlap) {
        break;
      }
      tail = candidate;
    }
    while (!tail.isEmpty() && joinedLength(tail, next) > chunkSize) {
      tail.remove(0);
    }
    return tail;
  }

  private static int joinedLength(List<String> window, String next) {
    List<String> extended = new ArrayList<>(window);
    extended.add(next);
    return join(extended).length();
  }

  @VisibleForTesting
  static String join(List<String> sentences) {
    StringBuilder sb = new StringBuilder();
    for (String sentence : sentences) {
      if (sb.length() > 0 && !CjkText.isCjkOrFullWidth(sb.codePointBefore(sb.length()))) {
        sb.append(' ');
      }
      sb.append(sentence);
    }
    return sb.toString();
  }

  private Chunk toChunk(SourceDocument document, int index, String text, int sentenceCount) {
    String language =
        CjkText.detect(text, ragConfig.getChunking().getCjkRatioThreshold()).getTag();
    Map<String, String> metadata = new HashMap<>(document.metadata());
    metadata.putIfAbsent(Chunk.META_SOURCE, document.sourceFile());
    metadata.put(Chunk.META_LANGUAGE, language);
    metadata.put(Chunk.META_LENGTH, String.valueOf(text.length()));
    metadata.put(Chunk.META_SENTENCE_COUNT, String.valueOf(sentenceCount));
    metadata.put(Chunk.META_QA_PAIR, String.valueOf(document.qaPair()));

    return Chunk.builder()
        .id(Chunk.idFor(document.sourceFile(), index))
        .text(text)
        .sourceFile(document.sourceFile())
        .index(index)
        .language(language)
        .metadata(metadata)
        .build();
  }
}
