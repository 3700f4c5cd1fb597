package com.flamingo.ai.museumguide.service.rag.corpus;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.museumguide.domain.model.Chunk;
import com.flamingo.ai.museumguide.domain.model.SourceDocument;
import com.flamingo.ai.museumguide.exception.IndexBuildFailedException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.Tika;
import org.apache.tika.exception.TikaException;
import org.springframework.stereotype.Component;

/**
 * Reads the corpus directory into {@link SourceDocument}s.
 *
 * <p>Files are visited in sorted path order so repeated loads yield the same documents:
 *
 * <ul>
 *   <li>{@code *.json}: an array of articles ({@code title, content, source, url, language}) or of
 *       question-answer pairs ({@code question, answer}); a top-level object is read from its
 *       {@code documents} or {@code qa_pairs} array
 *   <li>{@code *.txt}, {@code *.md}: one document per file
 *   <li>anything else: plain text extracted with Apache Tika
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CorpusLoader {

  private final ObjectMapper objectMapper;
  private final Tika tika = new Tika();

  /**
   * Loads every readable file below {@code root}.
   *
   * @param root corpus directory
   * @return documents in deterministic order
   * @throws IndexBuildFailedException if the directory or one of its files cannot be read
   */
  public List<SourceDocument> load(Path root) {
    if (!Files.isDirectory(root)) {
      throw new IndexBuildFailedException("Corpus directory does not exist: " + root);
    }
    List<Path> files;
    try (Stream<Path> walk = Files.walk(root)) {
      files = walk.filter(Files::isRegularFile).filter(p -> !isHidden(p)).sorted().toList();
    } catch (IOException e) {
      throw new IndexBuildFailedException("Failed to list corpus directory " + root, e);
    }

    List<SourceDocument> documents = new ArrayList<>();
    for (Path file : files) {
      String name = root.relativize(file).toString().replace('\\', '/');
      try {
        List<SourceDocument> loaded = loadFile(file, name);
        documents.addAll(loaded);
        log.debug("Loaded {} documents from {}", loaded.size(), name);
      } catch (IOException | TikaException e) {
        throw new IndexBuildFailedException("Failed to read corpus file " + name, e);
      }
    }
    log.info("Loaded {} documents from {} files under {}", documents.size(), files.size(), root);
    return documents;
  }

  private List<SourceDocument> loadFile(Path file, String name)
      throws IOException, TikaException {
    String lower = name.toLowerCase(Locale.ROOT);
    if (lower.endsWith(".json")) {
      return loadJson(file, name);
    }
    String text =
        lower.endsWith(".txt") || lower.endsWith(".md")
            ? Files.readString(file, StandardCharsets.UTF_8)
            : tika.parseToString(file);
    if (text == null || text.isBlank()) {
      return List.of();
    }
    Map<String, String> metadata = new HashMap<>();
    metadata.put(Chunk.META_SOURCE, name);
    metadata.put(Chunk.META_TITLE, stripExtension(file.getFileName().toString()));
    return List.of(new SourceDocument(name, text, metadata, false));
  }

  private List<SourceDocument> loadJson(Path file, String name) throws IOException {
    JsonNode root = objectMapper.readTree(file.toFile());
    JsonNode entries = root;
    if (root.isObject()) {
      entries = root.has("qa_pairs") ? root.get("qa_pairs") : root.path("documents");
    }
    List<SourceDocument> documents = new ArrayList<>();
    if (!entries.isArray()) {
      log.warn("Skipping {}: no array of entries found", name);
      return documents;
    }
    for (int i = 0; i < entries.size(); i++) {
      JsonNode entry = entries.get(i);
      String sourceFile = name + "#" + i;
      if (entry.hasNonNull("question") && entry.hasNonNull("answer")) {
        String question = entry.get("question").asText().trim();
        String answer = entry.get("answer").asText().trim();
        Map<String, String> metadata = new HashMap<>();
        metadata.put(Chunk.META_SOURCE, name);
        metadata.put(Chunk.META_QUESTION, question);
        documents.add(
            new SourceDocument(
                sourceFile, "Question: " + question + "\nAnswer: " + answer, metadata, true));
        continue;
      }
      String content = entry.path("content").asText("");
      if (content.isBlank()) {
        continue;
      }
      Map<String, String> metadata = new HashMap<>();
      metadata.put(Chunk.META_SOURCE, entry.path("source").asText(name));
      metadata.put(Chunk.META_TITLE, entry.path("title").asText("Untitled"));
      metadata.put(Chunk.META_URL, entry.path("url").asText(""));
      documents.add(new SourceDocument(sourceFile, content, metadata, false));
    }
    return documents;
  }

  private static boolean isHidden(Path path) {
    return path.getFileName().toString().startsWith(".");
  }

  private static String stripExtension(String fileName) {
    int dot = fileName.lastIndexOf('.');
    return dot > 0 ? fileName.substring(0, dot) : fileName;
  }
}
