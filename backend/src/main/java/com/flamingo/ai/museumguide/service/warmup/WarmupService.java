package com.flamingo.ai.museumguide.service.warmup;

import com.flamingo.ai.museumguide.api.dto.response.WarmupResponse;
import com.flamingo.ai.museumguide.api.dto.response.WarmupResponse.StepResult;
import com.flamingo.ai.museumguide.service.generation.GenerationService;
import com.flamingo.ai.museumguide.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.museumguide.service.rag.index.IndexBuildService;
import com.google.common.base.Stopwatch;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import java.util.List;
import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Sends one small request to each model so the first visitor query does not pay for model
 * loading. The embedding step is skipped while no index is active.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WarmupService {

  private static final String PROBE = "Warmup test";

  private final EmbeddingService embeddingService;
  private final GenerationService generationService;
  private final IndexBuildService indexBuildService;

  public WarmupResponse warmup() {
    log.info("Starting model warmup");
    StepResult embedding = warmupEmbedding();
    StepResult chat = warmupChat();
    boolean success = !"failed".equals(embedding.getStatus()) && "success".equals(chat.getStatus());
    log.info(
        "Model warmup finished: embedding={} ({}ms), chat={} ({}ms)",
        embedding.getStatus(),
        embedding.getTimeMs(),
        chat.getStatus(),
        chat.getTimeMs());
    return WarmupResponse.builder()
        .embeddingModel(embedding)
        .chatModel(chat)
        .overallSuccess(success)
        .build();
  }

  private StepResult warmupEmbedding() {
    if (!indexBuildService.isReady()) {
      return new StepResult("skipped", "Index not built yet", 0);
    }
    Stopwatch stopwatch = Stopwatch.createStarted();
    try {
      int dimensions = embeddingService.embedQuery(PROBE).size();
      return new StepResult(
          "success",
          "Embedding model warmed up (" + dimensions + " dimensions)",
          stopwatch.elapsed(TimeUnit.MILLISECONDS));
    } catch (RuntimeException e) {
      log.warn("Embedding warmup failed: {}", e.getMessage());
      return new StepResult(
          "failed",
          "Embedding warmup failed: " + e.getMessage(),
          stopwatch.elapsed(TimeUnit.MILLISECONDS));
    }
  }

  private StepResult warmupChat() {
    Stopwatch stopwatch = Stopwatch.createStarted();
    try {
      String reply =
          generationService.generate(
              List.of(
                  SystemMessage.from("You are a helpful assistant. Respond with just 'OK'."),
                  UserMessage.from(PROBE)));
      return new StepResult(
          "success",
          "Chat model warmed up, replied: " + reply,
          stopwatch.elapsed(TimeUnit.MILLISECONDS));
    } catch (RuntimeException e) {
      log.warn("Chat model warmup failed: {}", e.getMessage());
      return new StepResult(
          "failed",
          "Chat model warmup failed: " + e.getMessage(),
          stopwatch.elapsed(TimeUnit.MILLISECONDS));
    }
  }
}
