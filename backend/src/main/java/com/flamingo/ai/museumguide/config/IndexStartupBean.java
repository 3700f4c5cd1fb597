package com.flamingo.ai.museumguide.config;

import com.flamingo.ai.museumguide.exception.IndexBuildFailedException;
import com.flamingo.ai.museumguide.service.rag.index.IndexBuildService;
import com.flamingo.ai.museumguide.service.rag.index.IndexSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Builds the retrieval indexes from the configured corpus when the application starts.
 *
 * <p>A failed build does not stop the application: queries run in degraded mode (no retrieval)
 * until the index is rebuilt through the API.
 */
@Component
@ConditionalOnProperty(name = "rag.index.build-on-startup", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class IndexStartupBean implements CommandLineRunner {

  private final IndexBuildService indexBuildService;

  @Override
  public void run(String... args) {
    try {
      log.info("Building retrieval index on startup...");
      IndexSnapshot snapshot = indexBuildService.rebuildFromCorpus();
      log.info("Startup index build complete: {} chunks", snapshot.chunkCount());
    } catch (IndexBuildFailedException e) {
      log.error("Startup index build failed: {}", e.getMessage(), e);
    }
  }
}
