package com.flamingo.ai.museumguide.api.rest;

import com.flamingo.ai.museumguide.api.dto.response.IndexBuildResponse;
import com.flamingo.ai.museumguide.service.rag.index.IndexBuildService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for building the retrieval index. */
@RestController
@RequestMapping("/api/rag/index")
@RequiredArgsConstructor
@Slf4j
public class IndexController {

  private final IndexBuildService indexBuildService;

  /**
   * Rebuilds both indexes from the configured corpus. The previous index keeps serving until the
   * new one is complete and stays active if the build fails.
   */
  @PostMapping("/rebuild")
  public ResponseEntity<IndexBuildResponse> rebuild() {
    log.info("Index rebuild requested");
    indexBuildService.rebuildFromCorpus();
    return ResponseEntity.ok(IndexBuildResponse.fromStatus(indexBuildService.status()));
  }

  /** Describes the active index. */
  @GetMapping
  public ResponseEntity<IndexBuildResponse> status() {
    return ResponseEntity.ok(IndexBuildResponse.fromStatus(indexBuildService.status()));
  }
}
