package com.flamingo.ai.museumguide.api.rest;

import com.flamingo.ai.museumguide.service.rag.index.IndexBuildService;
import com.flamingo.ai.museumguide.service.rag.index.IndexStatus;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks. */
@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

  private final IndexBuildService indexBuildService;

  /** Returns a simple health check response. */
  @GetMapping
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> health = new HashMap<>();
    health.put("status", "UP");
    health.put("timestamp", LocalDateTime.now());
    health.put("service", "museum-guide");
    return ResponseEntity.ok(health);
  }

  /** Reports whether the dense and sparse indexes are loaded; 503 until they are. */
  @GetMapping("/ready")
  public ResponseEntity<Map<String, Object>> ready() {
    IndexStatus status = indexBuildService.status();
    Map<String, Object> ready = new HashMap<>();
    ready.put("ready", status.ready());
    ready.put("chunkCount", status.chunkCount());
    ready.put("vocabularySize", status.vocabularySize());
    ready.put("vectorStore", status.vectorStore());
    ready.put("generation", status.generation());
    ready.put("timestamp", LocalDateTime.now());
    HttpStatus code = status.ready() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
    return ResponseEntity.status(code).body(ready);
  }
}
