package com.flamingo.ai.museumguide.api.rest;

import com.flamingo.ai.museumguide.api.dto.response.WarmupResponse;
import com.flamingo.ai.museumguide.service.warmup.WarmupService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for model warmup. */
@RestController
@RequestMapping("/api/rag/warmup")
@RequiredArgsConstructor
public class WarmupController {

  private final WarmupService warmupService;

  /** Warms the embedding and chat models. */
  @PostMapping
  public ResponseEntity<WarmupResponse> warmup() {
    return ResponseEntity.ok(warmupService.warmup());
  }
}
