package com.flamingo.ai.museumguide.api.sse;

import com.flamingo.ai.museumguide.api.dto.request.QueryRequest;
import com.flamingo.ai.museumguide.api.dto.request.ToneConversionRequest;
import com.flamingo.ai.museumguide.api.dto.response.StreamChunkResponse;
import com.flamingo.ai.museumguide.service.chat.QueryOrchestrator;
import com.flamingo.ai.museumguide.service.tone.ToneConversionService;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.validation.Valid;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

/** Controller for visitor queries and tone conversion with SSE streaming support. */
@RestController
@RequestMapping("/api/rag")
@RequiredArgsConstructor
@Slf4j
public class QueryController {

  private final QueryOrchestrator queryOrchestrator;
  private final ToneConversionService toneConversionService;
  private final MeterRegistry meterRegistry;

  private final AtomicInteger activeConnections = new AtomicInteger(0);

  /**
   * Streams the answer to a visitor query using Server-Sent Events.
   *
   * @param request the query
   * @return a Flux of SSE events ending in a {@code done} or {@code error} event
   */
  @PostMapping(value = "/query", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public Flux<StreamChunkResponse> query(@Valid @RequestBody QueryRequest request) {
    String sessionId = request.effectiveSessionId();
    log.info("Starting query stream for session {}", sessionId);
    Flux<StreamChunkResponse> stream = queryOrchestrator.streamQuery(request);
    return track(stream, "Query", sessionId);
  }

  /**
   * Rewrites a text in the requested tone, without retrieval.
   *
   * @param request the text, tone and visitor details
   * @return a Flux of token events ending in a {@code done} or {@code error} event
   */
  @PostMapping(value = "/convert-tone", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public Flux<StreamChunkResponse> convertTone(@Valid @RequestBody ToneConversionRequest request) {
    log.info("Starting tone conversion stream (tone={})", request.getTone());
    return track(toneConversionService.convert(request), "Tone conversion", "-");
  }

  private Flux<StreamChunkResponse> track(
      Flux<StreamChunkResponse> stream, String kind, String sessionId) {
    activeConnections.incrementAndGet();
    meterRegistry.gauge("sse.connections.active", activeConnections);
    return stream
        .doOnComplete(
            () -> {
              activeConnections.decrementAndGet();
              log.debug("{} stream completed for session {}", kind, sessionId);
            })
        .doOnError(
            e -> {
              activeConnections.decrementAndGet();
              log.error("{} stream error for session {}: {}", kind, sessionId, e.getMessage());
              meterRegistry.counter("sse.errors").increment();
            })
        .doOnCancel(
            () -> {
              activeConnections.decrementAndGet();
              log.debug("{} stream cancelled for session {}", kind, sessionId);
            });
  }
}
