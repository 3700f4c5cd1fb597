package com.flamingo.ai.museumguide.service.context;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.museumguide.config.RagConfig;
import com.flamingo.ai.museumguide.exception.ContextFetchTimeoutException;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import reactor.core.publisher.Mono;

/**
 * HTTP client for the vision context service, which describes the visitor currently in front of
 * the camera for a session.
 */
@Component
@Slf4j
public class VisionContextClient implements AuxiliaryContextProvider {

  private final WebClient webClient;
  private final boolean enabled;
  private final MeterRegistry meterRegistry;

  public VisionContextClient(
      RagConfig ragConfig, WebClient.Builder webClientBuilder, MeterRegistry meterRegistry) {
    RagConfig.VisionContext config = ragConfig.getVisionContext();
    this.enabled = config.isEnabled();
    this.meterRegistry = meterRegistry;
    this.webClient = webClientBuilder.baseUrl(config.getBaseUrl()).build();
    log.info(
        "Vision context client initialized: baseUrl={}, enabled={}",
        config.getBaseUrl(),
        enabled);
  }

  @Override
  public AuxiliaryContext fetch(String sessionId, Duration timeout) {
    if (!enabled) {
      return AuxiliaryContext.unavailable();
    }
    log.debug("Fetching visual context for session {}", sessionId);
    VisualContextResponse response;
    try {
      response =
          webClient
              .get()
              .uri("/visual-context/{sessionId}", sessionId)
              .accept(MediaType.APPLICATION_JSON)
              .retrieve()
              .bodyToMono(VisualContextResponse.class)
              .timeout(timeout, Mono.error(new ContextFetchTimeoutException(sessionId, timeout)))
              .block();
    } catch (ContextFetchTimeoutException e) {
      meterRegistry.counter("vision_context.requests", "outcome", "timeout").increment();
      throw e;
    } catch (WebClientException e) {
      meterRegistry.counter("vision_context.requests", "outcome", "error").increment();
      log.warn("Vision context service call failed for session {}: {}", sessionId, e.getMessage());
      return AuxiliaryContext.unavailable();
    }

    if (response == null || !response.available()) {
      meterRegistry.counter("vision_context.requests", "outcome", "unavailable").increment();
      log.debug("No visual context available for session {}", sessionId);
      return AuxiliaryContext.unavailable();
    }
    meterRegistry.counter("vision_context.requests", "outcome", "success").increment();
    return new AuxiliaryContext(response.visualContext(), true);
  }

  /** Wire format of {@code GET /visual-context/{sessionId}}. */
  record VisualContextResponse(
      @JsonProperty("sessionid") String sessionId,
      @JsonProperty("visual_context") String visualContext,
      boolean available) {}
}
