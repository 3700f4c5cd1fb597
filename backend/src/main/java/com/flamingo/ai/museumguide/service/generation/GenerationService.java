package com.flamingo.ai.museumguide.service.generation;

import com.flamingo.ai.museumguide.exception.GenerationFailedException;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.PartialResponse;
import dev.langchain4j.model.chat.response.PartialResponseContext;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import dev.langchain4j.model.chat.response.StreamingHandle;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/** Buffered and streaming calls to the chat model. */
@Service
@RequiredArgsConstructor
@Slf4j
public class GenerationService {

  private final ChatModel chatModel;
  private final StreamingChatModel streamingChatModel;
  private final MeterRegistry meterRegistry;

  /**
   * Generates a complete answer.
   *
   * @param messages ordered prompt messages
   * @return the answer text, never blank
   * @throws GenerationFailedException if the backend fails or answers with nothing
   */
  @Timed(value = "generation.buffered", description = "Time for a buffered generation call")
  @CircuitBreaker(name = "inference", fallbackMethod = "generateFallback")
  @Retry(name = "inference")
  public String generate(List<ChatMessage> messages) {
    log.debug("generate called with {} messages", messages.size());
    ChatResponse response;
    try {
      response = chatModel.chat(messages);
    } catch (RuntimeException e) {
      throw new GenerationFailedException(
          "Generation backend call failed: " + e.getMessage(), isRateLimit(e));
    }
    String text =
        response != null && response.aiMessage() != null ? response.aiMessage().text() : null;
    if (text == null || text.isBlank()) {
      throw new GenerationFailedException("Generation backend returned an empty answer");
    }
    meterRegistry.counter("generation.requests.success", "mode", "buffered").increment();
    return text.trim();
  }

  /**
   * Streams an answer token by token.
   *
   * <p>Cancelling the returned flux cancels the backend stream through its {@link StreamingHandle}
   * as soon as the backend has handed one out; tokens still in flight are dropped.
   *
   * @param messages ordered prompt messages
   * @return partial response tokens; errors with {@link GenerationFailedException}
   */
  public Flux<String> stream(List<ChatMessage> messages) {
    return Flux.defer(
        () -> {
          Sinks.Many<String> sink = Sinks.many().unicast().onBackpressureBuffer();
          AtomicBoolean cancelled = new AtomicBoolean(false);
          AtomicReference<StreamingHandle> streamingHandle = new AtomicReference<>();
          AtomicInteger tokenCount = new AtomicInteger(0);

          StreamingChatResponseHandler handler =
              new StreamingChatResponseHandler() {
                @Override
                public void onPartialResponse(
                    PartialResponse partialResponse, PartialResponseContext context) {
                  StreamingHandle handle = context.streamingHandle();
                  streamingHandle.compareAndSet(null, handle);
                  if (cancelled.get()) {
                    handle.cancel();
                    return;
                  }
                  onPartialResponse(partialResponse.text());
                }

                @Override
                public void onPartialResponse(String token) {
                  if (cancelled.get() || token == null || token.isEmpty()) {
                    return;
                  }
                  tokenCount.incrementAndGet();
                  var result = sink.tryEmitNext(token);
                  if (result.isFailure()) {
                    log.warn("Failed to emit token: {}", result);
                  }
                }

                @Override
                public void onCompleteResponse(ChatResponse response) {
                  if (cancelled.get()) {
                    return;
                  }
                  log.debug("Streaming generation completed, tokens: {}", tokenCount.get());
                  meterRegistry
                      .counter("generation.requests.success", "mode", "stream")
                      .increment();
                  sink.tryEmitComplete();
                }

                @Override
                public void onError(Throwable error) {
                  if (cancelled.get()) {
                    log.debug("Ignoring error of a cancelled stream: {}", error.getMessage());
                    return;
                  }
                  meterRegistry
                      .counter("generation.requests.failure", "mode", "stream")
                      .increment();
                  log.error("Streaming generation failed: {}", error.getMessage(), error);
                  sink.tryEmitError(
                      new GenerationFailedException(
                          "Streaming generation failed: " + error.getMessage(), error));
                }
              };

          try {
            streamingChatModel.chat(messages, handler);
          } catch (RuntimeException e) {
            return Flux.error(
                new GenerationFailedException(
                    "Streaming generation could not start: " + e.getMessage(), e));
          }
          return sink.asFlux()
              .doOnCancel(
                  () -> {
                    cancelled.set(true);
                    StreamingHandle handle = streamingHandle.get();
                    if (handle != null) {
                      handle.cancel();
                    }
                    meterRegistry.counter("generation.streams.cancelled").increment();
                    log.debug(
                        "Streaming generation cancelled after {} tokens, backend notified={}",
                        tokenCount.get(),
                        handle != null);
                  });
        });
  }

  @SuppressWarnings("unused")
  private String generateFallback(List<ChatMessage> messages, Throwable t) {
    log.error("Generation failed, circuit breaker fallback: {}", t.getMessage());
    meterRegistry.counter("generation.requests.failure", "mode", "buffered").increment();
    if (t instanceof GenerationFailedException gfe) {
      throw gfe;
    }
    throw new GenerationFailedException("Generation backend unavailable: " + t.getMessage(), t);
  }

  private static boolean isRateLimit(Throwable t) {
    String message = t.getMessage();
    if (message == null) {
      return false;
    }
    String lower = message.toLowerCase(Locale.ROOT);
    return lower.contains("429") || lower.contains("rate limit");
  }
}
