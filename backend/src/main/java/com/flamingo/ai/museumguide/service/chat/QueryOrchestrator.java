package com.flamingo.ai.museumguide.service.chat;

import com.flamingo.ai.museumguide.api.dto.request.QueryRequest;
import com.flamingo.ai.museumguide.api.dto.response.StreamChunkResponse;
import com.flamingo.ai.museumguide.config.RagConfig;
import com.flamingo.ai.museumguide.domain.enums.ExchangeState;
import com.flamingo.ai.museumguide.domain.enums.ToneProfile;
import com.flamingo.ai.museumguide.domain.model.ChatTurn;
import com.flamingo.ai.museumguide.domain.model.RetrievalResult;
import com.flamingo.ai.museumguide.exception.ContextFetchTimeoutException;
import com.flamingo.ai.museumguide.exception.GenerationFailedException;
import com.flamingo.ai.museumguide.exception.InvalidRequestException;
import com.flamingo.ai.museumguide.exception.RetrievalUnavailableException;
import com.flamingo.ai.museumguide.service.context.AuxiliaryContext;
import com.flamingo.ai.museumguide.service.context.AuxiliaryContextProvider;
import com.flamingo.ai.museumguide.service.generation.GenerationService;
import com.flamingo.ai.museumguide.service.rag.search.HybridRetriever;
import com.flamingo.ai.museumguide.service.session.SessionStore;
import com.flamingo.ai.museumguide.service.tone.ToneConversionService;
import com.flamingo.ai.museumguide.service.tone.ToneSelector;
import dev.langchain4j.data.message.ChatMessage;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Runs one visitor query end to end.
 *
 * <p>The visitor context fetch and the retrieve-then-generate task start together on the
 * orchestration executor and the pipeline waits only for both to finish. The tone is then chosen
 * from the visitor context and the answer is streamed, rewritten in that tone when requested. The
 * exchange is written to the session history after the last token and before the {@code done}
 * event; errored or cancelled exchanges leave the history untouched. Cancelling the stream
 * interrupts whichever of the two tasks is still running and cancels the style pass stream.
 */
@Service
@Slf4j
public class QueryOrchestrator {

  // grace on top of the provider's own timeout before the fetch is abandoned
  private static final long CONTEXT_TIMEOUT_GRACE_MS = 250;

  private final AuxiliaryContextProvider contextProvider;
  private final HybridRetriever retriever;
  private final GenerationService generationService;
  private final ToneSelector toneSelector;
  private final ToneConversionService toneConversionService;
  private final SessionStore sessionStore;
  private final AnswerPromptBuilder promptBuilder;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;
  private final Executor executor;

  public QueryOrchestrator(
      AuxiliaryContextProvider contextProvider,
      HybridRetriever retriever,
      GenerationService generationService,
      ToneSelector toneSelector,
      ToneConversionService toneConversionService,
      SessionStore sessionStore,
      AnswerPromptBuilder promptBuilder,
      RagConfig ragConfig,
      MeterRegistry meterRegistry,
      @Qualifier("orchestrationExecutor") Executor executor) {
    this.contextProvider = contextProvider;
    this.retriever = retriever;
    this.generationService = generationService;
    this.toneSelector = toneSelector;
    this.toneConversionService = toneConversionService;
    this.sessionStore = sessionStore;
    this.promptBuilder = promptBuilder;
    this.ragConfig = ragConfig;
    this.meterRegistry = meterRegistry;
    this.executor = executor;
  }

  /**
   * Streams the answer to a query.
   *
   * @param request the query
   * @return {@code context} events, then {@code token} events, then exactly one terminal {@code
   *     done} or {@code error} event
   * @throws InvalidRequestException if the query text is missing; thrown before any work starts
   */
  public Flux<StreamChunkResponse> streamQuery(QueryRequest request) {
    if (request == null || request.getText() == null || request.getText().isBlank()) {
      meterRegistry.counter("orchestrator.exchanges", "outcome", "invalid").increment();
      throw new InvalidRequestException("Query text must not be empty");
    }
    String sessionId = request.effectiveSessionId();
    String question = request.getText().trim();
    ExchangeStateMachine machine =
        new ExchangeStateMachine(UUID.randomUUID().toString().substring(0, 8));
    List<CompletableFuture<?>> inFlight = new CopyOnWriteArrayList<>();

    return Flux.defer(() -> runExchange(request, sessionId, question, machine, inFlight))
        .onErrorResume(e -> Flux.just(fail(machine, sessionId, unwrap(e))))
        .doOnCancel(
            () -> {
              // interrupts a context fetch or buffered generation that is still running
              inFlight.forEach(task -> task.cancel(true));
              if (machine.tryTransition(ExchangeState.CANCELLED)) {
                meterRegistry.counter("orchestrator.exchanges", "outcome", "cancelled").increment();
                log.info(
                    "Exchange {} for session {} cancelled by caller, history unchanged",
                    machine.exchangeId(),
                    sessionId);
              }
            });
  }

  private Flux<StreamChunkResponse> runExchange(
      QueryRequest request,
      String sessionId,
      String question,
      ExchangeStateMachine machine,
      List<CompletableFuture<?>> inFlight) {
    List<ChatTurn> history = sessionStore.getHistory(sessionId);
    boolean firstMessage = history.isEmpty();
    machine.transition(ExchangeState.FETCHING_AND_GENERATING);
    log.info(
        "Exchange {} started for session {} (history={}, includeHistory={}, style={})",
        machine.exchangeId(),
        sessionId,
        history.size(),
        request.isIncludeHistory(),
        request.isApplyStyleConversion());

    CompletableFuture<AuxiliaryContext> contextTask =
        fetchContext(sessionId, request.getAuxiliaryContext(), inFlight);
    List<ChatTurn> promptHistory = request.isIncludeHistory() ? history : List.of();
    long generationTimeoutMs = ragConfig.getOrchestration().getGenerationTimeoutMs();
    CompletableFuture<GroundedAnswer> answerTask =
        InterruptibleTask.supply(() -> answer(question, promptHistory), executor);
    inFlight.add(answerTask);
    answerTask.orTimeout(generationTimeoutMs, TimeUnit.MILLISECONDS);

    return Mono.fromFuture(contextTask.thenCombine(answerTask, PreparedExchange::new))
        .flatMapMany(
            prepared -> deliver(request, sessionId, question, firstMessage, prepared, machine));
  }

  private CompletableFuture<AuxiliaryContext> fetchContext(
      String sessionId, String explicit, List<CompletableFuture<?>> inFlight) {
    if (explicit != null && !explicit.isBlank()) {
      return CompletableFuture.completedFuture(AuxiliaryContext.of(explicit));
    }
    Duration timeout = Duration.ofMillis(ragConfig.getOrchestration().getContextFetchTimeoutMs());
    CompletableFuture<AuxiliaryContext> fetch =
        InterruptibleTask.supply(() -> contextProvider.fetch(sessionId, timeout), executor);
    inFlight.add(fetch);
    return fetch
        .completeOnTimeout(
            AuxiliaryContext.unavailable(),
            timeout.toMillis() + CONTEXT_TIMEOUT_GRACE_MS,
            TimeUnit.MILLISECONDS)
        .exceptionally(
            e -> {
              Throwable cause = unwrap(e);
              if (cause instanceof ContextFetchTimeoutException) {
                meterRegistry.counter("orchestrator.context.timeouts").increment();
                log.warn("Visitor context for session {} timed out, using default tone", sessionId);
              } else {
                log.warn(
                    "Visitor context for session {} unavailable: {}",
                    sessionId,
                    cause.getMessage());
              }
              return AuxiliaryContext.unavailable();
            });
  }

  private GroundedAnswer answer(String question, List<ChatTurn> history) {
    List<RetrievalResult> results;
    boolean degraded = false;
    try {
      results = retriever.search(question);
    } catch (RetrievalUnavailableException e) {
      degraded = true;
      results = List.of();
      meterRegistry.counter("orchestrator.degraded").increment();
      log.warn("Retrieval unavailable, answering without context (degraded): {}", e.getMessage());
    }
    String ragContext = retriever.buildContext(results);
    List<ChatMessage> messages = promptBuilder.build(question, ragContext, history);
    log.debug("Generating answer with {} messages, {} passages", messages.size(), results.size());
    return new GroundedAnswer(results, generationService.generate(messages), degraded);
  }

  private Flux<StreamChunkResponse> deliver(
      QueryRequest request,
      String sessionId,
      String question,
      boolean firstMessage,
      PreparedExchange prepared,
      ExchangeStateMachine machine) {
    AuxiliaryContext visitor = prepared.context();
    GroundedAnswer answer = prepared.answer();
    ToneProfile tone = toneSelector.select(visitor.description());
    machine.transition(ExchangeState.TONE_SELECTED);
    log.debug(
        "Exchange {} tone {} (visitor context available={})",
        machine.exchangeId(),
        tone.getWireName(),
        visitor.available());

    List<RetrievalResult> results = answer.results();
    Flux<StreamChunkResponse> contextEvents =
        Flux.fromStream(
            IntStream.range(0, results.size())
                .mapToObj(i -> StreamChunkResponse.context(i + 1, results.get(i))));

    Flux<String> body;
    if (request.isApplyStyleConversion()) {
      machine.transition(ExchangeState.STREAMING);
      body =
          toneConversionService.streamRewrite(
              answer.text(), tone, visitor.description(), question, firstMessage);
    } else {
      body = Flux.just(answer.text());
    }

    StringBuilder finalText = new StringBuilder();
    AtomicInteger tokenCount = new AtomicInteger();
    Flux<StreamChunkResponse> tokenEvents =
        body.map(
            token -> {
              finalText.append(token);
              tokenCount.incrementAndGet();
              return StreamChunkResponse.token(token);
            });

    Flux<StreamChunkResponse> completion =
        Flux.defer(
            () -> {
              String text = finalText.toString().trim();
              if (text.isEmpty()) {
                return Flux.error(
                    new GenerationFailedException("Style conversion produced no text"));
              }
              if (!machine.tryTransition(ExchangeState.DONE)) {
                return Flux.empty();
              }
              sessionStore.appendExchange(sessionId, question, text);
              meterRegistry.counter("orchestrator.exchanges", "outcome", "done").increment();
              log.info(
                  "Exchange {} done for session {}: tone={}, degraded={}, tokens={}",
                  machine.exchangeId(),
                  sessionId,
                  tone.getWireName(),
                  answer.degraded(),
                  tokenCount.get());
              return Flux.just(
                  StreamChunkResponse.done(
                      tone.getWireName(), answer.degraded(), tokenCount.get()));
            });

    return Flux.concat(contextEvents, tokenEvents, completion);
  }

  private StreamChunkResponse fail(ExchangeStateMachine machine, String sessionId, Throwable e) {
    machine.tryTransition(ExchangeState.ERRORED);
    String errorId = machine.exchangeId();
    meterRegistry.counter("orchestrator.exchanges", "outcome", "error").increment();
    log.error(
        "[{}] Exchange failed for session {}, history unchanged: {}",
        errorId,
        sessionId,
        e.getMessage(),
        e);
    String message;
    if (e instanceof GenerationFailedException gfe) {
      message = gfe.getUserMessage();
    } else if (e instanceof TimeoutException) {
      message = "The answer took too long. Please try again.";
    } else {
      message = "An unexpected error occurred. Please try again.";
    }
    return StreamChunkResponse.error(errorId, message);
  }

  private static Throwable unwrap(Throwable e) {
    Throwable current = e;
    while (current instanceof CompletionException && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  /** Result of the retrieve-then-generate task. */
  record GroundedAnswer(List<RetrievalResult> results, String text, boolean degraded) {}

  /** Join of both parallel tasks. */
  record PreparedExchange(AuxiliaryContext context, GroundedAnswer answer) {}
}
