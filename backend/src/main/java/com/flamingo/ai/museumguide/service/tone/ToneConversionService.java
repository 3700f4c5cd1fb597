package com.flamingo.ai.museumguide.service.tone;

import com.flamingo.ai.museumguide.api.dto.request.ToneConversionRequest;
import com.flamingo.ai.museumguide.api.dto.response.StreamChunkResponse;
import com.flamingo.ai.museumguide.config.RagConfig;
import com.flamingo.ai.museumguide.domain.enums.ContentLanguage;
import com.flamingo.ai.museumguide.domain.enums.ToneProfile;
import com.flamingo.ai.museumguide.service.generation.GenerationService;
import com.flamingo.ai.museumguide.service.rag.chunking.CjkText;
import com.google.common.annotations.VisibleForTesting;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

/**
 * Rewrites an already generated answer in a {@link ToneProfile}'s style.
 *
 * <p>The rewrite sees the visitor's appearance and original question as well as the text, so it
 * can address the visitor directly. The first message of a session must reference the appearance.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ToneConversionService {

  private final GenerationService generationService;
  private final RagConfig ragConfig;

  /**
   * Streams the rewrite of {@code text}.
   *
   * @param text text to rewrite
   * @param tone target tone
   * @param userDescription visitor appearance, may be empty
   * @param userMessage the visitor's original question, may be empty
   * @param firstMessage whether this is the first answer in the session
   * @return rewrite tokens
   */
  public Flux<String> streamRewrite(
      String text,
      ToneProfile tone,
      String userDescription,
      String userMessage,
      boolean firstMessage) {
    return generationService.stream(
        buildMessages(text, tone, userDescription, userMessage, firstMessage));
  }

  /**
   * Tone conversion without retrieval, as a stream of {@code token} events ending in {@code done}.
   * With {@code stream=false} the whole rewrite arrives as one token event.
   *
   * @param request the conversion request
   * @return stream events; failures end in a single {@code error} event
   */
  public Flux<StreamChunkResponse> convert(ToneConversionRequest request) {
    ToneProfile tone = ToneProfile.fromWireName(request.getTone());
    log.debug("Tone conversion to {} (stream={})", tone, request.isStream());
    Flux<String> rewrite =
        streamRewrite(
            request.getText(),
            tone,
            request.getUserDescription(),
            request.getUserMessage(),
            request.isFirstMessage());
    if (!request.isStream()) {
      rewrite =
          rewrite
              .collect(StringBuilder::new, StringBuilder::append)
              .map(StringBuilder::toString)
              .flux();
    }

    AtomicInteger tokens = new AtomicInteger();
    return rewrite
        .map(
            token -> {
              tokens.incrementAndGet();
              return StreamChunkResponse.token(token);
            })
        .concatWith(
            Flux.defer(
                () -> Flux.just(StreamChunkResponse.done(tone.getWireName(), false, tokens.get()))))
        .onErrorResume(
            e -> {
              String errorId = UUID.randomUUID().toString().substring(0, 8);
              log.error("[{}] Tone conversion failed: {}", errorId, e.getMessage(), e);
              return Flux.just(
                  StreamChunkResponse.error(errorId, "Tone conversion failed. Please try again."));
            });
  }

  @VisibleForTesting
  List<ChatMessage> buildMessages(
      String text,
      ToneProfile tone,
      String userDescription,
      String userMessage,
      boolean firstMessage) {
    ContentLanguage language =
        CjkText.containsCjk(text) ? ContentLanguage.CHINESE : ContentLanguage.ENGLISH;
    String systemPrompt =
        tone.systemPrompt(language, ragConfig.getTone().getAppearanceReferencePercentage());

    StringBuilder instruction = new StringBuilder();
    instruction
        .append("Rewrite this text to speak to ")
        .append(tone.getAudience())
        .append(" in ")
        .append(language.getDisplayName())
        .append(":");
    boolean hasDescription = userDescription != null && !userDescription.isBlank();
    if (hasDescription) {
      instruction.append("\nUser Appearance: ").append(userDescription.trim());
    }
    if (userMessage != null && !userMessage.isBlank()) {
      instruction.append("\nUser Question: ").append(userMessage.trim());
    }
    if (hasDescription) {
      instruction.append(
          firstMessage
              ? "\nFirst Message: YES (MUST reference user appearance to grab attention)"
              : "\nFirst Message: NO ("
                  + ragConfig.getTone().getAppearanceReferencePercentage()
                  + "% chance to reference appearance for variety)");
    }
    instruction.append("\n---\n").append(text).append("\n---");

    return List.of(SystemMessage.from(systemPrompt), UserMessage.from(instruction.toString()));
  }
}
