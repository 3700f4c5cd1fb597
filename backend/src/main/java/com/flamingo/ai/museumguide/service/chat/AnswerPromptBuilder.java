package com.flamingo.ai.museumguide.service.chat;

import com.flamingo.ai.museumguide.domain.enums.ContentLanguage;
import com.flamingo.ai.museumguide.domain.enums.MessageRole;
import com.flamingo.ai.museumguide.domain.model.ChatTurn;
import com.flamingo.ai.museumguide.service.rag.chunking.CjkText;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/** Builds the message list for the grounded answer generation call. */
@Component
public class AnswerPromptBuilder {

  /**
   * Builds the prompt.
   *
   * @param question the visitor question
   * @param ragContext rendered retrieval context, empty when retrieval found nothing or failed
   * @param history earlier turns of the session, oldest first; empty to send no history
   * @return system message, history turns, then the question
   */
  public List<ChatMessage> build(String question, String ragContext, List<ChatTurn> history) {
    List<ChatMessage> messages = new ArrayList<>();
    messages.add(SystemMessage.from(buildSystemPrompt(ragContext)));

    for (ChatTurn turn : history) {
      if (turn.role() == MessageRole.USER) {
        messages.add(UserMessage.from(turn.content()));
      } else if (turn.role() == MessageRole.ASSISTANT) {
        messages.add(AiMessage.from(turn.content()));
      }
    }

    messages.add(UserMessage.from(question + "\n\n" + languageRequirement(question)));
    return messages;
  }

  private String buildSystemPrompt(String ragContext) {
    StringBuilder prompt = new StringBuilder();
    prompt.append(
        "You are a friendly museum guide. Answer visitor questions about the exhibition and the "
            + "institution behind it. Keep answers short: one or two sentences that sound natural "
            + "when spoken aloud.\n\n");
    if (ragContext == null || ragContext.isBlank()) {
      prompt.append(
          "No reference material is available for this question. Answer from general knowledge "
              + "and say so briefly if you are unsure.");
    } else {
      prompt.append(
          "Use the reference material below to answer. Prefer facts from it over general "
              + "knowledge, and rephrase them in your own words instead of copying sentences.\n\n");
      prompt.append("REFERENCE MATERIAL:\n").append(ragContext);
    }
    return prompt.toString();
  }

  static String languageRequirement(String question) {
    ContentLanguage language =
        CjkText.containsCjk(question) ? ContentLanguage.CHINESE : ContentLanguage.ENGLISH;
    return "CRITICAL: The user question is in "
        + language.getDisplayName()
        + ". You MUST respond ENTIRELY in "
        + language.getDisplayName()
        + ".";
  }
}
