package com.flamingo.ai.museumguide.service.rag.search;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/** Decides whether a visitor utterance is a question. */
public final class QuestionDetector {

  private static final Set<String> ENGLISH_INTERROGATIVES =
      Set.of(
          "what", "when", "where", "who", "whom", "whose", "why", "how", "which", "is", "are",
          "was", "were", "do", "does", "did", "can", "could", "will", "would", "should", "may",
          "shall", "has", "have", "tell");

  // 幾/几 alone also starts statements such as 幾乎 ("almost"), so only counting forms are listed
  private static final List<String> CHINESE_MARKERS =
      List.of(
          "什麼", "什么", "為什麼", "为什么", "如何", "怎麼", "怎么", "哪", "誰", "谁", "多少", "是否",
          "是不是", "有沒有", "有没有", "幾個", "几个", "幾點", "几点", "幾年", "几年", "幾歲", "几岁",
          "幾位", "几位", "幾次", "几次", "幾天", "几天");

  private QuestionDetector() {}

  public static boolean isQuestion(String text) {
    if (text == null || text.isBlank()) {
      return false;
    }
    String trimmed = text.trim();
    if (trimmed.endsWith("?") || trimmed.endsWith("？")) {
      return true;
    }
    char last = trimmed.charAt(trimmed.length() - 1);
    if (last == '嗎' || last == '吗' || last == '呢') {
      return true;
    }
    for (String marker : CHINESE_MARKERS) {
      if (trimmed.contains(marker)) {
        return true;
      }
    }
    String firstWord = trimmed.split("[\\s,.!]+", 2)[0].toLowerCase(Locale.ROOT);
    return ENGLISH_INTERROGATIVES.contains(firstWord);
  }
}
