package com.flamingo.ai.museumguide.service.rag.chunking;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits text into sentences on Chinese ({@code 。！？}) and Latin ({@code .!?}) terminators.
 *
 * <p>Terminators stay attached to their sentence together with any run of further terminators
 * and closing quotes or brackets. A Latin terminator only ends a sentence when followed by
 * whitespace, a CJK character or the end of the text, so decimals such as {@code 3.14} stay
 * intact. Blank lines end a sentence as well. Whitespace inside a sentence is collapsed.
 */
public final class SentenceSplitter {

  private static final String CJK_TERMINATORS = "。！？";
  private static final String LATIN_TERMINATORS = ".!?";
  private static final String CLOSERS = "\"'”’」』）)]】》";

  private SentenceSplitter() {}

  public static List<String> split(String text) {
    List<String> sentences = new ArrayList<>();
    if (text == null || text.isBlank()) {
      return sentences;
    }
    StringBuilder current = new StringBuilder();
    int len = text.length();
    int i = 0;
    while (i < len) {
      char c = text.charAt(i);
      if (c == '\n' && isParagraphBreak(text, i)) {
        flush(current, sentences);
        i++;
        continue;
      }
      current.append(c);
      if (!isTerminator(c)) {
        i++;
        continue;
      }
      boolean cjkTerminated = CJK_TERMINATORS.indexOf(c) >= 0;
      int j = i + 1;
      while (j < len && (isTerminator(text.charAt(j)) || CLOSERS.indexOf(text.charAt(j)) >= 0)) {
        cjkTerminated |= CJK_TERMINATORS.indexOf(text.charAt(j)) >= 0;
        current.append(text.charAt(j));
        j++;
      }
      if (cjkTerminated || j >= len || endsLatinSentence(text, j)) {
        flush(current, sentences);
      }
      i = j;
    }
    flush(current, sentences);
    return sentences;
  }

  private static boolean isTerminator(char c) {
    return CJK_TERMINATORS.indexOf(c) >= 0 || LATIN_TERMINATORS.indexOf(c) >= 0;
  }

  private static boolean endsLatinSentence(String text, int next) {
    int cp = text.codePointAt(next);
    return Character.isWhitespace(cp) || CjkText.isCjk(cp);
  }

  private static boolean isParagraphBreak(String text, int newline) {
    for (int j = newline + 1; j < text.length(); j++) {
      char c = text.charAt(j);
      if (c == '\n') {
        return true;
      }
      if (c != ' ' && c != '\t' && c != '\r') {
        return false;
      }
    }
    return false;
  }

  private static void flush(StringBuilder current, List<String> sentences) {
    String sentence = current.toString().replaceAll("\\s+", " ").trim();
    if (!sentence.isEmpty()) {
      sentences.add(sentence);
    }
    current.setLength(0);
  }
}
