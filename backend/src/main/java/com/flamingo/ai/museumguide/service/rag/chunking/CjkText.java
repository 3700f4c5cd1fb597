package com.flamingo.ai.museumguide.service.rag.chunking;

import com.flamingo.ai.museumguide.domain.enums.ContentLanguage;

/** Character-class helpers for mixed Chinese / Latin text. */
public final class CjkText {

  private CjkText() {}

  /** Whether the code point belongs to a CJK script (Han, kana, hangul). */
  public static boolean isCjk(int codePoint) {
    Character.UnicodeScript script = Character.UnicodeScript.of(codePoint);
    return script == Character.UnicodeScript.HAN
        || script == Character.UnicodeScript.HIRAGANA
        || script == Character.UnicodeScript.KATAKANA
        || script == Character.UnicodeScript.HANGUL;
  }

  /** CJK letters plus full-width punctuation, which join without a separating space. */
  public static boolean isCjkOrFullWidth(int codePoint) {
    return isCjk(codePoint)
        || (codePoint >= 0x3000 && codePoint <= 0x303F)
        || (codePoint >= 0xFF00 && codePoint <= 0xFFEF);
  }

  /**
   * Share of CJK code points among the letters of {@code text}; 0 for text without letters.
   *
   * @param text any text
   * @return ratio in [0, 1]
   */
  public static double cjkRatio(String text) {
    if (text == null || text.isEmpty()) {
      return 0.0;
    }
    int letters = 0;
    int cjk = 0;
    for (int i = 0; i < text.length(); ) {
      int cp = text.codePointAt(i);
      if (Character.isLetter(cp)) {
        letters++;
        if (isCjk(cp)) {
          cjk++;
        }
      }
      i += Character.charCount(cp);
    }
    return letters == 0 ? 0.0 : (double) cjk / letters;
  }

  /** Detects the dominant language using the given CJK ratio threshold. */
  public static ContentLanguage detect(String text, double threshold) {
    double ratio = cjkRatio(text);
    return ratio > 0 && ratio >= threshold ? ContentLanguage.CHINESE : ContentLanguage.ENGLISH;
  }

  /** Whether the text contains any CJK code point. */
  public static boolean containsCjk(String text) {
    return text != null && text.codePoints().anyMatch(CjkText::isCjk);
  }
}
