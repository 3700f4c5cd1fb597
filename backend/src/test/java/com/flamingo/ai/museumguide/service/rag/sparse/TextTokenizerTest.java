package com.flamingo.ai.museumguide.service.rag.sparse;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TextTokenizer Tests")
class TextTokenizerTest {

  private final TextTokenizer tokenizer = new TextTokenizer();

  @AfterEach
  void tearDown() {
    tokenizer.close();
  }

  @Test
  @DisplayName("should lowercase English words and drop punctuation")
  void shouldTokenizeEnglish() {
    assertThat(tokenizer.tokenize("ITRI was founded in 1973."))
        .containsExactly("itri", "was", "founded", "in", "1973");
  }

  @Test
  @DisplayName("should segment Chinese runs into words")
  void shouldSegmentChinese() {
    List<String> tokens = tokenizer.tokenize("工研院成立於1973年");

    assertThat(tokens).isNotEmpty();
    assertThat(tokens).contains("1973");
    assertThat(String.join("", tokens)).contains("成立");
  }

  @Test
  @DisplayName("should expand tokens to uni- and bi-grams")
  void shouldProduceBigrams() {
    assertThat(tokenizer.terms("smart living lab", 2))
        .containsExactly("smart", "smart living", "living", "living lab", "lab");
  }

  @Test
  @DisplayName("should return nothing for blank text")
  void shouldHandleBlank() {
    assertThat(tokenizer.tokenize("  ")).isEmpty();
    assertThat(tokenizer.terms(null, 2)).isEmpty();
  }
}
