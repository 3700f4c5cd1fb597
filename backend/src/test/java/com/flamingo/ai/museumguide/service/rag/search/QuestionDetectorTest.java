package com.flamingo.ai.museumguide.service.rag.search;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("QuestionDetector Tests")
class QuestionDetectorTest {

  @ParameterizedTest
  @ValueSource(
      strings = {
        "When was ITRI founded?",
        "what is this robot",
        "How does the laser work",
        "工研院是什麼時候成立的？",
        "這是什麼",
        "你好嗎",
        "工研院有幾個研究所",
        "博物館几点开门",
        "Is the cafe open today"
      })
  @DisplayName("should detect questions")
  void shouldDetectQuestions(String text) {
    assertThat(QuestionDetector.isQuestion(text)).isTrue();
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "ITRI founding year",
        "Tell-tale robots.",
        "工研院介紹",
        "幾乎所有展品都可以觸摸",
        "几乎每天都有导览",
        "",
        "   "
      })
  @DisplayName("should treat statements and blanks as non-questions")
  void shouldRejectStatements(String text) {
    assertThat(QuestionDetector.isQuestion(text)).isFalse();
  }
}
