package com.flamingo.ai.museumguide.domain.enums;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ToneProfile Tests")
class ToneProfileTest {

  @Test
  @DisplayName("should parse wire names and enum names")
  void shouldParseWireNames() {
    assertThat(ToneProfile.fromWireName("elder_friendly")).isEqualTo(ToneProfile.ELDER_FRIENDLY);
    assertThat(ToneProfile.fromWireName(" CHILD_FRIENDLY ")).isEqualTo(ToneProfile.CHILD_FRIENDLY);
  }

  @Test
  @DisplayName("should fall back to casual for unknown names")
  void shouldFallBackToCasual() {
    assertThat(ToneProfile.fromWireName("pirate")).isEqualTo(ToneProfile.CASUAL_FRIENDLY);
    assertThat(ToneProfile.fromWireName(null)).isEqualTo(ToneProfile.CASUAL_FRIENDLY);
  }

  @Test
  @DisplayName("system prompt should carry language, particles and appearance rule")
  void systemPromptShouldCarryRules() {
    String prompt = ToneProfile.ELDER_FRIENDLY.systemPrompt(ContentLanguage.CHINESE, 70);

    assertThat(prompt)
        .contains("elderly visitors")
        .contains("TARGET LANGUAGE: Traditional Chinese")
        .contains("您好")
        .contains("70% probability")
        .contains("Keep every fact of the original text unchanged");
  }
}
