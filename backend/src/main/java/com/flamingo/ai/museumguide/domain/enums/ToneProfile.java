package com.flamingo.ai.museumguide.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.List;
import java.util.Map;

/**
 * Communication style used when rewriting an answer for a particular visitor.
 *
 * <p>Each profile carries the audience it addresses, its style guidelines and a small lexicon of
 * spoken particles per language; {@link #systemPrompt(ContentLanguage, int)} renders them into the
 * instruction for the style-conversion pass.
 */
public enum ToneProfile {
  CHILD_FRIENDLY(
      "child_friendly",
      "children in a warm, encouraging way",
      List.of(
          "Use encouraging and positive language",
          "Make it sound like talking to a curious child",
          "Prefer simple, accessible vocabulary",
          "Add gentle enthusiasm and wonder"),
      Map.of(
          ContentLanguage.CHINESE, List.of("呢", "喔", "呀", "哇"),
          ContentLanguage.ENGLISH, List.of("you know", "wow", "amazing"))),

  ELDER_FRIENDLY(
      "elder_friendly",
      "elderly visitors in a respectful, patient and warm way",
      List.of(
          "Use respectful and polite forms of address",
          "Speak clearly and at a calm pace",
          "Show appreciation for their experience",
          "Avoid slang and unexplained jargon"),
      Map.of(
          ContentLanguage.CHINESE, List.of("呢", "啊", "您好"),
          ContentLanguage.ENGLISH, List.of("you see", "indeed", "certainly"))),

  PROFESSIONAL_FRIENDLY(
      "professional_friendly",
      "professional adults in a formal, clear and informative way",
      List.of(
          "Sound like an expert explaining to a peer",
          "Use precise vocabulary woven naturally into speech",
          "Keep a conversational but composed flow"),
      Map.of(
          ContentLanguage.CHINESE, List.of("你知道", "我們可以看到", "有趣的是"),
          ContentLanguage.ENGLISH, List.of("as we can see", "what's interesting is"))),

  CASUAL_FRIENDLY(
      "casual_friendly",
      "adults in a relaxed, friendly and conversational way",
      List.of(
          "Sound like two friends chatting about something interesting",
          "Keep vocabulary mature but conversational",
          "Add natural speech patterns and easy enthusiasm"),
      Map.of(
          ContentLanguage.CHINESE, List.of("就是說", "我覺得", "說真的"),
          ContentLanguage.ENGLISH, List.of("I mean", "honestly", "you know")));

  private final String wireName;
  private final String audience;
  private final List<String> guidelines;
  private final Map<ContentLanguage, List<String>> particles;

  ToneProfile(
      String wireName,
      String audience,
      List<String> guidelines,
      Map<ContentLanguage, List<String>> particles) {
    this.wireName = wireName;
    this.audience = audience;
    this.guidelines = guidelines;
    this.particles = particles;
  }

  @JsonValue
  public String getWireName() {
    return wireName;
  }

  /** Who the rewrite speaks to, phrased for the instruction ("children in a warm ..."). */
  public String getAudience() {
    return audience;
  }

  public List<String> getGuidelines() {
    return guidelines;
  }

  public List<String> particlesFor(ContentLanguage language) {
    return particles.getOrDefault(language, List.of());
  }

  /**
   * Parses a wire name such as {@code elder_friendly}; unknown or blank names fall back to {@link
   * #CASUAL_FRIENDLY}.
   */
  @JsonCreator
  public static ToneProfile fromWireName(String name) {
    if (name == null || name.isBlank()) {
      return CASUAL_FRIENDLY;
    }
    for (ToneProfile profile : values()) {
      if (profile.wireName.equalsIgnoreCase(name.trim())
          || profile.name().equalsIgnoreCase(name.trim())) {
        return profile;
      }
    }
    return CASUAL_FRIENDLY;
  }

  /**
   * Builds the system instruction for the style-conversion pass.
   *
   * @param language language the rewrite must be written in
   * @param appearancePercentage chance (0-100) of referencing appearance after the first message
   * @return the system prompt
   */
  public String systemPrompt(ContentLanguage language, int appearancePercentage) {
    StringBuilder prompt = new StringBuilder();
    prompt
        .append("You are a tone conversion assistant that rewrites text to speak to ")
        .append(audience)
        .append(".\n\n");
    prompt.append("TARGET LANGUAGE: ").append(language.getDisplayName()).append("\n\n");
    prompt.append("STYLE GUIDELINES:\n");
    int n = 1;
    for (String guideline : guidelines) {
      prompt.append(n++).append(". ").append(guideline).append("\n");
    }
    List<String> words = particlesFor(language);
    if (!words.isEmpty()) {
      prompt
          .append(n++)
          .append(". Add fitting spoken expressions such as: ")
          .append(String.join(", ", words))
          .append("\n");
    }
    prompt.append(n).append(". Keep every fact of the original text unchanged\n\n");
    prompt.append("USER APPEARANCE:\n");
    prompt.append(
        "- If the context says \"First Message: YES\", you MUST reference the user's appearance"
            + " in a friendly way.\n");
    prompt
        .append("- If it says \"First Message: NO\", reference the appearance with a ")
        .append(appearancePercentage)
        .append("% probability.\n\n");
    prompt.append("OUTPUT RULES:\n");
    prompt.append("- Output ONLY the rewritten message, no explanations or notes\n");
    prompt.append("- Keep it short and natural when spoken aloud\n");
    prompt.append("- Write in ").append(language.getDisplayName()).append("\n");
    return prompt.toString();
  }
}
