package com.flamingo.ai.museumguide.domain.enums;

/** Language of a chunk, query or answer, as far as the pipeline needs to distinguish them. */
public enum ContentLanguage {
  CHINESE("zh", "Traditional Chinese (繁體中文)"),
  ENGLISH("en", "English");

  private final String tag;
  private final String displayName;

  ContentLanguage(String tag, String displayName) {
    this.tag = tag;
    this.displayName = displayName;
  }

  /** Short tag stored in chunk metadata ({@code zh} or {@code en}). */
  public String getTag() {
    return tag;
  }

  /** Name used when instructing the model which language to answer in. */
  public String getDisplayName() {
    return displayName;
  }

  public static ContentLanguage fromTag(String tag) {
    for (ContentLanguage language : values()) {
      if (language.tag.equalsIgnoreCase(tag)) {
        return language;
      }
    }
    return ENGLISH;
  }
}
