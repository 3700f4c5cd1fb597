package com.flamingo.ai.museumguide.domain.enums;

/** Defines the role of a chat message sender. */
public enum MessageRole {
  /** Message from the visitor. */
  USER,

  /** Message from the guide. */
  ASSISTANT,

  /** System message (instructions, context). */
  SYSTEM
}
