package com.flamingo.ai.museumguide.exception;

/** Exception thrown when the generation backend fails or produces no answer. */
public class GenerationFailedException extends RuntimeException {

  private final boolean rateLimited;
  private final String userMessage;

  public GenerationFailedException(String message) {
    super(message);
    this.rateLimited = false;
    this.userMessage = "AI service is temporarily unavailable. Please try again later.";
  }

  public GenerationFailedException(String message, Throwable cause) {
    super(message, cause);
    this.rateLimited = false;
    this.userMessage = "AI service is temporarily unavailable. Please try again later.";
  }

  public GenerationFailedException(String message, boolean rateLimited) {
    super(message);
    this.rateLimited = rateLimited;
    this.userMessage =
        rateLimited
            ? "Service is temporarily busy. Please try again in a moment."
            : "AI service is temporarily unavailable. Please try again later.";
  }

  public boolean isRateLimited() {
    return rateLimited;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
