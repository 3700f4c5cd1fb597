package com.flamingo.ai.museumguide.exception;

/** Exception thrown when retrieval cannot run (embedding failure, vector store down, no index). */
public class RetrievalUnavailableException extends RuntimeException {

  private final String userMessage;

  public RetrievalUnavailableException(String message) {
    super(message);
    this.userMessage = "Search is temporarily unavailable. Please try again.";
  }

  public RetrievalUnavailableException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Search is temporarily unavailable. Please try again.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
