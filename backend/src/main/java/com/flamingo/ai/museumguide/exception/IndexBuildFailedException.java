package com.flamingo.ai.museumguide.exception;

/** Exception thrown when building the dense or sparse index fails; the previous index stays. */
public class IndexBuildFailedException extends RuntimeException {

  private final String userMessage;

  public IndexBuildFailedException(String message) {
    super(message);
    this.userMessage = "Index build failed. The previous index is still in use.";
  }

  public IndexBuildFailedException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Index build failed. The previous index is still in use.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
