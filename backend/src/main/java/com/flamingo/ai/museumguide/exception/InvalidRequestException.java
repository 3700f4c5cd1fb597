package com.flamingo.ai.museumguide.exception;

/** Exception thrown for malformed caller input; rejected before any work starts. */
public class InvalidRequestException extends RuntimeException {

  public InvalidRequestException(String message) {
    super(message);
  }
}
