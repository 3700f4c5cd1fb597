package com.flamingo.ai.museumguide.exception;

import java.time.Duration;

/** Exception raised when the auxiliary context provider does not answer in time. */
public class ContextFetchTimeoutException extends RuntimeException {

  private final String sessionId;
  private final Duration timeout;

  public ContextFetchTimeoutException(String sessionId, Duration timeout) {
    super(
        "Context fetch for session " + sessionId + " timed out after " + timeout.toMillis() + "ms");
    this.sessionId = sessionId;
    this.timeout = timeout;
  }

  public String getSessionId() {
    return sessionId;
  }

  public Duration getTimeout() {
    return timeout;
  }
}
