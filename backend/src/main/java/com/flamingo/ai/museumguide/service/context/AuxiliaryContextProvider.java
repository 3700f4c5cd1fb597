package com.flamingo.ai.museumguide.service.context;

import java.time.Duration;

/** Source of a visual description of the visitor behind a session. */
public interface AuxiliaryContextProvider {

  /**
   * Fetches the current description for a session.
   *
   * @param sessionId the session ID
   * @param timeout how long to wait for the provider
   * @return the context, {@link AuxiliaryContext#unavailable()} if the provider has none
   * @throws com.flamingo.ai.museumguide.exception.ContextFetchTimeoutException if the provider
   *     does not answer within {@code timeout}
   */
  AuxiliaryContext fetch(String sessionId, Duration timeout);
}
