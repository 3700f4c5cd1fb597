package com.flamingo.ai.museumguide.service.chat;

import com.flamingo.ai.museumguide.domain.enums.ExchangeState;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;

/**
 * Tracks the state of one query exchange. Transitions are atomic, so a cancellation racing with
 * stream completion lets exactly one of them reach a terminal state.
 */
@Slf4j
public class ExchangeStateMachine {

  private final String exchangeId;
  private final AtomicReference<ExchangeState> state = new AtomicReference<>(ExchangeState.IDLE);

  public ExchangeStateMachine(String exchangeId) {
    this.exchangeId = exchangeId;
  }

  public ExchangeState current() {
    return state.get();
  }

  public String exchangeId() {
    return exchangeId;
  }

  /**
   * Moves to {@code next}.
   *
   * @throws IllegalStateException if {@code next} is not reachable from the current state
   */
  public void transition(ExchangeState next) {
    if (!tryTransition(next)) {
      throw new IllegalStateException(
          "Exchange " + exchangeId + ": illegal transition " + state.get() + " -> " + next);
    }
  }

  /**
   * Moves to {@code next} if it is reachable from the current state.
   *
   * @return whether the transition happened
   */
  public boolean tryTransition(ExchangeState next) {
    while (true) {
      ExchangeState from = state.get();
      if (!from.successors().contains(next)) {
        return false;
      }
      if (state.compareAndSet(from, next)) {
        log.debug("Exchange {}: {} -> {}", exchangeId, from, next);
        return true;
      }
    }
  }

  public boolean isTerminal() {
    return state.get().isTerminal();
  }
}
