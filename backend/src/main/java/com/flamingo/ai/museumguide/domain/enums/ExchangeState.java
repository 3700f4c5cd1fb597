package com.flamingo.ai.museumguide.domain.enums;

import java.util.EnumSet;
import java.util.Set;

/** Lifecycle of one query exchange. */
public enum ExchangeState {
  IDLE,
  FETCHING_AND_GENERATING,
  TONE_SELECTED,
  STREAMING,
  DONE,
  ERRORED,
  CANCELLED;

  /** Whether no further transition is allowed out of this state. */
  public boolean isTerminal() {
    return this == DONE || this == ERRORED || this == CANCELLED;
  }

  /** States reachable from this one. */
  public Set<ExchangeState> successors() {
    return switch (this) {
      case IDLE -> EnumSet.of(FETCHING_AND_GENERATING, ERRORED, CANCELLED);
      case FETCHING_AND_GENERATING -> EnumSet.of(TONE_SELECTED, ERRORED, CANCELLED);
      case TONE_SELECTED -> EnumSet.of(STREAMING, DONE, ERRORED, CANCELLED);
      case STREAMING -> EnumSet.of(DONE, ERRORED, CANCELLED);
      case DONE, ERRORED, CANCELLED -> EnumSet.noneOf(ExchangeState.class);
    };
  }
}
