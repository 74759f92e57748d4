package com.example.translator.service;

import java.util.EnumSet;
import java.util.Set;

/**
 * States of a single translation relay and the transitions allowed out of each.
 * FAILED is reachable from every non-terminal state; only the upstream path fails in normal
 * operation, the other edges cover internal errors.
 */
public enum RelayState {
  START,
  CACHE_HIT,
  NO_CREDENTIAL,
  UPSTREAM,
  STREAMING,
  DONE,
  FAILED,
  CANCELLED;

  private Set<RelayState> next;

  static {
    START.next = EnumSet.of(CACHE_HIT, NO_CREDENTIAL, UPSTREAM, FAILED, CANCELLED);
    CACHE_HIT.next = EnumSet.of(DONE, FAILED, CANCELLED);
    NO_CREDENTIAL.next = EnumSet.of(STREAMING, FAILED, CANCELLED);
    UPSTREAM.next = EnumSet.of(STREAMING, FAILED, CANCELLED);
    STREAMING.next = EnumSet.of(DONE, FAILED, CANCELLED);
    DONE.next = EnumSet.noneOf(RelayState.class);
    FAILED.next = EnumSet.noneOf(RelayState.class);
    CANCELLED.next = EnumSet.noneOf(RelayState.class);
  }

  public boolean canTransitionTo(RelayState target) {
    return next.contains(target);
  }

  public boolean isTerminal() {
    return next.isEmpty();
  }
}
