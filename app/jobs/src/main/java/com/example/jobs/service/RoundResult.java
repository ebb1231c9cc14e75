package com.example.jobs.service;

/**
 * Outcome of one processing round.
 *
 * @param claimed rows claimed from the store, including stale ones that were only re-anchored
 * @param invoked handler invocations, including attempts for types without a handler
 */
public record RoundResult(int claimed, int invoked) {

  public static final RoundResult EMPTY = new RoundResult(0, 0);
}
