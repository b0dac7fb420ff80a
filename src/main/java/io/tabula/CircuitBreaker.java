/*
 * SPDX-FileCopyrightText: Copyright (c) 2019-2025, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.tabula;

import java.time.Duration;

/**
 * Lets a caller stop a long running join. Joins poll the breaker at their natural chunk
 * boundaries: every batch of probe rows in a hash join, every run of the inequality join and
 * every left row of the nested loop.
 */
public interface CircuitBreaker {
  /** A breaker that never trips. */
  CircuitBreaker NEVER = () -> false;

  /** Returns true once the join should stop. */
  boolean isTripped();

  /**
   * @throws JoinCancelledException if the breaker has tripped
   */
  default void throwIfTripped() {
    if (isTripped()) {
      throw new JoinCancelledException("join cancelled by circuit breaker");
    }
  }

  /** A breaker that trips once the given amount of time has passed from now. */
  static CircuitBreaker withDeadline(Duration timeout) {
    final long deadline = System.nanoTime() + timeout.toNanos();
    return () -> System.nanoTime() - deadline >= 0;
  }
}
