/*
 * SPDX-FileCopyrightText: Copyright (c) 2025, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tabula;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class CircuitBreakerTest {
  @Test
  void testNever() {
    assertFalse(CircuitBreaker.NEVER.isTripped());
    assertDoesNotThrow(CircuitBreaker.NEVER::throwIfTripped);
  }

  @Test
  void testDeadline() {
    assertTrue(CircuitBreaker.withDeadline(Duration.ZERO).isTripped());
    CircuitBreaker later = CircuitBreaker.withDeadline(Duration.ofHours(1));
    assertFalse(later.isTripped());
    assertThrows(JoinCancelledException.class,
        () -> CircuitBreaker.withDeadline(Duration.ofNanos(-1)).throwIfTripped());
  }

  @Test
  void testTripsMidJoin() {
    // lets the first check pass, then cancels
    AtomicInteger checks = new AtomicInteger();
    CircuitBreaker breaker = () -> checks.incrementAndGet() > 1;
    int rows = 5000;
    int[] keys = new int[rows];
    for (int i = 0; i < rows; i++) {
      keys[i] = i % 10;
    }
    Table left = new Table(HostColumnVector.fromInts("k", keys));
    Table right = new Table(HostColumnVector.fromInts("k", keys));
    JoinOptions options = JoinOptions.builder()
        .withOn("k")
        .withCircuitBreaker(breaker)
        .build();
    assertThrows(JoinCancelledException.class, () -> left.joinWithConfig(right, options));
    assertTrue(checks.get() >= 2);
  }
}
