/*
 * SPDX-FileCopyrightText: Copyright (c) 2025, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tabula;

import java.util.Objects;

/**
 * Settings for an inequality join, see {@link Table#joinWhere(Table, InequalityJoinOptions,
 * io.tabula.ast.AstExpression...)}.
 */
public final class InequalityJoinOptions {
  /**
   * Set -Dio.tabula.join.nestedLoopFallback=false to make inequality joins fail instead of
   * degrading to a nested loop when their predicates cannot be classified.
   */
  public static final String NESTED_LOOP_FALLBACK_PROPERTY = "io.tabula.join.nestedLoopFallback";

  public static final InequalityJoinOptions DEFAULT = new InequalityJoinOptions(new Builder());

  private final String suffix;
  private final boolean nestedLoopFallback;
  private final JoinEventHandler eventHandler;
  private final CircuitBreaker circuitBreaker;

  private InequalityJoinOptions(Builder builder) {
    suffix = builder.suffix;
    nestedLoopFallback = builder.nestedLoopFallback;
    eventHandler = builder.eventHandler;
    circuitBreaker = builder.circuitBreaker;
  }

  public String getSuffix() {
    return suffix;
  }

  public boolean isNestedLoopFallbackAllowed() {
    return nestedLoopFallback;
  }

  public JoinEventHandler getEventHandler() {
    return eventHandler;
  }

  public CircuitBreaker getCircuitBreaker() {
    return circuitBreaker;
  }

  static boolean defaultNestedLoopFallback() {
    String prop = System.getProperty(NESTED_LOOP_FALLBACK_PROPERTY);
    return prop == null || Boolean.parseBoolean(prop);
  }

  public static Builder builder() {
    return new Builder();
  }

  public static class Builder {
    private String suffix = JoinOptions.DEFAULT_SUFFIX;
    private boolean nestedLoopFallback = defaultNestedLoopFallback();
    private JoinEventHandler eventHandler = JoinEventHandler.NONE;
    private CircuitBreaker circuitBreaker = CircuitBreaker.NEVER;

    public Builder withSuffix(String suffix) {
      this.suffix = suffix == null || suffix.isEmpty() ? JoinOptions.DEFAULT_SUFFIX : suffix;
      return this;
    }

    /**
     * Allow or forbid the nested loop fallback. Defaults to the value of
     * {@link #NESTED_LOOP_FALLBACK_PROPERTY}, true if unset.
     */
    public Builder withNestedLoopFallback(boolean allowed) {
      this.nestedLoopFallback = allowed;
      return this;
    }

    public Builder withEventHandler(JoinEventHandler eventHandler) {
      this.eventHandler = Objects.requireNonNull(eventHandler, "eventHandler");
      return this;
    }

    public Builder withCircuitBreaker(CircuitBreaker circuitBreaker) {
      this.circuitBreaker = Objects.requireNonNull(circuitBreaker, "circuitBreaker");
      return this;
    }

    public InequalityJoinOptions build() {
      return new InequalityJoinOptions(this);
    }
  }
}
