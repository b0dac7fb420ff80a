/*
 * SPDX-FileCopyrightText: Copyright (c) 2019-2025, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tabula;

import java.util.Arrays;
import java.util.Objects;

/**
 * Settings for an equality join, see {@link Table#joinWithConfig(Table, JoinOptions)}.
 */
public final class JoinOptions {
  /** Appended to right column names that collide with a left column name. */
  public static final String DEFAULT_SUFFIX = "_right";

  public static final JoinOptions DEFAULT = new JoinOptions(new Builder());

  private final JoinType how;
  private final String[] leftOn;
  private final String[] rightOn;
  private final String suffix;
  private final NullEquality nullEquality;
  private final CircuitBreaker circuitBreaker;

  private JoinOptions(Builder builder) {
    how = builder.how;
    leftOn = builder.leftOn;
    rightOn = builder.rightOn;
    suffix = builder.suffix;
    nullEquality = builder.nullEquality;
    circuitBreaker = builder.circuitBreaker;
  }

  public JoinType getHow() {
    return how;
  }

  public String[] getLeftOn() {
    return leftOn.clone();
  }

  public String[] getRightOn() {
    return rightOn.clone();
  }

  public String getSuffix() {
    return suffix;
  }

  public NullEquality getNullEquality() {
    return nullEquality;
  }

  public CircuitBreaker getCircuitBreaker() {
    return circuitBreaker;
  }

  String[] leftOn() {
    return leftOn;
  }

  String[] rightOn() {
    return rightOn;
  }

  @Override
  public String toString() {
    return "JoinOptions{" +
        "how=" + how +
        ", leftOn=" + Arrays.toString(leftOn) +
        ", rightOn=" + Arrays.toString(rightOn) +
        ", suffix='" + suffix + '\'' +
        ", nullEquality=" + nullEquality +
        '}';
  }

  public static Builder builder() {
    return new Builder();
  }

  public static class Builder {
    private JoinType how = JoinType.INNER;
    private String[] leftOn = new String[0];
    private String[] rightOn = new String[0];
    private String suffix = DEFAULT_SUFFIX;
    private NullEquality nullEquality = NullEquality.UNEQUAL;
    private CircuitBreaker circuitBreaker = CircuitBreaker.NEVER;

    /** The kind of join, {@link JoinType#INNER} if not set. */
    public Builder withHow(JoinType how) {
      this.how = Objects.requireNonNull(how, "how");
      return this;
    }

    /** Use the same key column names on both sides. */
    public Builder withOn(String... names) {
      return withLeftOn(names).withRightOn(names);
    }

    public Builder withLeftOn(String... names) {
      this.leftOn = names.clone();
      return this;
    }

    public Builder withRightOn(String... names) {
      this.rightOn = names.clone();
      return this;
    }

    /**
     * Set the suffix used to rename right columns that collide with left ones. An empty or null
     * suffix means {@link #DEFAULT_SUFFIX}.
     */
    public Builder withSuffix(String suffix) {
      this.suffix = suffix == null || suffix.isEmpty() ? DEFAULT_SUFFIX : suffix;
      return this;
    }

    public Builder withNullEquality(NullEquality nullEquality) {
      this.nullEquality = Objects.requireNonNull(nullEquality, "nullEquality");
      return this;
    }

    public Builder withCircuitBreaker(CircuitBreaker circuitBreaker) {
      this.circuitBreaker = Objects.requireNonNull(circuitBreaker, "circuitBreaker");
      return this;
    }

    public JoinOptions build() {
      return new JoinOptions(this);
    }
  }
}
