/*
 * SPDX-FileCopyrightText: Copyright (c) 2025, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tabula;

import java.util.Objects;

/**
 * Settings for {@link Table#mergeAsof(Table, AsofJoinOptions)}.
 */
public final class AsofJoinOptions {
  private final String leftOn;
  private final String rightOn;
  private final String[] leftBy;
  private final String[] rightBy;
  private final AsofDirection direction;
  private final double tolerance;
  private final boolean allowExactMatches;
  private final String suffix;

  private AsofJoinOptions(Builder builder) {
    leftOn = builder.leftOn;
    rightOn = builder.rightOn;
    leftBy = builder.leftBy;
    rightBy = builder.rightBy;
    direction = builder.direction;
    tolerance = builder.tolerance;
    allowExactMatches = builder.allowExactMatches;
    suffix = builder.suffix;
  }

  public String getLeftOn() {
    return leftOn;
  }

  public String getRightOn() {
    return rightOn;
  }

  public String[] getLeftBy() {
    return leftBy.clone();
  }

  public String[] getRightBy() {
    return rightBy.clone();
  }

  public AsofDirection getDirection() {
    return direction;
  }

  /** The largest allowed distance between matched keys, infinite if not set. */
  public double getTolerance() {
    return tolerance;
  }

  public boolean isAllowExactMatches() {
    return allowExactMatches;
  }

  public String getSuffix() {
    return suffix;
  }

  String[] leftBy() {
    return leftBy;
  }

  String[] rightBy() {
    return rightBy;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static class Builder {
    private String leftOn;
    private String rightOn;
    private String[] leftBy = new String[0];
    private String[] rightBy = new String[0];
    private AsofDirection direction = AsofDirection.BACKWARD;
    private double tolerance = Double.POSITIVE_INFINITY;
    private boolean allowExactMatches = true;
    private String suffix = JoinOptions.DEFAULT_SUFFIX;

    /** Use the same ordered key column name on both sides. */
    public Builder withOn(String name) {
      return withLeftOn(name).withRightOn(name);
    }

    public Builder withLeftOn(String name) {
      this.leftOn = Objects.requireNonNull(name, "leftOn");
      return this;
    }

    public Builder withRightOn(String name) {
      this.rightOn = Objects.requireNonNull(name, "rightOn");
      return this;
    }

    /** Only match rows that have equal values in these columns, same names on both sides. */
    public Builder withBy(String... names) {
      return withLeftBy(names).withRightBy(names);
    }

    public Builder withLeftBy(String... names) {
      this.leftBy = names.clone();
      return this;
    }

    public Builder withRightBy(String... names) {
      this.rightBy = names.clone();
      return this;
    }

    public Builder withDirection(AsofDirection direction) {
      this.direction = Objects.requireNonNull(direction, "direction");
      return this;
    }

    /**
     * Drop matches whose keys are further apart than this.
     * @param tolerance a distance, zero or more
     */
    public Builder withTolerance(double tolerance) {
      if (!(tolerance >= 0)) {
        throw new IllegalArgumentException("tolerance must be >= 0, got " + tolerance);
      }
      this.tolerance = tolerance;
      return this;
    }

    public Builder withAllowExactMatches(boolean allowExactMatches) {
      this.allowExactMatches = allowExactMatches;
      return this;
    }

    public Builder withSuffix(String suffix) {
      this.suffix = suffix == null || suffix.isEmpty() ? JoinOptions.DEFAULT_SUFFIX : suffix;
      return this;
    }

    public AsofJoinOptions build() {
      if (leftOn == null || rightOn == null) {
        throw new IllegalArgumentException("the ordered key column must be set with withOn or " +
            "withLeftOn and withRightOn");
      }
      return new AsofJoinOptions(this);
    }
  }
}
