/*
 * SPDX-FileCopyrightText: Copyright (c) 2025, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tabula;

import java.util.Objects;

/**
 * Settings for {@link Table#rollingJoin(Table, RollingJoinOptions)}. The ordered key and a
 * window size must be set, everything else has a default: a backward window closed on the
 * right, no minimum number of matches and no grouping.
 */
public final class RollingJoinOptions {
  private final String leftOn;
  private final String rightOn;
  private final String[] leftBy;
  private final String[] rightBy;
  private final double windowSize;
  private final int minPeriods;
  private final boolean center;
  private final RollingDirection direction;
  private final ClosedInterval closedInterval;
  private final String suffix;

  private RollingJoinOptions(Builder builder) {
    leftOn = builder.leftOn;
    rightOn = builder.rightOn;
    leftBy = builder.leftBy;
    // right "by" columns default to the left ones
    rightBy = builder.rightBy.length == 0 ? builder.leftBy : builder.rightBy;
    windowSize = builder.windowSize;
    minPeriods = builder.minPeriods;
    center = builder.center;
    direction = builder.direction;
    closedInterval = builder.closedInterval;
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

  public double getWindowSize() {
    return windowSize;
  }

  /**
   * The fewest right rows a window must hold. A left row whose window holds fewer is output
   * once with nulls on the right.
   */
  public int getMinPeriods() {
    return minPeriods;
  }

  /** True if the window is centred on the left key, in which case the direction is ignored. */
  public boolean isCenter() {
    return center;
  }

  public RollingDirection getDirection() {
    return direction;
  }

  public ClosedInterval getClosedInterval() {
    return closedInterval;
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
    private double windowSize = Double.NaN;
    private int minPeriods;
    private boolean center;
    private RollingDirection direction = RollingDirection.BACKWARD;
    private ClosedInterval closedInterval = ClosedInterval.RIGHT;
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

    /**
     * @param windowSize width of the window in units of the ordered key, finite and positive
     */
    public Builder withWindowSize(double windowSize) {
      if (!(windowSize > 0) || Double.isInfinite(windowSize)) {
        throw new IllegalArgumentException("window size must be positive, got " + windowSize);
      }
      this.windowSize = windowSize;
      return this;
    }

    public Builder withMinPeriods(int minPeriods) {
      if (minPeriods < 0) {
        throw new IllegalArgumentException("min periods must be >= 0, got " + minPeriods);
      }
      this.minPeriods = minPeriods;
      return this;
    }

    public Builder withCenter(boolean center) {
      this.center = center;
      return this;
    }

    public Builder withDirection(RollingDirection direction) {
      this.direction = Objects.requireNonNull(direction, "direction");
      return this;
    }

    public Builder withClosedInterval(ClosedInterval closedInterval) {
      this.closedInterval = Objects.requireNonNull(closedInterval, "closedInterval");
      return this;
    }

    public Builder withSuffix(String suffix) {
      this.suffix = suffix == null || suffix.isEmpty() ? JoinOptions.DEFAULT_SUFFIX : suffix;
      return this;
    }

    public RollingJoinOptions build() {
      if (leftOn == null || rightOn == null) {
        throw new IllegalArgumentException("the ordered key column must be set with withOn or " +
            "withLeftOn and withRightOn");
      }
      if (Double.isNaN(windowSize)) {
        throw new IllegalArgumentException("the window size must be set with withWindowSize");
      }
      return new RollingJoinOptions(this);
    }
  }
}
