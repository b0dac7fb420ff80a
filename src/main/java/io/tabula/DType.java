/*
 * SPDX-FileCopyrightText: Copyright (c) 2019-2025, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.tabula;

import java.util.EnumSet;

/**
 * The closed set of column types a {@link HostColumnVector} can hold. Every type knows how it is
 * stored so typed accessors can be picked once per column instead of once per value.
 */
public enum DType {
  INT32(4),
  INT64(8),
  FLOAT32(4),
  FLOAT64(8),
  /**
   * Byte wise true non-0/false 0.  In general true will be 1.
   */
  BOOL8(1),
  STRING(0);

  private static final EnumSet<DType> INTEGRAL = EnumSet.of(INT32, INT64);
  private static final EnumSet<DType> FLOATING = EnumSet.of(FLOAT32, FLOAT64);

  private final int sizeInBytes;

  DType(int sizeInBytes) {
    this.sizeInBytes = sizeInBytes;
  }

  /** Returns the size in bytes of a single value, or 0 for variable width types. */
  public int getSizeInBytes() {
    return sizeInBytes;
  }

  public boolean isIntegral() {
    return INTEGRAL.contains(this);
  }

  public boolean isFloatingPoint() {
    return FLOATING.contains(this);
  }

  /** Integral and floating point types, the types that promote to a double coordinate. */
  public boolean isNumeric() {
    return isIntegral() || isFloatingPoint();
  }

  /**
   * Two key columns can be joined on if they have the same type or are both numeric. Numeric
   * values of different widths compare by value.
   */
  public boolean isJoinCompatibleWith(DType other) {
    return this == other || (isNumeric() && other.isNumeric());
  }
}
