/*
 * SPDX-FileCopyrightText: Copyright (c) 2025, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tabula;

import io.tabula.ast.BinaryOperator;

/**
 * A comparison usable by the inequality join, always read as {@code left op right}.
 */
public enum InequalityOperator {
  LESS("<", true),
  LESS_EQUAL("<=", false),
  GREATER(">", true),
  GREATER_EQUAL(">=", false);

  private final String symbol;
  private final boolean strict;

  InequalityOperator(String symbol, boolean strict) {
    this.symbol = symbol;
    this.strict = strict;
  }

  public String getSymbol() {
    return symbol;
  }

  /** True for {@code <} and {@code >}, which do not hold for equal values. */
  public boolean isStrict() {
    return strict;
  }

  /** True for {@code <} and {@code <=}. */
  public boolean isLessThan() {
    return this == LESS || this == LESS_EQUAL;
  }

  /**
   * The operator that gives the same answer with the operands swapped, {@code a < b} is
   * {@code b > a}.
   */
  public InequalityOperator flip() {
    return switch (this) {
      case LESS -> GREATER;
      case LESS_EQUAL -> GREATER_EQUAL;
      case GREATER -> LESS;
      case GREATER_EQUAL -> LESS_EQUAL;
    };
  }

  /** Evaluate {@code left op right}. Always false if either value is NaN. */
  public boolean test(double left, double right) {
    return switch (this) {
      case LESS -> left < right;
      case LESS_EQUAL -> left <= right;
      case GREATER -> left > right;
      case GREATER_EQUAL -> left >= right;
    };
  }

  /**
   * @return the matching inequality, or null if op is not one of {@code <, <=, >, >=}
   */
  public static InequalityOperator fromBinaryOperator(BinaryOperator op) {
    switch (op) {
      case LESS:
        return LESS;
      case LESS_EQUAL:
        return LESS_EQUAL;
      case GREATER:
        return GREATER;
      case GREATER_EQUAL:
        return GREATER_EQUAL;
      default:
        return null;
    }
  }
}
