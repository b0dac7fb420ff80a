/*
 * SPDX-FileCopyrightText: Copyright (c) 2021-2025, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tabula.ast;

/**
 * Enumeration of AST operators that can appear in a binary operation.
 */
public enum BinaryOperator {
  ADD("+"),
  SUB("-"),
  MUL("*"),
  DIV("/"),
  EQUAL("=="),
  NOT_EQUAL("!="),
  LESS("<"),
  GREATER(">"),
  LESS_EQUAL("<="),
  GREATER_EQUAL(">="),
  LOGICAL_AND("&&"),
  LOGICAL_OR("||");

  private final String symbol;

  BinaryOperator(String symbol) {
    this.symbol = symbol;
  }

  public String getSymbol() {
    return symbol;
  }

  /** True for the six operators that compare their operands and produce a boolean. */
  public boolean isComparison() {
    switch (this) {
      case EQUAL:
      case NOT_EQUAL:
      case LESS:
      case GREATER:
      case LESS_EQUAL:
      case GREATER_EQUAL:
        return true;
      default:
        return false;
    }
  }
}
