/*
 * SPDX-FileCopyrightText: Copyright (c) 2021-2025, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tabula.ast;

import java.util.Objects;

/** A binary operation consisting of an operator and two operands. */
public class BinaryOperation extends AstExpression {
  private final BinaryOperator op;
  private final AstExpression leftInput;
  private final AstExpression rightInput;

  public BinaryOperation(BinaryOperator op, AstExpression leftInput, AstExpression rightInput) {
    this.op = Objects.requireNonNull(op, "op");
    this.leftInput = Objects.requireNonNull(leftInput, "leftInput");
    this.rightInput = Objects.requireNonNull(rightInput, "rightInput");
  }

  public BinaryOperator getOp() {
    return op;
  }

  public AstExpression getLeftInput() {
    return leftInput;
  }

  public AstExpression getRightInput() {
    return rightInput;
  }

  @Override
  public String toString() {
    return "(" + leftInput + " " + op.getSymbol() + " " + rightInput + ")";
  }
}
