/*
 * SPDX-FileCopyrightText: Copyright (c) 2025, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tabula;

import io.tabula.ast.AstExpression;
import io.tabula.ast.BinaryOperation;
import io.tabula.ast.ColumnReference;
import io.tabula.ast.TableReference;

/**
 * A predicate normalized to {@code leftColumn op rightColumn}, where leftColumn belongs to the
 * left table, rightColumn to the right table and both are numeric.
 */
final class InequalityPredicate {
  private final HostColumnVector leftColumn;
  private final HostColumnVector rightColumn;
  private final InequalityOperator op;

  InequalityPredicate(HostColumnVector leftColumn, InequalityOperator op,
                      HostColumnVector rightColumn) {
    this.leftColumn = leftColumn;
    this.op = op;
    this.rightColumn = rightColumn;
  }

  HostColumnVector getLeftColumn() {
    return leftColumn;
  }

  HostColumnVector getRightColumn() {
    return rightColumn;
  }

  InequalityOperator getOp() {
    return op;
  }

  /**
   * Fail if either column holds a null.
   * @throws NullKeyException if one does
   */
  void checkNoNulls() {
    checkNoNulls(leftColumn, "left");
    checkNoNulls(rightColumn, "right");
  }

  static void checkNoNulls(HostColumnVector col, String side) {
    if (col.hasNulls()) {
      throw new NullKeyException("inequality join column '" + col.getName() + "' of the " + side +
          " table has " + col.getNullCount() + " null values");
    }
  }

  @Override
  public String toString() {
    return "left." + leftColumn.getName() + " " + op.getSymbol() + " right." +
        rightColumn.getName();
  }

  /**
   * Try to turn an expression into an inequality predicate between the two tables. The
   * operands are swapped, and the operator flipped, when the first operand belongs to the
   * right table.
   */
  static Classification classify(AstExpression expr, Table left, Table right) {
    if (!(expr instanceof BinaryOperation)) {
      return Classification.failed(expr + " is not a comparison");
    }
    BinaryOperation binop = (BinaryOperation) expr;
    InequalityOperator op = InequalityOperator.fromBinaryOperator(binop.getOp());
    if (op == null) {
      return Classification.failed("operator " + binop.getOp().getSymbol() + " in " + expr +
          " is not an inequality");
    }
    if (!(binop.getLeftInput() instanceof ColumnReference) ||
        !(binop.getRightInput() instanceof ColumnReference)) {
      return Classification.failed("operands of " + expr + " are not both column references");
    }
    ColumnReference a = (ColumnReference) binop.getLeftInput();
    ColumnReference b = (ColumnReference) binop.getRightInput();
    HostColumnVector leftCol;
    HostColumnVector rightCol;
    if (canBeOn(a, TableReference.LEFT, left) && canBeOn(b, TableReference.RIGHT, right)) {
      leftCol = left.getColumn(a.getColumnName());
      rightCol = right.getColumn(b.getColumnName());
    } else if (canBeOn(a, TableReference.RIGHT, right) &&
        canBeOn(b, TableReference.LEFT, left)) {
      leftCol = left.getColumn(b.getColumnName());
      rightCol = right.getColumn(a.getColumnName());
      op = op.flip();
    } else {
      return Classification.failed("cannot assign the columns of " + expr +
          " to one side each");
    }
    if (!leftCol.getType().isNumeric() || !rightCol.getType().isNumeric()) {
      return Classification.failed("columns of " + expr + " are not both numeric (" +
          leftCol.getType() + ", " + rightCol.getType() + ")");
    }
    return new Classification(new InequalityPredicate(leftCol, op, rightCol), null);
  }

  private static boolean canBeOn(ColumnReference ref, TableReference side, Table table) {
    TableReference source = ref.getTableSource();
    return (source == null || source == side) && table.hasColumn(ref.getColumnName());
  }

  /** Either a predicate or the reason the expression could not be classified. */
  static final class Classification {
    private final InequalityPredicate predicate;
    private final String reason;

    private Classification(InequalityPredicate predicate, String reason) {
      this.predicate = predicate;
      this.reason = reason;
    }

    static Classification failed(String reason) {
      return new Classification(null, reason);
    }

    boolean isClassified() {
      return predicate != null;
    }

    InequalityPredicate getPredicate() {
      return predicate;
    }

    String getReason() {
      return reason;
    }
  }
}
