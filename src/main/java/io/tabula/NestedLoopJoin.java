/*
 * SPDX-FileCopyrightText: Copyright (c) 2025, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tabula;

import io.tabula.ast.AstExpression;
import io.tabula.ast.BinaryOperation;
import io.tabula.ast.BinaryOperator;
import io.tabula.ast.ColumnReference;
import io.tabula.ast.Literal;
import io.tabula.ast.TableReference;

import java.util.List;

/**
 * Evaluates a conjunction of comparisons on every pair of rows. Each comparison is between
 * column references and literals. A column reference without a table is looked up in the left
 * table first, then the right one. Comparisons are compiled once per join so the pair loop
 * does no type dispatch.
 */
final class NestedLoopJoin {
  private NestedLoopJoin() {}

  @FunctionalInterface
  interface PairPredicate {
    boolean test(int leftRow, int rightRow);
  }

  static GatherMap[] gatherMaps(Table left, Table right, List<AstExpression> predicates,
                                CircuitBreaker breaker) {
    PairPredicate[] compiled = new PairPredicate[predicates.size()];
    for (int i = 0; i < compiled.length; i++) {
      compiled[i] = compile(predicates.get(i), left, right);
    }
    int leftRows = (int) left.getRowCount();
    int rightRows = (int) right.getRowCount();
    GatherMap.Builder leftOut = new GatherMap.Builder();
    GatherMap.Builder rightOut = new GatherMap.Builder();
    for (int l = 0; l < leftRows; l++) {
      breaker.throwIfTripped();
      for (int r = 0; r < rightRows; r++) {
        if (allMatch(compiled, l, r)) {
          leftOut.append(l);
          rightOut.append(r);
        }
      }
    }
    return new GatherMap[] {leftOut.build(), rightOut.build()};
  }

  private static boolean allMatch(PairPredicate[] predicates, int l, int r) {
    for (PairPredicate p : predicates) {
      if (!p.test(l, r)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Turn a comparison into a predicate over row pairs.
   * @throws PredicateShapeException if the expression is not a comparison between columns and
   *                                 literals of comparable types
   * @throws NullKeyException if a referenced column holds nulls
   */
  static PairPredicate compile(AstExpression expr, Table left, Table right) {
    if (!(expr instanceof BinaryOperation)) {
      throw new PredicateShapeException("cannot evaluate " + expr + ", expected a comparison");
    }
    BinaryOperation binop = (BinaryOperation) expr;
    BinaryOperator op = binop.getOp();
    if (!op.isComparison()) {
      throw new PredicateShapeException("cannot evaluate " + expr + ", operator " +
          op.getSymbol() + " is not a comparison");
    }
    Operand a = operand(binop.getLeftInput(), expr, left, right);
    Operand b = operand(binop.getRightInput(), expr, left, right);
    DType at = a.type;
    DType bt = b.type;
    if (at.isNumeric() && bt.isNumeric()) {
      return (l, r) -> compareNumbers(op, a.number(l, r), b.number(l, r));
    }
    if (at == DType.STRING && bt == DType.STRING) {
      return (l, r) -> matches(op, a.string(l, r).compareTo(b.string(l, r)));
    }
    if (at == DType.BOOL8 && bt == DType.BOOL8) {
      return (l, r) -> matches(op, Boolean.compare(a.bool(l, r), b.bool(l, r)));
    }
    throw new PredicateShapeException("cannot compare " + at + " with " + bt + " in " + expr);
  }

  private static boolean compareNumbers(BinaryOperator op, double a, double b) {
    switch (op) {
      case EQUAL:
        return a == b;
      case NOT_EQUAL:
        return a != b;
      case LESS:
        return a < b;
      case LESS_EQUAL:
        return a <= b;
      case GREATER:
        return a > b;
      case GREATER_EQUAL:
        return a >= b;
      default:
        throw new IllegalStateException("not a comparison " + op);
    }
  }

  private static boolean matches(BinaryOperator op, int cmp) {
    switch (op) {
      case EQUAL:
        return cmp == 0;
      case NOT_EQUAL:
        return cmp != 0;
      case LESS:
        return cmp < 0;
      case LESS_EQUAL:
        return cmp <= 0;
      case GREATER:
        return cmp > 0;
      case GREATER_EQUAL:
        return cmp >= 0;
      default:
        throw new IllegalStateException("not a comparison " + op);
    }
  }

  private static Operand operand(AstExpression input, AstExpression expr, Table left,
                                 Table right) {
    if (input instanceof Literal) {
      Literal lit = (Literal) input;
      if (lit.getValue() == null) {
        throw new PredicateShapeException("null literal in " + expr);
      }
      return new LiteralOperand(lit);
    }
    if (!(input instanceof ColumnReference)) {
      throw new PredicateShapeException("cannot evaluate " + input + " in " + expr +
          ", operands must be columns or literals");
    }
    ColumnReference ref = (ColumnReference) input;
    String name = ref.getColumnName();
    TableReference source = ref.getTableSource();
    boolean onLeft;
    if (source != null) {
      onLeft = source == TableReference.LEFT;
      Table table = onLeft ? left : right;
      if (!table.hasColumn(name)) {
        throw new PredicateShapeException("column '" + name + "' in " + expr +
            " is not in the " + (onLeft ? "left" : "right") + " table");
      }
    } else if (left.hasColumn(name)) {
      onLeft = true;
    } else if (right.hasColumn(name)) {
      onLeft = false;
    } else {
      throw new PredicateShapeException("column '" + name + "' in " + expr +
          " is in neither table");
    }
    HostColumnVector col = (onLeft ? left : right).getColumn(name);
    InequalityPredicate.checkNoNulls(col, onLeft ? "left" : "right");
    return new ColumnOperand(col, onLeft);
  }

  /** One side of a comparison, read for a pair of rows. */
  private abstract static class Operand {
    final DType type;

    Operand(DType type) {
      this.type = type;
    }

    abstract double number(int l, int r);

    abstract String string(int l, int r);

    abstract boolean bool(int l, int r);
  }

  private static final class ColumnOperand extends Operand {
    private final HostColumnVector col;
    private final boolean onLeft;

    ColumnOperand(HostColumnVector col, boolean onLeft) {
      super(col.getType());
      this.col = col;
      this.onLeft = onLeft;
    }

    @Override
    double number(int l, int r) {
      return col.getAsDouble(onLeft ? l : r);
    }

    @Override
    String string(int l, int r) {
      return col.getJavaString(onLeft ? l : r);
    }

    @Override
    boolean bool(int l, int r) {
      return col.getBoolean(onLeft ? l : r);
    }
  }

  private static final class LiteralOperand extends Operand {
    private final Object value;

    LiteralOperand(Literal lit) {
      super(lit.getType());
      this.value = lit.getValue();
    }

    @Override
    double number(int l, int r) {
      return ((Number) value).doubleValue();
    }

    @Override
    String string(int l, int r) {
      return (String) value;
    }

    @Override
    boolean bool(int l, int r) {
      return (Boolean) value;
    }
  }
}
