/*
 * SPDX-FileCopyrightText: Copyright (c) 2021-2025, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tabula.ast;

import io.tabula.DType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class AstExpressionTest {
  @Test
  void testColumnReference() {
    ColumnReference byName = new ColumnReference("dur");
    assertEquals("dur", byName.getColumnName());
    assertNull(byName.getTableSource());
    assertEquals("dur", byName.toString());
    ColumnReference onRight = new ColumnReference("time", TableReference.RIGHT);
    assertEquals(TableReference.RIGHT, onRight.getTableSource());
    assertEquals("right.time", onRight.toString());
    assertThrows(NullPointerException.class, () -> new ColumnReference(null));
  }

  @Test
  void testLiterals() {
    assertEquals(DType.INT32, Literal.ofInt(5).getType());
    assertEquals(5, Literal.ofInt(5).getValue());
    assertEquals(DType.INT64, Literal.ofLong(5L).getType());
    assertEquals(DType.FLOAT32, Literal.ofFloat(1.5f).getType());
    assertEquals(DType.FLOAT64, Literal.ofDouble(1.5).getType());
    assertEquals(DType.BOOL8, Literal.ofBoolean(true).getType());
    assertEquals(DType.STRING, Literal.ofString("x").getType());
    assertEquals("\"x\"", Literal.ofString("x").toString());
    assertEquals("2.5", Literal.ofDouble(2.5).toString());
  }

  @Test
  void testAndBuildsLeftDeepTree() {
    AstExpression a = new BinaryOperation(BinaryOperator.LESS,
        new ColumnReference("dur"), new ColumnReference("time"));
    AstExpression b = new BinaryOperation(BinaryOperator.GREATER,
        new ColumnReference("rev"), new ColumnReference("cost"));
    AstExpression c = new BinaryOperation(BinaryOperator.NOT_EQUAL,
        new ColumnReference("id", TableReference.LEFT), Literal.ofInt(0));
    assertSame(a, AstExpression.and(a));
    AstExpression all = AstExpression.and(a, b, c);
    assertEquals("(((dur < time) && (rev > cost)) && (left.id != 0))", all.toString());
    BinaryOperation top = (BinaryOperation) all;
    assertEquals(BinaryOperator.LOGICAL_AND, top.getOp());
    assertSame(c, top.getRightInput());
  }

  @Test
  void testComparisonOperators() {
    int comparisons = 0;
    for (BinaryOperator op : BinaryOperator.values()) {
      if (op.isComparison()) {
        comparisons++;
      }
    }
    assertEquals(6, comparisons);
    assertTrue(BinaryOperator.GREATER_EQUAL.isComparison());
    assertFalse(BinaryOperator.LOGICAL_AND.isComparison());
    assertFalse(BinaryOperator.ADD.isComparison());
    assertEquals(">=", BinaryOperator.GREATER_EQUAL.getSymbol());
  }
}
