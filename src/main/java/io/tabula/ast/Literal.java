/*
 * SPDX-FileCopyrightText: Copyright (c) 2021-2025, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tabula.ast;

import io.tabula.DType;

import java.util.Objects;

/** A literal value in an AST expression. */
public final class Literal extends AstExpression {
  private final DType type;
  private final Object value;

  private Literal(DType type, Object value) {
    this.type = type;
    this.value = Objects.requireNonNull(value, "value");
  }

  /** Construct a boolean literal with the specified value. */
  public static Literal ofBoolean(boolean value) {
    return new Literal(DType.BOOL8, value);
  }

  /** Construct an integer literal with the specified value. */
  public static Literal ofInt(int value) {
    return new Literal(DType.INT32, value);
  }

  /** Construct a long literal with the specified value. */
  public static Literal ofLong(long value) {
    return new Literal(DType.INT64, value);
  }

  /** Construct a float literal with the specified value. */
  public static Literal ofFloat(float value) {
    return new Literal(DType.FLOAT32, value);
  }

  /** Construct a double literal with the specified value. */
  public static Literal ofDouble(double value) {
    return new Literal(DType.FLOAT64, value);
  }

  /** Construct a string literal with the specified value. */
  public static Literal ofString(String value) {
    return new Literal(DType.STRING, value);
  }

  public DType getType() {
    return type;
  }

  /** The boxed value, an Integer, Long, Float, Double, Boolean or String matching the type. */
  public Object getValue() {
    return value;
  }

  @Override
  public String toString() {
    return type == DType.STRING ? "\"" + value + "\"" : String.valueOf(value);
  }
}
