/*
 * SPDX-FileCopyrightText: Copyright (c) 2021-2025, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tabula.ast;

/**
 * Base class of every node in an AST. Join predicates are built from these nodes and handed
 * to {@code Table.joinWhere}, which pattern matches the tree instead of compiling it.
 */
public abstract class AstExpression {
  AstExpression() {}

  /**
   * Combine predicates with {@link BinaryOperator#LOGICAL_AND}.
   * @param first the first predicate
   * @param rest more predicates, may be empty
   * @return {@code first} itself if there is nothing to combine
   */
  public static AstExpression and(AstExpression first, AstExpression... rest) {
    AstExpression result = first;
    for (AstExpression e : rest) {
      result = new BinaryOperation(BinaryOperator.LOGICAL_AND, result, e);
    }
    return result;
  }
}
