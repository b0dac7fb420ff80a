/*
 * SPDX-FileCopyrightText: Copyright (c) 2021-2025, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tabula.ast;

/**
 * Enumeration of tables that can be referenced in an AST. In a join the left table is the one
 * the join is called on and the right table is the argument.
 */
public enum TableReference {
  LEFT,
  RIGHT
}
