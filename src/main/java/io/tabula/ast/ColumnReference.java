/*
 * SPDX-FileCopyrightText: Copyright (c) 2021-2025, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tabula.ast;

import java.util.Locale;
import java.util.Objects;

/**
 * A reference to a column in an input table, by name. A reference without a
 * {@link TableReference} is resolved by looking the name up in the input tables.
 */
public final class ColumnReference extends AstExpression {
  private final String columnName;
  private final TableReference tableSource;

  /** Construct a column reference resolved by name against the join inputs */
  public ColumnReference(String columnName) {
    this.columnName = Objects.requireNonNull(columnName, "columnName");
    this.tableSource = null;
  }

  /** Construct a column reference to the named column in the specified table */
  public ColumnReference(String columnName, TableReference tableSource) {
    this.columnName = Objects.requireNonNull(columnName, "columnName");
    this.tableSource = Objects.requireNonNull(tableSource, "tableSource");
  }

  public String getColumnName() {
    return columnName;
  }

  /** The table this reference is pinned to, or null if it is resolved by name. */
  public TableReference getTableSource() {
    return tableSource;
  }

  @Override
  public String toString() {
    if (tableSource == null) {
      return columnName;
    }
    return tableSource.name().toLowerCase(Locale.ROOT) + "." + columnName;
  }
}
