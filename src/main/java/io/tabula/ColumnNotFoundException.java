/*
 * SPDX-FileCopyrightText: Copyright (c) 2019-2025, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.tabula;

/** Thrown when a column is looked up by a name the table does not have. */
public class ColumnNotFoundException extends JoinValidationException {
  private final String columnName;

  ColumnNotFoundException(String columnName, String message) {
    super(message);
    this.columnName = columnName;
  }

  /** The name that could not be found. */
  public String getColumnName() {
    return columnName;
  }
}
