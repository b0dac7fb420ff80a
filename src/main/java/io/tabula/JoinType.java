/*
 * SPDX-FileCopyrightText: Copyright (c) 2019-2025, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.tabula;

/**
 * The kinds of equality join a {@link Table} supports.
 */
public enum JoinType {
  /** Only pairs of rows with equal keys. */
  INNER,
  /** Every left row, with nulls for the right side when nothing matches. */
  LEFT,
  /** Every right row, with nulls for the left side when nothing matches. */
  RIGHT,
  /** Every matched pair, then unmatched left rows and unmatched right rows padded with nulls. */
  OUTER,
  /** Left rows that have at least one match, left columns only. */
  SEMI,
  /** Left rows that have no match, left columns only. */
  ANTI,
  /** Every left row paired with every right row. Keys are ignored. */
  CROSS
}
