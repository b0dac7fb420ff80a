/*
 * SPDX-FileCopyrightText: Copyright (c) 2025, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tabula;

/**
 * The algorithm an inequality join runs with, see {@link Table#planJoinWhere}.
 */
public enum JoinStrategy {
  /** No predicates, every pair of rows. */
  CROSS,
  /** One inequality predicate, sort both sides and merge. */
  PIECEWISE_MERGE,
  /** Two or more inequality predicates, the IEJoin over the first two. */
  IE_JOIN,
  /** Predicates the accelerated paths cannot classify, every pair of rows is tested. */
  NESTED_LOOP
}
