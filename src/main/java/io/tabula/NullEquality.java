/*
 *
 *  SPDX-FileCopyrightText: Copyright (c) 2021-2025, NVIDIA CORPORATION.
 *  SPDX-License-Identifier: Apache-2.0
 *
 */

package io.tabula;

/**
 * How should nulls in join keys be compared. The default for every join is {@link #UNEQUAL}:
 * a key with a null component matches nothing, not even another null.
 */
public enum NullEquality {
  UNEQUAL(false),
  EQUAL(true);

  NullEquality(boolean nullsEqual) {
    this.nullsEqual = nullsEqual;
  }

  final boolean nullsEqual;
}
