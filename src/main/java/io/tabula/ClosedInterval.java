/*
 * SPDX-FileCopyrightText: Copyright (c) 2025, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tabula;

/**
 * Which ends of a rolling join window are part of it.
 */
public enum ClosedInterval {
  LEFT(true, false),
  RIGHT(false, true),
  BOTH(true, true),
  NEITHER(false, false);

  final boolean includesLower;
  final boolean includesUpper;

  ClosedInterval(boolean includesLower, boolean includesUpper) {
    this.includesLower = includesLower;
    this.includesUpper = includesUpper;
  }
}
