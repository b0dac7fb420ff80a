/*
 * SPDX-FileCopyrightText: Copyright (c) 2025, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tabula;

/**
 * Where a rolling join window sits relative to the left key {@code v} for a window size
 * {@code w}.
 */
public enum RollingDirection {
  /** {@code [v - w, v]} */
  BACKWARD,
  /** {@code [v, v + w]} */
  FORWARD,
  /** {@code [v - w, v + w]} */
  BOTH
}
