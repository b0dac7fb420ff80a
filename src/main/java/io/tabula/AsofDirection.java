/*
 * SPDX-FileCopyrightText: Copyright (c) 2025, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tabula;

/**
 * Which right row an as-of join picks for a left row.
 */
public enum AsofDirection {
  /** The last right row whose key is less than or equal to the left key. */
  BACKWARD,
  /** The first right row whose key is greater than or equal to the left key. */
  FORWARD,
  /** The closer of the backward and forward rows, backward on a tie. */
  NEAREST
}
