/*
 * SPDX-FileCopyrightText: Copyright (c) 2019-2025, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.tabula;

/**
 * Thrown when the inputs of a join do not line up: a missing key column, key lists of
 * different lengths, or key columns whose types cannot be compared.
 */
public class JoinValidationException extends TabulaException {
  JoinValidationException(String message) {
    super(message);
  }
}
