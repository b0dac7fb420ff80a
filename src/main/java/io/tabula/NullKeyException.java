/*
 * SPDX-FileCopyrightText: Copyright (c) 2019-2025, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.tabula;

/** Thrown when an inequality join key column contains a null. Filter the nulls out first. */
public class NullKeyException extends TabulaException {
  NullKeyException(String message) {
    super(message);
  }
}
