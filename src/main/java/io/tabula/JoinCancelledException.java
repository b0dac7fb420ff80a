/*
 * SPDX-FileCopyrightText: Copyright (c) 2019-2025, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.tabula;

/** Thrown from inside a join when its {@link CircuitBreaker} trips. */
public class JoinCancelledException extends TabulaException {
  JoinCancelledException(String message) {
    super(message);
  }
}
