/*
 * SPDX-FileCopyrightText: Copyright (c) 2019-2025, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.tabula;

/**
 * Thrown when a join is asked to do something it does not support, for example an inequality
 * join that would need the nested loop fallback while the fallback is disabled.
 */
public class UnsupportedJoinException extends TabulaException {
  UnsupportedJoinException(String message) {
    super(message);
  }
}
