/*
 * SPDX-FileCopyrightText: Copyright (c) 2019-2025, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.tabula;

/**
 * Thrown when a join predicate cannot be evaluated at all, for example when it is not a
 * comparison or references a column found in neither table.
 */
public class PredicateShapeException extends TabulaException {
  PredicateShapeException(String message) {
    super(message);
  }
}
