/*
 * SPDX-FileCopyrightText: Copyright (c) 2019-2025, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.tabula;

/**
 * Base class of every exception thrown by tabula itself. Join operations never return a
 * partial result: when one of these is thrown no output table was produced.
 */
public class TabulaException extends RuntimeException {
  TabulaException(String message) {
    super(message);
  }

  TabulaException(String message, Throwable cause) {
    super(message, cause);
  }
}
