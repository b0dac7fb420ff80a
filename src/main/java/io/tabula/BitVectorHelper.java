/*
 *
 *  SPDX-FileCopyrightText: Copyright (c) 2019-2025, NVIDIA CORPORATION.
 *  SPDX-License-Identifier: Apache-2.0
 *
 */

package io.tabula;

/**
 * This class does validity bit manipulation on arrays of 64 bit words. A set bit means the
 * row holds a value, a clear bit means the row is null.
 */
final class BitVectorHelper {
  static final int BITS_PER_WORD = Long.SIZE;

  private BitVectorHelper() {}

  /**
   * This method returns the length in words needed to represent X number of rows
   * e.g. getValidityLengthInWords(5) => 1 word
   * getValidityLengthInWords(64) => 1 word
   * getValidityLengthInWords(65) => 2 words
   */
  static int getValidityLengthInWords(int rows) {
    return (rows + BITS_PER_WORD - 1) / BITS_PER_WORD;
  }

  /** Allocate a validity vector with every row marked valid. */
  static long[] allValid(int rows) {
    long[] valid = new long[getValidityLengthInWords(rows)];
    for (int i = 0; i < valid.length; i++) {
      valid[i] = -1L;
    }
    return valid;
  }

  /**
   * Set the validity bit to null for the given index.
   * @param valid the words to set it in.
   * @param index the index to set it at.
   * @return 1 if validity changed else 0 if it already was null.
   */
  static int setNullAt(long[] valid, int index) {
    int bucket = index / BITS_PER_WORD;
    long bitmask = 1L << (index % BITS_PER_WORD);
    int ret = (valid[bucket] & bitmask) != 0 ? 1 : 0;
    valid[bucket] &= ~bitmask;
    return ret;
  }

  static boolean isNull(long[] valid, int index) {
    long w = valid[index / BITS_PER_WORD];
    return (w & (1L << (index % BITS_PER_WORD))) == 0;
  }
}
