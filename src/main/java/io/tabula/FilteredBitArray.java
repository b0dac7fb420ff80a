/*
 * SPDX-FileCopyrightText: Copyright (c) 2025, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tabula;

/**
 * A fixed size bit set with one summary bit per chunk of {@link #CHUNK_BITS} bits. A summary
 * bit is set if and only if some bit of its chunk is set, which lets {@link #nextSetBit(int)}
 * jump over empty chunks when the set is sparse. Bits can only be set, never cleared.
 */
final class FilteredBitArray {
  static final int CHUNK_BITS = 1024;
  private static final int WORDS_PER_CHUNK = CHUNK_BITS / Long.SIZE;

  private final int size;
  private final long[] bits;
  private final long[] filter;

  FilteredBitArray(int size) {
    if (size < 0) {
      throw new IllegalArgumentException("negative size " + size);
    }
    this.size = size;
    this.bits = new long[(size + Long.SIZE - 1) / Long.SIZE];
    int chunks = (size + CHUNK_BITS - 1) / CHUNK_BITS;
    this.filter = new long[(chunks + Long.SIZE - 1) / Long.SIZE];
  }

  int size() {
    return size;
  }

  void set(int index) {
    checkIndex(index);
    bits[index >>> 6] |= 1L << index;
    int chunk = index / CHUNK_BITS;
    filter[chunk >>> 6] |= 1L << chunk;
  }

  boolean get(int index) {
    checkIndex(index);
    return (bits[index >>> 6] & (1L << index)) != 0;
  }

  /**
   * Find the first set bit at or after from.
   * @return the index of the bit, or -1 if no bit at or after from is set
   */
  int nextSetBit(int from) {
    if (from < 0) {
      throw new IndexOutOfBoundsException("from < 0: " + from);
    }
    if (from >= size) {
      return -1;
    }
    int chunk = from / CHUNK_BITS;
    if (chunkHasBits(chunk)) {
      // finish the partial chunk from the starting word
      int word = from >>> 6;
      long w = bits[word] & (-1L << from);
      int chunkEndWord = Math.min((chunk + 1) * WORDS_PER_CHUNK, bits.length);
      while (true) {
        if (w != 0) {
          return word * Long.SIZE + Long.numberOfTrailingZeros(w);
        }
        if (++word >= chunkEndWord) {
          break;
        }
        w = bits[word];
      }
    }
    int next = nextSetChunk(chunk + 1);
    if (next < 0) {
      return -1;
    }
    int word = next * WORDS_PER_CHUNK;
    // a set summary bit guarantees a set word in the chunk
    while (bits[word] == 0) {
      word++;
    }
    return word * Long.SIZE + Long.numberOfTrailingZeros(bits[word]);
  }

  /** Count the set bits, for tests and logging. */
  int cardinality() {
    int count = 0;
    for (long w : bits) {
      count += Long.bitCount(w);
    }
    return count;
  }

  private boolean chunkHasBits(int chunk) {
    return (filter[chunk >>> 6] & (1L << chunk)) != 0;
  }

  private int nextSetChunk(int fromChunk) {
    int word = fromChunk >>> 6;
    if (word >= filter.length) {
      return -1;
    }
    long w = filter[word] & (-1L << fromChunk);
    while (true) {
      if (w != 0) {
        return word * Long.SIZE + Long.numberOfTrailingZeros(w);
      }
      if (++word == filter.length) {
        return -1;
      }
      w = filter[word];
    }
  }

  private void checkIndex(int index) {
    if (index < 0 || index >= size) {
      throw new IndexOutOfBoundsException("index " + index + " out of range for " + size +
          " bits");
    }
  }
}
