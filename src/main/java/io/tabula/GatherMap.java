/*
 * SPDX-FileCopyrightText: Copyright (c) 2021-2025, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tabula;

import java.util.Arrays;

/**
 * This class tracks the data associated with a gather map, a sequence of row indices into a
 * source table that can be passed to a table gather operation. An entry of {@link #NO_ROW}
 * means there is no source row for that output row, and gathering it produces a null.
 *
 * Joins return their results as gather maps, one for each input table, with equal row counts.
 */
public final class GatherMap {
  /** Sentinel for an output row that has no corresponding row in the source table. */
  public static final int NO_ROW = -1;

  private static final GatherMap EMPTY = new GatherMap(new int[0], false);

  private final int[] indices;

  /**
   * Construct a gather map from row indices. The array is copied.
   * @param indices row indices, each either a valid row or {@link #NO_ROW}
   */
  public GatherMap(int... indices) {
    this(indices.clone(), true);
  }

  private GatherMap(int[] indices, boolean validate) {
    if (validate) {
      for (int index : indices) {
        if (index < NO_ROW) {
          throw new IllegalArgumentException("invalid gather map entry " + index);
        }
      }
    }
    this.indices = indices;
  }

  static GatherMap empty() {
    return EMPTY;
  }

  /** A gather map that selects rows {@code 0 .. rows - 1} in order. */
  static GatherMap identity(int rows) {
    int[] indices = new int[rows];
    for (int i = 0; i < rows; i++) {
      indices[i] = i;
    }
    return new GatherMap(indices, false);
  }

  /** Return the number of rows in the gather map */
  public long getRowCount() {
    return indices.length;
  }

  /** Return the source row for an output row, possibly {@link #NO_ROW}. */
  public int get(long row) {
    return indices[(int) row];
  }

  /** Returns true if at least one entry is {@link #NO_ROW}. */
  public boolean hasNoRowEntries() {
    for (int index : indices) {
      if (index == NO_ROW) {
        return true;
      }
    }
    return false;
  }

  /** Copy the row indices out of this gather map. */
  public int[] toIntArray() {
    return indices.clone();
  }

  /**
   * Create an INT32 column holding the gather map entries, {@link #NO_ROW} entries included.
   * @param name the name of the resulting column
   */
  public HostColumnVector toColumnVector(String name) {
    return HostColumnVector.fromInts(name, indices);
  }

  /** Direct access for gathers, must never be modified. */
  int[] indices() {
    return indices;
  }

  @Override
  public String toString() {
    return "GatherMap(rows=" + indices.length + ")";
  }

  /** Grows a gather map one entry at a time. */
  static final class Builder {
    private int[] data;
    private int size;

    Builder() {
      this(16);
    }

    Builder(int expectedRows) {
      data = new int[Math.max(expectedRows, 1)];
    }

    void append(int index) {
      if (size == data.length) {
        data = Arrays.copyOf(data, Math.max(data.length * 2, 16));
      }
      data[size++] = index;
    }

    int size() {
      return size;
    }

    GatherMap build() {
      if (size == 0) {
        return EMPTY;
      }
      return new GatherMap(size == data.length ? data : Arrays.copyOf(data, size), false);
    }
  }
}
