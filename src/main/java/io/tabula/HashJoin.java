/*
 * SPDX-FileCopyrightText: Copyright (c) 2021-2025, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tabula;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

/**
 * This class represents a hash table built from the join keys of the right-side table for a
 * join operation. This hash table can then be reused across a series of left probe tables
 * to compute gather maps for joins more efficiently when the right-side table is not changing.
 * Rows whose key has a null component are left out of the table unless nulls compare equal,
 * so they can never be the target of a match.
 */
public class HashJoin {
  private static final Logger log = LoggerFactory.getLogger(HashJoin.class);

  private static final int[] NO_MATCHES = new int[0];

  private final HostColumnVector[] buildKeys;
  private final long buildRows;
  private final NullEquality nullEquality;
  // key -> right rows in ascending (insertion) order
  private final Map<JoinKey, int[]> table;

  /**
   * Construct a hash table for a join from a table representing the join key columns from the
   * right-side table in the join.
   * @param buildKeys table containing the join keys for the right-side join table
   * @param compareNulls true if null key values should match otherwise false
   */
  public HashJoin(Table buildKeys, boolean compareNulls) {
    this(buildKeys, compareNulls ? NullEquality.EQUAL : NullEquality.UNEQUAL);
  }

  public HashJoin(Table buildKeys, NullEquality nullEquality) {
    this(buildKeys.getColumns(), buildKeys.getRowCount(), nullEquality);
  }

  /**
   * Build over key columns picked from a wider table. The same column may appear more than
   * once.
   */
  HashJoin(HostColumnVector[] buildKeys, NullEquality nullEquality) {
    this(buildKeys, buildKeys.length == 0 ? 0 : buildKeys[0].getRowCount(), nullEquality);
  }

  private HashJoin(HostColumnVector[] buildKeys, long buildRows, NullEquality nullEquality) {
    this.buildKeys = buildKeys;
    this.buildRows = buildRows;
    this.nullEquality = nullEquality;
    this.table = build(buildKeys, (int) buildRows, nullEquality);
    if (log.isDebugEnabled()) {
      log.debug("built hash table with {} distinct keys over {} rows", table.size(), buildRows);
    }
  }

  private static Map<JoinKey, int[]> build(HostColumnVector[] buildKeys, int rows,
                                           NullEquality nullEquality) {
    JoinKeyEncoder encoder = new JoinKeyEncoder(buildKeys, nullEquality);
    Map<JoinKey, RowList> building = new HashMap<>();
    for (int row = 0; row < rows; row++) {
      JoinKey key = encoder.encode(row);
      if (key != null) {
        building.computeIfAbsent(key, k -> new RowList()).add(row);
      }
    }
    Map<JoinKey, int[]> result = new HashMap<>(building.size() * 4 / 3 + 1);
    for (Map.Entry<JoinKey, RowList> e : building.entrySet()) {
      result.put(e.getKey(), e.getValue().toArray());
    }
    return result;
  }

  /** Get the number of join key columns for the table that was used to generate the hash table. */
  public int getNumberOfColumns() {
    return buildKeys.length;
  }

  /** Returns true if the hash table was built to match on nulls otherwise false. */
  public boolean getCompareNulls() {
    return nullEquality.nullsEqual;
  }

  public NullEquality getNullEquality() {
    return nullEquality;
  }

  /** Number of rows in the table the hash table was built from. */
  public long getBuildRowCount() {
    return buildRows;
  }

  /** Number of distinct keys in the hash table. Rows with null keys are not counted. */
  public int getDistinctKeyCount() {
    return table.size();
  }

  HostColumnVector[] getBuildKeys() {
    return buildKeys;
  }

  /**
   * Right rows with the given key, in right table order. The returned array must not be
   * modified.
   */
  int[] find(JoinKey key) {
    if (key == null) {
      return NO_MATCHES;
    }
    int[] rows = table.get(key);
    return rows == null ? NO_MATCHES : rows;
  }

  @Override
  public String toString() {
    StringBuilder names = new StringBuilder();
    for (HostColumnVector key : buildKeys) {
      names.append(names.length() == 0 ? "" : ", ").append(key.getName());
    }
    return "HashJoin{keys=[" + names + "]" +
        ", rows=" + buildRows +
        ", distinctKeys=" + table.size() +
        ", nullEquality=" + nullEquality + '}';
  }

  private static final class RowList {
    private int[] rows = new int[2];
    private int size;

    void add(int row) {
      if (size == rows.length) {
        rows = Arrays.copyOf(rows, size * 2);
      }
      rows[size++] = row;
    }

    int[] toArray() {
      return size == rows.length ? rows : Arrays.copyOf(rows, size);
    }
  }
}
