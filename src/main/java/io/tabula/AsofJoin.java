/*
 * SPDX-FileCopyrightText: Copyright (c) 2025, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tabula;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

/**
 * As-of join: every left row is matched with at most one right row, the one whose ordered key
 * is closest in the requested direction, optionally within groups of equal "by" keys.
 */
final class AsofJoin {
  private static final Logger log = LoggerFactory.getLogger(AsofJoin.class);

  private AsofJoin() {}

  static Table join(Table left, Table right, AsofJoinOptions options) {
    HostColumnVector leftOn = orderedKey(left, options.getLeftOn(), "left", "as-of");
    HostColumnVector rightOn = orderedKey(right, options.getRightOn(), "right", "as-of");
    String[] leftBy = options.leftBy();
    String[] rightBy = options.rightBy();
    if (leftBy.length > 0 || rightBy.length > 0) {
      EquiJoin.validateKeys(left, right, leftBy, rightBy);
    }

    Map<JoinKey, Group> groups = groupRight(right, rightOn, rightBy);
    JoinKeyEncoder leftKeys = leftBy.length == 0 ? null :
        new JoinKeyEncoder(left.columnsFor(leftBy), NullEquality.UNEQUAL);
    Group all = leftBy.length == 0 ? groups.get(null) : null;

    int rows = (int) left.getRowCount();
    int[] rightMap = new int[rows];
    int matched = 0;
    for (int row = 0; row < rows; row++) {
      rightMap[row] = GatherMap.NO_ROW;
      if (leftOn.isNull(row)) {
        continue;
      }
      double value = leftOn.getAsDouble(row);
      if (Double.isNaN(value)) {
        continue;
      }
      Group group = all;
      if (leftKeys != null) {
        JoinKey key = leftKeys.encode(row);
        group = key == null ? null : groups.get(key);
      }
      if (group != null) {
        rightMap[row] = group.find(value, options);
        if (rightMap[row] != GatherMap.NO_ROW) {
          matched++;
        }
      }
    }
    log.debug("as-of join matched {} of {} left rows", matched, rows);

    String[] leftKeyNames = concat(options.getLeftOn(), leftBy);
    String[] rightKeyNames = concat(options.getRightOn(), rightBy);
    return JoinResultBuilder.build(left, right, GatherMap.identity(rows), new GatherMap(rightMap),
        options.getSuffix(), leftKeyNames, rightKeyNames);
  }

  /**
   * The ordered key must exist, be numeric and be sorted ascending once nulls and NaN are
   * ignored.
   * @param kind the join named in error messages
   */
  static HostColumnVector orderedKey(Table table, String name, String side, String kind) {
    if (!table.hasColumn(name)) {
      throw new ColumnNotFoundException(name, kind + " column '" + name + "' not found in " +
          side + " table");
    }
    HostColumnVector col = table.getColumn(name);
    if (!col.getType().isNumeric()) {
      throw new JoinValidationException(kind + " column '" + name + "' of the " + side +
          " table must be numeric, not " + col.getType());
    }
    double previous = Double.NEGATIVE_INFINITY;
    for (int i = 0; i < col.getRowCount(); i++) {
      if (col.isNull(i)) {
        continue;
      }
      double v = col.getAsDouble(i);
      if (Double.isNaN(v)) {
        continue;
      }
      if (v < previous) {
        throw new JoinValidationException(kind + " column '" + name + "' of the " + side +
            " table is not sorted ascending at row " + i);
      }
      previous = v;
    }
    return col;
  }

  /**
   * Right rows with a usable ordered key, grouped by their "by" key. Without "by" columns
   * there is a single group under the null key.
   */
  static Map<JoinKey, Group> groupRight(Table right, HostColumnVector rightOn,
                                                String[] rightBy) {
    JoinKeyEncoder encoder = rightBy.length == 0 ? null :
        new JoinKeyEncoder(right.columnsFor(rightBy), NullEquality.UNEQUAL);
    Map<JoinKey, Group> groups = new HashMap<>();
    int rows = (int) right.getRowCount();
    for (int row = 0; row < rows; row++) {
      if (rightOn.isNull(row)) {
        continue;
      }
      double value = rightOn.getAsDouble(row);
      if (Double.isNaN(value)) {
        continue;
      }
      JoinKey key = null;
      if (encoder != null) {
        key = encoder.encode(row);
        if (key == null) {
          continue;
        }
      }
      groups.computeIfAbsent(key, k -> new Group()).add(row, value);
    }
    return groups;
  }

  static String[] concat(String first, String[] rest) {
    String[] out = new String[rest.length + 1];
    out[0] = first;
    System.arraycopy(rest, 0, out, 1, rest.length);
    return out;
  }

  /** Right rows of one group in ascending key order. */
  static final class Group {
    private int[] rows = new int[4];
    private double[] values = new double[4];
    private int size;

    void add(int row, double value) {
      if (size == rows.length) {
        rows = Arrays.copyOf(rows, size * 2);
        values = Arrays.copyOf(values, size * 2);
      }
      rows[size] = row;
      values[size] = value;
      size++;
    }

    int size() {
      return size;
    }

    int rowAt(int index) {
      return rows[index];
    }

    int find(double target, AsofJoinOptions options) {
      boolean exact = options.isAllowExactMatches();
      int backward = -1;
      int forward = -1;
      AsofDirection direction = options.getDirection();
      if (direction != AsofDirection.FORWARD) {
        // last index with value <= target, or < target without exact matches
        backward = firstIndexAbove(target, exact) - 1;
      }
      if (direction != AsofDirection.BACKWARD) {
        // first index with value >= target, or > target without exact matches
        int idx = firstIndexAbove(target, !exact);
        forward = idx < size ? idx : -1;
      }
      int pick;
      if (backward >= 0 && forward >= 0) {
        pick = target - values[backward] <= values[forward] - target ? backward : forward;
      } else {
        pick = backward >= 0 ? backward : forward;
      }
      if (pick < 0 || Math.abs(target - values[pick]) > options.getTolerance()) {
        return GatherMap.NO_ROW;
      }
      return rows[pick];
    }

    /**
     * First index whose value is greater than target, counting equal values as below it when
     * orEqualIsBelow is set and as above it otherwise.
     */
    int firstIndexAbove(double target, boolean orEqualIsBelow) {
      int lo = 0;
      int hi = size;
      while (lo < hi) {
        int mid = (lo + hi) >>> 1;
        boolean below = orEqualIsBelow ? values[mid] <= target : values[mid] < target;
        if (below) {
          lo = mid + 1;
        } else {
          hi = mid;
        }
      }
      return lo;
    }
  }
}
