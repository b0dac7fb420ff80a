/*
 * SPDX-FileCopyrightText: Copyright (c) 2025, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tabula;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Rolling join: every left row is paired with all right rows whose ordered key falls in a
 * window around the left key, optionally within groups of equal "by" keys. Output follows left
 * order and the matches of one left row follow right order. A left row with no usable window
 * is output once with nulls on the right.
 */
final class RollingJoin {
  private static final Logger log = LoggerFactory.getLogger(RollingJoin.class);

  private RollingJoin() {}

  static Table join(Table left, Table right, RollingJoinOptions options) {
    HostColumnVector leftOn = AsofJoin.orderedKey(left, options.getLeftOn(), "left", "rolling");
    HostColumnVector rightOn = AsofJoin.orderedKey(right, options.getRightOn(), "right",
        "rolling");
    String[] leftBy = options.leftBy();
    String[] rightBy = options.rightBy();
    if (leftBy.length > 0 || rightBy.length > 0) {
      EquiJoin.validateKeys(left, right, leftBy, rightBy);
    }

    Map<JoinKey, AsofJoin.Group> groups = AsofJoin.groupRight(right, rightOn, rightBy);
    JoinKeyEncoder leftKeys = leftBy.length == 0 ? null :
        new JoinKeyEncoder(left.columnsFor(leftBy), NullEquality.UNEQUAL);
    AsofJoin.Group all = leftBy.length == 0 ? groups.get(null) : null;

    int rows = (int) left.getRowCount();
    GatherMap.Builder leftMap = new GatherMap.Builder(rows);
    GatherMap.Builder rightMap = new GatherMap.Builder(rows);
    int matched = 0;
    for (int row = 0; row < rows; row++) {
      AsofJoin.Group group = all;
      if (leftKeys != null) {
        JoinKey key = leftKeys.encode(row);
        group = key == null ? null : groups.get(key);
      }
      if (group != null && !leftOn.isNull(row)) {
        double value = leftOn.getAsDouble(row);
        if (!Double.isNaN(value) && appendWindow(group, row, value, options, leftMap, rightMap)) {
          matched++;
          continue;
        }
      }
      leftMap.append(row);
      rightMap.append(GatherMap.NO_ROW);
    }
    log.debug("rolling join matched {} of {} left rows into {} rows", matched, rows,
        leftMap.size());

    String[] leftKeyNames = AsofJoin.concat(options.getLeftOn(), leftBy);
    String[] rightKeyNames = AsofJoin.concat(options.getRightOn(), rightBy);
    return JoinResultBuilder.build(left, right, leftMap.build(), rightMap.build(),
        options.getSuffix(), leftKeyNames, rightKeyNames);
  }

  /**
   * Append a pair for every right row of the group inside the window of one left row.
   * @return false if the window holds no rows or fewer than the minimum, nothing is appended
   */
  private static boolean appendWindow(AsofJoin.Group group, int row, double value,
                                      RollingJoinOptions options, GatherMap.Builder leftMap,
                                      GatherMap.Builder rightMap) {
    double size = options.getWindowSize();
    double lower;
    double upper;
    if (options.isCenter()) {
      lower = value - size / 2.0;
      upper = value + size / 2.0;
    } else {
      switch (options.getDirection()) {
        case BACKWARD:
          lower = value - size;
          upper = value;
          break;
        case FORWARD:
          lower = value;
          upper = value + size;
          break;
        case BOTH:
          lower = value - size;
          upper = value + size;
          break;
        default:
          throw new IllegalStateException("unknown direction " + options.getDirection());
      }
    }
    ClosedInterval closed = options.getClosedInterval();
    int start = group.firstIndexAbove(lower, !closed.includesLower);
    int end = group.firstIndexAbove(upper, closed.includesUpper);
    int count = end - start;
    if (count <= 0 || count < options.getMinPeriods()) {
      return false;
    }
    for (int i = start; i < end; i++) {
      leftMap.append(row);
      rightMap.append(group.rowAt(i));
    }
    return true;
  }
}
