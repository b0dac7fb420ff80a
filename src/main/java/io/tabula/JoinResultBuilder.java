/*
 * SPDX-FileCopyrightText: Copyright (c) 2025, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tabula;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns a pair of gather maps into the output table of a join. Left columns come first, then
 * right columns. {@link GatherMap#NO_ROW} entries become nulls. Empty maps still produce the
 * full schema.
 */
final class JoinResultBuilder {
  private JoinResultBuilder() {}

  /**
   * @param leftOn left key names of an equality join, empty for other joins
   * @param rightOn right key names matched by position with leftOn. A right key column is left
   *                out of the output when its name is the same as the matching left key.
   */
  static Table build(Table left, Table right, GatherMap leftMap, GatherMap rightMap,
                     String suffix, String[] leftOn, String[] rightOn) {
    if (leftMap.getRowCount() != rightMap.getRowCount()) {
      throw new IllegalArgumentException("gather maps differ in length: " +
          leftMap.getRowCount() + " and " + rightMap.getRowCount());
    }
    Set<String> skipped = new HashSet<>();
    for (int i = 0; i < rightOn.length && i < leftOn.length; i++) {
      if (rightOn[i].equals(leftOn[i])) {
        skipped.add(rightOn[i]);
      }
    }

    List<HostColumnVector> out = new ArrayList<>(left.getNumberOfColumns() +
        right.getNumberOfColumns());
    Set<String> names = new HashSet<>();
    for (HostColumnVector col : left.getColumns()) {
      out.add(col.gather(leftMap));
      names.add(col.getName());
    }
    for (HostColumnVector col : right.getColumns()) {
      if (skipped.contains(col.getName())) {
        continue;
      }
      String name = uniqueName(col.getName(), suffix, names);
      names.add(name);
      out.add(col.gather(rightMap).rename(name));
    }
    return new Table(out);
  }

  /** Output of a semi or anti join, left columns only. */
  static Table buildLeftOnly(Table left, GatherMap leftMap) {
    return left.gather(leftMap);
  }

  /**
   * Append the suffix until the name no longer collides with an output column.
   */
  static String uniqueName(String name, String suffix, Set<String> taken) {
    String result = name;
    while (taken.contains(result)) {
      result = result + suffix;
    }
    return result;
  }
}
