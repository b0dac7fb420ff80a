/*
 * SPDX-FileCopyrightText: Copyright (c) 2025, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tabula;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Equality join primitives. Each one probes a {@link HashJoin} built over the right keys with
 * the rows of the left keys, in left order, and produces gather maps. Matches for one left row
 * are emitted in right table order.
 */
final class EquiJoin {
  private static final Logger log = LoggerFactory.getLogger(EquiJoin.class);

  /** Probe rows between two circuit breaker checks. */
  static final int CHECK_INTERVAL = 1024;

  private EquiJoin() {}

  /**
   * Validate and run a full equality join between two tables.
   */
  static Table join(Table left, Table right, JoinOptions options) {
    JoinType how = options.getHow();
    if (how == JoinType.CROSS) {
      GatherMap[] maps = crossJoin(left.getRowCount(), right.getRowCount(),
          options.getCircuitBreaker());
      return JoinResultBuilder.build(left, right, maps[0], maps[1], options.getSuffix(),
          new String[0], new String[0]);
    }
    String[] leftOn = options.leftOn();
    String[] rightOn = options.rightOn();
    validateKeys(left, right, leftOn, rightOn);
    if (how == JoinType.RIGHT) {
      JoinOptions swapped = JoinOptions.builder()
          .withHow(JoinType.LEFT)
          .withLeftOn(rightOn)
          .withRightOn(leftOn)
          .withSuffix(options.getSuffix())
          .withNullEquality(options.getNullEquality())
          .withCircuitBreaker(options.getCircuitBreaker())
          .build();
      return join(right, left, swapped);
    }

    HashJoin rightHash = new HashJoin(right.columnsFor(rightOn), options.getNullEquality());
    HostColumnVector[] leftKeys = left.columnsFor(leftOn);
    CircuitBreaker breaker = options.getCircuitBreaker();
    Table result = switch (how) {
      case INNER -> fromMaps(left, right, innerJoin(leftKeys, rightHash, breaker), options);
      case LEFT -> fromMaps(left, right, leftJoin(leftKeys, rightHash, breaker), options);
      case OUTER -> fromMaps(left, right, fullJoin(leftKeys, rightHash, breaker), options);
      case SEMI -> JoinResultBuilder.buildLeftOnly(left,
          leftSemiJoin(leftKeys, rightHash, breaker));
      case ANTI -> JoinResultBuilder.buildLeftOnly(left,
          leftAntiJoin(leftKeys, rightHash, breaker));
      case RIGHT, CROSS -> throw new IllegalStateException(how + " should have been rewritten");
    };
    log.debug("{} join of {} x {} rows produced {} rows", how, left.getRowCount(),
        right.getRowCount(), result.getRowCount());
    return result;
  }

  private static Table fromMaps(Table left, Table right, GatherMap[] maps, JoinOptions options) {
    return JoinResultBuilder.build(left, right, maps[0], maps[1], options.getSuffix(),
        options.leftOn(), options.rightOn());
  }

  /**
   * Check that the key lists line up and name existing columns of compatible types.
   * @throws JoinValidationException naming the offending column otherwise
   */
  static void validateKeys(Table left, Table right, String[] leftOn, String[] rightOn) {
    if (leftOn.length == 0 || rightOn.length == 0) {
      throw new JoinValidationException("join keys must be given for both tables");
    }
    if (leftOn.length != rightOn.length) {
      throw new JoinValidationException("left has " + leftOn.length + " key columns but right has "
          + rightOn.length);
    }
    for (int i = 0; i < leftOn.length; i++) {
      if (!left.hasColumn(leftOn[i])) {
        throw new ColumnNotFoundException(leftOn[i],
            "join column '" + leftOn[i] + "' not found in left table");
      }
      if (!right.hasColumn(rightOn[i])) {
        throw new ColumnNotFoundException(rightOn[i],
            "join column '" + rightOn[i] + "' not found in right table");
      }
      DType lt = left.getColumn(leftOn[i]).getType();
      DType rt = right.getColumn(rightOn[i]).getType();
      if (!lt.isJoinCompatibleWith(rt)) {
        throw new JoinValidationException("incompatible types for join column '" + leftOn[i] +
            "' (" + lt + ") and '" + rightOn[i] + "' (" + rt + ")");
      }
    }
  }

  private static void checkTypes(HostColumnVector[] leftKeys, HashJoin rightHash) {
    HostColumnVector[] rightKeys = rightHash.getBuildKeys();
    for (int i = 0; i < leftKeys.length; i++) {
      HostColumnVector l = leftKeys[i];
      HostColumnVector r = rightKeys[i];
      if (!l.getType().isJoinCompatibleWith(r.getType())) {
        throw new JoinValidationException("incompatible types for join column '" + l.getName() +
            "' (" + l.getType() + ") and '" + r.getName() + "' (" + r.getType() + ")");
      }
    }
  }

  static GatherMap[] innerJoin(HostColumnVector[] leftKeys, HashJoin rightHash, CircuitBreaker breaker) {
    checkTypes(leftKeys, rightHash);
    int rows = rowCount(leftKeys);
    JoinKeyEncoder encoder = new JoinKeyEncoder(leftKeys, rightHash.getNullEquality());
    GatherMap.Builder leftOut = new GatherMap.Builder(rows);
    GatherMap.Builder rightOut = new GatherMap.Builder(rows);
    for (int row = 0; row < rows; row++) {
      if (row % CHECK_INTERVAL == 0) {
        breaker.throwIfTripped();
      }
      for (int match : rightHash.find(encoder.encode(row))) {
        leftOut.append(row);
        rightOut.append(match);
      }
    }
    return new GatherMap[] {leftOut.build(), rightOut.build()};
  }

  static GatherMap[] leftJoin(HostColumnVector[] leftKeys, HashJoin rightHash, CircuitBreaker breaker) {
    return probeKeepingLeft(leftKeys, rightHash, breaker, null);
  }

  static GatherMap[] fullJoin(HostColumnVector[] leftKeys, HashJoin rightHash, CircuitBreaker breaker) {
    int rightRows = (int) rightHash.getBuildRowCount();
    boolean[] rightMatched = new boolean[rightRows];
    GatherMap[] leftPass = probeKeepingLeft(leftKeys, rightHash, breaker, rightMatched);
    int unmatched = 0;
    for (boolean matched : rightMatched) {
      if (!matched) {
        unmatched++;
      }
    }
    if (unmatched == 0) {
      return leftPass;
    }
    int leftPassRows = (int) leftPass[0].getRowCount();
    GatherMap.Builder leftOut = new GatherMap.Builder(leftPassRows + unmatched);
    GatherMap.Builder rightOut = new GatherMap.Builder(leftPassRows + unmatched);
    for (int i = 0; i < leftPassRows; i++) {
      leftOut.append(leftPass[0].get(i));
      rightOut.append(leftPass[1].get(i));
    }
    for (int r = 0; r < rightRows; r++) {
      if (!rightMatched[r]) {
        leftOut.append(GatherMap.NO_ROW);
        rightOut.append(r);
      }
    }
    return new GatherMap[] {leftOut.build(), rightOut.build()};
  }

  /**
   * Left join probe. When rightMatched is not null every right row that takes part in a match
   * is flagged in it.
   */
  private static GatherMap[] probeKeepingLeft(HostColumnVector[] leftKeys, HashJoin rightHash,
                                              CircuitBreaker breaker, boolean[] rightMatched) {
    checkTypes(leftKeys, rightHash);
    int rows = rowCount(leftKeys);
    JoinKeyEncoder encoder = new JoinKeyEncoder(leftKeys, rightHash.getNullEquality());
    GatherMap.Builder leftOut = new GatherMap.Builder(rows);
    GatherMap.Builder rightOut = new GatherMap.Builder(rows);
    for (int row = 0; row < rows; row++) {
      if (row % CHECK_INTERVAL == 0) {
        breaker.throwIfTripped();
      }
      int[] matches = rightHash.find(encoder.encode(row));
      if (matches.length == 0) {
        leftOut.append(row);
        rightOut.append(GatherMap.NO_ROW);
        continue;
      }
      for (int match : matches) {
        leftOut.append(row);
        rightOut.append(match);
        if (rightMatched != null) {
          rightMatched[match] = true;
        }
      }
    }
    return new GatherMap[] {leftOut.build(), rightOut.build()};
  }

  static GatherMap leftSemiJoin(HostColumnVector[] leftKeys, HashJoin rightHash, CircuitBreaker breaker) {
    return filterLeft(leftKeys, rightHash, breaker, true);
  }

  static GatherMap leftAntiJoin(HostColumnVector[] leftKeys, HashJoin rightHash, CircuitBreaker breaker) {
    return filterLeft(leftKeys, rightHash, breaker, false);
  }

  private static GatherMap filterLeft(HostColumnVector[] leftKeys, HashJoin rightHash, CircuitBreaker breaker,
                                      boolean keepMatched) {
    checkTypes(leftKeys, rightHash);
    int rows = rowCount(leftKeys);
    JoinKeyEncoder encoder = new JoinKeyEncoder(leftKeys, rightHash.getNullEquality());
    GatherMap.Builder out = new GatherMap.Builder(rows);
    for (int row = 0; row < rows; row++) {
      if (row % CHECK_INTERVAL == 0) {
        breaker.throwIfTripped();
      }
      boolean matched = rightHash.find(encoder.encode(row)).length > 0;
      if (matched == keepMatched) {
        out.append(row);
      }
    }
    return out.build();
  }

  private static int rowCount(HostColumnVector[] keys) {
    return keys.length == 0 ? 0 : (int) keys[0].getRowCount();
  }

  /**
   * Every left row paired with every right row, left major.
   */
  static GatherMap[] crossJoin(long leftRows, long rightRows, CircuitBreaker breaker) {
    long total = leftRows * rightRows;
    if (total > Integer.MAX_VALUE - 8) {
      throw new UnsupportedJoinException("cross join of " + leftRows + " x " + rightRows +
          " rows is too large");
    }
    int[] leftMap = new int[(int) total];
    int[] rightMap = new int[(int) total];
    int pos = 0;
    for (int l = 0; l < leftRows; l++) {
      if (l % CHECK_INTERVAL == 0) {
        breaker.throwIfTripped();
      }
      for (int r = 0; r < rightRows; r++) {
        leftMap[pos] = l;
        rightMap[pos] = r;
        pos++;
      }
    }
    return new GatherMap[] {new GatherMap(leftMap), new GatherMap(rightMap)};
  }
}
