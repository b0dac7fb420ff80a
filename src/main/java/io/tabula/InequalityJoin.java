/*
 * SPDX-FileCopyrightText: Copyright (c) 2025, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tabula;

import io.tabula.ast.AstExpression;
import io.tabula.ast.BinaryOperation;
import io.tabula.ast.BinaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Joins two tables on a conjunction of inequality predicates between a numeric column of each
 * table.
 * <p>
 * A single predicate runs as a piecewise merge join: both sides are sorted on their coordinate
 * and, for each left value in ascending order, a monotone pointer into the sorted right side
 * is advanced with an exponential search. Every right value on the matching side of the pointer
 * satisfies the predicate.
 * </p>
 * <p>
 * Two or more predicates run the IEJoin of Khayyat et al. over the first two. Rows of both
 * tables are sorted together on the first coordinate (L1), then visited in the order of the
 * second coordinate (L2). Visiting a right row sets its L1 bit in a {@link FilteredBitArray}, so
 * when a left row is visited the set bits on the matching side of its own L1 position are
 * exactly the right rows that satisfy both predicates. Predicates past the second filter the
 * produced pairs.
 * </p>
 * <p>
 * Anything else falls back to evaluating every pair of rows with {@link NestedLoopJoin}. That
 * path is logged at WARN and reported to the {@link JoinEventHandler}, and can be disabled.
 * </p>
 * Rows whose coordinate is NaN never satisfy an inequality and take no part in the sorted
 * algorithms. Null coordinates are an error.
 */
public final class InequalityJoin {
  private static final Logger log = LoggerFactory.getLogger(InequalityJoin.class);

  /** Left rows between two circuit breaker checks in the merge join. */
  static final int CHECK_INTERVAL = 1024;

  private InequalityJoin() {}

  /**
   * Pick the algorithm for a set of predicates without running the join.
   */
  public static JoinStrategy plan(Table left, Table right, AstExpression... predicates) {
    return plan(left, right, flatten(predicates)).strategy;
  }

  static Table join(Table left, Table right, InequalityJoinOptions options,
                    AstExpression... predicates) {
    GatherMap[] maps = gatherMaps(left, right, options, predicates);
    return JoinResultBuilder.build(left, right, maps[0], maps[1], options.getSuffix(),
        new String[0], new String[0]);
  }

  /**
   * Compute the left and right gather maps of an inequality join.
   */
  static GatherMap[] gatherMaps(Table left, Table right, InequalityJoinOptions options,
                                AstExpression... predicates) {
    List<AstExpression> exprs = flatten(predicates);
    Plan plan = plan(left, right, exprs);
    long leftRows = left.getRowCount();
    long rightRows = right.getRowCount();
    JoinEventHandler handler = options.getEventHandler();
    CircuitBreaker breaker = options.getCircuitBreaker();
    if (plan.strategy == JoinStrategy.NESTED_LOOP) {
      if (!options.isNestedLoopFallbackAllowed()) {
        throw new UnsupportedJoinException("inequality join cannot use a sorted algorithm and " +
            "the nested loop fallback is disabled: " + plan.fallbackReason);
      }
      log.warn("Inequality join falling back to a nested loop over {} x {} rows: {}",
          leftRows, rightRows, plan.fallbackReason);
      handler.onNestedLoopFallback(plan.fallbackReason, leftRows, rightRows);
    }
    log.debug("Inequality join of {} x {} rows using {}", leftRows, rightRows, plan.strategy);
    handler.onStrategySelected(plan.strategy, leftRows, rightRows);

    List<InequalityPredicate> preds = plan.predicates;
    GatherMap[] maps = switch (plan.strategy) {
      case CROSS -> EquiJoin.crossJoin(leftRows, rightRows, breaker);
      case NESTED_LOOP -> NestedLoopJoin.gatherMaps(left, right, exprs, breaker);
      case PIECEWISE_MERGE -> {
        InequalityPredicate p = preds.get(0);
        p.checkNoNulls();
        yield piecewiseMerge(coordinates(p.getLeftColumn()), coordinates(p.getRightColumn()),
            p.getOp(), breaker);
      }
      case IE_JOIN -> {
        for (InequalityPredicate p : preds) {
          p.checkNoNulls();
        }
        InequalityPredicate first = preds.get(0);
        InequalityPredicate second = preds.get(1);
        GatherMap[] pairs = ieJoin(
            coordinates(first.getLeftColumn()), coordinates(second.getLeftColumn()),
            coordinates(first.getRightColumn()), coordinates(second.getRightColumn()),
            first.getOp(), second.getOp(), breaker);
        yield preds.size() > 2 ? postFilter(pairs, preds.subList(2, preds.size())) : pairs;
      }
    };
    log.debug("Inequality join produced {} rows", maps[0].getRowCount());
    return maps;
  }

  /**
   * Split top level logical ANDs so that {@code a && b} is treated as two predicates.
   */
  static List<AstExpression> flatten(AstExpression... predicates) {
    List<AstExpression> out = new ArrayList<>(predicates.length);
    for (AstExpression p : predicates) {
      flattenInto(Objects.requireNonNull(p, "predicate"), out);
    }
    return out;
  }

  private static void flattenInto(AstExpression expr, List<AstExpression> out) {
    if (expr instanceof BinaryOperation &&
        ((BinaryOperation) expr).getOp() == BinaryOperator.LOGICAL_AND) {
      flattenInto(((BinaryOperation) expr).getLeftInput(), out);
      flattenInto(((BinaryOperation) expr).getRightInput(), out);
    } else {
      out.add(expr);
    }
  }

  private static Plan plan(Table left, Table right, List<AstExpression> exprs) {
    if (exprs.isEmpty()) {
      return new Plan(JoinStrategy.CROSS, Collections.emptyList(), null);
    }
    List<InequalityPredicate> preds = new ArrayList<>(exprs.size());
    for (AstExpression expr : exprs) {
      InequalityPredicate.Classification c = InequalityPredicate.classify(expr, left, right);
      if (!c.isClassified()) {
        return new Plan(JoinStrategy.NESTED_LOOP, Collections.emptyList(), c.getReason());
      }
      preds.add(c.getPredicate());
    }
    JoinStrategy strategy = preds.size() == 1 ? JoinStrategy.PIECEWISE_MERGE :
        JoinStrategy.IE_JOIN;
    return new Plan(strategy, preds, null);
  }

  /**
   * Project a numeric column to doubles. -0.0 is folded into 0.0 so sorting agrees with
   * comparison.
   */
  static double[] coordinates(HostColumnVector col) {
    int rows = (int) col.getRowCount();
    double[] out = new double[rows];
    for (int i = 0; i < rows; i++) {
      out[i] = col.getAsDouble(i) + 0.0;
    }
    return out;
  }

  /////////////////////////////////////////////////////////////////////////////
  // PIECEWISE MERGE JOIN
  /////////////////////////////////////////////////////////////////////////////

  /**
   * All pairs with {@code leftValues[l] op rightValues[r]}, grouped by left row in ascending
   * left value order.
   */
  static GatherMap[] piecewiseMerge(double[] leftValues, double[] rightValues,
                                    InequalityOperator op, CircuitBreaker breaker) {
    int[] leftOrder = sortedRows(leftValues);
    int[] rightOrder = sortedRows(rightValues);
    double[] sortedRight = new double[rightOrder.length];
    for (int i = 0; i < rightOrder.length; i++) {
      sortedRight[i] = rightValues[rightOrder[i]];
    }
    // LESS and GREATER_EQUAL split the right side at the first value > v, the others at >= v
    boolean splitAfterEqual = op == InequalityOperator.LESS ||
        op == InequalityOperator.GREATER_EQUAL;
    GatherMap.Builder leftOut = new GatherMap.Builder();
    GatherMap.Builder rightOut = new GatherMap.Builder();
    int bound = 0;
    for (int i = 0; i < leftOrder.length; i++) {
      if (i % CHECK_INTERVAL == 0) {
        breaker.throwIfTripped();
      }
      int l = leftOrder[i];
      bound = gallop(sortedRight, bound, leftValues[l], splitAfterEqual);
      int from = op.isLessThan() ? bound : 0;
      int to = op.isLessThan() ? sortedRight.length : bound;
      for (int j = from; j < to; j++) {
        leftOut.append(l);
        rightOut.append(rightOrder[j]);
      }
    }
    return new GatherMap[] {leftOut.build(), rightOut.build()};
  }

  /**
   * Exponential search for the first index at or after start whose value is greater than
   * target (strict) or greater than or equal to it. The array must be sorted ascending and
   * every index before start must already fail the test.
   * @return the index found, or sorted.length if there is none
   */
  static int gallop(double[] sorted, int start, double target, boolean strict) {
    int n = sorted.length;
    if (start >= n || passes(sorted[start], target, strict)) {
      return start;
    }
    // invariant: sorted[lo] fails, sorted[hi] passes or hi == n
    int lo = start;
    int step = 1;
    int hi = start + step;
    while (hi < n && !passes(sorted[hi], target, strict)) {
      lo = hi;
      step <<= 1;
      hi = start + step;
    }
    if (hi > n) {
      hi = n;
    }
    while (lo + 1 < hi) {
      int mid = (lo + hi) >>> 1;
      if (passes(sorted[mid], target, strict)) {
        hi = mid;
      } else {
        lo = mid;
      }
    }
    return hi;
  }

  private static boolean passes(double value, double target, boolean strict) {
    return strict ? value > target : value >= target;
  }

  /** Rows that are not NaN, sorted by value ascending, stable. */
  private static int[] sortedRows(double[] values) {
    List<Integer> rows = new ArrayList<>(values.length);
    for (int i = 0; i < values.length; i++) {
      if (!Double.isNaN(values[i])) {
        rows.add(i);
      }
    }
    rows.sort((a, b) -> Double.compare(values[a], values[b]));
    return toIntArray(rows);
  }

  /////////////////////////////////////////////////////////////////////////////
  // IEJOIN
  /////////////////////////////////////////////////////////////////////////////

  /**
   * All pairs with {@code leftX[l] op1 rightX[r] && leftY[l] op2 rightY[r]}.
   */
  static GatherMap[] ieJoin(double[] leftX, double[] leftY, double[] rightX, double[] rightY,
                            InequalityOperator op1, InequalityOperator op2,
                            CircuitBreaker breaker) {
    // signed 1-based row ids, left positive and right negative, then the coordinates
    int[] ids = new int[leftX.length + rightX.length];
    double[] xs = new double[ids.length];
    double[] ys = new double[ids.length];
    int n = 0;
    for (int i = 0; i < leftX.length; i++) {
      if (!Double.isNaN(leftX[i]) && !Double.isNaN(leftY[i])) {
        ids[n] = i + 1;
        xs[n] = leftX[i];
        ys[n] = leftY[i];
        n++;
      }
    }
    for (int i = 0; i < rightX.length; i++) {
      if (!Double.isNaN(rightX[i]) && !Double.isNaN(rightY[i])) {
        ids[n] = -(i + 1);
        xs[n] = rightX[i];
        ys[n] = rightY[i];
        n++;
      }
    }
    if (n == 0) {
      return new GatherMap[] {GatherMap.empty(), GatherMap.empty()};
    }

    // L1: everything ordered by x so that rows satisfying op1 for a left row come after it.
    // On equal x a strict op1 puts right rows first, where the left row cannot see them.
    boolean xAscending = op1.isLessThan();
    List<Integer> order = range(n);
    order.sort((a, b) -> {
      int c = Double.compare(xs[a], xs[b]);
      if (c != 0) {
        return xAscending ? c : -c;
      }
      boolean aLeft = ids[a] > 0;
      if (aLeft == ids[b] > 0) {
        return 0;
      }
      return aLeft == op1.isStrict() ? 1 : -1;
    });
    int[] l1 = new int[n];
    double[] yOrderedByX = new double[n];
    for (int i = 0; i < n; i++) {
      int src = order.get(i);
      l1[i] = ids[src];
      yOrderedByX[i] = ys[src];
    }

    // L2: L1 positions ordered by y so that right rows satisfying op2 for a left row are
    // visited before it, with run ends wherever y changes.
    boolean yAscending = !op2.isLessThan();
    List<Integer> l2Order = range(n);
    l2Order.sort((a, b) -> yAscending ? Double.compare(yOrderedByX[a], yOrderedByX[b]) :
        Double.compare(yOrderedByX[b], yOrderedByX[a]));
    int[] l2 = toIntArray(l2Order);
    boolean[] runEnd = new boolean[n];
    for (int i = 0; i < n; i++) {
      runEnd[i] = i == n - 1 || yOrderedByX[l2[i]] != yOrderedByX[l2[i + 1]];
    }

    FilteredBitArray visited = new FilteredBitArray(n);
    int startOffset = op1.isStrict() ? 1 : 0;
    GatherMap.Builder leftOut = new GatherMap.Builder();
    GatherMap.Builder rightOut = new GatherMap.Builder();
    int runStart = 0;
    while (runStart < n) {
      breaker.throwIfTripped();
      int runStop = runStart;
      while (!runEnd[runStop]) {
        runStop++;
      }
      // rows tied on y see each other only when op2 is not strict
      if (op2.isStrict()) {
        probeRun(l2, runStart, runStop, l1, visited, startOffset, leftOut, rightOut);
        markRun(l2, runStart, runStop, l1, visited);
      } else {
        markRun(l2, runStart, runStop, l1, visited);
        probeRun(l2, runStart, runStop, l1, visited, startOffset, leftOut, rightOut);
      }
      runStart = runStop + 1;
    }
    return new GatherMap[] {leftOut.build(), rightOut.build()};
  }

  private static void markRun(int[] l2, int runStart, int runStop, int[] l1,
                              FilteredBitArray visited) {
    for (int i = runStart; i <= runStop; i++) {
      int pos = l2[i];
      if (l1[pos] < 0) {
        visited.set(pos);
      }
    }
  }

  private static void probeRun(int[] l2, int runStart, int runStop, int[] l1,
                               FilteredBitArray visited, int startOffset,
                               GatherMap.Builder leftOut, GatherMap.Builder rightOut) {
    for (int i = runStart; i <= runStop; i++) {
      int pos = l2[i];
      if (l1[pos] <= 0) {
        continue;
      }
      int leftRow = l1[pos] - 1;
      for (int bit = visited.nextSetBit(pos + startOffset); bit >= 0;
           bit = visited.nextSetBit(bit + 1)) {
        leftOut.append(leftRow);
        rightOut.append(-l1[bit] - 1);
      }
    }
  }

  /**
   * Keep only the pairs that also satisfy the extra predicates.
   */
  private static GatherMap[] postFilter(GatherMap[] pairs, List<InequalityPredicate> extra) {
    int count = extra.size();
    double[][] leftCoords = new double[count][];
    double[][] rightCoords = new double[count][];
    for (int p = 0; p < count; p++) {
      leftCoords[p] = coordinates(extra.get(p).getLeftColumn());
      rightCoords[p] = coordinates(extra.get(p).getRightColumn());
    }
    int rows = (int) pairs[0].getRowCount();
    GatherMap.Builder leftOut = new GatherMap.Builder(rows);
    GatherMap.Builder rightOut = new GatherMap.Builder(rows);
    outer:
    for (int i = 0; i < rows; i++) {
      int l = pairs[0].get(i);
      int r = pairs[1].get(i);
      for (int p = 0; p < count; p++) {
        if (!extra.get(p).getOp().test(leftCoords[p][l], rightCoords[p][r])) {
          continue outer;
        }
      }
      leftOut.append(l);
      rightOut.append(r);
    }
    return new GatherMap[] {leftOut.build(), rightOut.build()};
  }

  private static List<Integer> range(int n) {
    List<Integer> out = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      out.add(i);
    }
    return out;
  }

  private static int[] toIntArray(List<Integer> values) {
    int[] out = new int[values.size()];
    for (int i = 0; i < out.length; i++) {
      out[i] = values.get(i);
    }
    return out;
  }

  private static final class Plan {
    final JoinStrategy strategy;
    final List<InequalityPredicate> predicates;
    final String fallbackReason;

    Plan(JoinStrategy strategy, List<InequalityPredicate> predicates, String fallbackReason) {
      this.strategy = strategy;
      this.predicates = predicates;
      this.fallbackReason = fallbackReason;
    }

    @Override
    public String toString() {
      return strategy + " " + predicates;
    }
  }
}
