/*
 * SPDX-FileCopyrightText: Copyright (c) 2019-2025, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tabula;

import io.tabula.ast.AstExpression;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Class to represent a collection of named columns of equal length. A Table is immutable,
 * every operation on it returns a new Table and leaves the inputs untouched, so a Table can be
 * shared between threads without locking.
 */
public final class Table {
  private final HostColumnVector[] columns;
  private final long rows;
  private final Map<String, Integer> indexByName;

  /**
   * Table class makes a copy of the array of {@link HostColumnVector}s passed to it. The
   * columns themselves are immutable and are shared, not copied.
   * @param columns Array of columns
   */
  public Table(HostColumnVector... columns) {
    this.columns = columns.clone();
    this.indexByName = new HashMap<>(Math.max(16, columns.length * 2));
    for (int i = 0; i < columns.length; i++) {
      if (columns[i] == null) {
        throw new IllegalArgumentException("column " + i + " is null");
      }
    }
    long rowCount = columns.length == 0 ? 0 : columns[0].getRowCount();
    for (int i = 0; i < columns.length; i++) {
      HostColumnVector col = columns[i];
      if (col.getRowCount() != rowCount) {
        throw new IllegalArgumentException("All columns must have the same number of rows, "
            + "column '" + col.getName() + "' has " + col.getRowCount() + " expected "
            + rowCount);
      }
      if (indexByName.put(col.getName(), i) != null) {
        throw new IllegalArgumentException("duplicate column name '" + col.getName() + "'");
      }
    }
    this.rows = rowCount;
  }

  public Table(List<HostColumnVector> columns) {
    this(columns.toArray(new HostColumnVector[0]));
  }

  /**
   * Return the number of rows in the table
   */
  public long getRowCount() {
    return rows;
  }

  public int getNumberOfColumns() {
    return columns.length;
  }

  /**
   * Returns the column at the specified index.
   * @param index which column
   */
  public HostColumnVector getColumn(int index) {
    assert index < columns.length;
    return columns[index];
  }

  /**
   * Returns the column with the given name.
   * @throws ColumnNotFoundException if there is no such column
   */
  public HostColumnVector getColumn(String name) {
    Integer index = indexByName.get(name);
    if (index == null) {
      throw new ColumnNotFoundException(name, "column '" + name + "' not found, available: " +
          Arrays.toString(getColumnNames()));
    }
    return columns[index];
  }

  public boolean hasColumn(String name) {
    return indexByName.containsKey(name);
  }

  public String[] getColumnNames() {
    String[] names = new String[columns.length];
    for (int i = 0; i < columns.length; i++) {
      names[i] = columns[i].getName();
    }
    return names;
  }

  public DType[] getColumnTypes() {
    DType[] types = new DType[columns.length];
    for (int i = 0; i < columns.length; i++) {
      types[i] = columns[i].getType();
    }
    return types;
  }

  /** The backing array, must not be modified. */
  HostColumnVector[] getColumns() {
    return columns;
  }

  /**
   * Gather rows from every column of this table. A {@link GatherMap#NO_ROW} entry produces a
   * row of nulls.
   * @param gatherMap the rows to take, in output order
   * @return a new table with the same schema
   */
  public Table gather(GatherMap gatherMap) {
    HostColumnVector[] out = new HostColumnVector[columns.length];
    for (int i = 0; i < columns.length; i++) {
      out[i] = columns[i].gather(gatherMap);
    }
    return new Table(out);
  }

  /**
   * Create a new table holding only the named columns, in the order given.
   * @throws ColumnNotFoundException if a name is not in this table
   */
  public Table select(String... names) {
    return new Table(columnsFor(names));
  }

  /**
   * The named columns in the order given. Unlike {@link #select(String...)} a name may be
   * repeated, which is what join key lists need.
   * @throws ColumnNotFoundException if a name is not in this table
   */
  HostColumnVector[] columnsFor(String... names) {
    HostColumnVector[] out = new HostColumnVector[names.length];
    for (int i = 0; i < names.length; i++) {
      out[i] = getColumn(names[i]);
    }
    return out;
  }

  /////////////////////////////////////////////////////////////////////////////
  // JOIN
  /////////////////////////////////////////////////////////////////////////////

  /**
   * Join this table with another on a single column that has the same name in both tables.
   * @param other the right table
   * @param on the key column name
   * @param how the kind of join
   * @return the joined table, left columns first
   */
  public Table join(Table other, String on, JoinType how) {
    return joinWithConfig(other, JoinOptions.builder().withHow(how).withOn(on).build());
  }

  /**
   * Join this table with another on one or more key columns.
   * @param other the right table
   * @param leftOn key column names in this table
   * @param rightOn key column names in the other table, matched by position with leftOn
   * @param how the kind of join
   * @return the joined table, left columns first
   */
  public Table joinOn(Table other, String[] leftOn, String[] rightOn, JoinType how) {
    return joinWithConfig(other, JoinOptions.builder()
        .withHow(how)
        .withLeftOn(leftOn)
        .withRightOn(rightOn)
        .build());
  }

  /**
   * Join this table with another as described by the options. Right key columns whose name is
   * the same as the matching left key column are not repeated in the output, and other right
   * columns whose name collides with an output column get the configured suffix.
   * @param other the right table
   * @param options how to join
   * @return the joined table
   * @throws JoinValidationException if the keys are missing or have incompatible types
   */
  public Table joinWithConfig(Table other, JoinOptions options) {
    return EquiJoin.join(this, other, options);
  }

  /**
   * Join this table with another on a conjunction of inequality predicates between a column
   * of each table, for example {@code dur < time}. With no predicates this is a cross join.
   * @param other the right table
   * @param predicates comparisons that must all hold for a pair of rows to be in the output
   * @return every left column followed by every right column, colliding right names suffixed
   */
  public Table joinWhere(Table other, AstExpression... predicates) {
    return joinWhere(other, InequalityJoinOptions.DEFAULT, predicates);
  }

  /**
   * Inequality join with explicit options.
   * @see #joinWhere(Table, AstExpression...)
   */
  public Table joinWhere(Table other, InequalityJoinOptions options,
                         AstExpression... predicates) {
    return InequalityJoin.join(this, other, options, predicates);
  }

  /**
   * Report which algorithm {@link #joinWhere(Table, AstExpression...)} would pick for these
   * predicates without running the join.
   */
  public JoinStrategy planJoinWhere(Table other, AstExpression... predicates) {
    return InequalityJoin.plan(this, other, predicates);
  }

  /**
   * Ordered join on the nearest key. Every row of this table appears exactly once in the
   * output, matched to at most one row of the right table.
   * @param right the right table, sorted by its "on" column
   * @param options the key columns, direction and tolerance
   */
  public Table mergeAsof(Table right, AsofJoinOptions options) {
    return AsofJoin.join(this, right, options);
  }

  /**
   * Ordered join on a window of keys. Every row of this table is paired with each right row
   * whose key falls in the window around its own key, so one left row can produce many output
   * rows. A left row with no right row in its window, or fewer than the minimum, is output
   * once with nulls in the right columns.
   * @param right the right table, sorted by its "on" column
   * @param options the key columns, window size, direction and interval closure
   */
  public Table rollingJoin(Table right, RollingJoinOptions options) {
    return RollingJoin.join(this, right, options);
  }

  /**
   * Joins two tables all of the left against all of the right. Be careful as this
   * gets very big and you can easily use up all of the memory.
   * @param right the right table
   * @return the joined table. The order of the columns returned will be left columns,
   * right columns.
   */
  public Table crossJoin(Table right) {
    GatherMap[] maps = EquiJoin.crossJoin(getRowCount(), right.getRowCount(),
        CircuitBreaker.NEVER);
    return JoinResultBuilder.build(this, right, maps[0], maps[1],
        JoinOptions.DEFAULT_SUFFIX, new String[0], new String[0]);
  }

  /**
   * Computes the gather maps that can be used to manifest the result of a left equi-join between
   * two tables. It is assumed this table instance holds the key columns from the left table, and
   * the table argument represents the key columns from the right table. Two {@link GatherMap}
   * instances will be returned that can be used to gather the left and right tables,
   * respectively, to produce the result of the left join. Null keys never match.
   *
   * @param rightKeys join key columns from the right table
   * @return left and right table gather maps
   */
  public GatherMap[] leftJoinGatherMaps(Table rightKeys) {
    return leftJoinGatherMaps(rightKeys, false);
  }

  /**
   * Computes the gather maps for a left equi-join between two key tables.
   * @param rightKeys join key columns from the right table
   * @param compareNullsEqual true if null key values should match otherwise false
   * @return left and right table gather maps
   */
  public GatherMap[] leftJoinGatherMaps(Table rightKeys, boolean compareNullsEqual) {
    checkKeyColumnCount(rightKeys.getNumberOfColumns());
    return leftJoinGatherMaps(new HashJoin(rightKeys, compareNullsEqual));
  }

  /**
   * Computes the gather maps that can be used to manifest the result of a left equi-join between
   * two tables. It is assumed this table instance holds the key columns from the left table, and
   * the {@link HashJoin} argument has been constructed from the key columns from the right table.
   * Two {@link GatherMap} instances will be returned that can be used to gather the left and right
   * tables, respectively, to produce the result of the left join.
   *
   * @param rightHash hash table built from join key columns from the right table
   * @return left and right table gather maps
   */
  public GatherMap[] leftJoinGatherMaps(HashJoin rightHash) {
    checkKeyColumnCount(rightHash.getNumberOfColumns());
    return EquiJoin.leftJoin(columns, rightHash, CircuitBreaker.NEVER);
  }

  /**
   * Computes the gather maps that can be used to manifest the result of an inner equi-join
   * between two tables. It is assumed this table instance holds the key columns from the left
   * table, and the table argument represents the key columns from the right table.
   *
   * @param rightKeys join key columns from the right table
   * @return left and right table gather maps
   */
  public GatherMap[] innerJoinGatherMaps(Table rightKeys) {
    return innerJoinGatherMaps(rightKeys, false);
  }

  public GatherMap[] innerJoinGatherMaps(Table rightKeys, boolean compareNullsEqual) {
    checkKeyColumnCount(rightKeys.getNumberOfColumns());
    return innerJoinGatherMaps(new HashJoin(rightKeys, compareNullsEqual));
  }

  /**
   * Computes the gather maps for an inner equi-join, probing a prebuilt hash table.
   * @param rightHash hash table built from join key columns from the right table
   * @return left and right table gather maps
   */
  public GatherMap[] innerJoinGatherMaps(HashJoin rightHash) {
    checkKeyColumnCount(rightHash.getNumberOfColumns());
    return EquiJoin.innerJoin(columns, rightHash, CircuitBreaker.NEVER);
  }

  /**
   * Computes the gather maps that can be used to manifest the result of a full equi-join
   * between two tables. Matched pairs come first in left order, then one entry for every
   * right row that never matched, in right order.
   *
   * @param rightKeys join key columns from the right table
   * @return left and right table gather maps
   */
  public GatherMap[] fullJoinGatherMaps(Table rightKeys) {
    return fullJoinGatherMaps(rightKeys, false);
  }

  public GatherMap[] fullJoinGatherMaps(Table rightKeys, boolean compareNullsEqual) {
    checkKeyColumnCount(rightKeys.getNumberOfColumns());
    return fullJoinGatherMaps(new HashJoin(rightKeys, compareNullsEqual));
  }

  public GatherMap[] fullJoinGatherMaps(HashJoin rightHash) {
    checkKeyColumnCount(rightHash.getNumberOfColumns());
    return EquiJoin.fullJoin(columns, rightHash, CircuitBreaker.NEVER);
  }

  /**
   * Computes the gather map that can be used to manifest the result of a left semi-join between
   * two tables. It is assumed this table instance holds the key columns from the left table, and
   * the table argument represents the key columns from the right table. The {@link GatherMap}
   * instance returned can be used to gather the left table to produce the result of the
   * left semi-join.
   *
   * @param rightKeys join key columns from the right table
   * @return left table gather map
   */
  public GatherMap leftSemiJoinGatherMap(Table rightKeys) {
    return leftSemiJoinGatherMap(rightKeys, false);
  }

  public GatherMap leftSemiJoinGatherMap(Table rightKeys, boolean compareNullsEqual) {
    checkKeyColumnCount(rightKeys.getNumberOfColumns());
    return leftSemiJoinGatherMap(new HashJoin(rightKeys, compareNullsEqual));
  }

  public GatherMap leftSemiJoinGatherMap(HashJoin rightHash) {
    checkKeyColumnCount(rightHash.getNumberOfColumns());
    return EquiJoin.leftSemiJoin(columns, rightHash, CircuitBreaker.NEVER);
  }

  /**
   * Computes the gather map that can be used to manifest the result of a left anti-join between
   * two tables. Left rows with a null key are always in the result.
   *
   * @param rightKeys join key columns from the right table
   * @return left table gather map
   */
  public GatherMap leftAntiJoinGatherMap(Table rightKeys) {
    return leftAntiJoinGatherMap(rightKeys, false);
  }

  public GatherMap leftAntiJoinGatherMap(Table rightKeys, boolean compareNullsEqual) {
    checkKeyColumnCount(rightKeys.getNumberOfColumns());
    return leftAntiJoinGatherMap(new HashJoin(rightKeys, compareNullsEqual));
  }

  public GatherMap leftAntiJoinGatherMap(HashJoin rightHash) {
    checkKeyColumnCount(rightHash.getNumberOfColumns());
    return EquiJoin.leftAntiJoin(columns, rightHash, CircuitBreaker.NEVER);
  }

  private void checkKeyColumnCount(int rightColumns) {
    if (getNumberOfColumns() != rightColumns) {
      throw new IllegalArgumentException("column count mismatch, this: " + getNumberOfColumns() +
          " rightKeys: " + rightColumns);
    }
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("Table{rows=").append(rows).append(", columns=[");
    for (int i = 0; i < columns.length; i++) {
      if (i > 0) {
        sb.append(", ");
      }
      sb.append(columns[i].getName()).append(':').append(columns[i].getType());
    }
    return sb.append("]}").toString();
  }

  /////////////////////////////////////////////////////////////////////////////
  // BUILDER
  /////////////////////////////////////////////////////////////////////////////

  /**
   * Create a table from boxed java values, null entries become null rows. This is not fast and
   * intended mostly for tests.
   */
  public static final class TestBuilder {
    private final List<HostColumnVector> columns = new ArrayList<>();

    public TestBuilder column(String name, String... values) {
      columns.add(HostColumnVector.fromStrings(name, values));
      return this;
    }

    public TestBuilder column(String name, Boolean... values) {
      columns.add(HostColumnVector.fromBoxedBooleans(name, values));
      return this;
    }

    public TestBuilder column(String name, Integer... values) {
      columns.add(HostColumnVector.fromBoxedInts(name, values));
      return this;
    }

    public TestBuilder column(String name, Long... values) {
      columns.add(HostColumnVector.fromBoxedLongs(name, values));
      return this;
    }

    public TestBuilder column(String name, Float... values) {
      columns.add(HostColumnVector.fromBoxedFloats(name, values));
      return this;
    }

    public TestBuilder column(String name, Double... values) {
      columns.add(HostColumnVector.fromBoxedDoubles(name, values));
      return this;
    }

    public TestBuilder column(HostColumnVector column) {
      columns.add(column);
      return this;
    }

    public Table build() {
      return new Table(columns);
    }
  }
}
