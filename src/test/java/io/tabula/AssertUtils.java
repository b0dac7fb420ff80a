/*
 * SPDX-FileCopyrightText: Copyright (c) 2021-2025, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tabula;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

/** Utility methods for asserting in unit tests */
public class AssertUtils {

  /**
   * Checks and asserts that passed in host columns match, names aside
   * @param expected The expected result host column
   * @param cv The input host column
   * @param colName The name of the host column, used in failure messages
   */
  public static void assertColumnsAreEqual(HostColumnVector expected, HostColumnVector cv,
                                           String colName) {
    assertEquals(expected.getType(), cv.getType(), "Type For Column " + colName);
    assertEquals(expected.getRowCount(), cv.getRowCount(), "Row Count For Column " + colName);
    for (long row = 0; row < expected.getRowCount(); row++) {
      assertEquals(expected.isNull(row), cv.isNull(row),
          "NULL for Column " + colName + " Row " + row);
      assertEquals(expected.getObject(row), cv.getObject(row),
          "Column " + colName + " Row " + row);
    }
  }

  /**
   * Checks and asserts that the two tables match, column names included
   * @param expected the expected result table
   * @param table the input table to compare against expected
   */
  public static void assertTablesAreEqual(Table expected, Table table) {
    assertArrayEquals(expected.getColumnNames(), table.getColumnNames(), "COLUMN NAMES");
    assertEquals(expected.getRowCount(), table.getRowCount(), "ROW COUNT");
    for (int col = 0; col < expected.getNumberOfColumns(); col++) {
      assertColumnsAreEqual(expected.getColumn(col), table.getColumn(col),
          expected.getColumn(col).getName());
    }
  }

  public static void assertTableTypes(DType[] expectedTypes, Table t) {
    int len = t.getNumberOfColumns();
    assertEquals(expectedTypes.length, len);
    for (int i = 0; i < len; i++) {
      assertEquals(expectedTypes[i], t.getColumn(i).getType(), "Types don't match at " + i);
    }
  }

  /**
   * Render every row of a table as a string so that join outputs can be compared as sorted
   * lists when their row order is not defined.
   */
  public static List<String> rowsOf(Table table) {
    List<String> rows = new ArrayList<>((int) table.getRowCount());
    for (long row = 0; row < table.getRowCount(); row++) {
      StringBuilder sb = new StringBuilder();
      for (int col = 0; col < table.getNumberOfColumns(); col++) {
        if (col > 0) {
          sb.append('|');
        }
        sb.append(table.getColumn(col).getAsString(row));
      }
      rows.add(sb.toString());
    }
    return rows;
  }

  /** Pairs of a join gather map result as "left,right" strings, sorted. */
  public static List<String> sortedPairs(GatherMap[] maps) {
    assertEquals(2, maps.length);
    assertEquals(maps[0].getRowCount(), maps[1].getRowCount());
    List<long[]> pairs = new ArrayList<>();
    for (long i = 0; i < maps[0].getRowCount(); i++) {
      pairs.add(new long[] {maps[0].get(i), maps[1].get(i)});
    }
    pairs.sort((a, b) -> a[0] != b[0] ? Long.compare(a[0], b[0]) : Long.compare(a[1], b[1]));
    List<String> out = new ArrayList<>(pairs.size());
    for (long[] p : pairs) {
      out.add(p[0] + "," + p[1]);
    }
    return out;
  }
}
