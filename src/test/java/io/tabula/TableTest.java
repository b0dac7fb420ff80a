/*
 * SPDX-FileCopyrightText: Copyright (c) 2019-2025, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tabula;

import org.junit.jupiter.api.Test;

import static io.tabula.AssertUtils.assertTableTypes;
import static io.tabula.AssertUtils.assertTablesAreEqual;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TableTest {
  @Test
  void testSchema() {
    Table t = new Table.TestBuilder()
        .column("id", 1, 2, 3)
        .column("name", "a", "b", null)
        .column("score", 1.0, null, 2.0)
        .column("flag", true, false, true)
        .column("big", 1L, 2L, 3L)
        .column("f", 1f, 2f, 3f)
        .build();
    assertEquals(3, t.getRowCount());
    assertEquals(6, t.getNumberOfColumns());
    assertArrayEquals(new String[] {"id", "name", "score", "flag", "big", "f"},
        t.getColumnNames());
    assertTableTypes(new DType[] {DType.INT32, DType.STRING, DType.FLOAT64, DType.BOOL8,
        DType.INT64, DType.FLOAT32}, t);
    assertTrue(t.hasColumn("score"));
    assertFalse(t.hasColumn("missing"));
    assertEquals("name", t.getColumn(1).getName());
  }

  @Test
  void testMismatchedRowCounts() {
    assertThrows(IllegalArgumentException.class, () -> new Table.TestBuilder()
        .column("a", 1, 2)
        .column("b", 1, 2, 3)
        .build());
  }

  @Test
  void testDuplicateNames() {
    assertThrows(IllegalArgumentException.class, () -> new Table.TestBuilder()
        .column("a", 1, 2)
        .column("a", "x", "y")
        .build());
  }

  @Test
  void testNullColumn() {
    IllegalArgumentException first = assertThrows(IllegalArgumentException.class,
        () -> new Table((HostColumnVector) null));
    assertEquals("column 0 is null", first.getMessage());
    IllegalArgumentException second = assertThrows(IllegalArgumentException.class,
        () -> new Table(HostColumnVector.fromInts("a", 1), null));
    assertEquals("column 1 is null", second.getMessage());
  }

  @Test
  void testMissingColumn() {
    Table t = new Table.TestBuilder().column("a", 1).build();
    ColumnNotFoundException e = assertThrows(ColumnNotFoundException.class,
        () -> t.getColumn("b"));
    assertEquals("b", e.getColumnName());
    assertThrows(JoinValidationException.class, () -> t.select("a", "b"));
  }

  @Test
  void testEmptyTable() {
    Table t = new Table();
    assertEquals(0, t.getRowCount());
    assertEquals(0, t.getNumberOfColumns());
  }

  @Test
  void testSelectAndGather() {
    Table t = new Table.TestBuilder()
        .column("a", 1, 2, 3)
        .column("b", "x", "y", "z")
        .build();
    Table expected = new Table.TestBuilder()
        .column("b", "z", null, "x")
        .column("a", 3, null, 1)
        .build();
    assertTablesAreEqual(expected, t.select("b", "a").gather(new GatherMap(2, -1, 0)));
  }
}
