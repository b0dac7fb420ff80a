/*
 * SPDX-FileCopyrightText: Copyright (c) 2019-2025, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tabula;

import org.junit.jupiter.api.Test;

import static io.tabula.AssertUtils.assertColumnsAreEqual;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class HostColumnVectorTest {
  @Test
  void testBoxedNulls() {
    HostColumnVector col = HostColumnVector.fromBoxedInts("a", 1, null, 3);
    assertEquals(3, col.getRowCount());
    assertEquals(1, col.getNullCount());
    assertTrue(col.hasNulls());
    assertTrue(col.isNull(1));
    assertFalse(col.isNull(2));
    assertEquals(3, col.getInt(2));
    assertNull(col.getObject(1));
    assertEquals("null", col.getAsString(1));
    assertEquals("3", col.getAsString(2));
  }

  @Test
  void testStringsWithNulls() {
    HostColumnVector col = HostColumnVector.fromStrings("s", "x", null, "");
    assertEquals(DType.STRING, col.getType());
    assertEquals(1, col.getNullCount());
    assertEquals("", col.getJavaString(2));
  }

  @Test
  void testGetAsDouble() {
    assertEquals(7.0, HostColumnVector.fromLongs("l", 7L).getAsDouble(0));
    assertEquals(2.5, HostColumnVector.fromFloats("f", 2.5f).getAsDouble(0));
    assertThrows(IllegalStateException.class,
        () -> HostColumnVector.fromStrings("s", "1").getAsDouble(0));
    assertThrows(IllegalStateException.class,
        () -> HostColumnVector.fromBooleans("b", true).getAsDouble(0));
  }

  @Test
  void testGatherWithNoRow() {
    HostColumnVector col = HostColumnVector.fromBoxedDoubles("d", 1.5, null, 3.5);
    HostColumnVector gathered = col.gather(new GatherMap(2, GatherMap.NO_ROW, 1, 0, 2));
    HostColumnVector expected = HostColumnVector.fromBoxedDoubles("d", 3.5, null, null, 1.5, 3.5);
    assertColumnsAreEqual(expected, gathered, "d");
    assertEquals("d", gathered.getName());
    assertEquals(2, gathered.getNullCount());
  }

  @Test
  void testGatherOutOfRange() {
    HostColumnVector col = HostColumnVector.fromInts("a", 1, 2);
    assertThrows(IndexOutOfBoundsException.class, () -> col.gather(new GatherMap(2)));
  }

  @Test
  void testRename() {
    HostColumnVector col = HostColumnVector.fromBooleans("b", true, false);
    assertSame(col, col.rename("b"));
    HostColumnVector renamed = col.rename("c");
    assertEquals("c", renamed.getName());
    assertEquals("b", col.getName());
    assertColumnsAreEqual(col, renamed, "c");
  }

  @Test
  void testNullColumn() {
    HostColumnVector col = HostColumnVector.nullColumn("n", DType.INT64, 4);
    assertEquals(4, col.getRowCount());
    assertEquals(4, col.getNullCount());
    assertEquals(DType.INT64, col.getType());
  }

  @Test
  void testBuilder() {
    HostColumnVector.Builder builder = HostColumnVector.builder("s", DType.STRING, 10);
    builder.append("a").appendNull().append("c");
    HostColumnVector col = builder.build();
    assertEquals(3, col.getRowCount());
    assertEquals(1, col.getNullCount());
    assertEquals("c", col.getJavaString(2));
    assertThrows(IllegalStateException.class, builder::build);
  }
}
