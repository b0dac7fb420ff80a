/*
 * SPDX-FileCopyrightText: Copyright (c) 2021-2025, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tabula;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class GatherMapTest {
  @Test
  void testInvalidEntry() {
    assertThrows(IllegalArgumentException.class, () -> new GatherMap(0, 1, -2));
  }

  @Test
  void testRowCount() {
    GatherMap map = new GatherMap(3, 1, GatherMap.NO_ROW, 0);
    assertEquals(4, map.getRowCount());
    assertEquals(GatherMap.NO_ROW, map.get(2));
    assertTrue(map.hasNoRowEntries());
    assertFalse(new GatherMap(0, 1).hasNoRowEntries());
  }

  @Test
  void testConstructorCopies() {
    int[] data = {1, 2, 3};
    GatherMap map = new GatherMap(data);
    data[0] = 7;
    assertEquals(1, map.get(0));
    int[] out = map.toIntArray();
    out[1] = 9;
    assertEquals(2, map.get(1));
  }

  @Test
  void testToColumnVector() {
    HostColumnVector col = new GatherMap(4, GatherMap.NO_ROW).toColumnVector("left");
    assertEquals("left", col.getName());
    assertEquals(DType.INT32, col.getType());
    assertEquals(4, col.getInt(0));
    assertEquals(-1, col.getInt(1));
    assertFalse(col.hasNulls());
  }

  @Test
  void testIdentityAndBuilder() {
    assertArrayEquals(new int[] {0, 1, 2}, GatherMap.identity(3).toIntArray());
    GatherMap.Builder builder = new GatherMap.Builder(1);
    for (int i = 0; i < 100; i++) {
      builder.append(i * 2);
    }
    GatherMap built = builder.build();
    assertEquals(100, built.getRowCount());
    assertEquals(198, built.get(99));
    assertEquals(0, new GatherMap.Builder().build().getRowCount());
  }
}
