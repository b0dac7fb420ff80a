/*
 * SPDX-FileCopyrightText: Copyright (c) 2019-2025, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tabula;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class DTypeTest {
  @Test
  void testSizes() {
    assertEquals(4, DType.INT32.getSizeInBytes());
    assertEquals(8, DType.INT64.getSizeInBytes());
    assertEquals(4, DType.FLOAT32.getSizeInBytes());
    assertEquals(8, DType.FLOAT64.getSizeInBytes());
    assertEquals(1, DType.BOOL8.getSizeInBytes());
    // variable width
    assertEquals(0, DType.STRING.getSizeInBytes());
  }

  @Test
  void testJoinCompatibility() {
    for (DType a : DType.values()) {
      for (DType b : DType.values()) {
        boolean expected = a == b || (a.isNumeric() && b.isNumeric());
        assertEquals(expected, a.isJoinCompatibleWith(b), a + " with " + b);
      }
    }
    assertTrue(DType.INT32.isJoinCompatibleWith(DType.FLOAT64));
    assertFalse(DType.STRING.isJoinCompatibleWith(DType.BOOL8));
    assertTrue(DType.INT64.isIntegral());
    assertTrue(DType.FLOAT32.isFloatingPoint());
    assertFalse(DType.BOOL8.isNumeric());
  }
}
