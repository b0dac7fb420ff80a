/*
 * SPDX-FileCopyrightText: Copyright (c) 2025, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tabula;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

public class JoinKeyEncoderTest {
  private static JoinKey key(NullEquality nulls, HostColumnVector... columns) {
    return new JoinKeyEncoder(columns, nulls).encode(0);
  }

  private static JoinKey key(HostColumnVector... columns) {
    return key(NullEquality.UNEQUAL, columns);
  }

  @Test
  void testNumericWidthsCompareByValue() {
    JoinKey i = key(HostColumnVector.fromInts("a", 42));
    assertEquals(i, key(HostColumnVector.fromLongs("a", 42L)));
    assertEquals(i, key(HostColumnVector.fromDoubles("a", 42.0)));
    assertEquals(i, key(HostColumnVector.fromFloats("a", 42f)));
    assertNotEquals(i, key(HostColumnVector.fromDoubles("a", 42.5)));
    assertEquals(key(HostColumnVector.fromFloats("a", 0.5f)),
        key(HostColumnVector.fromDoubles("a", 0.5)));
  }

  @Test
  void testStringsNeverEqualNumbers() {
    assertNotEquals(key(HostColumnVector.fromStrings("a", "1")),
        key(HostColumnVector.fromInts("a", 1)));
    assertNotEquals(key(HostColumnVector.fromBooleans("a", true)),
        key(HostColumnVector.fromInts("a", 1)));
  }

  @Test
  void testCompositeKeysDoNotCollide() {
    JoinKey abC = key(HostColumnVector.fromStrings("a", "ab"),
        HostColumnVector.fromStrings("b", "c"));
    JoinKey aBc = key(HostColumnVector.fromStrings("a", "a"),
        HostColumnVector.fromStrings("b", "bc"));
    assertNotEquals(abC, aBc);
    // a separator inside a value must not line up with a field boundary
    JoinKey sep1 = key(HostColumnVector.fromStrings("a", "x|"),
        HostColumnVector.fromStrings("b", "y"));
    JoinKey sep2 = key(HostColumnVector.fromStrings("a", "x"),
        HostColumnVector.fromStrings("b", "|y"));
    assertNotEquals(sep1, sep2);
    assertEquals(abC, key(HostColumnVector.fromStrings("a", "ab"),
        HostColumnVector.fromStrings("b", "c")));
  }

  @Test
  void testFloatingEdgeCases() {
    assertEquals(key(HostColumnVector.fromDoubles("a", -0.0)),
        key(HostColumnVector.fromDoubles("a", 0.0)));
    assertEquals(key(HostColumnVector.fromDoubles("a", Double.NaN)),
        key(HostColumnVector.fromFloats("a", Float.NaN)));
    // 2^63 does not fit in a long and must not alias Long.MAX_VALUE
    assertNotEquals(key(HostColumnVector.fromDoubles("a", 0x1p63)),
        key(HostColumnVector.fromLongs("a", Long.MAX_VALUE)));
    assertEquals(key(HostColumnVector.fromDoubles("a", -0x1p63)),
        key(HostColumnVector.fromLongs("a", Long.MIN_VALUE)));
  }

  @Test
  void testNulls() {
    HostColumnVector withNull = HostColumnVector.fromBoxedInts("a", (Integer) null);
    HostColumnVector other = HostColumnVector.fromInts("b", 1);
    assertNull(key(withNull, other));
    JoinKey nullKey = key(NullEquality.EQUAL, withNull, other);
    assertNotNull(nullKey);
    assertEquals(nullKey, key(NullEquality.EQUAL,
        HostColumnVector.fromBoxedLongs("a", (Long) null), other));
    assertNotEquals(nullKey, key(NullEquality.EQUAL, HostColumnVector.fromInts("a", 0), other));
  }
}
