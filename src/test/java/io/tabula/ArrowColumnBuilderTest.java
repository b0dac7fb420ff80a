/*
 * SPDX-FileCopyrightText: Copyright (c) 2021-2025, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tabula;

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.BitVector;
import org.apache.arrow.vector.Float8Vector;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.util.Text;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.util.ArrayList;

import static io.tabula.AssertUtils.assertColumnsAreEqual;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ArrowColumnBuilderTest {
  private BufferAllocator allocator;

  @BeforeEach
  void setUp() {
    allocator = new RootAllocator(Long.MAX_VALUE);
  }

  @AfterEach
  void tearDown() {
    allocator.close();
  }

  @Test
  void testArrowIntMultiBatches() {
    ArrowColumnBuilder builder = new ArrowColumnBuilder("ints", DType.INT32);
    int numVecs = 4;
    IntVector[] vectors = new IntVector[numVecs];
    try {
      ArrayList<Integer> expectedArr = new ArrayList<>();
      for (int j = 0; j < numVecs; j++) {
        int count = 10000;
        IntVector vector = new IntVector("intVec", allocator);
        vectors[j] = vector;
        int start = count * j;
        for (int pos = 0; pos < count; pos++) {
          expectedArr.add(start + pos);
          vector.setSafe(pos, start + pos);
        }
        vector.setValueCount(count);
        ByteBuffer data = vector.getDataBuffer().nioBuffer();
        ByteBuffer valid = vector.getValidityBuffer().nioBuffer();
        builder.addBatch(vector.getValueCount(), vector.getNullCount(), data, valid, null);
      }
      HostColumnVector cv = builder.build();
      HostColumnVector expected = HostColumnVector.fromBoxedInts("ints",
          expectedArr.toArray(new Integer[0]));
      assertEquals(DType.INT32, cv.getType());
      assertColumnsAreEqual(expected, cv, "ints");
    } finally {
      for (IntVector v : vectors) {
        if (v != null) {
          v.close();
        }
      }
    }
  }

  @Test
  void testArrowLongWithNulls() {
    ArrowColumnBuilder builder = new ArrowColumnBuilder("longs", DType.INT64);
    try (BigIntVector vector = new BigIntVector("vec", allocator)) {
      ArrayList<Long> expectedArr = new ArrayList<>();
      int count = 1000;
      for (int i = 0; i < count; i++) {
        if (i % 7 == 0) {
          expectedArr.add(null);
          vector.setNull(i);
        } else {
          expectedArr.add((long) i * 1_000_000_000L);
          vector.setSafe(i, (long) i * 1_000_000_000L);
        }
      }
      vector.setValueCount(count);
      ByteBuffer data = vector.getDataBuffer().nioBuffer();
      ByteBuffer valid = vector.getValidityBuffer().nioBuffer();
      builder.addBatch(vector.getValueCount(), vector.getNullCount(), data, valid, null);
      HostColumnVector cv = builder.build();
      assertEquals(143, cv.getNullCount());
      assertColumnsAreEqual(HostColumnVector.fromBoxedLongs("longs",
          expectedArr.toArray(new Long[0])), cv, "longs");
    }
  }

  @Test
  void testArrowDouble() {
    ArrowColumnBuilder builder = new ArrowColumnBuilder("doubles", DType.FLOAT64);
    try (Float8Vector vector = new Float8Vector("vec", allocator)) {
      ArrayList<Double> expectedArr = new ArrayList<>();
      int count = 10000;
      for (int i = 0; i < count; i++) {
        expectedArr.add(i / 4.0);
        vector.setSafe(i, i / 4.0);
      }
      vector.setValueCount(count);
      ByteBuffer data = vector.getDataBuffer().nioBuffer();
      ByteBuffer valid = vector.getValidityBuffer().nioBuffer();
      builder.addBatch(vector.getValueCount(), vector.getNullCount(), data, valid, null);
      assertColumnsAreEqual(HostColumnVector.fromBoxedDoubles("doubles",
          expectedArr.toArray(new Double[0])), builder.build(), "doubles");
    }
  }

  @Test
  void testArrowBooleans() {
    ArrowColumnBuilder builder = new ArrowColumnBuilder("flags", DType.BOOL8);
    try (BitVector vector = new BitVector("vec", allocator)) {
      vector.setSafe(0, 1);
      vector.setSafe(1, 0);
      vector.setNull(2);
      vector.setSafe(3, 1);
      vector.setValueCount(4);
      builder.addBatch(vector.getValueCount(), vector.getNullCount(),
          vector.getDataBuffer().nioBuffer(), vector.getValidityBuffer().nioBuffer(), null);
      assertColumnsAreEqual(HostColumnVector.fromBoxedBooleans("flags", true, false, null, true),
          builder.build(), "flags");
    }
  }

  @Test
  void testArrowString() {
    ArrowColumnBuilder builder = new ArrowColumnBuilder("strings", DType.STRING);
    try (VarCharVector vector = new VarCharVector("vec", allocator)) {
      ArrayList<String> expectedArr = new ArrayList<>();
      int count = 10000;
      for (int i = 0; i < count; i++) {
        if (i % 100 == 99) {
          expectedArr.add(null);
          vector.setNull(i);
        } else {
          String toAdd = i + "testStringé";
          expectedArr.add(toAdd);
          vector.setSafe(i, new Text(toAdd));
        }
      }
      vector.setValueCount(count);
      ByteBuffer data = vector.getDataBuffer().nioBuffer();
      ByteBuffer valid = vector.getValidityBuffer().nioBuffer();
      ByteBuffer offsets = vector.getOffsetBuffer().nioBuffer();
      builder.addBatch(vector.getValueCount(), vector.getNullCount(), data, valid, offsets);
      HostColumnVector cv = builder.build();
      assertEquals(DType.STRING, cv.getType());
      assertColumnsAreEqual(HostColumnVector.fromStrings("strings",
          expectedArr.toArray(new String[0])), cv, "strings");
    }
  }

  @Test
  void testArrowBatchesJoin() {
    ArrowColumnBuilder keys = new ArrowColumnBuilder("id", DType.INT32);
    try (IntVector vector = new IntVector("vec", allocator)) {
      vector.setSafe(0, 3);
      vector.setSafe(1, 1);
      vector.setValueCount(2);
      keys.addBatch(vector.getValueCount(), vector.getNullCount(),
          vector.getDataBuffer().nioBuffer(), vector.getValidityBuffer().nioBuffer(), null);
      Table left = new Table(keys.build());
      Table right = new Table.TestBuilder().column("id", 1, 2, 3).column("v", "x", "y", "z")
          .build();
      Table result = left.join(right, "id", JoinType.INNER);
      assertEquals(2, result.getRowCount());
      assertEquals("z", result.getColumn("v").getJavaString(0));
      assertEquals("x", result.getColumn("v").getJavaString(1));
    }
  }

  @Test
  void testBuilderErrors() {
    ArrowColumnBuilder builder = new ArrowColumnBuilder("s", DType.STRING);
    assertThrows(IllegalStateException.class, builder::build);
    assertThrows(IllegalArgumentException.class,
        () -> builder.addBatch(1, 0, ByteBuffer.allocate(1), null, null));
  }
}
