/*
 * SPDX-FileCopyrightText: Copyright (c) 2025, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.tabula;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Turns the key columns of a row into a {@link JoinKey}.
 *
 * Every field is written as a one byte tag followed by a self delimiting payload:
 * <ul>
 *   <li>{@code INTEGRAL}: 8 byte long. Integers of any width and floating point values that are
 *   exact integers inside the long range use this form, so numeric keys of different widths
 *   compare by value.</li>
 *   <li>{@code FLOATING}: 8 byte double bits of any other floating point value, with every NaN
 *   folded into one canonical NaN.</li>
 *   <li>{@code STRING}: 4 byte length then the UTF-8 bytes.</li>
 *   <li>{@code BOOLEAN}: one byte.</li>
 *   <li>{@code NULL}: no payload, only written when nulls compare equal.</li>
 * </ul>
 * Because each field carries its own length no separator is needed and two different tuples
 * can never produce the same bytes.
 *
 * The field encoders are picked once per column when the encoder is created.
 */
final class JoinKeyEncoder {
  private static final byte TAG_NULL = 0;
  private static final byte TAG_INTEGRAL = 1;
  private static final byte TAG_FLOATING = 2;
  private static final byte TAG_STRING = 3;
  private static final byte TAG_BOOLEAN = 4;

  private static final double TWO_TO_63 = 0x1p63;

  @FunctionalInterface
  private interface FieldEncoder {
    void encode(int row, KeyBuffer out);
  }

  private final HostColumnVector[] columns;
  private final FieldEncoder[] encoders;
  private final boolean nullsEqual;
  private final KeyBuffer scratch = new KeyBuffer();

  JoinKeyEncoder(HostColumnVector[] columns, NullEquality nullEquality) {
    this.columns = columns;
    this.nullsEqual = nullEquality.nullsEqual;
    this.encoders = new FieldEncoder[columns.length];
    for (int i = 0; i < columns.length; i++) {
      encoders[i] = encoderFor(columns[i]);
    }
  }

  /**
   * Encode the key of a row.
   * @return the key, or null if the row has a null component and nulls are unequal, in which
   * case the row can never match anything
   */
  JoinKey encode(int row) {
    scratch.reset();
    for (int i = 0; i < columns.length; i++) {
      if (columns[i].isNull(row)) {
        if (!nullsEqual) {
          return null;
        }
        scratch.putByte(TAG_NULL);
      } else {
        encoders[i].encode(row, scratch);
      }
    }
    return new JoinKey(scratch.toByteArray());
  }

  private static FieldEncoder encoderFor(HostColumnVector col) {
    switch (col.getType()) {
      case INT32:
        return (row, out) -> putIntegral(out, col.getInt(row));
      case INT64:
        return (row, out) -> putIntegral(out, col.getLong(row));
      case FLOAT32:
        return (row, out) -> putFloating(out, col.getFloat(row));
      case FLOAT64:
        return (row, out) -> putFloating(out, col.getDouble(row));
      case BOOL8:
        return (row, out) -> {
          out.putByte(TAG_BOOLEAN);
          out.putByte(col.getBoolean(row) ? (byte) 1 : (byte) 0);
        };
      case STRING:
        return (row, out) -> {
          byte[] utf8 = col.getJavaString(row).getBytes(StandardCharsets.UTF_8);
          out.putByte(TAG_STRING);
          out.putInt(utf8.length);
          out.putBytes(utf8);
        };
      default:
        throw new IllegalArgumentException("unsupported key type " + col.getType());
    }
  }

  private static void putIntegral(KeyBuffer out, long value) {
    out.putByte(TAG_INTEGRAL);
    out.putLong(value);
  }

  private static void putFloating(KeyBuffer out, double value) {
    if (!Double.isNaN(value) && value >= -TWO_TO_63 && value < TWO_TO_63) {
      long asLong = (long) value;
      // -0.0 lands here too and becomes 0
      if ((double) asLong == value) {
        putIntegral(out, asLong);
        return;
      }
    }
    out.putByte(TAG_FLOATING);
    // doubleToLongBits already collapses every NaN into one representation
    out.putLong(Double.doubleToLongBits(value));
  }

  /** Growable big endian byte buffer reused across rows. */
  private static final class KeyBuffer {
    private byte[] buf = new byte[64];
    private int pos;

    void reset() {
      pos = 0;
    }

    void putByte(byte b) {
      ensure(1);
      buf[pos++] = b;
    }

    void putInt(int v) {
      ensure(Integer.BYTES);
      for (int shift = 24; shift >= 0; shift -= 8) {
        buf[pos++] = (byte) (v >>> shift);
      }
    }

    void putLong(long v) {
      ensure(Long.BYTES);
      for (int shift = 56; shift >= 0; shift -= 8) {
        buf[pos++] = (byte) (v >>> shift);
      }
    }

    void putBytes(byte[] bytes) {
      ensure(bytes.length);
      System.arraycopy(bytes, 0, buf, pos, bytes.length);
      pos += bytes.length;
    }

    byte[] toByteArray() {
      return Arrays.copyOf(buf, pos);
    }

    private void ensure(int extra) {
      if (pos + extra > buf.length) {
        buf = Arrays.copyOf(buf, Math.max(buf.length * 2, pos + extra));
      }
    }
  }
}
