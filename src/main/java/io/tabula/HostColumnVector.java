/*
 *
 *  SPDX-FileCopyrightText: Copyright (c) 2020-2025, NVIDIA CORPORATION.
 *  SPDX-License-Identifier: Apache-2.0
 *
 */

package io.tabula;

import java.util.Arrays;
import java.util.Objects;

/**
 * Similar to a ColumnVector, but the data is stored in host memory and accessible directly from
 * the JVM. This class holds a name, a {@link DType}, the typed values and a validity vector.
 *
 * Instances are immutable. Operations like {@link #gather(GatherMap)} and
 * {@link #rename(String)} return new columns and never touch the source.
 */
public final class HostColumnVector {
  private final String name;
  private final DType type;
  private final int rows;
  // int[], long[], float[], double[], byte[] or String[] depending on type
  private final Object data;
  // null when the column has no nulls
  private final long[] validity;
  private final int nullCount;

  HostColumnVector(String name, DType type, int rows, Object data, long[] validity,
                   int nullCount) {
    this.name = Objects.requireNonNull(name, "name");
    this.type = Objects.requireNonNull(type, "type");
    this.rows = rows;
    this.data = data;
    this.validity = nullCount == 0 ? null : validity;
    this.nullCount = nullCount;
  }

  public String getName() {
    return name;
  }

  public DType getType() {
    return type;
  }

  public long getRowCount() {
    return rows;
  }

  public long getNullCount() {
    return nullCount;
  }

  public boolean hasNulls() {
    return nullCount > 0;
  }

  /**
   * Returns true if the entry at the given index is null.
   */
  public boolean isNull(long rowIndex) {
    assertsForGet(rowIndex);
    return validity != null && BitVectorHelper.isNull(validity, (int) rowIndex);
  }

  public final int getInt(long index) {
    assert type == DType.INT32 : type + " is not a supported int type.";
    assertsForGet(index);
    return ((int[]) data)[(int) index];
  }

  public final long getLong(long index) {
    assert type == DType.INT64 : type + " is not a supported long type.";
    assertsForGet(index);
    return ((long[]) data)[(int) index];
  }

  public final float getFloat(long index) {
    assert type == DType.FLOAT32 : type + " is not a supported float type.";
    assertsForGet(index);
    return ((float[]) data)[(int) index];
  }

  public final double getDouble(long index) {
    assert type == DType.FLOAT64 : type + " is not a supported double type.";
    assertsForGet(index);
    return ((double[]) data)[(int) index];
  }

  public final boolean getBoolean(long index) {
    assert type == DType.BOOL8 : type + " is not a supported boolean type.";
    assertsForGet(index);
    return ((byte[]) data)[(int) index] != 0;
  }

  public String getJavaString(long index) {
    assert type == DType.STRING : type + " is not a supported string type.";
    assertsForGet(index);
    return ((String[]) data)[(int) index];
  }

  /**
   * Get the value at index promoted to a double. Only valid for numeric types.
   */
  public double getAsDouble(long index) {
    int i = (int) index;
    assertsForGet(index);
    switch (type) {
      case INT32:
        return ((int[]) data)[i];
      case INT64:
        return ((long[]) data)[i];
      case FLOAT32:
        return ((float[]) data)[i];
      case FLOAT64:
        return ((double[]) data)[i];
      default:
        throw new IllegalStateException(type + " cannot be converted to a double");
    }
  }

  /**
   * Get the value at index boxed as a java object, or null if the entry is null.
   */
  public Object getObject(long index) {
    if (isNull(index)) {
      return null;
    }
    int i = (int) index;
    switch (type) {
      case INT32:
        return ((int[]) data)[i];
      case INT64:
        return ((long[]) data)[i];
      case FLOAT32:
        return ((float[]) data)[i];
      case FLOAT64:
        return ((double[]) data)[i];
      case BOOL8:
        return ((byte[]) data)[i] != 0;
      case STRING:
        return ((String[]) data)[i];
      default:
        throw new IllegalStateException("unexpected type " + type);
    }
  }

  /**
   * Render the value at index as a string, "null" for a null entry.
   */
  public String getAsString(long index) {
    Object value = getObject(index);
    return value == null ? "null" : value.toString();
  }

  /**
   * Return a copy of this column with a different name.
   */
  public HostColumnVector rename(String newName) {
    if (name.equals(newName)) {
      return this;
    }
    return new HostColumnVector(newName, type, rows, data, validity, nullCount);
  }

  /**
   * Gather rows of this column. Entries of {@link GatherMap#NO_ROW} in the map, as well as
   * entries that point at null rows, produce nulls in the result.
   * @param map the rows to gather
   * @return a new column with {@code map.getRowCount()} rows and the name of this column
   */
  public HostColumnVector gather(GatherMap map) {
    return gather(map.indices());
  }

  HostColumnVector gather(int[] indices) {
    int outRows = indices.length;
    long[] outValid = BitVectorHelper.allValid(outRows);
    int outNulls = 0;
    for (int i = 0; i < outRows; i++) {
      int src = indices[i];
      if (src == GatherMap.NO_ROW) {
        outNulls += BitVectorHelper.setNullAt(outValid, i);
      } else {
        if (src < 0 || src >= rows) {
          throw new IndexOutOfBoundsException("gather index " + src + " out of range for " +
              rows + " rows");
        }
        if (validity != null && BitVectorHelper.isNull(validity, src)) {
          outNulls += BitVectorHelper.setNullAt(outValid, i);
        }
      }
    }
    return new HostColumnVector(name, type, outRows, gatherData(indices), outValid, outNulls);
  }

  private Object gatherData(int[] indices) {
    int n = indices.length;
    switch (type) {
      case INT32: {
        int[] src = (int[]) data;
        int[] out = new int[n];
        for (int i = 0; i < n; i++) {
          int idx = indices[i];
          out[i] = idx == GatherMap.NO_ROW ? 0 : src[idx];
        }
        return out;
      }
      case INT64: {
        long[] src = (long[]) data;
        long[] out = new long[n];
        for (int i = 0; i < n; i++) {
          int idx = indices[i];
          out[i] = idx == GatherMap.NO_ROW ? 0L : src[idx];
        }
        return out;
      }
      case FLOAT32: {
        float[] src = (float[]) data;
        float[] out = new float[n];
        for (int i = 0; i < n; i++) {
          int idx = indices[i];
          out[i] = idx == GatherMap.NO_ROW ? 0f : src[idx];
        }
        return out;
      }
      case FLOAT64: {
        double[] src = (double[]) data;
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
          int idx = indices[i];
          out[i] = idx == GatherMap.NO_ROW ? 0d : src[idx];
        }
        return out;
      }
      case BOOL8: {
        byte[] src = (byte[]) data;
        byte[] out = new byte[n];
        for (int i = 0; i < n; i++) {
          int idx = indices[i];
          out[i] = idx == GatherMap.NO_ROW ? 0 : src[idx];
        }
        return out;
      }
      case STRING: {
        String[] src = (String[]) data;
        String[] out = new String[n];
        for (int i = 0; i < n; i++) {
          int idx = indices[i];
          out[i] = idx == GatherMap.NO_ROW ? null : src[idx];
        }
        return out;
      }
      default:
        throw new IllegalStateException("unexpected type " + type);
    }
  }

  @Override
  public String toString() {
    return "HostColumnVector{" +
        "name='" + name + '\'' +
        ", type=" + type +
        ", rows=" + rows +
        ", nullCount=" + nullCount +
        '}';
  }

  private void assertsForGet(long index) {
    if (index < 0 || index >= rows) {
      throw new IndexOutOfBoundsException("index " + index + " out of range for " + rows +
          " rows");
    }
  }

  /////////////////////////////////////////////////////////////////////////////
  // BUILDERS
  /////////////////////////////////////////////////////////////////////////////

  /**
   * Create a new Builder to hold the specified number of rows.
   */
  public static Builder builder(String name, DType type, int rows) {
    return new Builder(name, type, rows);
  }

  /**
   * Create a column made up entirely of nulls.
   */
  public static HostColumnVector nullColumn(String name, DType type, int rows) {
    Builder b = builder(name, type, rows);
    for (int i = 0; i < rows; i++) {
      b.appendNull();
    }
    return b.build();
  }

  public static HostColumnVector fromInts(String name, int... values) {
    return new HostColumnVector(name, DType.INT32, values.length, values.clone(), null, 0);
  }

  public static HostColumnVector fromLongs(String name, long... values) {
    return new HostColumnVector(name, DType.INT64, values.length, values.clone(), null, 0);
  }

  public static HostColumnVector fromFloats(String name, float... values) {
    return new HostColumnVector(name, DType.FLOAT32, values.length, values.clone(), null, 0);
  }

  public static HostColumnVector fromDoubles(String name, double... values) {
    return new HostColumnVector(name, DType.FLOAT64, values.length, values.clone(), null, 0);
  }

  public static HostColumnVector fromBooleans(String name, boolean... values) {
    Builder b = builder(name, DType.BOOL8, values.length);
    for (boolean v : values) {
      b.append(v);
    }
    return b.build();
  }

  /**
   * Create a new string vector from the given values.  Null entries become null rows.
   */
  public static HostColumnVector fromStrings(String name, String... values) {
    Builder b = builder(name, DType.STRING, values.length);
    for (String v : values) {
      if (v == null) {
        b.appendNull();
      } else {
        b.append(v);
      }
    }
    return b.build();
  }

  public static HostColumnVector fromBoxedInts(String name, Integer... values) {
    Builder b = builder(name, DType.INT32, values.length);
    for (Integer v : values) {
      if (v == null) {
        b.appendNull();
      } else {
        b.append(v.intValue());
      }
    }
    return b.build();
  }

  public static HostColumnVector fromBoxedLongs(String name, Long... values) {
    Builder b = builder(name, DType.INT64, values.length);
    for (Long v : values) {
      if (v == null) {
        b.appendNull();
      } else {
        b.append(v.longValue());
      }
    }
    return b.build();
  }

  public static HostColumnVector fromBoxedFloats(String name, Float... values) {
    Builder b = builder(name, DType.FLOAT32, values.length);
    for (Float v : values) {
      if (v == null) {
        b.appendNull();
      } else {
        b.append(v.floatValue());
      }
    }
    return b.build();
  }

  public static HostColumnVector fromBoxedDoubles(String name, Double... values) {
    Builder b = builder(name, DType.FLOAT64, values.length);
    for (Double v : values) {
      if (v == null) {
        b.appendNull();
      } else {
        b.append(v.doubleValue());
      }
    }
    return b.build();
  }

  public static HostColumnVector fromBoxedBooleans(String name, Boolean... values) {
    Builder b = builder(name, DType.BOOL8, values.length);
    for (Boolean v : values) {
      if (v == null) {
        b.appendNull();
      } else {
        b.append(v.booleanValue());
      }
    }
    return b.build();
  }

  /**
   * Base class for building a column one row at a time. Appending a value of the wrong type
   * is a programming error and trips an assertion.
   */
  public static final class Builder {
    private final String name;
    private final DType type;
    private final Object data;
    private final long[] valid;
    private final int rows;
    private int currentIndex = 0;
    private int nullCount = 0;
    private boolean built = false;

    Builder(String name, DType type, int rows) {
      this.name = name;
      this.type = type;
      this.rows = rows;
      this.valid = BitVectorHelper.allValid(rows);
      switch (type) {
        case INT32:
          data = new int[rows];
          break;
        case INT64:
          data = new long[rows];
          break;
        case FLOAT32:
          data = new float[rows];
          break;
        case FLOAT64:
          data = new double[rows];
          break;
        case BOOL8:
          data = new byte[rows];
          break;
        case STRING:
          data = new String[rows];
          break;
        default:
          throw new IllegalArgumentException("unsupported type " + type);
      }
    }

    public Builder append(int value) {
      assert type == DType.INT32;
      ensureCapacity();
      ((int[]) data)[currentIndex++] = value;
      return this;
    }

    public Builder append(long value) {
      assert type == DType.INT64;
      ensureCapacity();
      ((long[]) data)[currentIndex++] = value;
      return this;
    }

    public Builder append(float value) {
      assert type == DType.FLOAT32;
      ensureCapacity();
      ((float[]) data)[currentIndex++] = value;
      return this;
    }

    public Builder append(double value) {
      assert type == DType.FLOAT64;
      ensureCapacity();
      ((double[]) data)[currentIndex++] = value;
      return this;
    }

    public Builder append(boolean value) {
      assert type == DType.BOOL8;
      ensureCapacity();
      ((byte[]) data)[currentIndex++] = value ? (byte) 1 : (byte) 0;
      return this;
    }

    public Builder append(String value) {
      assert type == DType.STRING;
      assert value != null : "appendNull must be used for null strings";
      ensureCapacity();
      ((String[]) data)[currentIndex++] = value;
      return this;
    }

    public Builder appendNull() {
      ensureCapacity();
      nullCount += BitVectorHelper.setNullAt(valid, currentIndex);
      currentIndex++;
      return this;
    }

    /**
     * Finish building the column. Rows that were reserved but never appended are dropped.
     */
    public HostColumnVector build() {
      if (built) {
        throw new IllegalStateException("Cannot reuse a builder.");
      }
      built = true;
      Object finalData = data;
      if (currentIndex < rows) {
        finalData = truncate(currentIndex);
      }
      return new HostColumnVector(name, type, currentIndex, finalData, valid, nullCount);
    }

    private Object truncate(int newRows) {
      switch (type) {
        case INT32:
          return Arrays.copyOf((int[]) data, newRows);
        case INT64:
          return Arrays.copyOf((long[]) data, newRows);
        case FLOAT32:
          return Arrays.copyOf((float[]) data, newRows);
        case FLOAT64:
          return Arrays.copyOf((double[]) data, newRows);
        case BOOL8:
          return Arrays.copyOf((byte[]) data, newRows);
        case STRING:
          return Arrays.copyOf((String[]) data, newRows);
        default:
          throw new IllegalStateException("unexpected type " + type);
      }
    }

    private void ensureCapacity() {
      if (built) {
        throw new IllegalStateException("Cannot reuse a builder.");
      }
      if (currentIndex >= rows) {
        throw new IllegalStateException("Row count " + rows + " exceeded for column " + name);
      }
    }
  }
}
