/*
 * SPDX-FileCopyrightText: Copyright (c) 2020-2025, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tabula;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;

/**
 * Column builder from Arrow data. This builder takes in byte buffers referencing
 * Arrow data and allows efficient building of a {@link HostColumnVector}, so Arrow record
 * batches can be joined without a row by row conversion.
 * The caller can add multiple batches where each batch corresponds to Arrow data
 * and those batches get concatenated together into a single column.
 * This currently only supports the fixed width types and Strings, nested types
 * such as list and struct are not supported.
 */
public final class ArrowColumnBuilder {
    private final String name;
    private final DType type;
    private final ArrayList<ByteBuffer> data = new ArrayList<>();
    private final ArrayList<ByteBuffer> validity = new ArrayList<>();
    private final ArrayList<ByteBuffer> offsets = new ArrayList<>();
    private final ArrayList<Long> nullCount = new ArrayList<>();
    private final ArrayList<Long> rows = new ArrayList<>();

    public ArrowColumnBuilder(String name, DType type) {
      this.name = name;
      this.type = type;
    }

    /**
     * Add an Arrow buffer. This API allows you to add multiple if you want them
     * combined into a single column.
     * Note, this takes all data, validity, and offsets buffers, but they may not all
     * be needed based on the data type. The buffer should be null if its not used
     * for that type. A null validity buffer means every row is valid.
     * @param rows - number of rows in this Arrow buffer
     * @param nullCount - number of null values in this Arrow buffer
     * @param data - ByteBuffer of the Arrow data buffer
     * @param validity - ByteBuffer of the Arrow validity buffer
     * @param offsets - ByteBuffer of the Arrow offsets buffer
     */
    public void addBatch(long rows, long nullCount, ByteBuffer data, ByteBuffer validity,
                         ByteBuffer offsets) {
      if (type == DType.STRING && offsets == null) {
        throw new IllegalArgumentException("STRING batches need an offsets buffer");
      }
      this.rows.add(rows);
      this.nullCount.add(nullCount);
      this.data.add(data);
      this.validity.add(validity);
      this.offsets.add(offsets);
    }

    /**
     * Copy the Arrow data of every batch, in the order added, into a new column.
     * @return - new HostColumnVector
     */
    public HostColumnVector build() {
      int numBatches = rows.size();
      if (numBatches == 0) {
        throw new IllegalStateException("Can't build a column when no Arrow batches specified");
      }
      long total = 0;
      for (long r : rows) {
        total += r;
      }
      if (total > Integer.MAX_VALUE) {
        throw new IllegalStateException("too many rows for a single column: " + total);
      }
      HostColumnVector.Builder builder = HostColumnVector.builder(name, type, (int) total);
      for (int i = 0; i < numBatches; i++) {
        appendBatch(builder, i);
      }
      return builder.build();
    }

    private void appendBatch(HostColumnVector.Builder builder, int batch) {
      int numRows = Math.toIntExact(rows.get(batch));
      ByteBuffer valid = nullCount.get(batch) == 0 ? null : validity.get(batch);
      ByteBuffer values = littleEndian(data.get(batch));
      ByteBuffer offs = littleEndian(offsets.get(batch));
      for (int row = 0; row < numRows; row++) {
        if (valid != null && !isSet(valid, row)) {
          builder.appendNull();
          continue;
        }
        switch (type) {
          case INT32:
            builder.append(values.getInt(row * Integer.BYTES));
            break;
          case INT64:
            builder.append(values.getLong(row * Long.BYTES));
            break;
          case FLOAT32:
            builder.append(values.getFloat(row * Float.BYTES));
            break;
          case FLOAT64:
            builder.append(values.getDouble(row * Double.BYTES));
            break;
          case BOOL8:
            // arrow packs booleans one bit per row
            builder.append(isSet(values, row));
            break;
          case STRING:
            builder.append(readString(values, offs, row));
            break;
          default:
            throw new IllegalStateException("unsupported arrow type " + type);
        }
      }
    }

    private static String readString(ByteBuffer values, ByteBuffer offs, int row) {
      int start = offs.getInt(row * Integer.BYTES);
      int end = offs.getInt((row + 1) * Integer.BYTES);
      byte[] utf8 = new byte[end - start];
      for (int i = 0; i < utf8.length; i++) {
        utf8[i] = values.get(start + i);
      }
      return new String(utf8, StandardCharsets.UTF_8);
    }

    private static boolean isSet(ByteBuffer bits, int index) {
      return (bits.get(index >> 3) & (1 << (index & 7))) != 0;
    }

    private static ByteBuffer littleEndian(ByteBuffer buffer) {
      return buffer == null ? null : buffer.duplicate().order(ByteOrder.LITTLE_ENDIAN);
    }

    @Override
    public String toString() {
      return "ArrowColumnBuilder{" +
        "name=" + name +
        ", type=" + type +
        ", data=" + data +
        ", validity=" + validity +
        ", offsets=" + offsets +
        ", nullCount=" + nullCount +
        ", rows=" + rows +
        '}';
    }
}
