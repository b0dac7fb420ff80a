/*
 * SPDX-FileCopyrightText: Copyright (c) 2025, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.tabula;

import java.util.Arrays;

/**
 * The encoded form of one row's join key tuple. Two keys are equal iff their encodings are
 * byte for byte equal, see {@link JoinKeyEncoder} for the format.
 */
final class JoinKey {
  private final byte[] encoded;
  private final int hash;

  JoinKey(byte[] encoded) {
    this.encoded = encoded;
    this.hash = Arrays.hashCode(encoded);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof JoinKey)) {
      return false;
    }
    JoinKey other = (JoinKey) o;
    return hash == other.hash && Arrays.equals(encoded, other.encoded);
  }

  @Override
  public int hashCode() {
    return hash;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("JoinKey[");
    for (byte b : encoded) {
      sb.append(String.format("%02x", b & 0xFF));
    }
    return sb.append(']').toString();
  }
}
