/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.sorrel.eval;

import static java.util.Objects.requireNonNull;

import com.google.common.io.BaseEncoding;
import java.util.Arrays;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Opaque value of an evaluated constant.
 *
 * <p>Unlike a {@link ValTree}, an opaque value cannot be decomposed into
 * sub-patterns; a pattern can only compare against it as a whole. */
public class ConstValue {
  public final Kind kind;
  private final @Nullable ScalarInt scalar;
  private final byte[] bytes;

  private ConstValue(Kind kind, @Nullable ScalarInt scalar, byte[] bytes) {
    this.kind = requireNonNull(kind);
    this.scalar = scalar;
    this.bytes = requireNonNull(bytes);
  }

  /** Creates a value that is a single scalar. */
  public static ConstValue scalar(ScalarInt scalar) {
    return new ConstValue(Kind.SCALAR, requireNonNull(scalar), new byte[0]);
  }

  /** Creates a value of a zero-sized type, such as {@code ()}. */
  public static ConstValue zeroSized() {
    return new ConstValue(Kind.ZERO_SIZED, null, new byte[0]);
  }

  /** Creates a value held in memory, as a sequence of bytes. */
  public static ConstValue indirect(byte[] bytes) {
    return new ConstValue(Kind.INDIRECT, null, bytes.clone());
  }

  /** Returns the scalar, or null if this value is not a scalar. */
  public @Nullable ScalarInt tryToScalar() {
    return scalar;
  }

  @Override
  public int hashCode() {
    return kind.hashCode() * 31
        + (scalar == null ? Arrays.hashCode(bytes) : scalar.hashCode());
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof ConstValue
        && kind == ((ConstValue) o).kind
        && Objects.equals(scalar, ((ConstValue) o).scalar)
        && Arrays.equals(bytes, ((ConstValue) o).bytes);
  }

  @Override
  public String toString() {
    switch (kind) {
    case SCALAR:
      return String.valueOf(scalar);
    case ZERO_SIZED:
      return "<zst>";
    default:
      return "<opaque 0x" + BaseEncoding.base16().lowerCase().encode(bytes)
          + ">";
    }
  }

  /** Kind of opaque value. */
  public enum Kind {
    SCALAR,
    ZERO_SIZED,
    INDIRECT
  }
}

// End ConstValue.java
