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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.math.BigInteger;
import java.util.Objects;

/** The raw bits of a scalar value (integer, boolean, character or
 * floating-point number), together with its size in bytes.
 *
 * <p>The bits are stored as a non-negative {@link BigInteger} less than
 * 2<sup>8 &times; size</sup>; negative integers are in two's complement
 * form. The ordering compares bits as unsigned numbers. */
public class ScalarInt implements Comparable<ScalarInt> {
  public final BigInteger bits;
  public final int size;

  private ScalarInt(BigInteger bits, int size) {
    this.bits = requireNonNull(bits);
    this.size = size;
  }

  /** Creates a scalar from a bit pattern, which must fit in {@code size}
   * bytes. */
  public static ScalarInt ofBits(BigInteger bits, int size) {
    checkArgument(size > 0 && size <= 16, "bad size %s", size);
    checkArgument(bits.signum() >= 0 && bits.bitLength() <= size * 8,
        "bits %s do not fit in %s bytes", bits, size);
    return new ScalarInt(bits, size);
  }

  /** Creates a scalar from a value, truncating to {@code size} bytes. A
   * value that does not fit wraps around. */
  public static ScalarInt of(BigInteger value, int size) {
    checkArgument(size > 0 && size <= 16, "bad size %s", size);
    return new ScalarInt(value.and(mask(size)), size);
  }

  /** Creates a scalar from a value, truncating to {@code size} bytes. */
  public static ScalarInt of(long value, int size) {
    return of(BigInteger.valueOf(value), size);
  }

  private static BigInteger mask(int size) {
    return BigInteger.ONE.shiftLeft(size * 8).subtract(BigInteger.ONE);
  }

  /** Returns the value, interpreting the bits as a signed number. */
  public BigInteger signExtend() {
    return bits.testBit(size * 8 - 1)
        ? bits.subtract(BigInteger.ONE.shiftLeft(size * 8))
        : bits;
  }

  @Override
  public int compareTo(ScalarInt o) {
    final int c = bits.compareTo(o.bits);
    return c != 0 ? c : Integer.compare(size, o.size);
  }

  @Override
  public int hashCode() {
    return Objects.hash(bits, size);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof ScalarInt
        && bits.equals(((ScalarInt) o).bits)
        && size == ((ScalarInt) o).size;
  }

  @Override
  public String toString() {
    return "0x" + bits.toString(16) + "_" + size;
  }
}

// End ScalarInt.java
