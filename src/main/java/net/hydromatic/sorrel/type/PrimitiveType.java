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
package net.hydromatic.sorrel.type;

import java.math.BigInteger;
import java.util.Locale;
import java.util.function.UnaryOperator;
import net.hydromatic.sorrel.ast.Op;

/** Primitive type. */
public enum PrimitiveType implements Type {
  BOOL(1, false),
  CHAR(4, false),
  I8(1, true),
  I16(2, true),
  I32(4, true),
  I64(8, true),
  I128(16, true),
  ISIZE(8, true),
  U8(1, false),
  U16(2, false),
  U32(4, false),
  U64(8, false),
  U128(16, false),
  USIZE(8, false),
  F32(4, true),
  F64(8, true),
  /** String slice. Not sized; values are always behind a reference. */
  STR(0, false);

  /** Largest Unicode scalar value, {@code char::MAX}. */
  public static final int MAX_CHAR = 0x10FFFF;

  /** The name in the language, e.g. {@code u8}. */
  public final String moniker = name().toLowerCase(Locale.ROOT);

  /** Size of a value, in bytes. */
  public final int size;

  /** Whether values of this type have a sign. */
  public final boolean signed;

  PrimitiveType(int size, boolean signed) {
    this.size = size;
    this.signed = signed;
  }

  @Override
  public String toString() {
    return moniker;
  }

  @Override
  public Op op() {
    return Op.PRIMITIVE_TYPE;
  }

  @Override
  public StringBuilder describe(StringBuilder buf) {
    return buf.append(moniker);
  }

  @Override
  public PrimitiveType copy(
      TypeSystem typeSystem, UnaryOperator<Type> transform) {
    return this;
  }

  /** Returns the size of a value, in bits. */
  public int bits() {
    return size * 8;
  }

  /** Whether this is a signed or unsigned integer type. */
  public boolean isInteger() {
    return ordinal() >= I8.ordinal() && ordinal() <= USIZE.ordinal();
  }

  /** Whether this is a signed integer type. */
  public boolean isSignedInteger() {
    return isInteger() && signed;
  }

  /** Whether this is a floating-point type. */
  public boolean isFloat() {
    return this == F32 || this == F64;
  }

  /** Whether a range pattern may have this type: integers, characters and
   * floating-point numbers. */
  public boolean isNumeric() {
    return isInteger() || isFloat() || this == CHAR;
  }

  /** Returns the smallest value of an integer type. */
  public BigInteger minValue() {
    checkInteger();
    return signed
        ? BigInteger.ONE.shiftLeft(bits() - 1).negate()
        : BigInteger.ZERO;
  }

  /** Returns the largest value of an integer type. */
  public BigInteger maxValue() {
    checkInteger();
    return signed
        ? BigInteger.ONE.shiftLeft(bits() - 1).subtract(BigInteger.ONE)
        : BigInteger.ONE.shiftLeft(bits()).subtract(BigInteger.ONE);
  }

  /** Returns the bit pattern of the smallest value of a numeric type;
   * negative infinity for floating-point types. */
  public BigInteger minBits() {
    switch (this) {
    case CHAR:
      return BigInteger.ZERO;
    case F32:
      return unsigned(Float.floatToIntBits(Float.NEGATIVE_INFINITY));
    case F64:
      return unsigned(Double.doubleToLongBits(Double.NEGATIVE_INFINITY));
    default:
      return truncate(minValue());
    }
  }

  /** Returns the bit pattern of the largest value of a numeric type;
   * positive infinity for floating-point types. */
  public BigInteger maxBits() {
    switch (this) {
    case CHAR:
      return BigInteger.valueOf(MAX_CHAR);
    case F32:
      return unsigned(Float.floatToIntBits(Float.POSITIVE_INFINITY));
    case F64:
      return unsigned(Double.doubleToLongBits(Double.POSITIVE_INFINITY));
    default:
      return truncate(maxValue());
    }
  }

  /** Truncates a value to the width of this type, yielding a non-negative
   * bit pattern (two's complement for negative values). */
  public BigInteger truncate(BigInteger value) {
    return value.and(BigInteger.ONE.shiftLeft(bits()).subtract(BigInteger.ONE));
  }

  private void checkInteger() {
    if (!isInteger()) {
      throw new IllegalArgumentException("not an integer type: " + this);
    }
  }

  private static BigInteger unsigned(long bits) {
    return BigInteger.valueOf(bits)
        .and(BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE));
  }
}

// End PrimitiveType.java
