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

import java.math.BigInteger;
import net.hydromatic.sorrel.type.PrimitiveType;
import net.hydromatic.sorrel.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Compares constants. */
public abstract class ConstComparators {
  private ConstComparators() {}

  /**
   * Compares two constants of the same type.
   *
   * <p>Returns a negative number, zero or a positive number, as for
   * {@link Comparable#compareTo}; or null if the values are not comparable,
   * which occurs only if either is a floating-point NaN.
   *
   * <p>Floating-point values compare numerically, so {@code -0.0} equals
   * {@code 0.0}. Signed integers compare by value; everything else compares
   * bit patterns as unsigned numbers, or value trees structurally.
   */
  public static @Nullable Integer compare(Const a, Const b) {
    checkArgument(a.type.equals(b.type), "types differ: %s, %s", a.type,
        b.type);
    final Type type = a.type;
    if (!isFloatOrSignedInteger(type)) {
      if (a instanceof Const.ValConst && b instanceof Const.ValConst) {
        final ScalarInt sa = a.tryToScalar();
        final ScalarInt sb = b.tryToScalar();
        if (sa != null && sb != null) {
          return Integer.signum(sa.bits.compareTo(sb.bits));
        }
      }
      if (a instanceof Const.TyConst && b instanceof Const.TyConst) {
        return Integer.signum(
            ((Const.TyConst) a).valTree.compareTo(((Const.TyConst) b).valTree));
      }
    }

    // Opaque values and value trees of a compound type cannot be compared
    // with each other.
    if (!(type instanceof PrimitiveType)) {
      throw new AssertionError("expected bits of " + type.moniker()
          + ", got " + a + " and " + b);
    }
    final BigInteger aBits = a.evalBits();
    final BigInteger bBits = b.evalBits();
    final PrimitiveType primitiveType = (PrimitiveType) type;
    switch (primitiveType) {
    case F32:
      return compareDoubles(Float.intBitsToFloat(aBits.intValue()),
          Float.intBitsToFloat(bBits.intValue()));
    case F64:
      return compareDoubles(Double.longBitsToDouble(aBits.longValue()),
          Double.longBitsToDouble(bBits.longValue()));
    default:
      if (primitiveType.isSignedInteger()) {
        final int size = primitiveType.size;
        return Integer.signum(
            ScalarInt.ofBits(aBits, size).signExtend()
                .compareTo(ScalarInt.ofBits(bBits, size).signExtend()));
      }
      return Integer.signum(aBits.compareTo(bBits));
    }
  }

  private static boolean isFloatOrSignedInteger(Type type) {
    return type instanceof PrimitiveType
        && (((PrimitiveType) type).isFloat()
            || ((PrimitiveType) type).isSignedInteger());
  }

  /** Compares with IEEE 754 semantics. Unlike {@link Double#compare}, NaN is
   * not comparable and {@code -0.0} equals {@code 0.0}. */
  private static @Nullable Integer compareDoubles(double a, double b) {
    if (Double.isNaN(a) || Double.isNaN(b)) {
      return null;
    }
    return a < b ? -1 : a > b ? 1 : 0;
  }
}

// End ConstComparators.java
