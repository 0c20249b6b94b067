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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import net.hydromatic.sorrel.type.PrimitiveType;
import net.hydromatic.sorrel.type.Type;
import net.hydromatic.sorrel.type.TypeSystem;
import org.junit.jupiter.api.Test;

/** Tests for {@link ConstComparators}. */
public class ConstComparatorsTest {
  private static Const i8(long value) {
    return Const.ty(PrimitiveType.I8, ValTree.leaf(ScalarInt.of(value, 1)));
  }

  private static Const u8(long value) {
    return Const.ty(PrimitiveType.U8, ValTree.leaf(ScalarInt.of(value, 1)));
  }

  private static Const f32(float value) {
    return Const.fromBits(PrimitiveType.F32,
        BigInteger.valueOf(Float.floatToIntBits(value) & 0xFFFFFFFFL));
  }

  private static Const f64(double value) {
    return Const.fromBits(PrimitiveType.F64,
        new BigInteger(
            Long.toUnsignedString(Double.doubleToLongBits(value))));
  }

  @Test
  void testSigned() {
    assertThat(ConstComparators.compare(i8(-1), i8(1)), is(-1));
    assertThat(ConstComparators.compare(i8(1), i8(-1)), is(1));
    assertThat(ConstComparators.compare(i8(-128), i8(127)), is(-1));
    assertThat(ConstComparators.compare(i8(5), i8(5)), is(0));
  }

  /** Unsigned values compare by bit pattern; 255 is the largest
   * {@code u8}. */
  @Test
  void testUnsigned() {
    assertThat(ConstComparators.compare(u8(255), u8(1)), is(1));
    assertThat(ConstComparators.compare(u8(0), u8(255)), is(-1));
  }

  @Test
  void testFloat() {
    assertThat(ConstComparators.compare(f64(-0.0), f64(0.0)), is(0));
    assertThat(ConstComparators.compare(f32(-0.0f), f32(0.0f)), is(0));
    assertThat(ConstComparators.compare(f64(-1.5), f64(1.0)), is(-1));
    assertThat(ConstComparators.compare(f32(2.5f), f32(-3.0f)), is(1));
    assertThat(
        ConstComparators.compare(f64(Double.NEGATIVE_INFINITY), f64(0)),
        is(-1));
  }

  @Test
  void testNan() {
    assertThat(ConstComparators.compare(f64(Double.NaN), f64(1.0)),
        nullValue());
    assertThat(ConstComparators.compare(f64(1.0), f64(Double.NaN)),
        nullValue());
    assertThat(ConstComparators.compare(f32(Float.NaN), f32(Float.NaN)),
        nullValue());
  }

  @Test
  void testChar() {
    final Const a = Const.fromBits(PrimitiveType.CHAR, BigInteger.valueOf('a'));
    final Const z = Const.fromBits(PrimitiveType.CHAR, BigInteger.valueOf('z'));
    assertThat(ConstComparators.compare(a, z), is(-1));
    assertThat(ConstComparators.compare(z, a), is(1));
  }

  @Test
  void testValueTrees() {
    final Type type =
        new TypeSystem().tupleType(PrimitiveType.U8, PrimitiveType.U8);
    final Const a =
        Const.ty(type,
            ValTree.branch(
                ImmutableList.of(ValTree.leaf(ScalarInt.of(1, 1)),
                    ValTree.leaf(ScalarInt.of(9, 1)))));
    final Const b =
        Const.ty(type,
            ValTree.branch(
                ImmutableList.of(ValTree.leaf(ScalarInt.of(2, 1)),
                    ValTree.leaf(ScalarInt.of(0, 1)))));
    assertThat(ConstComparators.compare(a, b), is(-1));
    assertThat(ConstComparators.compare(b, a), is(1));
    assertThat(ConstComparators.compare(a, a), is(0));
  }

  /** A structured and an opaque scalar of the same type compare by
   * value. */
  @Test
  void testMixed() {
    final Const opaque =
        Const.val(PrimitiveType.U8, ConstValue.scalar(ScalarInt.of(7, 1)));
    assertThat(ConstComparators.compare(opaque, u8(7)), is(0));
    assertThat(ConstComparators.compare(u8(3), opaque), is(-1));
    final Const opaque2 =
        Const.val(PrimitiveType.U8, ConstValue.scalar(ScalarInt.of(200, 1)));
    assertThat(ConstComparators.compare(opaque2, opaque), is(1));
  }

  /** An opaque value and a value tree of a compound type are not
   * comparable. */
  @Test
  void testMixedCompound() {
    final Type type =
        new TypeSystem().tupleType(PrimitiveType.U8, PrimitiveType.U8);
    final Const tree =
        Const.ty(type,
            ValTree.branch(
                ImmutableList.of(ValTree.leaf(ScalarInt.of(1, 1)),
                    ValTree.leaf(ScalarInt.of(2, 1)))));
    final Const opaque = Const.val(type, ConstValue.indirect(new byte[2]));
    assertThrows(AssertionError.class,
        () -> ConstComparators.compare(tree, opaque));
    assertThrows(AssertionError.class,
        () -> ConstComparators.compare(opaque, tree));
  }

  /** Every pair of {@code i8} and of {@code u8} values compares as the
   * integers do, and swapping the arguments negates the result. */
  @Test
  void testIntegerSweep() {
    for (int a = -128; a <= 127; a++) {
      for (int b = -128; b <= 127; b++) {
        final Integer c = ConstComparators.compare(i8(a), i8(b));
        assertThat(c, is(Integer.signum(Integer.compare(a, b))));
        assertThat(ConstComparators.compare(i8(b), i8(a)), is(-c));
      }
    }
    for (int a = 0; a <= 255; a++) {
      for (int b = 0; b <= 255; b++) {
        final Integer c = ConstComparators.compare(u8(a), u8(b));
        assertThat(c, is(Integer.signum(Integer.compare(a, b))));
        assertThat(ConstComparators.compare(u8(b), u8(a)), is(-c));
      }
    }
  }

  /** Floating-point values, including signed zeros and infinities, compare
   * numerically and antisymmetrically. */
  @Test
  void testFloatSweep() {
    final double[] values = {
        Double.NEGATIVE_INFINITY, -Double.MAX_VALUE, -1.5, -1.0,
        -Double.MIN_VALUE, -0.0, 0.0, Double.MIN_VALUE, 0.25, 1.0, 1e300,
        Double.MAX_VALUE, Double.POSITIVE_INFINITY
    };
    for (double a : values) {
      for (double b : values) {
        final int expected = a < b ? -1 : a > b ? 1 : 0;
        final String reason = a + " vs " + b;
        assertThat(reason, ConstComparators.compare(f64(a), f64(b)),
            is(expected));
        assertThat(reason, ConstComparators.compare(f64(b), f64(a)),
            is(-expected));

        final float fa = (float) a;
        final float fb = (float) b;
        final int expected32 = fa < fb ? -1 : fa > fb ? 1 : 0;
        assertThat(reason, ConstComparators.compare(f32(fa), f32(fb)),
            is(expected32));
        assertThat(reason, ConstComparators.compare(f32(fb), f32(fa)),
            is(-expected32));
      }
    }
  }

  @Test
  void testDifferentTypes() {
    assertThrows(IllegalArgumentException.class,
        () -> ConstComparators.compare(i8(1), u8(1)));
  }
}

// End ConstComparatorsTest.java
