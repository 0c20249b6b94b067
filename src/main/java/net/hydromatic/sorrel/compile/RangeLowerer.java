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
package net.hydromatic.sorrel.compile;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.sorrel.ast.CoreBuilder.core;

import java.math.BigInteger;
import net.hydromatic.sorrel.ast.Ast;
import net.hydromatic.sorrel.ast.Core;
import net.hydromatic.sorrel.ast.Pos;
import net.hydromatic.sorrel.ast.RangeEnd;
import net.hydromatic.sorrel.eval.Const;
import net.hydromatic.sorrel.eval.ConstComparators;
import net.hydromatic.sorrel.type.PrimitiveType;
import net.hydromatic.sorrel.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Lowers range patterns such as {@code 0..=9}, {@code 'a'..} and
 * {@code ..MAX}.
 *
 * <p>The result is a {@link Core.RangePat}; or a {@link Core.ConstantPat}
 * if an inclusive range has equal bounds; or a {@link Core.ErrorPat} if the
 * range is empty. If a bound is an associated constant with a type
 * annotation, the result is wrapped in an ascription. */
class RangeLowerer {
  private final PatternContext cx;
  private final ConstantLowerer constantLowerer;

  RangeLowerer(PatternContext cx, ConstantLowerer constantLowerer) {
    this.cx = requireNonNull(cx);
    this.constantLowerer = requireNonNull(constantLowerer);
  }

  Core.Pat lower(Ast.@Nullable Exp loExp, Ast.@Nullable Exp hiExp,
      RangeEnd end, Type type, Pos span) {
    if (loExp == null && hiExp == null) {
      return core.errorPat(span, type,
          cx.delayBug(span, "found twice-open range pattern (`..`) "
              + "outside of error recovery"));
    }

    final Bound lo = lowerBound(loExp, type);
    if (lo.error != null) {
      return core.errorPat(span, type, lo.error);
    }
    final Bound hi = lowerBound(hiExp, type);
    if (hi.error != null) {
      return core.errorPat(span, type, hi.error);
    }

    final Const loValue =
        lo.value != null ? lo.value : extremum(type, false, span);
    final Const hiValue =
        hi.value != null ? hi.value : extremum(type, true, span);

    final Integer c = ConstComparators.compare(loValue, hiValue);
    Core.Pat pat;
    if (c != null && c < 0) {
      // "x..y" or "x..=y" where x < y; non-empty because it contains x.
      pat = core.rangePat(span, type, loValue, hiValue, end);
    } else if (c != null && c == 0 && end == RangeEnd.INCLUDED) {
      pat = core.constantPat(span, type, loValue);
    } else {
      // Empty range. If a bound overflowed, say so; otherwise the bounds
      // are in the wrong order.
      CompileException e = checkLiteralOverflow(loExp, type);
      if (e == null) {
        e = checkLiteralOverflow(hiExp, type);
      }
      if (e == null) {
        e = emptyRange(end, span);
      }
      return core.errorPat(span, type, e);
    }

    // Put the ascriptions of associated constants (as in
    // "Foo::A..=Foo::B") on the range.
    if (lo.ascription != null) {
      pat = core.ascribeUserTypePat(span, type, pat, lo.ascription);
    }
    if (hi.ascription != null) {
      pat = core.ascribeUserTypePat(span, type, pat, hi.ascription);
    }
    return pat;
  }

  /** Lowers one bound of a range. */
  private Bound lowerBound(Ast.@Nullable Exp exp, Type type) {
    if (exp == null) {
      return new Bound(null, null, null);
    }
    Core.Pat pat = constantLowerer.lowerLit(exp, type);
    Core.Ascription ascription = null;
    if (pat instanceof Core.AscribeUserTypePat) {
      ascription = ((Core.AscribeUserTypePat) pat).ascription;
      pat = ((Core.AscribeUserTypePat) pat).pat;
    }
    switch (pat.op) {
    case CONSTANT_PAT:
      return new Bound(((Core.ConstantPat) pat).value, ascription, null);
    case ERROR_PAT:
      return new Bound(null, null, ((Core.ErrorPat) pat).error);
    default:
      return new Bound(null, null,
          cx.delayBug(exp.pos, "found bad range pattern endpoint `" + exp
              + "` outside of error recovery"));
    }
  }

  /** Returns the smallest or largest value of a numeric type. */
  private static Const extremum(Type type, boolean max, Pos span) {
    if (!(type instanceof PrimitiveType)
        || !((PrimitiveType) type).isNumeric()) {
      throw new AssertionError("range pattern of non-numeric type " + type
          + " at " + span);
    }
    final PrimitiveType primitiveType = (PrimitiveType) type;
    return Const.fromBits(primitiveType,
        max ? primitiveType.maxBits() : primitiveType.minBits());
  }

  /** Reports an error if a bound is an integer literal outside the range of
   * its type. We must inspect the literal, because evaluation has already
   * wrapped an overflowing value around. */
  private @Nullable CompileException checkLiteralOverflow(
      Ast.@Nullable Exp exp, Type type) {
    if (exp == null) {
      return null;
    }
    Ast.Exp operand = exp;
    boolean negated = false;
    if (operand instanceof Ast.Negate) {
      negated = true;
      operand = ((Ast.Negate) operand).exp;
    }
    if (!(operand instanceof Ast.Literal)
        || ((Ast.Literal) operand).kind != Ast.LitKind.INT
        || !(type instanceof PrimitiveType)
        || !((PrimitiveType) type).isInteger()) {
      return null;
    }
    final PrimitiveType primitiveType = (PrimitiveType) type;
    final BigInteger value = (BigInteger) ((Ast.Literal) operand).value;
    final BigInteger min = primitiveType.minValue();
    final BigInteger max = primitiveType.maxValue();
    // A negated literal may be one more than max, e.g. "-128i8".
    final BigInteger limit = negated ? max.add(BigInteger.ONE) : max;
    if (value.compareTo(limit) <= 0) {
      return null;
    }
    return cx.emit(ErrorKind.LITERAL_OVERFLOW, exp.pos,
        "literal out of range for `" + type + "`",
        "the literal `" + exp + "` does not fit into the type `" + type
            + "` whose range is `" + min + "..=" + max + "`");
  }

  private CompileException emptyRange(RangeEnd end, Pos span) {
    switch (end) {
    case INCLUDED:
      if (cx.is(Prop.TEACH)) {
        return cx.emit(ErrorKind.RANGE_INCLUSIVE_EMPTY, span,
            "lower range bound must be less than or equal to upper",
            "When matching against a range, the compiler verifies that the "
                + "range is non-empty. Range patterns include both "
                + "end-points, so this is equivalent to requiring the start "
                + "of the range to be less than or equal to the end of the "
                + "range.");
      }
      return cx.emit(ErrorKind.RANGE_INCLUSIVE_EMPTY, span,
          "lower range bound must be less than or equal to upper");
    case EXCLUDED:
      return cx.emit(ErrorKind.RANGE_EXCLUSIVE_EMPTY, span,
          "lower range bound must be less than upper");
    default:
      throw new AssertionError(end);
    }
  }

  /** A lowered bound of a range: a value, an optional ascription, or an
   * error. A missing bound has no value and no error. */
  private static class Bound {
    final @Nullable Const value;
    final Core.@Nullable Ascription ascription;
    final @Nullable CompileException error;

    Bound(@Nullable Const value, Core.@Nullable Ascription ascription,
        @Nullable CompileException error) {
      this.value = value;
      this.ascription = ascription;
      this.error = error;
    }
  }
}

// End RangeLowerer.java
