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

import static net.hydromatic.sorrel.ast.AstBuilder.ast;
import static net.hydromatic.sorrel.compile.Fixture.I32;
import static net.hydromatic.sorrel.compile.Fixture.U8;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.sorrel.ast.Ast;
import net.hydromatic.sorrel.ast.Core;
import net.hydromatic.sorrel.ast.RangeEnd;
import net.hydromatic.sorrel.eval.EvalException;
import net.hydromatic.sorrel.eval.ScalarInt;
import net.hydromatic.sorrel.eval.ValTree;
import net.hydromatic.sorrel.type.AdtDef;
import net.hydromatic.sorrel.type.DefId;
import net.hydromatic.sorrel.type.DefKind;
import net.hydromatic.sorrel.type.PrimitiveType;
import net.hydromatic.sorrel.type.Type;
import net.hydromatic.sorrel.type.UserType;
import net.hydromatic.sorrel.type.Variance;
import org.junit.jupiter.api.Test;

/** Tests for {@link RangeLowerer}, via {@link PatternLowerer}. */
public class RangeLowererTest {
  private static final Type I8 = PrimitiveType.I8;

  /** Creates an integer literal with a suffix, such as "{@code 130i8}",
   * negated if the value is negative. */
  private static Ast.Exp suffixed(Fixture f, long value, String suffix) {
    final Ast.Literal literal =
        ast.intLiteral(f.pos(), BigInteger.valueOf(Math.abs(value)), suffix);
    return value < 0 ? ast.negate(literal.pos, literal) : literal;
  }

  private static Ast.Exp constPath(Fixture f, String name, DefId def) {
    final Ast.QPath path = f.path(name, def);
    return ast.pathExp(path.pos, path);
  }

  private static ValTree i32(long value) {
    return ValTree.leaf(ScalarInt.of(value, 4));
  }

  @Test
  void testInclusive() {
    final Fixture f = new Fixture();
    final Ast.RangePat pat =
        f.range(f.intExp(0), f.intExp(5), RangeEnd.INCLUDED, U8);
    final Core.Pat p = f.lower(pat);
    assertThat(p, instanceOf(Core.RangePat.class));
    assertThat(p, hasToString("0..=5"));
    assertThat(p.type, is(U8));
    assertThat(p.pos, is(pat.pos));
    final Core.RangePat range = (Core.RangePat) p;
    assertThat(range.lo.type, is(U8));
    assertThat(range.hi.evalBits(), is(BigInteger.valueOf(5)));
    assertThat(range.end, is(RangeEnd.INCLUDED));
  }

  @Test
  void testExclusive() {
    final Fixture f = new Fixture();
    final Core.Pat p =
        f.lower(f.range(f.intExp(-10), f.intExp(10), RangeEnd.EXCLUDED, I8));
    assertThat(p, hasToString("-10..10"));
    assertThat(((Core.RangePat) p).end, is(RangeEnd.EXCLUDED));
  }

  /** An inclusive range whose bounds are equal is a constant. */
  @Test
  void testSingleton() {
    final Fixture f = new Fixture();
    final Core.Pat p =
        f.lower(f.range(f.intExp(5), f.intExp(5), RangeEnd.INCLUDED, U8));
    assertThat(p, instanceOf(Core.ConstantPat.class));
    assertThat(p, hasToString("5"));
    assertThat(f.diagnostics.isEmpty(), is(true));
  }

  /** Every pair of {@code i8} and of {@code u8} bounds: an inclusive range
   * is a range if lo &lt; hi, a constant if lo = hi, and an error if
   * lo &gt; hi. */
  @Test
  void testInclusiveSweep() {
    checkInclusiveSweep(I8, -128, 127);
    checkInclusiveSweep(U8, 0, 255);
  }

  private static void checkInclusiveSweep(Type type, int min, int max) {
    for (int lo = min; lo <= max; lo++) {
      final Fixture f = new Fixture();
      final List<Ast.RangePat> pats = new ArrayList<>();
      for (int hi = min; hi <= max; hi++) {
        pats.add(f.range(f.intExp(lo), f.intExp(hi), RangeEnd.INCLUDED, type));
      }
      final List<Core.Pat> results =
          PatternLowerer.lowerAll(f.context(), pats);
      for (int hi = min; hi <= max; hi++) {
        final Core.Pat p = results.get(hi - min);
        final String context = type + " " + lo + "..=" + hi;
        if (lo < hi) {
          assertThat(context, p, instanceOf(Core.RangePat.class));
          assertThat(context, p, hasToString(lo + "..=" + hi));
        } else if (lo == hi) {
          assertThat(context, p, instanceOf(Core.ConstantPat.class));
          assertThat(context, p, hasToString(Integer.toString(lo)));
        } else {
          assertThat(context, p, instanceOf(Core.ErrorPat.class));
          assertThat(context, ((Core.ErrorPat) p).error.kind,
              is(ErrorKind.RANGE_INCLUSIVE_EMPTY));
        }
      }
      assertThat(f.diagnostics.errors(), hasSize(lo - min));
    }
  }

  @Test
  void testEmptyExclusive() {
    final Fixture f = new Fixture();
    final Ast.RangePat pat =
        f.range(f.intExp(5), f.intExp(5), RangeEnd.EXCLUDED, U8);
    final Core.Pat p = f.lower(pat);
    assertThat(p, instanceOf(Core.ErrorPat.class));
    final CompileException e = ((Core.ErrorPat) p).error;
    assertThat(e.kind, is(ErrorKind.RANGE_EXCLUSIVE_EMPTY));
    assertThat(e.kind.code, is("E0579"));
    assertThat(e.getMessage(), is("lower range bound must be less than upper"));
    assertThat(e.pos(), is(pat.pos));
    assertThat(f.diagnostics.errors(), contains(e));
  }

  @Test
  void testEmptyInclusive() {
    final Fixture f = new Fixture();
    final Core.Pat p =
        f.lower(f.range(f.intExp(7), f.intExp(3), RangeEnd.INCLUDED, U8));
    final CompileException e = ((Core.ErrorPat) p).error;
    assertThat(e.kind, is(ErrorKind.RANGE_INCLUSIVE_EMPTY));
    assertThat(e.kind.code, is("E0030"));
    assertThat(e.getMessage(),
        is("lower range bound must be less than or equal to upper"));
    assertThat(e.notes, empty());

    // In teaching mode, the error has an explanation.
    final Fixture f2 = new Fixture().withProp(Prop.TEACH, true);
    final Core.Pat p2 =
        f2.lower(f2.range(f2.intExp(7), f2.intExp(3), RangeEnd.INCLUDED, U8));
    final CompileException e2 = ((Core.ErrorPat) p2).error;
    assertThat(e2.kind, is(ErrorKind.RANGE_INCLUSIVE_EMPTY));
    assertThat(e2.notes, hasSize(1));
  }

  /** "{@code -130i8..2i8}": the lower bound overflows {@code i8}, and wraps
   * around to 126, which makes the range look empty. The overflow is the
   * error reported. */
  @Test
  void testLiteralOverflow() {
    final Fixture f = new Fixture();
    final Ast.Exp lo = suffixed(f, -130, "i8");
    final Ast.Exp hi = suffixed(f, 2, "i8");
    final Core.Pat p = f.lower(f.range(lo, hi, RangeEnd.EXCLUDED, I8));
    assertThat(p, instanceOf(Core.ErrorPat.class));
    final CompileException e = ((Core.ErrorPat) p).error;
    assertThat(e.kind, is(ErrorKind.LITERAL_OVERFLOW));
    assertThat(e.kind.family, is(ErrorKind.Family.MALFORMED_RANGE));
    assertThat(e.getMessage(), is("literal out of range for `i8`"));
    assertThat(e.notes,
        contains("the literal `-130i8` does not fit into the type `i8` "
            + "whose range is `-128..=127`"));
    assertThat(e.pos(), is(lo.pos));
    assertThat(f.diagnostics.errors(), hasSize(1));
  }

  /** "{@code -128i8}" is the minimum of {@code i8}, not an overflow. */
  @Test
  void testMinimumIsNotOverflow() {
    final Fixture f = new Fixture();
    final Core.Pat p =
        f.lower(
            f.range(suffixed(f, -128, "i8"), suffixed(f, -128, "i8"),
                RangeEnd.EXCLUDED, I8));
    final CompileException e = ((Core.ErrorPat) p).error;
    assertThat(e.kind, is(ErrorKind.RANGE_EXCLUSIVE_EMPTY));
  }

  @Test
  void testUpperBoundOverflow() {
    final Fixture f = new Fixture();
    final Ast.Exp hi = suffixed(f, 256, "u8");
    final Core.Pat p =
        f.lower(f.range(f.intExp(10), hi, RangeEnd.INCLUDED, U8));
    final CompileException e = ((Core.ErrorPat) p).error;
    assertThat(e.kind, is(ErrorKind.LITERAL_OVERFLOW));
    assertThat(e.getMessage(), is("literal out of range for `u8`"));
    assertThat(e.pos(), is(hi.pos));
  }

  /** A missing bound is the minimum or maximum of the type. */
  @Test
  void testHalfOpen() {
    final Fixture f = new Fixture();
    final Core.Pat p =
        f.lower(f.range(null, f.intExp(5), RangeEnd.INCLUDED, I8));
    assertThat(p, hasToString("-128..=5"));

    final Fixture f2 = new Fixture();
    final Core.Pat p2 =
        f2.lower(f2.range(f2.intExp(250), null, RangeEnd.EXCLUDED, U8));
    assertThat(p2, hasToString("250..255"));
    assertThat(((Core.RangePat) p2).end, is(RangeEnd.EXCLUDED));

    final Fixture f3 = new Fixture();
    final Ast.Exp a = ast.charLiteral(f3.pos(), 'a');
    final Core.Pat p3 =
        f3.lower(f3.range(a, null, RangeEnd.EXCLUDED, PrimitiveType.CHAR));
    assertThat(((Core.RangePat) p3).hi.evalBits(),
        is(BigInteger.valueOf(0x10FFFF)));
  }

  @Test
  void testHalfOpenNonNumeric() {
    final Fixture f = new Fixture();
    final Ast.Exp t = ast.boolLiteral(f.pos(), true);
    final Ast.RangePat pat =
        f.range(t, null, RangeEnd.EXCLUDED, PrimitiveType.BOOL);
    assertThrows(AssertionError.class, () -> f.lower(pat));
  }

  @Test
  void testTwiceOpen() {
    final Fixture f = new Fixture();
    final Ast.RangePat pat = f.range(null, null, RangeEnd.EXCLUDED, I32);
    final Core.Pat p = f.lower(pat);
    assertThat(p, instanceOf(Core.ErrorPat.class));
    assertThat(((Core.ErrorPat) p).error.kind, is(ErrorKind.DELAYED_BUG));
    assertThat(f.diagnostics.errors(), empty());
    assertThat(f.diagnostics.delayedBugs(), hasSize(1));

    final Fixture f2 =
        new Fixture().withProp(Prop.DELAYED_BUGS_FATAL, true);
    final Ast.RangePat pat2 = f2.range(null, null, RangeEnd.EXCLUDED, I32);
    final AssertionError e =
        assertThrows(AssertionError.class, () -> f2.lower(pat2));
    assertThat(e.getMessage(),
        is("found twice-open range pattern (`..`) outside of error "
            + "recovery"));
  }

  @Test
  void testChar() {
    final Fixture f = new Fixture();
    final Ast.Exp a = ast.charLiteral(f.pos(), 'a');
    final Ast.Exp z = ast.charLiteral(f.pos(), 'z');
    final Core.Pat p =
        f.lower(f.range(a, z, RangeEnd.INCLUDED, PrimitiveType.CHAR));
    assertThat(p, hasToString("'a'..='z'"));
  }

  @Test
  void testFloat() {
    final Fixture f = new Fixture();
    final Ast.Exp lo = ast.floatLiteral(f.pos(), "1.5", null);
    final Ast.Exp hi = ast.floatLiteral(f.pos(), "2.5", null);
    final Core.Pat p =
        f.lower(f.range(lo, hi, RangeEnd.INCLUDED, PrimitiveType.F64));
    assertThat(p, hasToString("1.5..=2.5"));

    // Negative zero equals zero, so the range is a constant.
    final Fixture f2 = new Fixture();
    final Ast.Exp negZero = ast.negate(f2.pos(),
        ast.floatLiteral(f2.pos(), "0.0", null));
    final Ast.Exp zero = ast.floatLiteral(f2.pos(), "0.0", null);
    final Core.Pat p2 =
        f2.lower(f2.range(negZero, zero, RangeEnd.INCLUDED,
            PrimitiveType.F32));
    assertThat(p2, instanceOf(Core.ConstantPat.class));

    final Fixture f3 = new Fixture();
    final Ast.Exp one = ast.floatLiteral(f3.pos(), "1.0", null);
    final Core.Pat p3 =
        f3.lower(f3.range(null, one, RangeEnd.INCLUDED, PrimitiveType.F64));
    assertThat(p3, hasToString("-Infinity..=1.0"));
  }

  @Test
  void testConstantBound() {
    final Fixture f = new Fixture();
    final DefId limit = f.def(DefKind.CONST, "LIMIT");
    f.evaluator.valTree(limit, i32(10));
    final Core.Pat p =
        f.lower(
            f.range(f.intExp(0), constPath(f, "LIMIT", limit),
                RangeEnd.EXCLUDED, I32));
    assertThat(p, hasToString("0..10"));
    assertThat(f.evaluator.evaluated, hasSize(1));
    assertThat(f.evaluator.evaluated.get(0).def, is(limit));
  }

  /** If a bound cannot be evaluated, the range is an error, and no further
   * error is reported. */
  @Test
  void testBoundTooGeneric() {
    final Fixture f = new Fixture();
    final DefId n = f.def(DefKind.CONST, "N");
    f.evaluator.failure(n, EvalException.Kind.TOO_GENERIC);
    final Ast.RangePat pat =
        f.range(constPath(f, "N", n), f.intExp(10), RangeEnd.EXCLUDED, I32);
    final Core.Pat p = f.lower(pat);
    assertThat(p, instanceOf(Core.ErrorPat.class));
    assertThat(p.pos, is(pat.pos));
    final List<CompileException> errors = f.diagnostics.errors();
    assertThat(errors, hasSize(1));
    assertThat(errors.get(0).kind, is(ErrorKind.CONST_EVAL_TOO_GENERIC));
    assertThat(((Core.ErrorPat) p).error, sameInstance(errors.get(0)));
  }

  /** A bound that is a unit struct, not a constant, should have been
   * rejected by type checking. */
  @Test
  void testBadBound() {
    final Fixture f = new Fixture();
    final AdtDef unit = f.typeSystem.adt(AdtDef.Kind.STRUCT, "Unit")
        .unitVariant("Unit")
        .build();
    final Ast.Exp exp = constPath(f, "Unit", unit.def);
    f.typeck.nodeType(exp, f.typeSystem.adtType(unit));
    final Core.Pat p =
        f.lower(f.range(exp, f.intExp(3), RangeEnd.EXCLUDED, I32));
    final CompileException e = ((Core.ErrorPat) p).error;
    assertThat(e.kind, is(ErrorKind.DELAYED_BUG));
    assertThat(e.getMessage(),
        is("found bad range pattern endpoint `Unit` outside of error "
            + "recovery"));
    assertThat(e.pos(), is(exp.pos));
  }

  /** In "{@code <Limits>::MIN..=<Limits>::MAX}", both bounds are
   * associated constants with type annotations. The ascription of the
   * upper bound is outermost. */
  @Test
  void testAscribedBounds() {
    final Fixture f = new Fixture();
    final DefId min = f.def(DefKind.ASSOC_CONST, "Limits::MIN");
    final DefId max = f.def(DefKind.ASSOC_CONST, "Limits::MAX");
    f.evaluator.valTree(min, i32(1)).valTree(max, i32(9));
    final Ast.Exp lo = constPath(f, "Limits::MIN", min);
    final Ast.Exp hi = constPath(f, "Limits::MAX", max);
    final UserType loType = UserType.of(I32);
    final UserType hiType = UserType.of(f.typeSystem.refType(I32));
    f.typeck.userProvidedType(lo, loType);
    f.typeck.userProvidedType(hi, hiType);

    final Ast.RangePat pat = f.range(lo, hi, RangeEnd.INCLUDED, I32);
    final Core.Pat p = f.lower(pat);
    assertThat(p, instanceOf(Core.AscribeUserTypePat.class));
    final Core.AscribeUserTypePat outer = (Core.AscribeUserTypePat) p;
    assertThat(outer.ascription.annotation.userType, is(hiType));
    assertThat(outer.ascription.annotation.span, is(hi.pos));
    assertThat(outer.ascription.variance, is(Variance.CONTRAVARIANT));
    assertThat(outer.pos, is(pat.pos));

    final Core.AscribeUserTypePat inner =
        (Core.AscribeUserTypePat) outer.pat;
    assertThat(inner.ascription.annotation.userType, is(loType));
    assertThat(inner.ascription.variance, is(Variance.CONTRAVARIANT));
    assertThat(inner.pat, hasToString("1..=9"));
    assertThat(Patterns.eraseAscriptions(p), hasToString("1..=9"));
  }
}

// End RangeLowererTest.java
