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
package net.hydromatic.sorrel.ast;

import static net.hydromatic.sorrel.ast.AstBuilder.ast;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import net.hydromatic.sorrel.type.DefId;
import net.hydromatic.sorrel.type.DefKind;
import net.hydromatic.sorrel.type.Mutability;
import net.hydromatic.sorrel.type.TypeSystem;
import org.junit.jupiter.api.Test;

/** Tests for {@link Ast} surface patterns, chiefly how they print. */
public class AstTest {
  private static final Pos POS = Pos.ZERO;

  private static Ast.BindingPat id(String name) {
    return ast.bindingPat(POS, name, 0);
  }

  private static Ast.LitPat lit(long value) {
    final Ast.Exp exp = value < 0
        ? ast.negate(POS, ast.intLiteral(POS, -value))
        : ast.intLiteral(POS, value);
    return ast.litPat(POS, exp);
  }

  @Test
  void testPrefixes() {
    final Ast.Pat refRef =
        ast.refPat(POS, Mutability.NOT, ast.refPat(POS, Mutability.NOT,
            id("x")));
    assertThat(refRef, hasToString("&&x"));
    assertThat(ast.refPat(POS, Mutability.MUT, id("x")),
        hasToString("&mut x"));
    assertThat(ast.boxPat(POS, ast.boxPat(POS, id("x"))),
        hasToString("box box x"));
    final Ast.Pat or =
        ast.orPat(POS, ImmutableList.of(lit(1), lit(2)));
    assertThat(ast.refPat(POS, Mutability.NOT, or), hasToString("&(1 | 2)"));
  }

  @Test
  void testBindings() {
    assertThat(id("x"), hasToString("x"));
    final Ast.BindingPat refMut =
        ast.bindingPat(POS, true, Mutability.MUT, ast.id(POS, "x"), 1, 1,
            ast.wildcardPat(POS));
    assertThat(refMut, hasToString("ref mut x @ _"));
    final Ast.BindingPat withOr =
        ast.bindingPat(POS, false, Mutability.NOT, ast.id(POS, "y"), 2, 2,
            ast.orPat(POS, ImmutableList.of(lit(1), lit(2))));
    assertThat(withOr, hasToString("y @ (1 | 2)"));
    // A binding that refers to the variable of an earlier alternative.
    final Ast.BindingPat secondary =
        ast.bindingPat(POS, false, Mutability.NOT, ast.id(POS, "y"), 2, 3,
            null);
    assertThat(secondary.isPrimary(), is(false));
    assertThat(withOr.isPrimary(), is(true));
  }

  @Test
  void testTuples() {
    final ImmutableList<Ast.Pat> az = ImmutableList.of(id("a"), id("z"));
    assertThat(ast.tuplePat(POS, az, 1), hasToString("(a, .., z)"));
    assertThat(ast.tuplePat(POS, az, 0), hasToString("(.., a, z)"));
    assertThat(ast.tuplePat(POS, az, 2), hasToString("(a, z, ..)"));
    assertThat(ast.tuplePat(POS, az), hasToString("(a, z)"));
    assertThat(ast.tuplePat(POS, ImmutableList.of(id("a"))),
        hasToString("(a,)"));
    assertThat(ast.tuplePat(POS, ImmutableList.of(), 0),
        hasToString("(..)"));
    assertThrows(IllegalArgumentException.class,
        () -> ast.tuplePat(POS, az, 3));

    final Ast.QPath some = ast.path(POS, "Option::Some");
    assertThat(some.segments, is(ImmutableList.of("Option", "Some")));
    assertThat(ast.tupleStructPat(POS, some, ImmutableList.of(id("x"))),
        hasToString("Option::Some(x)"));
  }

  @Test
  void testStruct() {
    final Ast.QPath point = ast.path(POS, "Point");
    final Ast.StructPat pat =
        ast.structPat(POS, point,
            ImmutableList.of(ast.fieldPat(POS, "x", lit(0)),
                ast.fieldPat(POS, "y", id("y"))),
            true);
    assertThat(pat, hasToString("Point { x: 0, y, .. }"));
    assertThat(ast.structPat(POS, point, ImmutableList.of(), true),
        hasToString("Point { .. }"));
  }

  @Test
  void testRangesAndLiterals() {
    assertThat(
        ast.rangePat(POS, lit(-5).exp, lit(5).exp, RangeEnd.INCLUDED),
        hasToString("-5..=5"));
    assertThat(ast.rangePat(POS, null, lit(5).exp, RangeEnd.EXCLUDED),
        hasToString("..5"));
    final Ast.Exp suffixed =
        ast.intLiteral(POS, BigInteger.valueOf(300), "u8");
    assertThat(ast.rangePat(POS, suffixed, null, RangeEnd.EXCLUDED),
        hasToString("300u8.."));
    assertThat(ast.charLiteral(POS, 'q'), hasToString("'q'"));
    assertThat(ast.byteLiteral(POS, 'q'), hasToString("b'q'"));
    assertThat(ast.stringLiteral(POS, "hi"), hasToString("\"hi\""));
    assertThat(ast.byteStringLiteral(POS, "hi"), hasToString("b\"hi\""));
    assertThat(ast.floatLiteral(POS, "2.5", "f32"), hasToString("2.5f32"));

    final DefId def =
        new TypeSystem().def(DefKind.INLINE_CONST, "f::{constant#0}");
    assertThat(ast.constBlock(POS, def, lit(-1).exp),
        hasToString("const { -1 }"));
    assertThrows(IllegalArgumentException.class,
        () -> ast.intLiteral(POS, -1));
  }

  @Test
  void testSlices() {
    final Ast.Pat pat =
        ast.slicePat(POS, ImmutableList.of(id("a")), id("rest"),
            ImmutableList.of(id("z")));
    assertThat(pat, hasToString("[a, rest @ .., z]"));
    assertThat(
        ast.slicePat(POS, ImmutableList.of(), ast.wildcardPat(POS),
            ImmutableList.of()),
        hasToString("[..]"));
    assertThat(
        ast.slicePat(POS, ImmutableList.of(id("a"), id("b")), null,
            ImmutableList.of()),
        hasToString("[a, b]"));
    assertThrows(IllegalArgumentException.class,
        () -> ast.slicePat(POS, ImmutableList.of(), null,
            ImmutableList.of(id("z"))));
  }
}

// End AstTest.java
