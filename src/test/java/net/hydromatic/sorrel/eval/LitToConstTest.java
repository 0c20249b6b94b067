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

import static net.hydromatic.sorrel.ast.AstBuilder.ast;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigInteger;
import net.hydromatic.sorrel.ast.Ast;
import net.hydromatic.sorrel.ast.Pos;
import net.hydromatic.sorrel.compile.Diagnostics;
import net.hydromatic.sorrel.compile.ErrorKind;
import net.hydromatic.sorrel.compile.PatternContext;
import net.hydromatic.sorrel.compile.TypeckResults;
import net.hydromatic.sorrel.type.PrimitiveType;
import net.hydromatic.sorrel.type.Type;
import net.hydromatic.sorrel.type.TypeSystem;
import org.junit.jupiter.api.Test;

/** Tests for {@link LitToConst}. */
public class LitToConstTest {
  private static final Pos POS = new Pos("", 1, 1, 1, 4);

  private final TypeSystem typeSystem = new TypeSystem();
  private final Diagnostics diagnostics = new Diagnostics();
  private final PatternContext cx =
      PatternContext.of(typeSystem, TypeckResults.builder().build(),
              new StubEvaluator())
          .withDiagnostics(diagnostics);

  private Const convert(Ast.Literal literal, Type type) {
    return LitToConst.convert(cx, literal, type, false);
  }

  private Const negate(Ast.Literal literal, Type type) {
    return LitToConst.convert(cx, literal, type, true);
  }

  @Test
  void testInteger() {
    final Const c = convert(ast.intLiteral(POS, 200), PrimitiveType.U8);
    assertThat(c.type, is(PrimitiveType.U8));
    assertThat(c.evalBits(), is(BigInteger.valueOf(200)));
    assertThat(c, hasToString("200"));

    // Negation precedes truncation.
    final Const c2 = negate(ast.intLiteral(POS, 1), PrimitiveType.I16);
    assertThat(c2.evalBits(), is(BigInteger.valueOf(0xFFFF)));
    assertThat(c2, hasToString("-1"));

    final Const c3 = negate(ast.intLiteral(POS, 128), PrimitiveType.I8);
    assertThat(c3, hasToString("-128"));
  }

  /** A literal that does not fit wraps around; reporting the overflow is
   * someone else's job. */
  @Test
  void testIntegerWraps() {
    final Const c = convert(ast.intLiteral(POS, 256), PrimitiveType.U8);
    assertThat(c.evalBits(), is(BigInteger.ZERO));
    final Const c2 = negate(ast.intLiteral(POS, 130), PrimitiveType.I8);
    assertThat(c2, hasToString("126"));
  }

  @Test
  void testFloat() {
    final Const c =
        convert(ast.floatLiteral(POS, "2.5", null), PrimitiveType.F64);
    assertThat(c, hasToString("2.5"));
    final Const c2 =
        negate(ast.floatLiteral(POS, "1_000.25", "f32"), PrimitiveType.F32);
    assertThat(c2, hasToString("-1000.25"));
    assertThat(c2.evalBits(),
        is(BigInteger.valueOf(Float.floatToIntBits(-1000.25f) & 0xFFFFFFFFL)));
  }

  @Test
  void testInvalidFloat() {
    final EvalException e =
        assertThrows(EvalException.class,
            () -> convert(ast.floatLiteral(POS, "1e", null),
                PrimitiveType.F32));
    assertThat(e.kind, is(EvalException.Kind.REPORTED));
    assertThat(e.reportedError().kind, is(ErrorKind.INVALID_LITERAL));
    assertThat(diagnostics.errors(), hasSize(1));
  }

  @Test
  void testScalars() {
    assertThat(convert(ast.boolLiteral(POS, true), PrimitiveType.BOOL),
        hasToString("true"));
    assertThat(convert(ast.boolLiteral(POS, false), PrimitiveType.BOOL)
        .evalBits(), is(BigInteger.ZERO));
    assertThat(convert(ast.charLiteral(POS, 'x'), PrimitiveType.CHAR),
        hasToString("'x'"));
    assertThat(convert(ast.byteLiteral(POS, 'A'), PrimitiveType.U8),
        hasToString("65"));
  }

  @Test
  void testStrings() {
    final Type strRef = typeSystem.refType(PrimitiveType.STR);
    final Const c = convert(ast.stringLiteral(POS, "hé"), strRef);
    assertThat(c, hasToString("\"hé\""));
    // UTF-8 encoding of "é" is two bytes.
    assertThat(((Const.TyConst) c).valTree.unwrapBranch(), hasSize(3));

    final Type arrayRef =
        typeSystem.refType(typeSystem.arrayType(PrimitiveType.U8, 3));
    final Const c2 = convert(ast.byteStringLiteral(POS, "abc"), arrayRef);
    assertThat(c2, hasToString("&[97, 98, 99]"));

    final Type sliceRef =
        typeSystem.refType(typeSystem.sliceType(PrimitiveType.U8));
    final Const c3 = convert(ast.byteStringLiteral(POS, "ab"), sliceRef);
    assertThat(c3, hasToString("&[97, 98]"));
  }

  @Test
  void testTypeErrors() {
    assertTypeError(ast.intLiteral(POS, 1), PrimitiveType.BOOL);
    assertTypeError(ast.floatLiteral(POS, "1.0", null), PrimitiveType.I32);
    assertTypeError(ast.boolLiteral(POS, true), PrimitiveType.U8);
    assertTypeError(ast.byteLiteral(POS, 1), PrimitiveType.I8);
    assertTypeError(ast.stringLiteral(POS, "a"), PrimitiveType.STR);
    // The array has the wrong length.
    assertTypeError(ast.byteStringLiteral(POS, "ab"),
        typeSystem.refType(typeSystem.arrayType(PrimitiveType.U8, 3)));
    assertThat(diagnostics.isEmpty(), is(true));
  }

  private void assertTypeError(Ast.Literal literal, Type type) {
    final EvalException e =
        assertThrows(EvalException.class, () -> convert(literal, type));
    assertThat(e.kind, is(EvalException.Kind.TYPE_ERROR));
  }
}

// End LitToConstTest.java
