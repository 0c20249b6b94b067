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

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import net.hydromatic.sorrel.ast.Ast;
import net.hydromatic.sorrel.compile.CompileException;
import net.hydromatic.sorrel.compile.ErrorKind;
import net.hydromatic.sorrel.compile.PatternContext;
import net.hydromatic.sorrel.type.ArrayType;
import net.hydromatic.sorrel.type.PrimitiveType;
import net.hydromatic.sorrel.type.RefType;
import net.hydromatic.sorrel.type.SliceType;
import net.hydromatic.sorrel.type.Type;

/** Converts literals to constants.
 *
 * <p>An integer literal is truncated to the width of its type, after
 * negation if it was preceded by "{@code -}". So {@code -128i8} is the
 * minimum value of {@code i8}, and {@code 256u8} wraps to 0; detecting such
 * overflow is the job of a lint, or of range checking.
 *
 * @see ConstEvaluator#litToConst */
public abstract class LitToConst {
  private LitToConst() {}

  /** Converts a literal to a constant of a given type. */
  public static Const convert(PatternContext cx, Ast.Literal literal,
      Type type, boolean negated) {
    switch (literal.kind) {
    case INT:
      if (type instanceof PrimitiveType
          && ((PrimitiveType) type).isInteger()) {
        final BigInteger value = (BigInteger) literal.value;
        return Const.ty(type,
            ValTree.leaf(
                ScalarInt.of(negated ? value.negate() : value,
                    ((PrimitiveType) type).size)));
      }
      break;

    case FLOAT:
      if (type == PrimitiveType.F32 || type == PrimitiveType.F64) {
        return floatToConst(cx, literal, (PrimitiveType) type, negated);
      }
      break;

    case BOOL:
      if (type == PrimitiveType.BOOL) {
        return Const.fromBits(PrimitiveType.BOOL,
            (Boolean) literal.value ? BigInteger.ONE : BigInteger.ZERO);
      }
      break;

    case CHAR:
      if (type == PrimitiveType.CHAR) {
        return Const.fromBits(PrimitiveType.CHAR,
            BigInteger.valueOf((Integer) literal.value));
      }
      break;

    case BYTE:
      if (type == PrimitiveType.U8) {
        return Const.fromBits(PrimitiveType.U8,
            BigInteger.valueOf((Integer) literal.value));
      }
      break;

    case STR:
      if (type instanceof RefType
          && ((RefType) type).referent == PrimitiveType.STR) {
        return Const.ty(type,
            bytes(((String) literal.value).getBytes(StandardCharsets.UTF_8)));
      }
      break;

    case BYTE_STR:
      final byte[] bytes =
          ((String) literal.value).getBytes(StandardCharsets.ISO_8859_1);
      if (type instanceof RefType && isBytes(((RefType) type).referent,
          bytes.length)) {
        return Const.ty(type, bytes(bytes));
      }
      break;

    default:
      throw new AssertionError("unknown literal kind " + literal.kind);
    }
    throw EvalException.typeError("literal " + literal + " does not have "
        + "type " + type.moniker());
  }

  private static Const floatToConst(PatternContext cx, Ast.Literal literal,
      PrimitiveType type, boolean negated) {
    final String symbol = ((String) literal.value).replace("_", "");
    final BigInteger bits;
    try {
      if (type == PrimitiveType.F32) {
        final float f = Float.parseFloat(symbol);
        bits = BigInteger.valueOf(
            Float.floatToIntBits(negated ? -f : f) & 0xFFFFFFFFL);
      } else {
        final double d = Double.parseDouble(symbol);
        bits = new BigInteger(
            Long.toUnsignedString(Double.doubleToLongBits(negated ? -d : d)));
      }
    } catch (NumberFormatException e) {
      final CompileException error =
          cx.emit(ErrorKind.INVALID_LITERAL, literal.pos,
              "could not parse float literal " + literal);
      throw EvalException.reported(error);
    }
    return Const.fromBits(type, bits);
  }

  /** Whether a type is {@code [u8; n]} or {@code [u8]}. */
  private static boolean isBytes(Type type, int length) {
    return type instanceof ArrayType
        && ((ArrayType) type).elementType == PrimitiveType.U8
        && ((ArrayType) type).length == length
        || type instanceof SliceType
        && ((SliceType) type).elementType == PrimitiveType.U8;
  }

  private static ValTree bytes(byte[] bytes) {
    final ImmutableList.Builder<ValTree> b = ImmutableList.builder();
    for (byte x : bytes) {
      b.add(ValTree.leaf(ScalarInt.of(x & 0xFF, 1)));
    }
    return ValTree.branch(b.build());
  }
}

// End LitToConst.java
