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

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import net.hydromatic.sorrel.type.AdtDef;
import net.hydromatic.sorrel.type.AdtType;
import net.hydromatic.sorrel.type.ArrayType;
import net.hydromatic.sorrel.type.ParamType;
import net.hydromatic.sorrel.type.PrimitiveType;
import net.hydromatic.sorrel.type.RefType;
import net.hydromatic.sorrel.type.SliceType;
import net.hydromatic.sorrel.type.TupleType;
import net.hydromatic.sorrel.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Value of a constant, together with its type.
 *
 * <p>There are two representations. A {@link TyConst} holds a structured
 * {@link ValTree}, and is what literals and most named constants produce. A
 * {@link ValConst} holds an opaque {@link ConstValue}, for constants whose
 * type has no structured representation (such as raw pointers or unions).
 */
public abstract class Const {
  public final Type type;

  Const(Type type) {
    this.type = requireNonNull(type);
  }

  /** Creates a constant with a structured value. */
  public static TyConst ty(Type type, ValTree valTree) {
    return new TyConst(type, valTree);
  }

  /** Creates a constant with an opaque value. */
  public static ValConst val(Type type, ConstValue value) {
    return new ValConst(type, value);
  }

  /** Creates a scalar constant from its bit pattern. */
  public static TyConst fromBits(PrimitiveType type, BigInteger bits) {
    return ty(type, ValTree.leaf(ScalarInt.ofBits(bits, type.size)));
  }

  /** Returns the scalar, or null if this constant is not a scalar. */
  public abstract @Nullable ScalarInt tryToScalar();

  /** Returns the bits of a scalar constant.
   *
   * @throws AssertionError if the constant is not a scalar of the size of
   * its type */
  public BigInteger evalBits() {
    final ScalarInt scalar = tryToScalar();
    if (scalar == null
        || !(type instanceof PrimitiveType)
        || scalar.size != ((PrimitiveType) type).size) {
      throw new AssertionError("expected bits of " + type.moniker()
          + ", got " + this);
    }
    return scalar.bits;
  }

  /** Constant whose value is a {@link ValTree}. */
  public static class TyConst extends Const {
    public final ValTree valTree;

    TyConst(Type type, ValTree valTree) {
      super(type);
      this.valTree = requireNonNull(valTree);
    }

    @Override
    public @Nullable ScalarInt tryToScalar() {
      return valTree instanceof ValTree.Leaf
          ? ((ValTree.Leaf) valTree).scalar
          : null;
    }

    @Override
    public int hashCode() {
      return Objects.hash(type, valTree);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof TyConst
          && type.equals(((TyConst) o).type)
          && valTree.equals(((TyConst) o).valTree);
    }

    @Override
    public String toString() {
      return describe(new StringBuilder(), type, valTree).toString();
    }
  }

  /** Constant whose value is an opaque {@link ConstValue}. */
  public static class ValConst extends Const {
    public final ConstValue value;

    ValConst(Type type, ConstValue value) {
      super(type);
      this.value = requireNonNull(value);
    }

    @Override
    public @Nullable ScalarInt tryToScalar() {
      return value.tryToScalar();
    }

    @Override
    public int hashCode() {
      return Objects.hash(type, value);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof ValConst
          && type.equals(((ValConst) o).type)
          && value.equals(((ValConst) o).value);
    }

    @Override
    public String toString() {
      final ScalarInt scalar = value.tryToScalar();
      if (scalar != null && type instanceof PrimitiveType) {
        return describe(new StringBuilder(), type, ValTree.leaf(scalar))
            .toString();
      }
      return value.toString();
    }
  }

  /** Writes a value in the syntax of the source language, e.g.
   * "{@code -1}", "{@code 'a'}", "{@code "abc"}", "{@code (1, true)}". */
  static StringBuilder describe(StringBuilder buf, Type type, ValTree v) {
    if (type instanceof PrimitiveType) {
      return describeScalar(buf, (PrimitiveType) type, v.unwrapLeaf());
    }
    if (type instanceof RefType) {
      final Type referent = ((RefType) type).referent;
      if (referent == PrimitiveType.STR) {
        return buf.append('"').append(utf8(v)).append('"');
      }
      return describe(buf.append('&'), referent, v);
    }
    if (type instanceof TupleType) {
      final List<Type> argTypes = ((TupleType) type).argTypes;
      final List<ValTree> children = v.unwrapBranch();
      buf.append('(');
      for (int i = 0; i < children.size(); i++) {
        describe(buf.append(i == 0 ? "" : ", "), argTypes.get(i),
            children.get(i));
      }
      return buf.append(children.size() == 1 ? ",)" : ")");
    }
    if (type instanceof ArrayType || type instanceof SliceType) {
      final Type elementType = type instanceof ArrayType
          ? ((ArrayType) type).elementType
          : ((SliceType) type).elementType;
      final List<ValTree> children = v.unwrapBranch();
      buf.append('[');
      for (int i = 0; i < children.size(); i++) {
        describe(buf.append(i == 0 ? "" : ", "), elementType,
            children.get(i));
      }
      return buf.append(']');
    }
    if (type instanceof AdtType) {
      final AdtDef adtDef = ((AdtType) type).adtDef;
      final List<ValTree> children = v.unwrapBranch();
      final int variantIndex = adtDef.isEnum()
          ? children.get(0).unwrapLeaf().bits.intValueExact()
          : 0;
      final AdtDef.VariantDef variant = adtDef.variants.get(variantIndex);
      final int offset = adtDef.isEnum() ? 1 : 0;
      buf.append(variant.name());
      if (variant.ctorKind == AdtDef.CtorKind.CONST) {
        return buf;
      }
      final boolean braced = variant.ctorKind == AdtDef.CtorKind.NONE;
      buf.append(braced ? " { " : "(");
      for (int i = 0; i < variant.fields.size(); i++) {
        buf.append(i == 0 ? "" : ", ");
        if (braced) {
          buf.append(variant.fields.get(i).name).append(": ");
        }
        Type fieldType = variant.fields.get(i).type;
        if (fieldType instanceof ParamType) {
          fieldType =
              ((AdtType) type).args.get(((ParamType) fieldType).ordinal);
        }
        describe(buf, fieldType, children.get(i + offset));
      }
      return buf.append(braced ? " }" : ")");
    }
    return buf.append(v);
  }

  private static StringBuilder describeScalar(StringBuilder buf,
      PrimitiveType type, ScalarInt scalar) {
    switch (type) {
    case BOOL:
      return buf.append(scalar.bits.signum() != 0);
    case CHAR:
      return buf.append('\'')
          .appendCodePoint(scalar.bits.intValueExact())
          .append('\'');
    case F32:
      return buf.append(Float.intBitsToFloat(scalar.bits.intValue()));
    case F64:
      return buf.append(Double.longBitsToDouble(scalar.bits.longValue()));
    default:
      return buf.append(type.signed ? scalar.signExtend() : scalar.bits);
    }
  }

  private static String utf8(ValTree v) {
    final List<ValTree> children = v.unwrapBranch();
    final byte[] bytes = new byte[children.size()];
    for (int i = 0; i < bytes.length; i++) {
      bytes[i] = children.get(i).unwrapLeaf().bits.byteValue();
    }
    return new String(bytes, StandardCharsets.UTF_8);
  }
}

// End Const.java
