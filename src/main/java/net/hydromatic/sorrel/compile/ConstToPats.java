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

import static net.hydromatic.sorrel.ast.CoreBuilder.core;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.sorrel.ast.Core;
import net.hydromatic.sorrel.ast.Pos;
import net.hydromatic.sorrel.eval.Const;
import net.hydromatic.sorrel.eval.ValTree;
import net.hydromatic.sorrel.type.AdtDef;
import net.hydromatic.sorrel.type.AdtType;
import net.hydromatic.sorrel.type.ArrayType;
import net.hydromatic.sorrel.type.PrimitiveType;
import net.hydromatic.sorrel.type.RefType;
import net.hydromatic.sorrel.type.SliceType;
import net.hydromatic.sorrel.type.TupleType;
import net.hydromatic.sorrel.type.Type;

/** Implementations of {@link ConstToPat}. */
public abstract class ConstToPats {
  private ConstToPats() {}

  /** Decomposer that turns a structured constant into the equivalent
   * structural pattern, so that exhaustiveness checking can see inside it.
   * Scalars, string slices and opaque values become constant patterns. */
  public static final ConstToPat DEFAULT = ConstToPats::toPat;

  private static Core.Pat toPat(PatternContext cx, Const constant,
      Pos span) {
    if (!(constant instanceof Const.TyConst)) {
      return core.constantPat(span, constant);
    }
    final ValTree valTree = ((Const.TyConst) constant).valTree;
    final Type type = constant.type;
    if (type instanceof PrimitiveType) {
      return core.constantPat(span, constant);
    }
    if (type instanceof RefType) {
      final Type referent = ((RefType) type).referent;
      if (referent == PrimitiveType.STR) {
        return core.constantPat(span, constant);
      }
      return core.derefPat(span, type,
          toPat(cx, Const.ty(referent, valTree), span));
    }
    if (type instanceof TupleType) {
      final List<Type> argTypes = ((TupleType) type).argTypes;
      return core.leafPat(span, type,
          fieldPats(cx, argTypes, valTree.unwrapBranch(), 0, span));
    }
    if (type instanceof ArrayType) {
      return core.arrayPat(span, type,
          elements(cx, ((ArrayType) type).elementType, valTree, span), null,
          ImmutableList.of());
    }
    if (type instanceof SliceType) {
      return core.slicePat(span, type,
          elements(cx, ((SliceType) type).elementType, valTree, span), null,
          ImmutableList.of());
    }
    if (type instanceof AdtType) {
      final AdtType adtType = (AdtType) type;
      final AdtDef adtDef = adtType.adtDef;
      final List<ValTree> children = valTree.unwrapBranch();
      if (adtDef.isEnum()) {
        final int variantIndex =
            children.get(0).unwrapLeaf().bits.intValueExact();
        return core.variantPat(span, type, adtDef, adtType.args,
            variantIndex,
            fieldPats(cx, fieldTypes(cx, adtType, variantIndex), children, 1,
                span));
      }
      return core.leafPat(span, type,
          fieldPats(cx, fieldTypes(cx, adtType, 0), children, 0, span));
    }
    throw new AssertionError("cannot convert constant of type " + type
        + " to pattern");
  }

  private static List<Type> fieldTypes(PatternContext cx, AdtType adtType,
      int variantIndex) {
    final int fieldCount =
        adtType.adtDef.variants.get(variantIndex).fields.size();
    final ImmutableList.Builder<Type> types = ImmutableList.builder();
    for (int i = 0; i < fieldCount; i++) {
      types.add(adtType.fieldType(cx.typeSystem, variantIndex, i));
    }
    return types.build();
  }

  /** Converts the children of a branch, starting at {@code offset}, to
   * field patterns. */
  private static List<Core.FieldPat> fieldPats(PatternContext cx,
      List<Type> types, List<ValTree> children, int offset, Pos span) {
    final ImmutableList.Builder<Core.FieldPat> fieldPats =
        ImmutableList.builder();
    for (int i = 0; i < types.size(); i++) {
      fieldPats.add(
          core.fieldPat(i,
              toPat(cx, Const.ty(types.get(i), children.get(i + offset)),
                  span)));
    }
    return fieldPats.build();
  }

  private static List<Core.Pat> elements(PatternContext cx, Type elementType,
      ValTree valTree, Pos span) {
    final ImmutableList.Builder<Core.Pat> pats = ImmutableList.builder();
    for (ValTree child : valTree.unwrapBranch()) {
      pats.add(toPat(cx, Const.ty(elementType, child), span));
    }
    return pats.build();
  }
}

// End ConstToPats.java
