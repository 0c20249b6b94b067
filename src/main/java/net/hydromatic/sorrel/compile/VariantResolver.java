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

import java.util.List;
import net.hydromatic.sorrel.ast.AstNode;
import net.hydromatic.sorrel.ast.Core;
import net.hydromatic.sorrel.ast.Pos;
import net.hydromatic.sorrel.type.AdtDef;
import net.hydromatic.sorrel.type.AdtType;
import net.hydromatic.sorrel.type.DefId;
import net.hydromatic.sorrel.type.DefKind;
import net.hydromatic.sorrel.type.ErrorType;
import net.hydromatic.sorrel.type.Type;
import net.hydromatic.sorrel.type.UserType;
import net.hydromatic.sorrel.type.Variance;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Converts the resolution of a path in a pattern, such as
 * "{@code Some}" in "{@code Some(x)}" or "{@code Point}" in
 * "{@code Point { x, y }}", into a variant or leaf pattern. */
class VariantResolver {
  private final PatternContext cx;

  VariantResolver(PatternContext cx) {
    this.cx = requireNonNull(cx);
  }

  /** Creates a pattern for a resolved path and the patterns of its
   * fields. If the user wrote a type annotation on the node, wraps the
   * result in an ascription. */
  Core.Pat resolve(Res res, AstNode node, Pos span, Type type,
      List<Core.FieldPat> subPats) {
    res = normalize(res);
    Core.Pat pat;
    switch (res.kind) {
    case DEF:
      final DefId def = requireNonNull(res.def);
      switch (def.kind) {
      case VARIANT:
        final AdtDef adtDef = cx.typeSystem.adtDef(cx.typeSystem.parent(def));
        if (!adtDef.isEnum()) {
          pat = core.leafPat(span, type, subPats);
          break;
        }
        final List<Type> args;
        if (type instanceof AdtType) {
          args = ((AdtType) type).args;
        } else if (type instanceof ErrorType) {
          return core.errorPat(span, type, ((ErrorType) type).error);
        } else {
          throw new AssertionError("inappropriate type for def: " + type);
        }
        pat = core.variantPat(span, type, adtDef, args,
            adtDef.variantIndexWithId(def), subPats);
        break;

      case STRUCT:
      case CTOR_STRUCT:
      case UNION:
      case TY_ALIAS:
      case ASSOC_TY:
        pat = core.leafPat(span, type, subPats);
        break;

      default:
        pat = core.errorPat(span, type, unresolvable(def.kind, span));
      }
      break;

    case SELF_TY_PARAM:
    case SELF_TY_ALIAS:
    case SELF_CTOR:
      pat = core.leafPat(span, type, subPats);
      break;

    default:
      pat = core.errorPat(span, type, unresolvable(null, span));
    }

    final UserType userType = cx.typeckResults.userProvidedType(node);
    if (userType != null) {
      final Core.UserTypeAnnotation annotation =
          new Core.UserTypeAnnotation(userType, span,
              cx.typeckResults.nodeType(node, type));
      pat = core.ascribeUserTypePat(span, type, pat,
          new Core.Ascription(annotation, Variance.COVARIANT));
    }
    return pat;
  }

  /** Returns the variant of an ADT that a path resolves to. */
  AdtDef.VariantDef variantOfRes(AdtDef adtDef, Res res) {
    switch (res.kind) {
    case DEF:
      final DefId def = requireNonNull(res.def);
      switch (def.kind) {
      case VARIANT:
        return adtDef.variantWithId(def);
      case CTOR_STRUCT:
      case CTOR_VARIANT:
        return adtDef.variantWithCtorId(def);
      case STRUCT:
      case UNION:
      case TY_ALIAS:
      case ASSOC_TY:
        return adtDef.nonEnumVariant();
      default:
        throw new AssertionError("unexpected res: " + res);
      }
    case SELF_TY_PARAM:
    case SELF_TY_ALIAS:
    case SELF_CTOR:
      return adtDef.nonEnumVariant();
    default:
      throw new AssertionError("unexpected res: " + res);
    }
  }

  /** Converts a resolution to a variant's constructor into a resolution to
   * the variant. */
  private Res normalize(Res res) {
    if (res.defKind() == DefKind.CTOR_VARIANT) {
      return Res.def(cx.typeSystem.parent(requireNonNull(res.def)));
    }
    return res;
  }

  private CompileException unresolvable(@Nullable DefKind defKind, Pos span) {
    if (defKind == DefKind.CONST_PARAM) {
      return cx.emit(ErrorKind.CONST_PARAM_IN_PATTERN, span,
          "const parameters cannot be referenced in patterns");
    }
    if (defKind == DefKind.STATIC) {
      return cx.emit(ErrorKind.STATIC_IN_PATTERN, span,
          "statics cannot be referenced in patterns");
    }
    return cx.emit(ErrorKind.NON_CONST_PATH, span,
        "runtime values cannot be referenced in patterns");
  }
}

// End VariantResolver.java
