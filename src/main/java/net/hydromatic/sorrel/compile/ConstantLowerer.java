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

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.sorrel.ast.Ast;
import net.hydromatic.sorrel.ast.AstNode;
import net.hydromatic.sorrel.ast.Core;
import net.hydromatic.sorrel.ast.Pos;
import net.hydromatic.sorrel.eval.Const;
import net.hydromatic.sorrel.eval.ConstId;
import net.hydromatic.sorrel.eval.ConstValue;
import net.hydromatic.sorrel.eval.EvalException;
import net.hydromatic.sorrel.eval.ValTree;
import net.hydromatic.sorrel.type.DefId;
import net.hydromatic.sorrel.type.DefKind;
import net.hydromatic.sorrel.type.Type;
import net.hydromatic.sorrel.type.UserType;
import net.hydromatic.sorrel.type.Variance;
import net.hydromatic.sorrel.util.Static;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Converts literals, negated literals, paths to constants, and inline
 * constant blocks into patterns.
 *
 * <p>The result is usually a {@link Core.ConstantPat}, but a structured
 * constant may become a tree of patterns, and a failure becomes a
 * {@link Core.ErrorPat}. */
class ConstantLowerer {
  private final PatternContext cx;
  private final VariantResolver variantResolver;

  ConstantLowerer(PatternContext cx, VariantResolver variantResolver) {
    this.cx = requireNonNull(cx);
    this.variantResolver = requireNonNull(variantResolver);
  }

  /** Lowers an expression that occurs in a pattern, either on its own or
   * as the bound of a range.
   *
   * <p>A negated literal is converted as a whole, so that the minimum value
   * of a signed type, such as {@code -128i8}, does not overflow. */
  Core.Pat lowerLit(Ast.Exp exp, Type type) {
    return lowerLit(exp, exp.pos, type);
  }

  /** Lowers an expression, giving the resulting pattern, and any
   * ascription or constant block within it, the span {@code span}. */
  Core.Pat lowerLit(Ast.Exp exp, Pos span, Type type) {
    final Ast.Literal literal;
    final boolean negated;
    switch (exp.op) {
    case PATH:
      return lowerPath(((Ast.PathExp) exp).path, exp, span,
          cx.typeckResults.nodeType(exp, type));

    case CONST_BLOCK:
      return lowerInlineConst((Ast.ConstBlock) exp, span, type);

    case LITERAL:
      literal = (Ast.Literal) exp;
      negated = false;
      break;

    case NEGATE:
      final Ast.Exp operand = ((Ast.Negate) exp).exp;
      if (!(operand instanceof Ast.Literal)) {
        throw new AssertionError("not a literal: " + operand + " at "
            + operand.pos);
      }
      literal = (Ast.Literal) operand;
      negated = true;
      break;

    default:
      throw new AssertionError("not a literal: " + exp + " at " + exp.pos);
    }

    final Type literalType = cx.typeckResults.nodeType(exp, type);
    final Const constant;
    try {
      constant = cx.evaluator.litToConst(cx, literal, literalType, negated);
    } catch (EvalException e) {
      if (e.kind == EvalException.Kind.REPORTED) {
        return core.errorPat(exp.pos, literalType, e.reportedError());
      }
      throw new AssertionError("lowerLit: had type error", e);
    }
    return cx.constToPat.toPat(cx, constant, literal.pos);
  }

  /** Lowers a path. If it refers to a constant, evaluates the constant and
   * converts it to a pattern; otherwise (for example, a unit variant such as
   * {@code None}) the path becomes a variant or leaf pattern. */
  Core.Pat lowerPath(Ast.QPath path, AstNode node, Pos span, Type type) {
    final Res res = cx.typeckResults.qpathRes(path);
    final DefKind defKind = res.defKind();
    if (defKind != DefKind.CONST && defKind != DefKind.ASSOC_CONST) {
      return variantResolver.resolve(res, node, span, type,
          ImmutableList.of());
    }
    final DefId def = requireNonNull(res.def);
    final boolean associated = defKind == DefKind.ASSOC_CONST;

    final @Nullable ConstId instance;
    try {
      instance = cx.evaluator.resolveInstance(cx, def,
          cx.typeckResults.nodeArgs(path));
    } catch (EvalException e) {
      return core.errorPat(span, type,
          cx.emit(ErrorKind.CONST_EVAL_FAILED, span,
              "could not evaluate constant pattern"));
    }
    if (instance == null) {
      // Only an associated constant can lack an implementation.
      return core.errorPat(span, type,
          cx.emit(ErrorKind.ASSOC_CONST_UNRESOLVED, span,
              "associated consts cannot be referenced in patterns"));
    }

    final Const constant;
    try {
      constant = evalPreferringValTree(instance, type, span);
    } catch (EvalException e) {
      if (e.kind == EvalException.Kind.TOO_GENERIC) {
        return core.errorPat(span, type, tooGeneric(span));
      }
      return core.errorPat(span, type,
          cx.emit(ErrorKind.CONST_EVAL_FAILED, span,
              "could not evaluate constant pattern"));
    }

    final Core.Pat pat = cx.constToPat.toPat(cx, constant, span);
    if (!associated) {
      return pat;
    }
    final UserType userType = cx.typeckResults.userProvidedType(node);
    if (userType == null) {
      return pat;
    }
    final Core.UserTypeAnnotation annotation =
        new Core.UserTypeAnnotation(userType, span, type);
    return core.ascribeUserTypePat(span, constant.type, pat,
        new Core.Ascription(annotation, Variance.CONTRAVARIANT));
  }

  /** Evaluates a constant, as a structured value if possible, otherwise as
   * an opaque value. */
  private Const evalPreferringValTree(ConstId instance, Type type,
      Pos span) {
    final ValTree valTree = cx.evaluator.evalToValTree(cx, instance, span);
    if (valTree != null) {
      return Const.ty(type, valTree);
    }
    final ConstValue value;
    try {
      value = cx.evaluator.evalToValue(cx, instance, span);
    } catch (EvalException e) {
      throw new AssertionError("evalToValTree should have already failed",
          e);
    }
    return Const.val(type, value);
  }

  /** Lowers an inline constant block, such as {@code const { N + 1 }}. */
  Core.Pat lowerInlineConst(Ast.ConstBlock block, Pos span, Type type) {
    final Type blockType = cx.typeckResults.nodeType(block, type);

    // A block that is just a literal is converted directly. If that fails,
    // evaluation below reports the error.
    if (cx.is(Prop.INLINE_CONST_FAST_PATH)) {
      final Ast.@Nullable Literal literal = literal(block.body);
      if (literal != null) {
        try {
          final Const constant =
              cx.evaluator.litToConst(cx, literal, blockType,
                  block.body instanceof Ast.Negate);
          return cx.constToPat.toPat(cx, constant, span);
        } catch (EvalException e) {
          cx.tracer.onConstFallback(block, e);
        }
      }
    }

    final List<Type> args = Static.append(cx.genericArgs, blockType);
    final ConstId id = new ConstId(block.def, args);
    try {
      final ValTree valTree = cx.evaluator.evalToValTree(cx, id, span);
      if (valTree != null) {
        return cx.constToPat.toPat(cx, Const.ty(blockType, valTree), span);
      }
    } catch (EvalException e) {
      cx.tracer.onConstFallback(block, e);
    }

    // No structured value; match against an opaque constant.
    try {
      final ConstValue value = cx.evaluator.evalToValue(cx, id, span);
      return cx.constToPat.toPat(cx, Const.val(blockType, value), span);
    } catch (EvalException e) {
      switch (e.kind) {
      case TOO_GENERIC:
        return core.errorPat(span, blockType, tooGeneric(span));
      case REPORTED:
        return core.errorPat(span, blockType, e.reportedError());
      default:
        throw new AssertionError("unexpected evaluation failure", e);
      }
    }
  }

  /** Returns the literal if an expression is a literal or a negated
   * literal, otherwise null. */
  private static Ast.@Nullable Literal literal(Ast.Exp exp) {
    if (exp instanceof Ast.Literal) {
      return (Ast.Literal) exp;
    }
    if (exp instanceof Ast.Negate
        && ((Ast.Negate) exp).exp instanceof Ast.Literal) {
      return (Ast.Literal) ((Ast.Negate) exp).exp;
    }
    return null;
  }

  private CompileException tooGeneric(Pos span) {
    return cx.emit(ErrorKind.CONST_EVAL_TOO_GENERIC, span,
        "constant pattern depends on a generic parameter");
  }
}

// End ConstantLowerer.java
