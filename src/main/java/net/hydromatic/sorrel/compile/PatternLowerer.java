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
import static net.hydromatic.sorrel.util.Static.adjustedIndex;
import static net.hydromatic.sorrel.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import java.util.List;
import net.hydromatic.sorrel.ast.Ast;
import net.hydromatic.sorrel.ast.Core;
import net.hydromatic.sorrel.ast.Pos;
import net.hydromatic.sorrel.type.AdtDef;
import net.hydromatic.sorrel.type.AdtType;
import net.hydromatic.sorrel.type.ArrayType;
import net.hydromatic.sorrel.type.Mutability;
import net.hydromatic.sorrel.type.RefType;
import net.hydromatic.sorrel.type.SliceType;
import net.hydromatic.sorrel.type.TupleType;
import net.hydromatic.sorrel.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Converts surface patterns into typed {@link Core} patterns.
 *
 * <p>Lowering never fails because of an error in the user's program: a
 * pattern that cannot be lowered becomes a {@link Core.ErrorPat} and the
 * error is emitted to the context's {@link Diagnostics}. An
 * {@link AssertionError} means that type checking produced results that are
 * inconsistent with the pattern.
 *
 * <p>For example, given
 *
 * <blockquote><pre>
 * match &amp;&amp;Some(0i32) {
 *   Some(n) =&gt; ...
 * }</pre></blockquote>
 *
 * <p>type checking assigns type {@code Option<i32>} to {@code Some(n)} and
 * records two implicit dereferences, {@code [&&Option<i32>, &Option<i32>]};
 * lowering yields {@code &&Option::Some(n)}. */
public class PatternLowerer {
  private final PatternContext cx;
  private final VariantResolver variantResolver;
  private final ConstantLowerer constantLowerer;
  private final RangeLowerer rangeLowerer;

  private PatternLowerer(PatternContext cx) {
    this.cx = requireNonNull(cx);
    this.variantResolver = new VariantResolver(cx);
    this.constantLowerer = new ConstantLowerer(cx, variantResolver);
    this.rangeLowerer = new RangeLowerer(cx, constantLowerer);
  }

  /** Lowers a pattern. */
  public static Core.Pat lower(PatternContext cx, Ast.Pat pat) {
    return new PatternLowerer(cx).lowerTop(pat);
  }

  /** Lowers a list of independent patterns, such as the arms of a match.
   * Returns one pattern per input, in the same order. */
  public static List<Core.Pat> lowerAll(PatternContext cx,
      List<? extends Ast.Pat> pats) {
    final PatternLowerer lowerer = new PatternLowerer(cx);
    return transformEager(pats, lowerer::lowerTop);
  }

  private Core.Pat lowerTop(Ast.Pat pat) {
    final Core.Pat result = lowerPattern(pat);
    cx.tracer.onLower(pat, result);
    return result;
  }

  /** Lowers a pattern, then wraps it in the implicit dereferences that type
   * checking inserted. The adjustments are consumed in reverse, so that the
   * last dereference inserted gets the least-dereferenced type. */
  private Core.Pat lowerPattern(Ast.Pat pat) {
    Core.Pat result = lowerPatternUnadjusted(pat);
    for (Type refType
        : Lists.reverse(cx.typeckResults.patAdjustments(pat))) {
      cx.tracer.onDeref(result, refType);
      result = core.derefPat(result.pos, refType, result);
    }
    return result;
  }

  private Core.@Nullable Pat lowerOptPattern(Ast.@Nullable Pat pat) {
    return pat == null ? null : lowerPattern(pat);
  }

  private List<Core.Pat> lowerPatterns(List<Ast.Pat> pats) {
    return transformEager(pats, this::lowerPattern);
  }

  private Core.Pat lowerPatternUnadjusted(Ast.Pat pat) {
    final Type type = cx.typeckResults.nodeType(pat);
    final Pos span = pat.pos;
    switch (pat.op) {
    case WILDCARD_PAT:
      return core.wildcardPat(span, type);

    case LIT_PAT:
      return constantLowerer.lowerLit(((Ast.LitPat) pat).exp, span, type)
          .withPosType(span, type);

    case RANGE_PAT:
      final Ast.RangePat rangePat = (Ast.RangePat) pat;
      return rangeLowerer.lower(rangePat.lo, rangePat.hi, rangePat.end, type,
          span);

    case PATH_PAT:
      return constantLowerer.lowerPath(((Ast.PathPat) pat).path, pat, span,
          type);

    case REF_PAT:
      return core.derefPat(span, type, lowerPattern(((Ast.RefPat) pat).pat));

    case BOX_PAT:
      return core.derefPat(span, type, lowerPattern(((Ast.BoxPat) pat).pat));

    case SLICE_PAT:
      return lowerSliceOrArray((Ast.SlicePat) pat, type);

    case TUPLE_PAT:
      final Ast.TuplePat tuplePat = (Ast.TuplePat) pat;
      if (!(type instanceof TupleType)) {
        throw new AssertionError("unexpected type for tuple pattern: "
            + type + " at " + span);
      }
      return core.leafPat(span, type,
          lowerTupleSubPats(tuplePat.args,
              ((TupleType) type).argTypes.size(), tuplePat.gapPos));

    case BINDING_PAT:
      return lowerBinding((Ast.BindingPat) pat, type);

    case TUPLE_STRUCT_PAT:
      final Ast.TupleStructPat tupleStructPat = (Ast.TupleStructPat) pat;
      final Res res = cx.typeckResults.qpathRes(tupleStructPat.path);
      if (!(type instanceof AdtType)) {
        throw new AssertionError("tuple struct pattern not applied to an "
            + "ADT: " + type + " at " + span);
      }
      final AdtDef.VariantDef variant =
          variantResolver.variantOfRes(((AdtType) type).adtDef, res);
      return variantResolver.resolve(res, pat, span, type,
          lowerTupleSubPats(tupleStructPat.args, variant.fields.size(),
              tupleStructPat.gapPos));

    case STRUCT_PAT:
      final Ast.StructPat structPat = (Ast.StructPat) pat;
      final ImmutableList.Builder<Core.FieldPat> fieldPats =
          ImmutableList.builder();
      for (Ast.FieldPat field : structPat.fields) {
        fieldPats.add(
            core.fieldPat(cx.typeckResults.fieldIndex(field),
                lowerPattern(field.pat)));
      }
      return variantResolver.resolve(
          cx.typeckResults.qpathRes(structPat.path), pat, span, type,
          fieldPats.build());

    case OR_PAT:
      return core.orPat(span, type, lowerPatterns(((Ast.OrPat) pat).args));

    default:
      throw new AssertionError("unknown pattern " + pat.op + " at " + span);
    }
  }

  /** Lowers a binding such as "{@code ref mut x @ Some(_)}". */
  private Core.Pat lowerBinding(Ast.BindingPat pat, Type type) {
    Pos span = pat.pos;
    if (span.contains(pat.id.pos)) {
      // Report "ref mut x", not "ref mut x @ Some(_)".
      span = span.withEnd(pat.id.pos);
    }

    final TypeckResults.BindMode bindMode =
        cx.typeckResults.bindingMode(pat);
    if (bindMode == null) {
      throw new AssertionError("missing binding mode for " + pat + " at "
          + pat.pos);
    }
    final Mutability mutability;
    final Core.BindingMode mode;
    switch (bindMode) {
    case BY_VALUE:
    case BY_VALUE_MUT:
      mutability = bindMode.mutability;
      mode = Core.BindingMode.BY_VALUE;
      break;
    case BY_REF_MUT:
      mutability = Mutability.NOT;
      mode = Core.BindingMode.BY_REF_MUT;
      break;
    case BY_REF:
      mutability = Mutability.NOT;
      mode = Core.BindingMode.BY_REF_SHARED;
      break;
    default:
      throw new AssertionError(bindMode);
    }

    // "ref x" has the type of x, which is &T; the pattern matches a T.
    final Type varType = type;
    Type matchedType = type;
    if (bindMode.isByRef()) {
      if (!(type instanceof RefType)) {
        throw new AssertionError("`ref " + pat.id.name + "` has wrong type "
            + type);
      }
      matchedType = ((RefType) type).referent;
    }

    return core.bindingPat(span, matchedType, mutability, mode, pat.id.name,
        pat.varId, varType, lowerOptPattern(pat.pat), pat.isPrimary());
  }

  /** Lowers the elements of a tuple or tuple-struct pattern, numbering them
   * as fields; elements after a rest marker are numbered from the end. */
  private List<Core.FieldPat> lowerTupleSubPats(List<Ast.Pat> pats,
      int expectedSize, int gapPos) {
    final ImmutableList.Builder<Core.FieldPat> fieldPats =
        ImmutableList.builder();
    for (int i = 0; i < pats.size(); i++) {
      fieldPats.add(
          core.fieldPat(adjustedIndex(i, pats.size(), expectedSize, gapPos),
              lowerPattern(pats.get(i))));
    }
    return fieldPats.build();
  }

  private Core.Pat lowerSliceOrArray(Ast.SlicePat pat, Type type) {
    final List<Core.Pat> prefix = lowerPatterns(pat.prefix);
    final Core.@Nullable Pat slice = lowerOptPattern(pat.slice);
    final List<Core.Pat> suffix = lowerPatterns(pat.suffix);
    if (type instanceof SliceType) {
      return core.slicePat(pat.pos, type, prefix, slice, suffix);
    }
    if (type instanceof ArrayType) {
      return core.arrayPat(pat.pos, type, prefix, slice, suffix);
    }
    throw new AssertionError("bad slice pattern type " + type + " at "
        + pat.pos);
  }
}

// End PatternLowerer.java
