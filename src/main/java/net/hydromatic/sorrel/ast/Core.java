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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.sorrel.ast.CoreBuilder.core;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import net.hydromatic.sorrel.compile.CompileException;
import net.hydromatic.sorrel.eval.Const;
import net.hydromatic.sorrel.type.AdtDef;
import net.hydromatic.sorrel.type.AdtType;
import net.hydromatic.sorrel.type.ArrayType;
import net.hydromatic.sorrel.type.BoxType;
import net.hydromatic.sorrel.type.Mutability;
import net.hydromatic.sorrel.type.RefType;
import net.hydromatic.sorrel.type.TupleType;
import net.hydromatic.sorrel.type.Type;
import net.hydromatic.sorrel.type.UserType;
import net.hydromatic.sorrel.type.Variance;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Core patterns: the typed, normalized form of patterns that
 * exhaustiveness checking and match lowering consume.
 *
 * <p>This class functions as a namespace, so that we can keep the class
 * names short.
 *
 * <p>Patterns are immutable trees. Equality is structural over kind, type
 * and payload; positions do not participate. To transform a pattern, use a
 * {@link Shuttle}. */
public class Core {
  private Core() {}

  /** Returns whether two lists contain the same pattern objects. Unlike
   * {@link List#equals}, a child that differs only in position counts as a
   * change. */
  static boolean samePats(List<Pat> pats0, List<Pat> pats1) {
    if (pats0.size() != pats1.size()) {
      return false;
    }
    for (int i = 0; i < pats0.size(); i++) {
      if (pats0.get(i) != pats1.get(i)) {
        return false;
      }
    }
    return true;
  }

  /** As {@link #samePats}, for field patterns. */
  static boolean sameFields(List<FieldPat> fields0, List<FieldPat> fields1) {
    if (fields0.size() != fields1.size()) {
      return false;
    }
    for (int i = 0; i < fields0.size(); i++) {
      final FieldPat f0 = fields0.get(i);
      final FieldPat f1 = fields1.get(i);
      if (f0.field != f1.field || f0.pat != f1.pat) {
        return false;
      }
    }
    return true;
  }

  /** Base class for a pattern. */
  public abstract static class Pat extends AstNode {
    public final Type type;

    Pat(Pos pos, Op op, Type type) {
      super(pos, op);
      this.type = requireNonNull(type);
    }

    /** Returns the type. */
    public Type type() {
      return type;
    }

    /** Accepts a shuttle, calling the {@link Shuttle#visit} method
     * appropriate to the type of this node, and returning the result. */
    public abstract Pat accept(Shuttle shuttle);

    /** Accepts a visitor, calling the {@link Visitor#visit} method
     * appropriate to the type of this node. */
    public abstract void accept(Visitor visitor);

    /** Returns a pattern of the same kind and payload but with a different
     * position and type. */
    public abstract Pat withPosType(Pos pos, Type type);

    /** Compares kind and type; sub-classes add their payload. */
    boolean sameHeader(Object o) {
      return o instanceof Pat
          && op == ((Pat) o).op
          && type.equals(((Pat) o).type);
    }
  }

  /** Wildcard pattern, "{@code _}". */
  public static class WildcardPat extends Pat {
    WildcardPat(Pos pos, Type type) {
      super(pos, Op.WILDCARD_PAT, type);
    }

    @Override public int hashCode() {
      return type.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this || sameHeader(o);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("_");
    }

    @Override public Pat accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Pat withPosType(Pos pos, Type type) {
      return core.wildcardPat(pos, type);
    }
  }

  /** How a binding holds its value. */
  public enum BindingMode {
    BY_VALUE(""),
    BY_REF_SHARED("ref "),
    BY_REF_MUT("ref mut ");

    public final String prefix;

    BindingMode(String prefix) {
      this.prefix = prefix;
    }
  }

  /** Binding pattern, "{@code x}", "{@code ref mut x}" or
   * "{@code x @ p}".
   *
   * <p>For a by-reference binding, {@link #type} is the type of the value
   * matched (the referent), and {@link #varType} is the type of the
   * variable (a reference). */
  public static class BindingPat extends Pat {
    public final Mutability mutability;
    public final BindingMode mode;
    public final String name;
    /** Identity of the variable. */
    public final int varId;
    public final Type varType;
    public final @Nullable Pat pat;
    /** Whether this is the binding that introduces the variable; false for
     * later alternatives of an or-pattern. */
    public final boolean primary;

    BindingPat(Pos pos, Type type, Mutability mutability, BindingMode mode,
        String name, int varId, Type varType, @Nullable Pat pat,
        boolean primary) {
      super(pos, Op.BINDING_PAT, type);
      this.mutability = requireNonNull(mutability);
      this.mode = requireNonNull(mode);
      this.name = requireNonNull(name);
      this.varId = varId;
      this.varType = requireNonNull(varType);
      this.pat = pat;
      this.primary = primary;
    }

    @Override public int hashCode() {
      return Objects.hash(type, name, varId, pat);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || sameHeader(o)
          && mutability == ((BindingPat) o).mutability
          && mode == ((BindingPat) o).mode
          && name.equals(((BindingPat) o).name)
          && varId == ((BindingPat) o).varId
          && varType.equals(((BindingPat) o).varType)
          && Objects.equals(pat, ((BindingPat) o).pat)
          && primary == ((BindingPat) o).primary;
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append(mode.prefix).append(mutability.prefix).append(name);
      return pat == null ? w : w.append(op.padded).append(pat, op.right, right);
    }

    @Override Op precedence() {
      return pat == null ? Op.ID : op;
    }

    @Override public Pat accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Pat withPosType(Pos pos, Type type) {
      return core.bindingPat(pos, type, mutability, mode, name, varId,
          varType, pat, primary);
    }

    public BindingPat copy(@Nullable Pat pat) {
      return pat == this.pat ? this
          : core.bindingPat(this.pos, type, mutability, mode, name, varId,
              varType, pat, primary);
    }
  }

  /** Pattern that matches one field of a struct, tuple or variant. */
  public static class FieldPat {
    /** Index of the field within its variant. */
    public final int field;
    public final Pat pat;

    FieldPat(int field, Pat pat) {
      checkArgument(field >= 0, "negative field index %s", field);
      this.field = field;
      this.pat = requireNonNull(pat);
    }

    @Override public int hashCode() {
      return field * 31 + pat.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof FieldPat
          && field == ((FieldPat) o).field
          && pat.equals(((FieldPat) o).pat);
    }

    @Override public String toString() {
      return field + ": " + pat;
    }

    public FieldPat copy(Pat pat) {
      return pat == this.pat ? this : core.fieldPat(field, pat);
    }
  }

  /** Writes the fields of a variant, e.g. "{@code (x, _)}" or
   * "{@code { a: x, .. }}". */
  static AstWriter unparseFields(AstWriter w, AdtDef.VariantDef variant,
      List<FieldPat> subPats) {
    switch (variant.ctorKind) {
    case CONST:
      return w;
    case FN:
      return unparsePositional(w, variant.fields.size(), subPats);
    default:
      w.append(" {");
      int i = 0;
      for (FieldPat subPat : sorted(subPats)) {
        w.append(i++ == 0 ? " " : ", ")
            .append(variant.fields.get(subPat.field).name)
            .append(": ")
            .append(subPat.pat, 0, 0);
      }
      if (subPats.size() < variant.fields.size()) {
        w.append(subPats.isEmpty() ? " .." : ", ..");
      }
      return w.append(" }");
    }
  }

  /** Writes fields in order, using "{@code _}" for missing fields. */
  static AstWriter unparsePositional(AstWriter w, int fieldCount,
      List<FieldPat> subPats) {
    w.append("(");
    for (int i = 0; i < fieldCount; i++) {
      w.append(i == 0 ? "" : ", ");
      final Pat pat = find(subPats, i);
      if (pat == null) {
        w.append("_");
      } else {
        w.append(pat, 0, 0);
      }
    }
    return w.append(")");
  }

  private static @Nullable Pat find(List<FieldPat> subPats, int field) {
    for (FieldPat subPat : subPats) {
      if (subPat.field == field) {
        return subPat.pat;
      }
    }
    return null;
  }

  private static List<FieldPat> sorted(List<FieldPat> subPats) {
    return subPats.stream()
        .sorted((p0, p1) -> Integer.compare(p0.field, p1.field))
        .collect(ImmutableList.toImmutableList());
  }

  /** Pattern that matches one variant of an enum, such as
   * "{@code Some(x)}". */
  public static class VariantPat extends Pat {
    public final AdtDef adtDef;
    public final List<Type> args;
    public final int variantIndex;
    public final List<FieldPat> subPats;

    VariantPat(Pos pos, Type type, AdtDef adtDef, ImmutableList<Type> args,
        int variantIndex, ImmutableList<FieldPat> subPats) {
      super(pos, Op.VARIANT_PAT, type);
      this.adtDef = requireNonNull(adtDef);
      this.args = requireNonNull(args);
      this.variantIndex = variantIndex;
      this.subPats = requireNonNull(subPats);
      checkArgument(adtDef.isEnum(), "%s is not an enum", adtDef);
      checkArgument(variantIndex >= 0
          && variantIndex < adtDef.variants.size(),
          "bad variant index %s", variantIndex);
    }

    public AdtDef.VariantDef variant() {
      return adtDef.variants.get(variantIndex);
    }

    @Override public int hashCode() {
      return Objects.hash(adtDef.def, variantIndex, subPats);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || sameHeader(o)
          && adtDef == ((VariantPat) o).adtDef
          && args.equals(((VariantPat) o).args)
          && variantIndex == ((VariantPat) o).variantIndex
          && subPats.equals(((VariantPat) o).subPats);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return unparseFields(w.append(variant().def.path), variant(),
          subPats);
    }

    @Override public Pat accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Pat withPosType(Pos pos, Type type) {
      return core.variantPat(pos, type, adtDef, args, variantIndex, subPats);
    }

    public VariantPat copy(List<FieldPat> subPats) {
      return sameFields(subPats, this.subPats) ? this
          : core.variantPat(pos, type, adtDef, args, variantIndex, subPats);
    }
  }

  /** Pattern that matches the fields of a struct, union, tuple, or enum
   * with a single variant, such as "{@code (x, _)}" or
   * "{@code Point { x: 0, .. }}". */
  public static class LeafPat extends Pat {
    public final List<FieldPat> subPats;

    LeafPat(Pos pos, Type type, ImmutableList<FieldPat> subPats) {
      super(pos, Op.LEAF_PAT, type);
      this.subPats = requireNonNull(subPats);
    }

    @Override public int hashCode() {
      return Objects.hash(type, subPats);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || sameHeader(o)
          && subPats.equals(((LeafPat) o).subPats);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (type instanceof TupleType) {
        return unparsePositional(w, ((TupleType) type).argTypes.size(),
            subPats);
      }
      if (type instanceof AdtType
          && ((AdtType) type).adtDef.variants.size() == 1) {
        final AdtDef adtDef = ((AdtType) type).adtDef;
        return unparseFields(w.append(adtDef.def.path),
            adtDef.variants.get(0), subPats);
      }
      w.append("{");
      int i = 0;
      for (FieldPat subPat : sorted(subPats)) {
        w.append(i++ == 0 ? "" : ", ")
            .append(Integer.toString(subPat.field))
            .append(": ")
            .append(subPat.pat, 0, 0);
      }
      return w.append("}");
    }

    @Override public Pat accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Pat withPosType(Pos pos, Type type) {
      return core.leafPat(pos, type, subPats);
    }

    public LeafPat copy(List<FieldPat> subPats) {
      return sameFields(subPats, this.subPats) ? this
          : core.leafPat(pos, type, subPats);
    }
  }

  /** Pattern that matches the value behind a reference or box, such as
   * "{@code &p}". Also inserted for implicit dereferences. */
  public static class DerefPat extends Pat {
    public final Pat pat;

    DerefPat(Pos pos, Type type, Pat pat) {
      super(pos, Op.DEREF_PAT, type);
      this.pat = requireNonNull(pat);
    }

    @Override public int hashCode() {
      return Objects.hash(type, pat);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || sameHeader(o)
          && pat.equals(((DerefPat) o).pat);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      final String prefix;
      if (type instanceof RefType) {
        prefix = "&" + ((RefType) type).mutability.prefix;
      } else if (type instanceof BoxType) {
        prefix = "box ";
      } else {
        prefix = "*";
      }
      return w.prefix(left, prefix, pat, op, right);
    }

    @Override public Pat accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Pat withPosType(Pos pos, Type type) {
      return core.derefPat(pos, type, pat);
    }

    public DerefPat copy(Pat pat) {
      return pat == this.pat ? this : core.derefPat(pos, type, pat);
    }
  }

  /** Pattern that matches a constant value, such as "{@code 1}" or
   * "{@code "abc"}". */
  public static class ConstantPat extends Pat {
    public final Const value;

    ConstantPat(Pos pos, Type type, Const value) {
      super(pos, Op.CONSTANT_PAT, type);
      this.value = requireNonNull(value);
    }

    @Override public int hashCode() {
      return value.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || sameHeader(o)
          && value.equals(((ConstantPat) o).value);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(value.toString());
    }

    @Override public Pat accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Pat withPosType(Pos pos, Type type) {
      return core.constantPat(pos, type, value);
    }
  }

  /** Pattern that matches a non-empty range of scalar values, such as
   * "{@code 0..=9}" or "{@code 'a'..'z'}". */
  public static class RangePat extends Pat {
    public final Const lo;
    public final Const hi;
    public final RangeEnd end;

    RangePat(Pos pos, Type type, Const lo, Const hi, RangeEnd end) {
      super(pos, Op.RANGE_PAT, type);
      this.lo = requireNonNull(lo);
      this.hi = requireNonNull(hi);
      this.end = requireNonNull(end);
      checkArgument(lo.type.equals(type) && hi.type.equals(type),
          "bounds %s and %s must have type %s", lo, hi, type);
    }

    @Override public int hashCode() {
      return Objects.hash(lo, hi, end);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || sameHeader(o)
          && lo.equals(((RangePat) o).lo)
          && hi.equals(((RangePat) o).hi)
          && end == ((RangePat) o).end;
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(lo.toString()).append(end.symbol)
          .append(hi.toString());
    }

    @Override public Pat accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Pat withPosType(Pos pos, Type type) {
      return core.rangePat(pos, type, lo, hi, end);
    }
  }

  /** Pattern that matches a slice ({@link Op#SLICE_PAT}) or a fixed-length
   * array ({@link Op#ARRAY_PAT}), such as "{@code [first, .., last]}".
   *
   * <p>For an array, the length of the array type is at least the number of
   * patterns in the prefix and suffix. */
  public static class SlicePat extends Pat {
    public final List<Pat> prefix;
    public final @Nullable Pat slice;
    public final List<Pat> suffix;

    SlicePat(Pos pos, Op op, Type type, ImmutableList<Pat> prefix,
        @Nullable Pat slice, ImmutableList<Pat> suffix) {
      super(pos, op, type);
      this.prefix = requireNonNull(prefix);
      this.slice = slice;
      this.suffix = requireNonNull(suffix);
      checkArgument(op == Op.SLICE_PAT || op == Op.ARRAY_PAT);
      if (op == Op.ARRAY_PAT) {
        checkArgument(type instanceof ArrayType,
            "array pattern must have array type, not %s", type);
        checkArgument(
            ((ArrayType) type).length >= prefix.size() + suffix.size(),
            "array of length %s cannot match %s elements",
            ((ArrayType) type).length, prefix.size() + suffix.size());
      }
    }

    @Override public int hashCode() {
      return Objects.hash(op, prefix, slice, suffix);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || sameHeader(o)
          && prefix.equals(((SlicePat) o).prefix)
          && Objects.equals(slice, ((SlicePat) o).slice)
          && suffix.equals(((SlicePat) o).suffix);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append("[").appendAll(prefix, ", ");
      if (slice != null) {
        w.append(prefix.isEmpty() ? "" : ", ");
        if (slice.op == Op.WILDCARD_PAT) {
          w.append("..");
        } else {
          w.append(slice, 0, 0).append(" @ ..");
        }
        w.append(suffix.isEmpty() ? "" : ", ").appendAll(suffix, ", ");
      }
      return w.append("]");
    }

    @Override public Pat accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Pat withPosType(Pos pos, Type type) {
      return new SlicePat(pos, op, type, ImmutableList.copyOf(prefix), slice,
          ImmutableList.copyOf(suffix));
    }

    public SlicePat copy(List<Pat> prefix, @Nullable Pat slice,
        List<Pat> suffix) {
      return samePats(prefix, this.prefix)
          && slice == this.slice
          && samePats(suffix, this.suffix)
          ? this
          : new SlicePat(pos, op, type, ImmutableList.copyOf(prefix), slice,
              ImmutableList.copyOf(suffix));
    }
  }

  /** Or pattern, such as "{@code 1 | 2}". Alternatives are in source
   * order. */
  public static class OrPat extends Pat {
    public final List<Pat> pats;

    OrPat(Pos pos, Type type, ImmutableList<Pat> pats) {
      super(pos, Op.OR_PAT, type);
      this.pats = requireNonNull(pats);
    }

    @Override public int hashCode() {
      return pats.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || sameHeader(o)
          && pats.equals(((OrPat) o).pats);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, pats, op, right);
    }

    @Override public Pat accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Pat withPosType(Pos pos, Type type) {
      return core.orPat(pos, type, pats);
    }

    public OrPat copy(List<Pat> pats) {
      return samePats(pats, this.pats) ? this : core.orPat(pos, type, pats);
    }
  }

  /** A user-written type annotation, with the type that inference
   * assigned to the annotated node. */
  public static class UserTypeAnnotation {
    public final UserType userType;
    public final Pos span;
    public final Type inferredType;

    public UserTypeAnnotation(UserType userType, Pos span,
        Type inferredType) {
      this.userType = requireNonNull(userType);
      this.span = requireNonNull(span);
      this.inferredType = requireNonNull(inferredType);
    }

    @Override public int hashCode() {
      return Objects.hash(userType, inferredType);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof UserTypeAnnotation
          && userType.equals(((UserTypeAnnotation) o).userType)
          && inferredType.equals(((UserTypeAnnotation) o).inferredType);
    }

    @Override public String toString() {
      return userType.toString();
    }
  }

  /** A user type annotation, and the variance with which a pattern's type
   * must relate to it. */
  public static class Ascription {
    public final UserTypeAnnotation annotation;
    public final Variance variance;

    public Ascription(UserTypeAnnotation annotation, Variance variance) {
      this.annotation = requireNonNull(annotation);
      this.variance = requireNonNull(variance);
    }

    @Override public int hashCode() {
      return Objects.hash(annotation, variance);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Ascription
          && annotation.equals(((Ascription) o).annotation)
          && variance == ((Ascription) o).variance;
    }

    @Override public String toString() {
      return annotation + " (" + variance + ")";
    }
  }

  /** Pattern that records a user type annotation on its sub-pattern. It
   * matches whatever its sub-pattern matches, and is removed before
   * exhaustiveness checking. */
  public static class AscribeUserTypePat extends Pat {
    public final Pat pat;
    public final Ascription ascription;

    AscribeUserTypePat(Pos pos, Type type, Pat pat, Ascription ascription) {
      super(pos, Op.ASCRIBE_USER_TYPE_PAT, type);
      this.pat = requireNonNull(pat);
      this.ascription = requireNonNull(ascription);
    }

    @Override public int hashCode() {
      return Objects.hash(pat, ascription);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || sameHeader(o)
          && pat.equals(((AscribeUserTypePat) o).pat)
          && ascription.equals(((AscribeUserTypePat) o).ascription);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || right > op.right) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      return w.append(pat, left, op.left)
          .append(op.padded)
          .append(ascription.annotation.userType.toString());
    }

    @Override public Pat accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Pat withPosType(Pos pos, Type type) {
      return core.ascribeUserTypePat(pos, type, pat, ascription);
    }

    public AscribeUserTypePat copy(Pat pat) {
      return pat == this.pat ? this
          : core.ascribeUserTypePat(pos, type, pat, ascription);
    }
  }

  /** Pattern that could not be lowered. Holds the error that was
   * reported. */
  public static class ErrorPat extends Pat {
    public final CompileException error;

    ErrorPat(Pos pos, Type type, CompileException error) {
      super(pos, Op.ERROR_PAT, type);
      this.error = requireNonNull(error);
    }

    @Override public int hashCode() {
      return error.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || sameHeader(o)
          && error == ((ErrorPat) o).error;
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("<error>");
    }

    @Override public Pat accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Pat withPosType(Pos pos, Type type) {
      return core.errorPat(pos, type, error);
    }
  }
}

// End Core.java
