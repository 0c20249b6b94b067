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

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.List;
import net.hydromatic.sorrel.type.DefId;
import net.hydromatic.sorrel.type.Mutability;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Various sub-classes of AST nodes: the surface syntax of patterns, and
 * the expressions that may occur inside patterns.
 *
 * <p>Nodes are produced by parsing and name resolution, which are not part
 * of this library; {@link AstBuilder} creates them directly. Results of
 * later phases (types, resolutions, binding modes) are recorded separately,
 * keyed by node identity, so nodes do not override {@link #equals}. */
public class Ast {
  private Ast() {}

  /** Value of a gap position when a tuple pattern has no rest marker. */
  public static final int NO_GAP = -1;

  /** Base class for a pattern. */
  public abstract static class Pat extends AstNode {
    Pat(Pos pos, Op op) {
      super(pos, op);
    }
  }

  /** Base class for an expression that occurs in a pattern. */
  public abstract static class Exp extends AstNode {
    Exp(Pos pos, Op op) {
      super(pos, op);
    }
  }

  /** Identifier. */
  public static class Id extends AstNode {
    public final String name;

    Id(Pos pos, String name) {
      super(pos, Op.ID);
      this.name = requireNonNull(name);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(name);
    }
  }

  /** Qualified path, such as {@code Option::Some} or
   * {@code <T as Tr>::MAX}. */
  public static class QPath extends AstNode {
    public final List<String> segments;

    QPath(Pos pos, ImmutableList<String> segments) {
      super(pos, Op.QPATH);
      this.segments = requireNonNull(segments);
      checkArgument(!segments.isEmpty());
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(String.join("::", segments));
    }
  }

  /** Wildcard pattern, "{@code _}". */
  public static class WildcardPat extends Pat {
    WildcardPat(Pos pos) {
      super(pos, Op.WILDCARD_PAT);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("_");
    }
  }

  /** Binding pattern, such as "{@code x}", "{@code ref mut x}" or
   * "{@code x @ Some(_)}".
   *
   * <p>The binding mode is determined by type checking, not by the
   * keywords, because of default binding modes; the keywords are kept for
   * printing.
   *
   * <p>In an or-pattern such as {@code Ok(x) | Err(x)}, each alternative
   * has its own binding node but all refer to the variable of the first;
   * a binding is primary if {@link #varId} equals {@link #nodeId}. */
  public static class BindingPat extends Pat {
    public final boolean byRef;
    public final Mutability mutability;
    public final Id id;
    /** Identity of the variable that this binding introduces. */
    public final int varId;
    /** Identity of this node. */
    public final int nodeId;
    public final @Nullable Pat pat;

    BindingPat(Pos pos, boolean byRef, Mutability mutability, Id id,
        int varId, int nodeId, @Nullable Pat pat) {
      super(pos, Op.BINDING_PAT);
      this.byRef = byRef;
      this.mutability = requireNonNull(mutability);
      this.id = requireNonNull(id);
      this.varId = varId;
      this.nodeId = nodeId;
      this.pat = pat;
    }

    public boolean isPrimary() {
      return varId == nodeId;
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append(byRef ? "ref " : "")
          .append(mutability.prefix)
          .append(id.name);
      return pat == null ? w : w.append(op.padded).append(pat, op.right, right);
    }

    @Override Op precedence() {
      return pat == null ? Op.ID : op;
    }
  }

  /** Literal pattern, such as "{@code 1}", "{@code -1}",
   * "{@code FOO}" or "{@code const { 1 + 2 }}". */
  public static class LitPat extends Pat {
    public final Exp exp;

    LitPat(Pos pos, Exp exp) {
      super(pos, Op.LIT_PAT);
      this.exp = requireNonNull(exp);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(exp, left, right);
    }
  }

  /** Range pattern, such as "{@code 0..=9}", "{@code 'a'..}" or
   * "{@code ..10}". Either bound may be absent. */
  public static class RangePat extends Pat {
    public final @Nullable Exp lo;
    public final @Nullable Exp hi;
    public final RangeEnd end;

    RangePat(Pos pos, @Nullable Exp lo, @Nullable Exp hi, RangeEnd end) {
      super(pos, Op.RANGE_PAT);
      this.lo = lo;
      this.hi = hi;
      this.end = requireNonNull(end);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (lo != null) {
        w.append(lo, op.right, op.left);
      }
      w.append(end.symbol);
      if (hi != null) {
        w.append(hi, op.right, op.left);
      }
      return w;
    }
  }

  /** Path pattern, such as "{@code None}" or "{@code FOO}". */
  public static class PathPat extends Pat {
    public final QPath path;

    PathPat(Pos pos, QPath path) {
      super(pos, Op.PATH_PAT);
      this.path = requireNonNull(path);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(path, left, right);
    }
  }

  /** Reference pattern, "{@code &p}" or "{@code &mut p}". */
  public static class RefPat extends Pat {
    public final Mutability mutability;
    public final Pat pat;

    RefPat(Pos pos, Mutability mutability, Pat pat) {
      super(pos, Op.REF_PAT);
      this.mutability = requireNonNull(mutability);
      this.pat = requireNonNull(pat);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.prefix(left, op.padded + mutability.prefix, pat, op, right);
    }
  }

  /** Box pattern, "{@code box p}". */
  public static class BoxPat extends Pat {
    public final Pat pat;

    BoxPat(Pos pos, Pat pat) {
      super(pos, Op.BOX_PAT);
      this.pat = requireNonNull(pat);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.prefix(left, op.padded, pat, op, right);
    }
  }

  /** Slice pattern, such as "{@code [a, rest @ .., z]}".
   *
   * <p>The same syntax matches slices and fixed-length arrays; which one
   * depends on the type of the scrutinee. */
  public static class SlicePat extends Pat {
    public final List<Pat> prefix;
    /** Pattern for the elements between prefix and suffix, or null if there
     * is no rest marker. */
    public final @Nullable Pat slice;
    public final List<Pat> suffix;

    SlicePat(Pos pos, ImmutableList<Pat> prefix, @Nullable Pat slice,
        ImmutableList<Pat> suffix) {
      super(pos, Op.SLICE_PAT);
      this.prefix = requireNonNull(prefix);
      this.slice = slice;
      this.suffix = requireNonNull(suffix);
      checkArgument(slice != null || suffix.isEmpty(),
          "suffix requires a rest marker");
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
  }

  /** Writes patterns, with a rest marker before the one at {@code gapPos}
   * (or at the end, if {@code gapPos} is the number of patterns). */
  private static AstWriter unparseWithGap(AstWriter w, List<Pat> args,
      int gapPos) {
    for (int i = 0; i < args.size(); i++) {
      if (i == gapPos) {
        w.append(i == 0 ? ".." : ", ..");
      }
      w.append(i == 0 && i != gapPos ? "" : ", ").append(args.get(i), 0, 0);
    }
    if (gapPos == args.size()) {
      w.append(args.isEmpty() ? ".." : ", ..");
    }
    return w;
  }

  /** Tuple pattern, such as "{@code (a, .., z)}". */
  public static class TuplePat extends Pat {
    public final List<Pat> args;
    /** Position of the rest marker, or {@link #NO_GAP}. */
    public final int gapPos;

    TuplePat(Pos pos, ImmutableList<Pat> args, int gapPos) {
      super(pos, Op.TUPLE_PAT);
      this.args = requireNonNull(args);
      this.gapPos = gapPos;
      checkArgument(gapPos >= NO_GAP && gapPos <= args.size());
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      unparseWithGap(w.append("("), args, gapPos);
      return w.append(args.size() == 1 && gapPos == NO_GAP ? ",)" : ")");
    }
  }

  /** Tuple struct pattern, such as "{@code Some(x)}" or
   * "{@code Point3(x, ..)}". */
  public static class TupleStructPat extends Pat {
    public final QPath path;
    public final List<Pat> args;
    /** Position of the rest marker, or {@link #NO_GAP}. */
    public final int gapPos;

    TupleStructPat(Pos pos, QPath path, ImmutableList<Pat> args,
        int gapPos) {
      super(pos, Op.TUPLE_STRUCT_PAT);
      this.path = requireNonNull(path);
      this.args = requireNonNull(args);
      this.gapPos = gapPos;
      checkArgument(gapPos >= NO_GAP && gapPos <= args.size());
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append(path, 0, 0).append("(");
      return unparseWithGap(w, args, gapPos).append(")");
    }
  }

  /** Struct pattern, such as "{@code Point { x: 0, y, .. }}". */
  public static class StructPat extends Pat {
    public final QPath path;
    public final List<FieldPat> fields;
    /** Whether the pattern ends with a rest marker, "{@code ..}". */
    public final boolean rest;

    StructPat(Pos pos, QPath path, ImmutableList<FieldPat> fields,
        boolean rest) {
      super(pos, Op.STRUCT_PAT);
      this.path = requireNonNull(path);
      this.fields = requireNonNull(fields);
      this.rest = rest;
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append(path, 0, 0).append(" {");
      if (!fields.isEmpty()) {
        w.append(" ").appendAll(fields, ", ");
      }
      if (rest) {
        w.append(fields.isEmpty() ? " .." : ", ..");
      }
      return w.append(" }");
    }
  }

  /** Field of a struct pattern, such as "{@code x: 0}" in
   * "{@code Point { x: 0, y }}". */
  public static class FieldPat extends AstNode {
    public final Id field;
    public final Pat pat;

    FieldPat(Pos pos, Id field, Pat pat) {
      super(pos, Op.FIELD_PAT);
      this.field = requireNonNull(field);
      this.pat = requireNonNull(pat);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (pat instanceof BindingPat
          && ((BindingPat) pat).pat == null
          && ((BindingPat) pat).id.name.equals(field.name)) {
        // shorthand, "y" rather than "y: y"
        return w.append(pat, 0, 0);
      }
      return w.append(field.name).append(": ").append(pat, 0, 0);
    }
  }

  /** Or pattern, such as "{@code 1 | 2 | 3}". */
  public static class OrPat extends Pat {
    public final List<Pat> args;

    OrPat(Pos pos, ImmutableList<Pat> args) {
      super(pos, Op.OR_PAT);
      this.args = requireNonNull(args);
      checkArgument(args.size() >= 2, "or-pattern needs two alternatives");
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, args, op, right);
    }
  }

  /** Kind of literal. */
  public enum LitKind {
    /** Integer; value is a non-negative {@link BigInteger}. */
    INT,
    /** Floating-point; value is the {@link String} as written, without
     * suffix. */
    FLOAT,
    /** Boolean; value is a {@link Boolean}. */
    BOOL,
    /** Character; value is an {@link Integer} code point. */
    CHAR,
    /** Byte, {@code b'a'}; value is an {@link Integer} between 0 and 255. */
    BYTE,
    /** String; value is a {@link String}. */
    STR,
    /** Byte string, {@code b"abc"}; value is a {@link String} whose chars
     * are all between 0 and 255. */
    BYTE_STR
  }

  /** Literal, such as "{@code 1}", "{@code 2.5f32}", "{@code 'a'}" or
   * "{@code "abc"}". */
  public static class Literal extends Exp {
    public final LitKind kind;
    public final Object value;
    /** Type suffix as written, e.g. "i8" in "{@code 1i8}", or null. */
    public final @Nullable String suffix;

    Literal(Pos pos, LitKind kind, Object value, @Nullable String suffix) {
      super(pos, Op.LITERAL);
      this.kind = requireNonNull(kind);
      this.value = requireNonNull(value);
      this.suffix = suffix;
      checkArgument(kind != LitKind.INT
          || ((BigInteger) value).signum() >= 0,
          "integer literal must be non-negative; use negate");
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      switch (kind) {
      case CHAR:
        w.append("'").append(new String(Character.toChars((Integer) value)))
            .append("'");
        break;
      case BYTE:
        w.append("b'").append(String.valueOf((char) (int) (Integer) value))
            .append("'");
        break;
      case STR:
        w.append("\"").append((String) value).append("\"");
        break;
      case BYTE_STR:
        w.append("b\"").append((String) value).append("\"");
        break;
      default:
        w.append(value.toString());
      }
      return suffix == null ? w : w.append(suffix);
    }
  }

  /** Negation of a literal, such as "{@code -1}". */
  public static class Negate extends Exp {
    public final Exp exp;

    Negate(Pos pos, Exp exp) {
      super(pos, Op.NEGATE);
      this.exp = requireNonNull(exp);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.prefix(left, op.padded, exp, op, right);
    }
  }

  /** Path expression, such as "{@code FOO}" or "{@code i32::MAX}". */
  public static class PathExp extends Exp {
    public final QPath path;

    PathExp(Pos pos, QPath path) {
      super(pos, Op.PATH);
      this.path = requireNonNull(path);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(path, left, right);
    }
  }

  /** Inline constant block, such as "{@code const { N + 1 }}". */
  public static class ConstBlock extends Exp {
    /** Definition of the anonymous constant. */
    public final DefId def;
    public final Exp body;

    ConstBlock(Pos pos, DefId def, Exp body) {
      super(pos, Op.CONST_BLOCK);
      this.def = requireNonNull(def);
      this.body = requireNonNull(body);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("const { ").append(body, 0, 0).append(" }");
    }
  }
}

// End Ast.java
