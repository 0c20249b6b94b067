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

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.List;
import net.hydromatic.sorrel.type.DefId;
import net.hydromatic.sorrel.type.Mutability;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds parse tree nodes. */
public enum AstBuilder {
  /** The singleton instance of the AST builder.
   * The short name is convenient for use via 'import static',
   * but checkstyle does not approve. */
  // CHECKSTYLE: IGNORE 1
  ast;

  /** Creates an identifier. */
  public Ast.Id id(Pos pos, String name) {
    return new Ast.Id(pos, name);
  }

  /** Creates a path from "::"-separated segments, e.g. "Option::Some". */
  public Ast.QPath path(Pos pos, String path) {
    return new Ast.QPath(pos, ImmutableList.copyOf(path.split("::")));
  }

  // patterns

  public Ast.WildcardPat wildcardPat(Pos pos) {
    return new Ast.WildcardPat(pos);
  }

  /** Creates a binding pattern, "{@code x}", whose variable is introduced
   * by this node. */
  public Ast.BindingPat bindingPat(Pos pos, String name, int nodeId) {
    return bindingPat(pos, false, Mutability.NOT, id(pos, name), nodeId,
        nodeId, null);
  }

  public Ast.BindingPat bindingPat(Pos pos, boolean byRef,
      Mutability mutability, Ast.Id id, int varId, int nodeId,
      Ast.@Nullable Pat pat) {
    return new Ast.BindingPat(pos, byRef, mutability, id, varId, nodeId,
        pat);
  }

  public Ast.LitPat litPat(Pos pos, Ast.Exp exp) {
    return new Ast.LitPat(pos, exp);
  }

  public Ast.RangePat rangePat(Pos pos, Ast.@Nullable Exp lo,
      Ast.@Nullable Exp hi, RangeEnd end) {
    return new Ast.RangePat(pos, lo, hi, end);
  }

  public Ast.PathPat pathPat(Pos pos, Ast.QPath path) {
    return new Ast.PathPat(pos, path);
  }

  public Ast.RefPat refPat(Pos pos, Mutability mutability, Ast.Pat pat) {
    return new Ast.RefPat(pos, mutability, pat);
  }

  public Ast.BoxPat boxPat(Pos pos, Ast.Pat pat) {
    return new Ast.BoxPat(pos, pat);
  }

  public Ast.SlicePat slicePat(Pos pos, List<? extends Ast.Pat> prefix,
      Ast.@Nullable Pat slice, List<? extends Ast.Pat> suffix) {
    return new Ast.SlicePat(pos, ImmutableList.copyOf(prefix), slice,
        ImmutableList.copyOf(suffix));
  }

  public Ast.TuplePat tuplePat(Pos pos, List<? extends Ast.Pat> args) {
    return tuplePat(pos, args, Ast.NO_GAP);
  }

  public Ast.TuplePat tuplePat(Pos pos, List<? extends Ast.Pat> args,
      int gapPos) {
    return new Ast.TuplePat(pos, ImmutableList.copyOf(args), gapPos);
  }

  public Ast.TupleStructPat tupleStructPat(Pos pos, Ast.QPath path,
      List<? extends Ast.Pat> args) {
    return tupleStructPat(pos, path, args, Ast.NO_GAP);
  }

  public Ast.TupleStructPat tupleStructPat(Pos pos, Ast.QPath path,
      List<? extends Ast.Pat> args, int gapPos) {
    return new Ast.TupleStructPat(pos, path, ImmutableList.copyOf(args),
        gapPos);
  }

  public Ast.StructPat structPat(Pos pos, Ast.QPath path,
      List<Ast.FieldPat> fields, boolean rest) {
    return new Ast.StructPat(pos, path, ImmutableList.copyOf(fields), rest);
  }

  public Ast.FieldPat fieldPat(Pos pos, String field, Ast.Pat pat) {
    return new Ast.FieldPat(pos, id(pos, field), pat);
  }

  public Ast.OrPat orPat(Pos pos, List<? extends Ast.Pat> args) {
    return new Ast.OrPat(pos, ImmutableList.copyOf(args));
  }

  // expressions

  public Ast.Literal intLiteral(Pos pos, long value) {
    return intLiteral(pos, BigInteger.valueOf(value), null);
  }

  public Ast.Literal intLiteral(Pos pos, BigInteger value,
      @Nullable String suffix) {
    return new Ast.Literal(pos, Ast.LitKind.INT, value, suffix);
  }

  public Ast.Literal floatLiteral(Pos pos, String value,
      @Nullable String suffix) {
    return new Ast.Literal(pos, Ast.LitKind.FLOAT, value, suffix);
  }

  public Ast.Literal boolLiteral(Pos pos, boolean value) {
    return new Ast.Literal(pos, Ast.LitKind.BOOL, value, null);
  }

  public Ast.Literal charLiteral(Pos pos, int codePoint) {
    return new Ast.Literal(pos, Ast.LitKind.CHAR, codePoint, null);
  }

  public Ast.Literal byteLiteral(Pos pos, int value) {
    return new Ast.Literal(pos, Ast.LitKind.BYTE, value, null);
  }

  public Ast.Literal stringLiteral(Pos pos, String value) {
    return new Ast.Literal(pos, Ast.LitKind.STR, value, null);
  }

  public Ast.Literal byteStringLiteral(Pos pos, String value) {
    return new Ast.Literal(pos, Ast.LitKind.BYTE_STR, value, null);
  }

  public Ast.Negate negate(Pos pos, Ast.Exp exp) {
    return new Ast.Negate(pos, exp);
  }

  public Ast.PathExp pathExp(Pos pos, Ast.QPath path) {
    return new Ast.PathExp(pos, path);
  }

  public Ast.ConstBlock constBlock(Pos pos, DefId def, Ast.Exp body) {
    return new Ast.ConstBlock(pos, def, body);
  }
}

// End AstBuilder.java
