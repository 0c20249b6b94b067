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

import static net.hydromatic.sorrel.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.sorrel.ast.Ast;
import net.hydromatic.sorrel.ast.Core;
import net.hydromatic.sorrel.ast.Pos;
import net.hydromatic.sorrel.ast.RangeEnd;
import net.hydromatic.sorrel.eval.StubEvaluator;
import net.hydromatic.sorrel.type.AdtDef;
import net.hydromatic.sorrel.type.DefId;
import net.hydromatic.sorrel.type.DefKind;
import net.hydromatic.sorrel.type.Mutability;
import net.hydromatic.sorrel.type.PrimitiveType;
import net.hydromatic.sorrel.type.Type;
import net.hydromatic.sorrel.type.TypeSystem;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds synthetic surface patterns, type-check results and constants
 * for lowering tests.
 *
 * <p>Declares:
 *
 * <blockquote><pre>
 * enum Option&lt;T&gt; { None, Some(T) }
 * struct Point { x: i32, y: i32 }
 * struct Pair(i32, bool);
 * </pre></blockquote>
 *
 * <p>Each node gets its own position on line 1, so that spans can be
 * told apart. */
class Fixture {
  static final Type I32 = PrimitiveType.I32;
  static final Type U8 = PrimitiveType.U8;
  static final Type BOOL = PrimitiveType.BOOL;

  final TypeSystem typeSystem = new TypeSystem();
  final TypeckResults.Builder typeck = TypeckResults.builder();
  final StubEvaluator evaluator = new StubEvaluator();
  final Diagnostics diagnostics = new Diagnostics();
  /** Events reported to the tracer, in order. */
  final List<String> events = new ArrayList<>();
  private final Map<Prop, Object> props = new LinkedHashMap<>();
  private final List<Type> genericArgs = new ArrayList<>();

  final AdtDef option;
  final AdtDef point;
  final AdtDef pair;

  private int column = 1;
  private int nextId = 1;

  Fixture() {
    final AdtDef.Builder b =
        typeSystem.adt(AdtDef.Kind.ENUM, "Option", "T");
    option = b.unitVariant("None").tupleVariant("Some", b.param(0)).build();
    point = typeSystem.adt(AdtDef.Kind.STRUCT, "Point")
        .structVariant("Point", new AdtDef.FieldDef("x", I32),
            new AdtDef.FieldDef("y", I32))
        .build();
    pair = typeSystem.adt(AdtDef.Kind.STRUCT, "Pair")
        .tupleVariant("Pair", I32, BOOL)
        .build();
  }

  /** Returns a new position, after all previous positions. */
  Pos pos() {
    final int c = column;
    column += 4;
    return new Pos("", 1, c, 1, c + 3);
  }

  Type optionOf(Type type) {
    return typeSystem.adtType(option, type);
  }

  Type pointType() {
    return typeSystem.adtType(point);
  }

  Type ref(Type type) {
    return typeSystem.refType(type);
  }

  DefId def(DefKind kind, String path) {
    return typeSystem.def(kind, path);
  }

  <P extends Ast.Pat> P typed(P pat, Type type) {
    typeck.nodeType(pat, type);
    return pat;
  }

  Ast.WildcardPat wildcard(Type type) {
    return typed(ast.wildcardPat(pos()), type);
  }

  /** Creates a by-value binding. */
  Ast.BindingPat binding(String name, Type type) {
    return binding(name, type, TypeckResults.BindMode.BY_VALUE, null);
  }

  Ast.BindingPat binding(String name, Type type,
      TypeckResults.BindMode mode, Ast.@Nullable Pat subPat) {
    final Pos pos = pos();
    final int id = nextId++;
    // With a sub-pattern, "x @ p", the pattern extends beyond the name.
    final Pos patPos = subPat == null ? pos
        : new Pos("", 1, pos.startColumn, 1, pos.endColumn + 10);
    final Ast.BindingPat pat =
        ast.bindingPat(patPos, mode.isByRef(), mode.mutability,
            ast.id(pos, name), id, id, subPat);
    typeck.bindingMode(pat, mode);
    return typed(pat, type);
  }

  /** Creates an integer literal, negated if the value is negative. */
  Ast.Exp intExp(long value) {
    final Pos pos = pos();
    if (value < 0) {
      return ast.negate(pos, ast.intLiteral(pos, -value));
    }
    return ast.intLiteral(pos, value);
  }

  Ast.LitPat lit(long value, Type type) {
    return lit(intExp(value), type);
  }

  Ast.LitPat lit(Ast.Exp exp, Type type) {
    return typed(ast.litPat(exp.pos, exp), type);
  }

  Ast.RangePat range(Ast.@Nullable Exp lo, Ast.@Nullable Exp hi,
      RangeEnd end, Type type) {
    return typed(ast.rangePat(pos(), lo, hi, end), type);
  }

  /** Creates a path that resolves to a given definition. */
  Ast.QPath path(String path, DefId def) {
    final Ast.QPath qPath = ast.path(pos(), path);
    typeck.res(qPath, Res.def(def));
    return qPath;
  }

  Ast.PathPat pathPat(String path, DefId def, Type type) {
    final Ast.QPath qPath = path(path, def);
    return typed(ast.pathPat(qPath.pos, qPath), type);
  }

  /** Creates "{@code Some(arg)}", resolved to the constructor of
   * {@code Some}. */
  Ast.TupleStructPat some(Ast.Pat arg, Type argType) {
    final Ast.QPath qPath = path("Option::Some",
        option.variants.get(1).ctor);
    return typed(ast.tupleStructPat(qPath.pos, qPath, ImmutableList.of(arg)),
        optionOf(argType));
  }

  /** Creates "{@code None}", resolved to the constructor of
   * {@code None}. */
  Ast.PathPat none(Type argType) {
    return pathPat("Option::None", option.variants.get(0).ctor,
        optionOf(argType));
  }

  Ast.RefPat refPat(Ast.Pat pat, Type type) {
    return typed(ast.refPat(pos(), Mutability.NOT, pat), type);
  }

  Ast.TuplePat tuple(Type type, int gapPos, Ast.Pat... args) {
    return typed(ast.tuplePat(pos(), ImmutableList.copyOf(args), gapPos),
        type);
  }

  Fixture withProp(Prop prop, Object value) {
    prop.set(props, value);
    return this;
  }

  Fixture withGenericArgs(Type... types) {
    genericArgs.addAll(ImmutableList.copyOf(types));
    return this;
  }

  /** Creates a context. Call after all nodes have been typed. */
  PatternContext context() {
    Tracer tracer = Tracers.empty();
    tracer = Tracers.withOnLower(tracer,
        (pat, result) -> events.add("lower " + pat + " -> " + result));
    tracer = Tracers.withOnDeref(tracer,
        (pat, type) -> events.add("deref " + pat + " : " + type));
    tracer = Tracers.withOnDiagnostic(tracer,
        e -> events.add("diagnostic " + e.kind));
    tracer = Tracers.withOnConstFallback(tracer,
        (node, e) -> events.add("fallback " + node + " " + e.kind));
    PatternContext cx =
        PatternContext.of(typeSystem, typeck.build(), evaluator)
            .withDiagnostics(diagnostics)
            .withTracer(tracer)
            .withGenericArgs(genericArgs.toArray(new Type[0]));
    for (Map.Entry<Prop, Object> entry : props.entrySet()) {
      cx = cx.withProp(entry.getKey(), entry.getValue());
    }
    return cx;
  }

  /** Lowers a pattern. */
  Core.Pat lower(Ast.Pat pat) {
    return PatternLowerer.lower(context(), pat);
  }
}

// End Fixture.java
