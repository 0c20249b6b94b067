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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import net.hydromatic.sorrel.ast.Ast;
import net.hydromatic.sorrel.ast.Pos;
import net.hydromatic.sorrel.compile.ErrorKind;
import net.hydromatic.sorrel.compile.PatternContext;
import net.hydromatic.sorrel.type.DefId;
import net.hydromatic.sorrel.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Constant evaluator for tests. Each constant's value (or failure) is
 * registered in advance; the evaluator records what it is asked to
 * evaluate. */
public class StubEvaluator implements ConstEvaluator {
  private final Map<DefId, Object> values = new HashMap<>();
  private final Map<DefId, EvalException> failures = new HashMap<>();
  private final Set<DefId> unresolved = new HashSet<>();

  /** Constants that were evaluated, in order. */
  public final List<ConstId> evaluated = new ArrayList<>();
  /** Literals that were converted, in order. */
  public final List<Ast.Literal> literals = new ArrayList<>();

  /** Registers a constant that has a structured value. */
  public StubEvaluator valTree(DefId def, ValTree valTree) {
    values.put(def, valTree);
    return this;
  }

  /** Registers a constant that has only an opaque value. */
  public StubEvaluator value(DefId def, ConstValue value) {
    values.put(def, value);
    return this;
  }

  /** Registers a constant whose evaluation fails. */
  public StubEvaluator failure(DefId def, EvalException.Kind kind) {
    values.put(def, kind);
    return this;
  }

  /** Registers an associated constant that has no implementation. */
  public StubEvaluator unresolved(DefId def) {
    unresolved.add(def);
    return this;
  }

  @Override
  public @Nullable ConstId resolveInstance(PatternContext cx, DefId def,
      List<Type> args) {
    if (unresolved.contains(def)) {
      return null;
    }
    return new ConstId(def, args);
  }

  @Override
  public @Nullable ValTree evalToValTree(PatternContext cx, ConstId id,
      Pos span) {
    evaluated.add(id);
    final Object value = lookup(cx, id, span);
    return value instanceof ValTree ? (ValTree) value : null;
  }

  @Override
  public ConstValue evalToValue(PatternContext cx, ConstId id, Pos span) {
    final Object value = lookup(cx, id, span);
    if (value instanceof ConstValue) {
      return (ConstValue) value;
    }
    throw new AssertionError("no opaque value for " + id);
  }

  @Override
  public Const litToConst(PatternContext cx, Ast.Literal literal, Type type,
      boolean negated) {
    literals.add(literal);
    return ConstEvaluator.super.litToConst(cx, literal, type, negated);
  }

  /** Returns the value of a constant, or throws its failure. A failure is
   * created, and if necessary reported, only once. */
  private Object lookup(PatternContext cx, ConstId id, Pos span) {
    final Object value = values.get(id.def);
    if (value == null) {
      throw failure(id.def,
          () -> EvalException.reported(
              cx.emit(ErrorKind.CONST_EVAL_FAILED, span,
                  "evaluation of constant value failed")));
    }
    if (value instanceof EvalException.Kind) {
      switch ((EvalException.Kind) value) {
      case TOO_GENERIC:
        throw failure(id.def, () -> EvalException.tooGeneric(id.toString()));
      case REPORTED:
        throw failure(id.def,
            () -> EvalException.reported(
                cx.emit(ErrorKind.CONST_EVAL_FAILED, span,
                    "evaluation of constant value failed")));
      default:
        throw failure(id.def, () -> EvalException.typeError(id.toString()));
      }
    }
    return value;
  }

  private EvalException failure(DefId def,
      Supplier<EvalException> supplier) {
    return failures.computeIfAbsent(def, d -> supplier.get());
  }
}

// End StubEvaluator.java
