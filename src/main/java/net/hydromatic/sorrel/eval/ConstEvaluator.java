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

import java.util.List;
import net.hydromatic.sorrel.ast.Ast;
import net.hydromatic.sorrel.ast.Pos;
import net.hydromatic.sorrel.compile.PatternContext;
import net.hydromatic.sorrel.type.DefId;
import net.hydromatic.sorrel.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Evaluates constants.
 *
 * <p>Pattern lowering calls an evaluator whenever a pattern refers to a
 * constant: a named constant, an associated constant, an inline constant
 * block, or a literal. Evaluation itself belongs to another phase of the
 * compiler; this interface is its boundary.
 *
 * <p>Methods may throw {@link EvalException}. An evaluator that reports an
 * error must emit it via {@link PatternContext#emit} and then throw
 * {@link EvalException#reported}, so that the error is reported exactly
 * once.
 */
public interface ConstEvaluator {
  /**
   * Resolves a constant or associated constant, with generic arguments, to
   * the constant that implements it.
   *
   * @return the constant, or null if there is no implementation for these
   * arguments (possible only for associated constants)
   * @throws EvalException if resolution fails
   */
  @Nullable ConstId resolveInstance(PatternContext cx, DefId def,
      List<Type> args);

  /**
   * Evaluates a constant to a structured value.
   *
   * @return the value, or null if the constant's type has no structured
   * representation, in which case the caller should call
   * {@link #evalToValue}
   * @throws EvalException if evaluation fails
   */
  @Nullable ValTree evalToValTree(PatternContext cx, ConstId id, Pos span);

  /**
   * Evaluates a constant to an opaque value.
   *
   * @throws EvalException if evaluation fails
   */
  ConstValue evalToValue(PatternContext cx, ConstId id, Pos span);

  /**
   * Converts a literal to a constant of a given type. If {@code negated},
   * the literal was preceded by "{@code -}".
   *
   * @throws EvalException of kind {@link EvalException.Kind#REPORTED} or
   * {@link EvalException.Kind#TYPE_ERROR}
   */
  default Const litToConst(PatternContext cx, Ast.Literal literal, Type type,
      boolean negated) {
    return LitToConst.convert(cx, literal, type, negated);
  }
}

// End ConstEvaluator.java
