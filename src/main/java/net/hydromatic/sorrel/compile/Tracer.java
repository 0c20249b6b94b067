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

import net.hydromatic.sorrel.ast.Ast;
import net.hydromatic.sorrel.ast.AstNode;
import net.hydromatic.sorrel.ast.Core;
import net.hydromatic.sorrel.eval.EvalException;
import net.hydromatic.sorrel.type.Type;

/** Called on various events during pattern lowering.
 *
 * @see Tracers */
public interface Tracer {
  /** Called when a surface pattern has been lowered, with the result
   * (including implicit dereferences). */
  void onLower(Ast.Pat pat, Core.Pat result);

  /** Called when a pattern is wrapped in an implicit dereference of a value
   * of type {@code type}. */
  void onDeref(Core.Pat pat, Type type);

  /** Called when a diagnostic or delayed bug is emitted. */
  void onDiagnostic(CompileException e);

  /** Called when an attempt to evaluate a constant fails and lowering falls
   * back to another strategy; for example, when the literal fast path for
   * an inline constant fails, or when a constant has no structured
   * value. */
  void onConstFallback(AstNode node, EvalException e);
}

// End Tracer.java
