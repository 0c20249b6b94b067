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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.sorrel.ast.Pos;
import net.hydromatic.sorrel.eval.ConstEvaluator;
import net.hydromatic.sorrel.type.Type;
import net.hydromatic.sorrel.type.TypeSystem;

/** Everything that lowering a pattern needs to know about its
 * environment.
 *
 * <p>A context is immutable; the "with" methods return a modified copy. The
 * only mutable object it refers to is the {@link Diagnostics} sink. */
public class PatternContext {
  public final TypeSystem typeSystem;
  public final TypeckResults typeckResults;
  public final ConstEvaluator evaluator;
  public final ConstToPat constToPat;
  public final Diagnostics diagnostics;
  public final Tracer tracer;
  public final ImmutableMap<Prop, Object> props;
  /** Generic arguments of the item that contains the patterns. */
  public final ImmutableList<Type> genericArgs;

  private PatternContext(TypeSystem typeSystem, TypeckResults typeckResults,
      ConstEvaluator evaluator, ConstToPat constToPat,
      Diagnostics diagnostics, Tracer tracer, Map<Prop, Object> props,
      List<Type> genericArgs) {
    this.typeSystem = requireNonNull(typeSystem);
    this.typeckResults = requireNonNull(typeckResults);
    this.evaluator = requireNonNull(evaluator);
    this.constToPat = requireNonNull(constToPat);
    this.diagnostics = requireNonNull(diagnostics);
    this.tracer = requireNonNull(tracer);
    this.props = ImmutableMap.copyOf(props);
    this.genericArgs = ImmutableList.copyOf(genericArgs);
  }

  /** Creates a context with a new diagnostics sink, no tracing, default
   * properties, the default constant decomposer, and no generic
   * arguments. */
  public static PatternContext of(TypeSystem typeSystem,
      TypeckResults typeckResults, ConstEvaluator evaluator) {
    return new PatternContext(typeSystem, typeckResults, evaluator,
        ConstToPats.DEFAULT, new Diagnostics(), Tracers.empty(),
        ImmutableMap.of(), ImmutableList.of());
  }

  public PatternContext withConstToPat(ConstToPat constToPat) {
    return new PatternContext(typeSystem, typeckResults, evaluator,
        constToPat, diagnostics, tracer, props, genericArgs);
  }

  public PatternContext withDiagnostics(Diagnostics diagnostics) {
    return new PatternContext(typeSystem, typeckResults, evaluator,
        constToPat, diagnostics, tracer, props, genericArgs);
  }

  public PatternContext withTracer(Tracer tracer) {
    return new PatternContext(typeSystem, typeckResults, evaluator,
        constToPat, diagnostics, tracer, props, genericArgs);
  }

  /** Returns a context with a property set. The value is validated as by
   * {@link Prop#setLenient}. */
  public PatternContext withProp(Prop prop, Object value) {
    final Map<Prop, Object> map = new LinkedHashMap<>(props);
    prop.setLenient(map, value);
    return new PatternContext(typeSystem, typeckResults, evaluator,
        constToPat, diagnostics, tracer, map, genericArgs);
  }

  public PatternContext withGenericArgs(Type... genericArgs) {
    return new PatternContext(typeSystem, typeckResults, evaluator,
        constToPat, diagnostics, tracer, props, Arrays.asList(genericArgs));
  }

  /** Returns the value of a boolean property. */
  public boolean is(Prop prop) {
    return prop.booleanValue(props);
  }

  /** Emits a diagnostic, and returns it so that the caller can store it in
   * an error node. */
  public CompileException emit(ErrorKind kind, Pos pos, String message,
      String... notes) {
    final CompileException e =
        new CompileException(kind, message, pos, Arrays.asList(notes));
    diagnostics.add(e);
    tracer.onDiagnostic(e);
    return e;
  }

  /** Emits an internal error that does not abort lowering.
   *
   * @throws AssertionError if {@link Prop#DELAYED_BUGS_FATAL} is set */
  public CompileException delayBug(Pos pos, String message) {
    final CompileException e = emit(ErrorKind.DELAYED_BUG, pos, message);
    if (is(Prop.DELAYED_BUGS_FATAL)) {
      throw new AssertionError(message, e);
    }
    return e;
  }
}

// End PatternContext.java
