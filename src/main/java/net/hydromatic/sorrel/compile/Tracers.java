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

import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.sorrel.ast.Ast;
import net.hydromatic.sorrel.ast.AstNode;
import net.hydromatic.sorrel.ast.Core;
import net.hydromatic.sorrel.eval.EvalException;
import net.hydromatic.sorrel.type.Type;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on each lowered
   * pattern, then calls the underlying tracer. */
  public static Tracer withOnLower(Tracer tracer,
      BiConsumer<Ast.Pat, Core.Pat> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onLower(Ast.Pat pat, Core.Pat result) {
        consumer.accept(pat, result);
        super.onLower(pat, result);
      }
    };
  }

  /** Returns a tracer that performs the given action on each implicit
   * dereference, then calls the underlying tracer. */
  public static Tracer withOnDeref(Tracer tracer,
      BiConsumer<Core.Pat, Type> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onDeref(Core.Pat pat, Type type) {
        consumer.accept(pat, type);
        super.onDeref(pat, type);
      }
    };
  }

  public static Tracer withOnDiagnostic(Tracer tracer,
      Consumer<CompileException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onDiagnostic(CompileException e) {
        consumer.accept(e);
        super.onDiagnostic(e);
      }
    };
  }

  public static Tracer withOnConstFallback(Tracer tracer,
      BiConsumer<AstNode, EvalException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onConstFallback(AstNode node, EvalException e) {
        consumer.accept(node, e);
        super.onConstFallback(node, e);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onLower(Ast.Pat pat, Core.Pat result) {
    }

    @Override public void onDeref(Core.Pat pat, Type type) {
    }

    @Override public void onDiagnostic(CompileException e) {
    }

    @Override public void onConstFallback(AstNode node, EvalException e) {
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override public void onLower(Ast.Pat pat, Core.Pat result) {
      tracer.onLower(pat, result);
    }

    @Override public void onDeref(Core.Pat pat, Type type) {
      tracer.onDeref(pat, type);
    }

    @Override public void onDiagnostic(CompileException e) {
      tracer.onDiagnostic(e);
    }

    @Override public void onConstFallback(AstNode node, EvalException e) {
      tracer.onConstFallback(node, e);
    }
  }
}

// End Tracers.java
