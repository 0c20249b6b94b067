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

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.sorrel.ast.Core;
import net.hydromatic.sorrel.ast.Shuttle;
import net.hydromatic.sorrel.ast.Visitor;

/** Utilities for {@link Core.Pat lowered patterns}. */
public abstract class Patterns {
  private Patterns() {}

  /** Removes type ascriptions from a pattern. Exhaustiveness checking
   * needs only the structure of a pattern, and ascriptions have been
   * checked by then. */
  public static Core.Pat eraseAscriptions(Core.Pat pat) {
    return pat.accept(AscriptionEraser.INSTANCE);
  }

  /** Returns the errors held by the error patterns in a pattern, in
   * pre-order. */
  public static List<CompileException> errors(Core.Pat pat) {
    final ErrorCollector collector = new ErrorCollector();
    pat.accept(collector);
    return collector.errors.build();
  }

  /** Returns whether a pattern contains no error patterns. */
  public static boolean isValid(Core.Pat pat) {
    return errors(pat).isEmpty();
  }

  /** Shuttle that replaces each ascription with its sub-pattern. */
  private static class AscriptionEraser extends Shuttle {
    static final AscriptionEraser INSTANCE = new AscriptionEraser();

    @Override protected Core.Pat visit(
        Core.AscribeUserTypePat ascribeUserTypePat) {
      return ascribeUserTypePat.pat.accept(this);
    }
  }

  /** Visitor that collects errors. */
  private static class ErrorCollector extends Visitor {
    final ImmutableList.Builder<CompileException> errors =
        ImmutableList.builder();

    @Override protected void visit(Core.ErrorPat errorPat) {
      errors.add(errorPat.error);
    }
  }
}

// End Patterns.java
