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

import static java.util.Objects.requireNonNull;

import net.hydromatic.sorrel.compile.CompileException;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Failure of constant evaluation or of converting a literal to a
 * constant. */
public class EvalException extends RuntimeException {
  public final Kind kind;
  /** The diagnostic, if {@link #kind} is {@link Kind#REPORTED}. */
  public final @Nullable CompileException error;

  private EvalException(Kind kind, String message,
      @Nullable CompileException error) {
    super(message, error);
    this.kind = requireNonNull(kind);
    this.error = error;
  }

  /** Creates an exception indicating that the value depends on generic
   * parameters that are not yet known. */
  public static EvalException tooGeneric(String message) {
    return new EvalException(Kind.TOO_GENERIC, message, null);
  }

  /** Creates an exception for an error that has already been emitted. */
  public static EvalException reported(CompileException error) {
    return new EvalException(Kind.REPORTED, requireNonNull(error).getMessage(),
        error);
  }

  /** Creates an exception indicating that a literal does not match the
   * type inferred for it. Type checking should have prevented this. */
  public static EvalException typeError(String message) {
    return new EvalException(Kind.TYPE_ERROR, message, null);
  }

  /** Returns the diagnostic of a {@link Kind#REPORTED} exception. */
  public CompileException reportedError() {
    if (error == null) {
      throw new IllegalStateException("not reported: " + kind);
    }
    return error;
  }

  /** Kind of evaluation failure. */
  public enum Kind {
    /** The value depends on a generic parameter. */
    TOO_GENERIC,
    /** An error was reported; {@link #error} holds it. */
    REPORTED,
    /** The literal does not match its type. */
    TYPE_ERROR
  }
}

// End EvalException.java
