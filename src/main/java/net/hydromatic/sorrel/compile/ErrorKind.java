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

import org.checkerframework.checker.nullness.qual.Nullable;

/** Kind of error that can occur while lowering a pattern.
 *
 * <p>All kinds are recoverable: lowering replaces the offending pattern
 * with an error node and carries on. */
public enum ErrorKind {
  /** An inclusive range such as {@code 5..=1} whose lower bound is greater
   * than its upper bound. */
  RANGE_INCLUSIVE_EMPTY(Family.MALFORMED_RANGE, "E0030"),
  /** An exclusive range such as {@code 5..5} whose lower bound is not less
   * than its upper bound. */
  RANGE_EXCLUSIVE_EMPTY(Family.MALFORMED_RANGE, "E0579"),
  /** A literal range bound, such as {@code 300u8}, that is out of range for
   * its type. */
  LITERAL_OVERFLOW(Family.MALFORMED_RANGE, null),
  CONST_PARAM_IN_PATTERN(Family.UNRESOLVABLE_PATTERN_PATH, "E0158"),
  STATIC_IN_PATTERN(Family.UNRESOLVABLE_PATTERN_PATH, "E0530"),
  NON_CONST_PATH(Family.UNRESOLVABLE_PATTERN_PATH, "E0532"),
  /** An associated constant with no implementation for the given generic
   * arguments. */
  ASSOC_CONST_UNRESOLVED(Family.ASSOCIATED_CONSTANT_UNRESOLVED, null),
  CONST_EVAL_TOO_GENERIC(Family.CONSTANT_EVALUATION_TOO_GENERIC, "E0158"),
  CONST_EVAL_FAILED(Family.CONSTANT_EVALUATION_FAILED, null),
  /** A literal that cannot be converted to a constant, such as a
   * malformed floating-point number. */
  INVALID_LITERAL(Family.CONSTANT_EVALUATION_FAILED, null),
  /** An internal error that should have been preceded by another error; if
   * it was not, it indicates a bug in the compiler. */
  DELAYED_BUG(Family.INTERNAL, null);

  public final Family family;
  /** Error code, e.g. "E0030", or null. */
  public final @Nullable String code;

  ErrorKind(Family family, @Nullable String code) {
    this.family = family;
    this.code = code;
  }

  /** Family of related error kinds. */
  public enum Family {
    MALFORMED_RANGE,
    UNRESOLVABLE_PATTERN_PATH,
    ASSOCIATED_CONSTANT_UNRESOLVED,
    CONSTANT_EVALUATION_TOO_GENERIC,
    CONSTANT_EVALUATION_FAILED,
    INTERNAL
  }
}

// End ErrorKind.java
