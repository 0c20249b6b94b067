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
package net.hydromatic.sorrel.type;

import java.util.List;
import java.util.function.UnaryOperator;
import net.hydromatic.sorrel.ast.Op;

/** Type. */
public interface Type {
  /** Type operator. */
  Op op();

  /**
   * Writes the name of this type in the source language to a string builder,
   * e.g. "{@code &mut [u8]}", "{@code Option<i32>}".
   */
  StringBuilder describe(StringBuilder buf);

  /** Returns the name of this type in the source language. */
  default String moniker() {
    return describe(new StringBuilder()).toString();
  }

  /**
   * Copies this type, applying a given transform to component types, and
   * returning the original type if the component types are unchanged.
   */
  Type copy(TypeSystem typeSystem, UnaryOperator<Type> transform);

  /**
   * Returns a copy of this type, specialized by substituting generic
   * parameters.
   */
  default Type substitute(TypeSystem typeSystem, List<? extends Type> types) {
    if (types.isEmpty()) {
      return this;
    }
    return copy(typeSystem, t -> t.substitute(typeSystem, types));
  }

  /** Whether this is the error type. */
  default boolean isError() {
    return false;
  }
}

// End Type.java
