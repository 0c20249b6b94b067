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

import static java.util.Objects.requireNonNull;

import java.util.function.UnaryOperator;
import net.hydromatic.sorrel.ast.Op;
import net.hydromatic.sorrel.compile.CompileException;

/** Type of an expression or pattern that failed to type-check.
 *
 * <p>Holds the diagnostic that was reported, so that code that encounters
 * the type can produce an error node without reporting again. */
public class ErrorType extends BaseType {
  public final CompileException error;

  ErrorType(CompileException error) {
    super(Op.ERROR_TYPE);
    this.error = requireNonNull(error);
  }

  @Override
  public StringBuilder describe(StringBuilder buf) {
    return buf.append("{type error}");
  }

  @Override
  public Type copy(TypeSystem typeSystem, UnaryOperator<Type> transform) {
    return this;
  }

  @Override
  public boolean isError() {
    return true;
  }

  @Override
  public int hashCode() {
    return error.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof ErrorType && error == ((ErrorType) o).error;
  }
}

// End ErrorType.java
