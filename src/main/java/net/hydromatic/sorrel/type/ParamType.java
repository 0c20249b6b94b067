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

import java.util.List;
import java.util.function.UnaryOperator;
import net.hydromatic.sorrel.ast.Op;

/** Generic type parameter, such as {@code T} in {@code Option<T>}.
 *
 * <p>Parameters are numbered within their definition; substitution
 * replaces parameter {@code i} with the {@code i}th generic argument. */
public class ParamType extends BaseType {
  public final int ordinal;
  public final String name;

  ParamType(int ordinal, String name) {
    super(Op.PARAM_TYPE);
    this.ordinal = ordinal;
    this.name = requireNonNull(name);
  }

  @Override
  public StringBuilder describe(StringBuilder buf) {
    return buf.append(name);
  }

  @Override
  public Type copy(TypeSystem typeSystem, UnaryOperator<Type> transform) {
    return this;
  }

  @Override
  public Type substitute(TypeSystem typeSystem, List<? extends Type> types) {
    return ordinal < types.size() ? types.get(ordinal) : this;
  }

  @Override
  public int hashCode() {
    return ordinal * 37 + name.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof ParamType
        && ordinal == ((ParamType) o).ordinal
        && name.equals(((ParamType) o).name);
  }
}

// End ParamType.java
