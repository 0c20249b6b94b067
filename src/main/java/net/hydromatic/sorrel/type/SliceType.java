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

/** Slice type, {@code [T]}. */
public class SliceType extends BaseType {
  public final Type elementType;

  SliceType(Type elementType) {
    super(Op.SLICE_TYPE);
    this.elementType = requireNonNull(elementType);
  }

  @Override
  public StringBuilder describe(StringBuilder buf) {
    buf.append('[');
    return elementType.describe(buf).append(']');
  }

  @Override
  public Type copy(TypeSystem typeSystem, UnaryOperator<Type> transform) {
    final Type elementType2 = transform.apply(elementType);
    return elementType2 == elementType ? this
        : typeSystem.sliceType(elementType2);
  }

  @Override
  public int hashCode() {
    return elementType.hashCode() * 31 + 11;
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof SliceType
        && elementType.equals(((SliceType) o).elementType);
  }
}

// End SliceType.java
