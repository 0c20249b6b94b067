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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.Objects;
import java.util.function.UnaryOperator;
import net.hydromatic.sorrel.ast.Op;

/** Fixed-length array type, {@code [T; n]}. */
public class ArrayType extends BaseType {
  public final Type elementType;
  public final long length;

  ArrayType(Type elementType, long length) {
    super(Op.ARRAY_TYPE);
    this.elementType = requireNonNull(elementType);
    this.length = length;
    checkArgument(length >= 0, "negative array length %s", length);
  }

  @Override
  public StringBuilder describe(StringBuilder buf) {
    buf.append('[');
    return elementType.describe(buf).append("; ").append(length).append(']');
  }

  @Override
  public Type copy(TypeSystem typeSystem, UnaryOperator<Type> transform) {
    final Type elementType2 = transform.apply(elementType);
    return elementType2 == elementType ? this
        : typeSystem.arrayType(elementType2, length);
  }

  @Override
  public int hashCode() {
    return Objects.hash(elementType, length);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof ArrayType
        && elementType.equals(((ArrayType) o).elementType)
        && length == ((ArrayType) o).length;
  }
}

// End ArrayType.java
