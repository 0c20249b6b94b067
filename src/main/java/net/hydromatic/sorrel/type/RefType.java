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

import java.util.Objects;
import java.util.function.UnaryOperator;
import net.hydromatic.sorrel.ast.Op;

/** Reference type, {@code &T} or {@code &mut T}. */
public class RefType extends BaseType {
  public final Type referent;
  public final Mutability mutability;

  RefType(Type referent, Mutability mutability) {
    super(Op.REF_TYPE);
    this.referent = requireNonNull(referent);
    this.mutability = requireNonNull(mutability);
  }

  @Override
  public StringBuilder describe(StringBuilder buf) {
    buf.append('&').append(mutability.prefix);
    return referent.describe(buf);
  }

  @Override
  public Type copy(TypeSystem typeSystem, UnaryOperator<Type> transform) {
    final Type referent2 = transform.apply(referent);
    return referent2 == referent ? this
        : typeSystem.refType(referent2, mutability);
  }

  @Override
  public int hashCode() {
    return Objects.hash(referent, mutability);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof RefType
        && referent.equals(((RefType) o).referent)
        && mutability == ((RefType) o).mutability;
  }
}

// End RefType.java
