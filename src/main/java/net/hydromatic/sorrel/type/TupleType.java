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

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.UnaryOperator;
import net.hydromatic.sorrel.ast.Op;

/** The type of a tuple value. */
public class TupleType extends BaseType {
  public final List<Type> argTypes;

  TupleType(List<? extends Type> argTypes) {
    super(Op.TUPLE_TYPE);
    this.argTypes = ImmutableList.copyOf(argTypes);
  }

  @Override
  public StringBuilder describe(StringBuilder buf) {
    buf.append('(');
    for (int i = 0; i < argTypes.size(); i++) {
      argTypes.get(i).describe(buf.append(i == 0 ? "" : ", "));
    }
    // A 1-tuple is written "(T,)"
    return buf.append(argTypes.size() == 1 ? ",)" : ")");
  }

  @Override
  public TupleType copy(TypeSystem typeSystem, UnaryOperator<Type> transform) {
    int differenceCount = 0;
    final ImmutableList.Builder<Type> argTypes2 = ImmutableList.builder();
    for (Type argType : argTypes) {
      final Type argType2 = transform.apply(argType);
      if (argType != argType2) {
        ++differenceCount;
      }
      argTypes2.add(argType2);
    }
    return differenceCount == 0 ? this
        : typeSystem.tupleType(argTypes2.build());
  }

  @Override
  public int hashCode() {
    return argTypes.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof TupleType
        && argTypes.equals(((TupleType) o).argTypes);
  }
}

// End TupleType.java
