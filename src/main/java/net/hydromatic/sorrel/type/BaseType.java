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

import net.hydromatic.sorrel.ast.Op;

/** Abstract implementation of Type.
 *
 * <p>Sub-classes implement {@link #equals} and {@link #hashCode}
 * structurally, so that two types created independently are equal if they
 * have the same structure. {@link TypeSystem} interns them too. */
abstract class BaseType implements Type {
  final Op op;

  protected BaseType(Op op) {
    this.op = requireNonNull(op);
  }

  @Override
  public Op op() {
    return op;
  }

  @Override
  public String toString() {
    return moniker();
  }
}

// End BaseType.java
