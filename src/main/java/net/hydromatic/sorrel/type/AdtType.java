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

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;
import net.hydromatic.sorrel.ast.Op;

/** Application of an algebraic data type (struct, enum or union) to
 * generic arguments, e.g. {@code Option<i32>}. */
public class AdtType extends BaseType {
  public final AdtDef adtDef;
  public final List<Type> args;

  AdtType(AdtDef adtDef, List<? extends Type> args) {
    super(Op.ADT_TYPE);
    this.adtDef = requireNonNull(adtDef);
    this.args = ImmutableList.copyOf(args);
    checkArgument(this.args.size() == adtDef.typeParams.size(),
        "%s expects %s generic arguments, got %s", adtDef,
        adtDef.typeParams.size(), this.args.size());
  }

  @Override
  public StringBuilder describe(StringBuilder buf) {
    buf.append(adtDef.def.name());
    if (!args.isEmpty()) {
      buf.append('<');
      for (int i = 0; i < args.size(); i++) {
        args.get(i).describe(buf.append(i == 0 ? "" : ", "));
      }
      buf.append('>');
    }
    return buf;
  }

  @Override
  public Type copy(TypeSystem typeSystem, UnaryOperator<Type> transform) {
    int differenceCount = 0;
    final ImmutableList.Builder<Type> args2 = ImmutableList.builder();
    for (Type arg : args) {
      final Type arg2 = transform.apply(arg);
      if (arg != arg2) {
        ++differenceCount;
      }
      args2.add(arg2);
    }
    return differenceCount == 0 ? this
        : typeSystem.adtType(adtDef, args2.build());
  }

  /** Returns the type of a field of a variant of this type, with generic
   * parameters replaced by this type's arguments. */
  public Type fieldType(TypeSystem typeSystem, int variantIndex,
      int field) {
    return adtDef.variants.get(variantIndex).fields.get(field).type
        .substitute(typeSystem, args);
  }

  @Override
  public int hashCode() {
    return Objects.hash(adtDef.def, args);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof AdtType
        && adtDef.def.equals(((AdtType) o).adtDef.def)
        && args.equals(((AdtType) o).args);
  }
}

// End AdtType.java
