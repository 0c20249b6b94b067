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
package net.hydromatic.sorrel.eval;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import net.hydromatic.sorrel.type.DefId;
import net.hydromatic.sorrel.type.Type;

/** Identity of a constant to be evaluated: a definition (a constant, an
 * implementation of an associated constant, or an inline constant block)
 * together with its generic arguments. */
public class ConstId {
  public final DefId def;
  public final List<Type> args;

  public ConstId(DefId def, List<? extends Type> args) {
    this.def = requireNonNull(def);
    this.args = ImmutableList.copyOf(args);
  }

  @Override
  public int hashCode() {
    return Objects.hash(def, args);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof ConstId
        && def.equals(((ConstId) o).def)
        && args.equals(((ConstId) o).args);
  }

  @Override
  public String toString() {
    if (args.isEmpty()) {
      return def.path;
    }
    final StringBuilder b = new StringBuilder(def.path).append("::<");
    for (int i = 0; i < args.size(); i++) {
      args.get(i).describe(b.append(i == 0 ? "" : ", "));
    }
    return b.append('>').toString();
  }
}

// End ConstId.java
