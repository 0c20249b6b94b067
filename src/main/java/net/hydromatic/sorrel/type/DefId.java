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

/** Identity of a definition, such as a struct, an enum variant or a
 * constant.
 *
 * <p>Definitions are created by, and numbered within, a
 * {@link TypeSystem}. */
public class DefId implements Comparable<DefId> {
  public final int index;
  public final DefKind kind;
  /** Path of the definition, e.g. "{@code Option::Some}". */
  public final String path;

  DefId(int index, DefKind kind, String path) {
    this.index = index;
    this.kind = requireNonNull(kind);
    this.path = requireNonNull(path);
  }

  @Override
  public String toString() {
    return path;
  }

  @Override
  public int hashCode() {
    return index;
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof DefId
        && index == ((DefId) o).index
        && path.equals(((DefId) o).path);
  }

  @Override
  public int compareTo(DefId o) {
    return Integer.compare(index, o.index);
  }

  /** Returns the last segment of the path, e.g. "{@code Some}". */
  public String name() {
    final int i = path.lastIndexOf("::");
    return i < 0 ? path : path.substring(i + 2);
  }
}

// End DefId.java
