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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/** A type as the user wrote it, in a path or an annotation, before
 * inference filled in the gaps.
 *
 * <p>For example, the path in {@code Foo::<u8>::BAR} has a user type
 * that refers to {@code Foo} with explicit arguments {@code [u8]}.
 * Arguments the user omitted are null. */
public class UserType {
  /** The definition the user named, or null if the user wrote a type
   * directly (see {@link #type}). */
  public final @Nullable DefId def;
  /** Generic arguments as written; null elements are inferred. */
  public final List<@Nullable Type> args;
  /** The type, if the user wrote a type rather than a path. */
  public final @Nullable Type type;

  private UserType(@Nullable DefId def, List<@Nullable Type> args,
      @Nullable Type type) {
    this.def = def;
    this.args = requireNonNull(args);
    this.type = type;
  }

  /** Creates a user type that names a definition, with some explicit
   * generic arguments. */
  public static UserType of(DefId def, List<@Nullable Type> args) {
    // ImmutableList does not allow nulls
    return new UserType(def,
        Collections.unmodifiableList(new ArrayList<>(args)), null);
  }

  /** Creates a user type that was written as a type. */
  public static UserType of(Type type) {
    return new UserType(null, ImmutableList.of(), type);
  }

  @Override
  public int hashCode() {
    return Objects.hash(def, args, type);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof UserType
        && Objects.equals(def, ((UserType) o).def)
        && args.equals(((UserType) o).args)
        && Objects.equals(type, ((UserType) o).type);
  }

  @Override
  public String toString() {
    if (type != null) {
      return type.moniker();
    }
    final StringBuilder b = new StringBuilder();
    b.append(requireNonNull(def).path);
    if (!args.isEmpty()) {
      b.append("::<");
      for (int i = 0; i < args.size(); i++) {
        final Type arg = args.get(i);
        b.append(i == 0 ? "" : ", ").append(arg == null ? "_" : arg.moniker());
      }
      b.append('>');
    }
    return b.toString();
  }
}

// End UserType.java
