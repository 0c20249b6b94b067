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
package net.hydromatic.sorrel.compile;

import static java.util.Objects.requireNonNull;

import java.util.Objects;
import net.hydromatic.sorrel.type.DefId;
import net.hydromatic.sorrel.type.DefKind;
import org.checkerframework.checker.nullness.qual.Nullable;

/** What a path in a pattern resolves to, as determined by name
 * resolution. */
public class Res {
  private static final Res SELF_TY_PARAM = new Res(Kind.SELF_TY_PARAM, null);
  private static final Res SELF_TY_ALIAS = new Res(Kind.SELF_TY_ALIAS, null);
  private static final Res SELF_CTOR = new Res(Kind.SELF_CTOR, null);
  private static final Res LOCAL = new Res(Kind.LOCAL, null);
  private static final Res ERR = new Res(Kind.ERR, null);

  public final Kind kind;
  /** The definition, if {@link #kind} is {@link Kind#DEF}. */
  public final @Nullable DefId def;

  private Res(Kind kind, @Nullable DefId def) {
    this.kind = requireNonNull(kind);
    this.def = def;
  }

  /** Resolution to a definition. */
  public static Res def(DefId def) {
    return new Res(Kind.DEF, requireNonNull(def));
  }

  /** Resolution to "{@code Self}" in a trait. */
  public static Res selfTyParam() {
    return SELF_TY_PARAM;
  }

  /** Resolution to "{@code Self}" in an impl. */
  public static Res selfTyAlias() {
    return SELF_TY_ALIAS;
  }

  /** Resolution to the constructor "{@code Self}" of a tuple or unit
   * struct. */
  public static Res selfCtor() {
    return SELF_CTOR;
  }

  /** Resolution to a local variable. */
  public static Res local() {
    return LOCAL;
  }

  /** Failed resolution; an error has already been reported. */
  public static Res err() {
    return ERR;
  }

  /** Returns the kind of the definition, or null if this is not a
   * definition. */
  public @Nullable DefKind defKind() {
    return def == null ? null : def.kind;
  }

  @Override public int hashCode() {
    return Objects.hash(kind, def);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Res
        && kind == ((Res) o).kind
        && Objects.equals(def, ((Res) o).def);
  }

  @Override public String toString() {
    return def == null ? kind.toString() : kind + "(" + def + ")";
  }

  /** Kind of resolution. */
  public enum Kind {
    DEF,
    SELF_TY_PARAM,
    SELF_TY_ALIAS,
    SELF_CTOR,
    LOCAL,
    ERR
  }
}

// End Res.java
