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

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import net.hydromatic.sorrel.compile.CompileException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A collection of types and the definitions they refer to.
 *
 * <p>Compound types are interned, so a type that is created twice is the
 * same object. (Types also implement structural equality, so callers need
 * not rely on interning.)
 *
 * <p>Definitions form a tree: an enum variant's parent is the enum, a
 * variant constructor's parent is the variant, a struct constructor's
 * parent is the struct.
 */
public class TypeSystem {
  private final Map<Type, Type> typeByType = new ConcurrentHashMap<>();
  private final List<DefId> defs = new CopyOnWriteArrayList<>();
  private final Map<DefId, DefId> parents = new ConcurrentHashMap<>();
  private final Map<DefId, AdtDef> adtDefs = new ConcurrentHashMap<>();

  /** Creates a definition with no parent. */
  public DefId def(DefKind kind, String path) {
    return def(kind, path, null);
  }

  /** Creates a definition. */
  public synchronized DefId def(DefKind kind, String path,
      @Nullable DefId parent) {
    final DefId def = new DefId(defs.size(), kind, path);
    defs.add(def);
    if (parent != null) {
      parents.put(def, parent);
    }
    return def;
  }

  /** Returns the parent of a definition, or throws if it has none. */
  public DefId parent(DefId def) {
    final DefId parent = parents.get(def);
    if (parent == null) {
      throw new IllegalArgumentException("definition " + def
          + " has no parent");
    }
    return parent;
  }

  /** Starts building an algebraic data type. */
  public AdtDef.Builder adt(AdtDef.Kind kind, String path,
      String... typeParams) {
    return new AdtDef.Builder(this, kind, def(kind.defKind, path),
        ImmutableList.copyOf(typeParams));
  }

  void register(AdtDef adtDef) {
    checkArgument(adtDefs.putIfAbsent(adtDef.def, adtDef) == null,
        "duplicate definition %s", adtDef.def);
  }

  /** Returns the definition of a struct, enum or union. */
  public AdtDef adtDef(DefId def) {
    final AdtDef adtDef = adtDefs.get(def);
    if (adtDef == null) {
      throw new IllegalArgumentException("not an algebraic data type: "
          + def);
    }
    return adtDef;
  }

  @SuppressWarnings("unchecked")
  private <T extends Type> T intern(T type) {
    return (T) typeByType.computeIfAbsent(type, t -> t);
  }

  /** Creates a shared reference type, {@code &T}. */
  public RefType refType(Type referent) {
    return refType(referent, Mutability.NOT);
  }

  /** Creates a reference type. */
  public RefType refType(Type referent, Mutability mutability) {
    return intern(new RefType(referent, mutability));
  }

  /** Creates a box type, {@code Box<T>}. */
  public BoxType boxType(Type elementType) {
    return intern(new BoxType(elementType));
  }

  /** Creates a slice type, {@code [T]}. */
  public SliceType sliceType(Type elementType) {
    return intern(new SliceType(elementType));
  }

  /** Creates an array type, {@code [T; n]}. */
  public ArrayType arrayType(Type elementType, long length) {
    return intern(new ArrayType(elementType, length));
  }

  /** Creates a tuple type. */
  public TupleType tupleType(Type... argTypes) {
    return tupleType(ImmutableList.copyOf(argTypes));
  }

  /** Creates a tuple type. */
  public TupleType tupleType(List<? extends Type> argTypes) {
    return intern(new TupleType(argTypes));
  }

  /** Creates an application of an algebraic data type. */
  public AdtType adtType(AdtDef adtDef, Type... args) {
    return adtType(adtDef, ImmutableList.copyOf(args));
  }

  /** Creates an application of an algebraic data type. */
  public AdtType adtType(AdtDef adtDef, List<? extends Type> args) {
    return intern(new AdtType(adtDef, args));
  }

  /** Creates a generic type parameter. */
  public ParamType paramType(int ordinal, String name) {
    return intern(new ParamType(ordinal, name));
  }

  /** Creates an error type that remembers the error that caused it.
   * Error types are not interned. */
  public ErrorType errorType(CompileException error) {
    return new ErrorType(error);
  }
}

// End TypeSystem.java
