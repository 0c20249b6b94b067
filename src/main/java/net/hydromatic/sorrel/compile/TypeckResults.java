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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.sorrel.ast.Ast;
import net.hydromatic.sorrel.ast.AstNode;
import net.hydromatic.sorrel.type.Mutability;
import net.hydromatic.sorrel.type.Type;
import net.hydromatic.sorrel.type.UserType;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Results of type-checking the surface patterns of a function.
 *
 * <p>Entries are keyed by surface node. Surface nodes have identity
 * equality, so two structurally identical nodes have separate entries.
 *
 * <p>Type checking is outside this library; callers (and tests) populate an
 * instance using a {@link Builder}. The table is immutable, so lowerings
 * may share it. */
public class TypeckResults {
  private final ImmutableMap<AstNode, Type> nodeTypes;
  private final ImmutableMap<Ast.Pat, ImmutableList<Type>> patAdjustments;
  private final ImmutableMap<Ast.BindingPat, BindMode> bindingModes;
  private final ImmutableMap<AstNode, UserType> userProvidedTypes;
  private final ImmutableMap<Ast.FieldPat, Integer> fieldIndices;
  private final ImmutableMap<Ast.QPath, Res> qpathResolutions;
  private final ImmutableMap<Ast.QPath, ImmutableList<Type>> nodeArgs;

  private TypeckResults(Builder b) {
    this.nodeTypes = ImmutableMap.copyOf(b.nodeTypes);
    this.patAdjustments = ImmutableMap.copyOf(b.patAdjustments);
    this.bindingModes = ImmutableMap.copyOf(b.bindingModes);
    this.userProvidedTypes = ImmutableMap.copyOf(b.userProvidedTypes);
    this.fieldIndices = ImmutableMap.copyOf(b.fieldIndices);
    this.qpathResolutions = ImmutableMap.copyOf(b.qpathResolutions);
    this.nodeArgs = ImmutableMap.copyOf(b.nodeArgs);
  }

  /** Creates a builder. */
  public static Builder builder() {
    return new Builder();
  }

  /** Returns the type of a node.
   *
   * @throws AssertionError if the node has no type; type checking assigns
   * a type to every pattern */
  public Type nodeType(AstNode node) {
    final Type type = nodeTypes.get(node);
    if (type == null) {
      throw new AssertionError("no type for " + node + " at " + node.pos);
    }
    return type;
  }

  /** Returns the type of a node, or a given type if type checking did not
   * record one. Literals and paths in a pattern usually have the type of
   * the pattern. */
  public Type nodeType(AstNode node, Type defaultType) {
    final Type type = nodeTypes.get(node);
    return type != null ? type : defaultType;
  }

  /** Returns the implicit dereferences applied to a pattern, outermost
   * first; each element is the type of the value being dereferenced. Empty
   * if there are none. */
  public List<Type> patAdjustments(Ast.Pat pat) {
    final ImmutableList<Type> types = patAdjustments.get(pat);
    return types == null ? ImmutableList.of() : types;
  }

  /** Returns the binding mode of a binding pattern, or null if type checking
   * did not determine one. */
  public @Nullable BindMode bindingMode(Ast.BindingPat pat) {
    return bindingModes.get(pat);
  }

  /** Returns the type annotation the user wrote for a node, or null. */
  public @Nullable UserType userProvidedType(AstNode node) {
    return userProvidedTypes.get(node);
  }

  /** Returns the index of the field named in a field pattern.
   *
   * @throws AssertionError if the field was not resolved */
  public int fieldIndex(Ast.FieldPat fieldPat) {
    final Integer index = fieldIndices.get(fieldPat);
    if (index == null) {
      throw new AssertionError("no field index for " + fieldPat);
    }
    return index;
  }

  /** Returns what a path resolves to; {@link Res#err()} if it was not
   * resolved. */
  public Res qpathRes(Ast.QPath path) {
    final Res res = qpathResolutions.get(path);
    return res == null ? Res.err() : res;
  }

  /** Returns the generic arguments of a path; empty if there are none. */
  public List<Type> nodeArgs(Ast.QPath path) {
    final ImmutableList<Type> args = nodeArgs.get(path);
    return args == null ? ImmutableList.of() : args;
  }

  /** How a binding was resolved by type checking. */
  public enum BindMode {
    BY_VALUE(Mutability.NOT),
    BY_VALUE_MUT(Mutability.MUT),
    BY_REF(Mutability.NOT),
    BY_REF_MUT(Mutability.MUT);

    /** Mutability of the binding (for {@link #BY_VALUE} and
     * {@link #BY_VALUE_MUT}) or of the reference (otherwise). */
    public final Mutability mutability;

    BindMode(Mutability mutability) {
      this.mutability = mutability;
    }

    public boolean isByRef() {
      return this == BY_REF || this == BY_REF_MUT;
    }
  }

  /** Builds a {@link TypeckResults}. */
  public static class Builder {
    private final Map<AstNode, Type> nodeTypes = new LinkedHashMap<>();
    private final Map<Ast.Pat, ImmutableList<Type>> patAdjustments =
        new LinkedHashMap<>();
    private final Map<Ast.BindingPat, BindMode> bindingModes =
        new LinkedHashMap<>();
    private final Map<AstNode, UserType> userProvidedTypes =
        new LinkedHashMap<>();
    private final Map<Ast.FieldPat, Integer> fieldIndices =
        new LinkedHashMap<>();
    private final Map<Ast.QPath, Res> qpathResolutions =
        new LinkedHashMap<>();
    private final Map<Ast.QPath, ImmutableList<Type>> nodeArgs =
        new LinkedHashMap<>();

    private Builder() {
    }

    public Builder nodeType(AstNode node, Type type) {
      nodeTypes.put(requireNonNull(node), requireNonNull(type));
      return this;
    }

    /** Records the implicit dereferences of a pattern, outermost first. */
    public Builder patAdjustments(Ast.Pat pat, Type... types) {
      patAdjustments.put(requireNonNull(pat), ImmutableList.copyOf(types));
      return this;
    }

    public Builder bindingMode(Ast.BindingPat pat, BindMode mode) {
      bindingModes.put(requireNonNull(pat), requireNonNull(mode));
      return this;
    }

    public Builder userProvidedType(AstNode node, UserType userType) {
      userProvidedTypes.put(requireNonNull(node), requireNonNull(userType));
      return this;
    }

    public Builder fieldIndex(Ast.FieldPat fieldPat, int index) {
      fieldIndices.put(requireNonNull(fieldPat), index);
      return this;
    }

    public Builder res(Ast.QPath path, Res res) {
      qpathResolutions.put(requireNonNull(path), requireNonNull(res));
      return this;
    }

    public Builder nodeArgs(Ast.QPath path, Type... args) {
      nodeArgs.put(requireNonNull(path), ImmutableList.copyOf(args));
      return this;
    }

    public TypeckResults build() {
      return new TypeckResults(this);
    }
  }
}

// End TypeckResults.java
