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
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Definition of an algebraic data type: a struct, an enum or a union.
 *
 * <p>A struct or union has exactly one variant, whose identity is that of
 * the type itself. An enum has zero or more variants, each with its own
 * identity.
 *
 * <p>Instances are created via {@link TypeSystem#adt}, and compare by
 * identity. */
public class AdtDef {
  public final DefId def;
  public final Kind kind;
  /** Names of generic type parameters. */
  public final List<String> typeParams;
  public final List<VariantDef> variants;

  AdtDef(DefId def, Kind kind, List<String> typeParams,
      List<VariantDef> variants) {
    this.def = requireNonNull(def);
    this.kind = requireNonNull(kind);
    this.typeParams = ImmutableList.copyOf(typeParams);
    this.variants = ImmutableList.copyOf(variants);
    checkArgument(kind == Kind.ENUM || this.variants.size() == 1,
        "%s must have exactly one variant", kind);
  }

  @Override
  public String toString() {
    return def.path;
  }

  public boolean isEnum() {
    return kind == Kind.ENUM;
  }

  /** Returns the only variant of a struct or union. */
  public VariantDef nonEnumVariant() {
    checkState(kind != Kind.ENUM, "%s is an enum", def);
    return variants.get(0);
  }

  /** Returns the index of the variant with a given identity. */
  public int variantIndexWithId(DefId variantId) {
    for (int i = 0; i < variants.size(); i++) {
      if (variants.get(i).def.equals(variantId)) {
        return i;
      }
    }
    throw new IllegalArgumentException("variant " + variantId
        + " not found in " + def);
  }

  /** Returns the variant with a given identity. */
  public VariantDef variantWithId(DefId variantId) {
    return variants.get(variantIndexWithId(variantId));
  }

  /** Returns the variant whose constructor has a given identity. */
  public VariantDef variantWithCtorId(DefId ctorId) {
    for (VariantDef variant : variants) {
      if (ctorId.equals(variant.ctor)) {
        return variant;
      }
    }
    throw new IllegalArgumentException("constructor " + ctorId
        + " not found in " + def);
  }

  /** Kind of algebraic data type. */
  public enum Kind {
    STRUCT(DefKind.STRUCT),
    ENUM(DefKind.ENUM),
    UNION(DefKind.UNION);

    public final DefKind defKind;

    Kind(DefKind defKind) {
      this.defKind = defKind;
    }
  }

  /** How a variant is constructed, which also determines how patterns
   * against it are written. */
  public enum CtorKind {
    /** Tuple-like, {@code Some(x)}. */
    FN,
    /** Unit-like, {@code None}. */
    CONST,
    /** Braced, {@code Point { x, y }}; has no constructor. */
    NONE
  }

  /** Variant of an algebraic data type. */
  public static class VariantDef {
    public final DefId def;
    /** Identity of the constructor, or null if the variant is braced. */
    public final @Nullable DefId ctor;
    public final CtorKind ctorKind;
    public final List<FieldDef> fields;

    VariantDef(DefId def, @Nullable DefId ctor, CtorKind ctorKind,
        List<FieldDef> fields) {
      this.def = requireNonNull(def);
      this.ctor = ctor;
      this.ctorKind = requireNonNull(ctorKind);
      this.fields = ImmutableList.copyOf(fields);
      checkArgument((ctor == null) == (ctorKind == CtorKind.NONE));
    }

    @Override
    public String toString() {
      return def.path;
    }

    public String name() {
      return def.name();
    }
  }

  /** Field of a variant. Tuple-like variants have fields named "0", "1",
   * etc. */
  public static class FieldDef {
    public final String name;
    /** Declared type; may reference the type's generic parameters. */
    public final Type type;

    public FieldDef(String name, Type type) {
      this.name = requireNonNull(name);
      this.type = requireNonNull(type);
    }

    @Override
    public String toString() {
      return name + ": " + type.moniker();
    }
  }

  /** Builds an {@link AdtDef}. */
  public static class Builder {
    private final TypeSystem typeSystem;
    private final Kind kind;
    private final DefId def;
    private final List<String> typeParams;
    private final List<VariantDef> variants = new ArrayList<>();

    Builder(TypeSystem typeSystem, Kind kind, DefId def,
        List<String> typeParams) {
      this.typeSystem = typeSystem;
      this.kind = kind;
      this.def = def;
      this.typeParams = typeParams;
    }

    /** Returns the type of the {@code i}th generic parameter, for use in
     * field declarations. */
    public Type param(int i) {
      return typeSystem.paramType(i, typeParams.get(i));
    }

    /** Adds a unit-like variant, e.g. {@code None}. */
    public Builder unitVariant(String name) {
      return variant(name, CtorKind.CONST, ImmutableList.of());
    }

    /** Adds a tuple-like variant, e.g. {@code Some(T)}. */
    public Builder tupleVariant(String name, Type... types) {
      final List<FieldDef> fields = new ArrayList<>();
      for (int i = 0; i < types.length; i++) {
        fields.add(new FieldDef(Integer.toString(i), types[i]));
      }
      return variant(name, CtorKind.FN, fields);
    }

    /** Adds a braced variant, e.g. {@code Point { x: i32, y: i32 }}. */
    public Builder structVariant(String name, FieldDef... fields) {
      return variant(name, CtorKind.NONE, ImmutableList.copyOf(fields));
    }

    /** Adds a variant. For a struct or union, the variant's name must be
     * the name of the type. */
    public Builder variant(String name, CtorKind ctorKind,
        List<FieldDef> fields) {
      final DefId variantId;
      final @Nullable DefId ctorId;
      if (kind == Kind.ENUM) {
        variantId =
            typeSystem.def(DefKind.VARIANT, def.path + "::" + name, def);
        ctorId = ctorKind == CtorKind.NONE ? null
            : typeSystem.def(DefKind.CTOR_VARIANT, variantId.path, variantId);
      } else {
        checkArgument(name.equals(def.name()),
            "variant of %s must be named %s", kind, def.name());
        checkState(variants.isEmpty(), "%s has only one variant", kind);
        variantId = def;
        ctorId = ctorKind == CtorKind.NONE ? null
            : typeSystem.def(DefKind.CTOR_STRUCT, def.path, def);
      }
      variants.add(new VariantDef(variantId, ctorId, ctorKind, fields));
      return this;
    }

    /** Creates the definition and registers it with the type system. */
    public AdtDef build() {
      final AdtDef adtDef = new AdtDef(def, kind, typeParams, variants);
      typeSystem.register(adtDef);
      return adtDef;
    }
  }
}

// End AdtDef.java
