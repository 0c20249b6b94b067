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
package net.hydromatic.sorrel.ast;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.sorrel.compile.CompileException;
import net.hydromatic.sorrel.eval.Const;
import net.hydromatic.sorrel.type.AdtDef;
import net.hydromatic.sorrel.type.Mutability;
import net.hydromatic.sorrel.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds patterns in the {@link Core} language. */
public enum CoreBuilder {
  /** The singleton instance of the Core builder.
   * The short name is convenient for use via 'import static',
   * but checkstyle does not approve. */
  // CHECKSTYLE: IGNORE 1
  core;

  public Core.WildcardPat wildcardPat(Pos pos, Type type) {
    return new Core.WildcardPat(pos, type);
  }

  public Core.BindingPat bindingPat(Pos pos, Type type,
      Mutability mutability, Core.BindingMode mode, String name, int varId,
      Type varType, Core.@Nullable Pat pat, boolean primary) {
    return new Core.BindingPat(pos, type, mutability, mode, name, varId,
        varType, pat, primary);
  }

  /** Creates a by-value, immutable binding with no sub-pattern. */
  public Core.BindingPat bindingPat(Pos pos, Type type, String name,
      int varId) {
    return bindingPat(pos, type, Mutability.NOT, Core.BindingMode.BY_VALUE,
        name, varId, type, null, true);
  }

  public Core.FieldPat fieldPat(int field, Core.Pat pat) {
    return new Core.FieldPat(field, pat);
  }

  public Core.VariantPat variantPat(Pos pos, Type type, AdtDef adtDef,
      List<Type> args, int variantIndex, List<Core.FieldPat> subPats) {
    return new Core.VariantPat(pos, type, adtDef, ImmutableList.copyOf(args),
        variantIndex, ImmutableList.copyOf(subPats));
  }

  public Core.LeafPat leafPat(Pos pos, Type type,
      List<Core.FieldPat> subPats) {
    return new Core.LeafPat(pos, type, ImmutableList.copyOf(subPats));
  }

  public Core.DerefPat derefPat(Pos pos, Type type, Core.Pat pat) {
    return new Core.DerefPat(pos, type, pat);
  }

  public Core.ConstantPat constantPat(Pos pos, Type type, Const value) {
    return new Core.ConstantPat(pos, type, value);
  }

  /** Creates a constant pattern whose type is the type of the constant. */
  public Core.ConstantPat constantPat(Pos pos, Const value) {
    return constantPat(pos, value.type, value);
  }

  public Core.RangePat rangePat(Pos pos, Type type, Const lo, Const hi,
      RangeEnd end) {
    return new Core.RangePat(pos, type, lo, hi, end);
  }

  public Core.SlicePat slicePat(Pos pos, Type type, List<Core.Pat> prefix,
      Core.@Nullable Pat slice, List<Core.Pat> suffix) {
    return new Core.SlicePat(pos, Op.SLICE_PAT, type,
        ImmutableList.copyOf(prefix), slice, ImmutableList.copyOf(suffix));
  }

  /** Creates an array pattern.
   *
   * @throws IllegalArgumentException if the type is not an array type whose
   * length is at least the number of elements in prefix and suffix */
  public Core.SlicePat arrayPat(Pos pos, Type type, List<Core.Pat> prefix,
      Core.@Nullable Pat slice, List<Core.Pat> suffix) {
    return new Core.SlicePat(pos, Op.ARRAY_PAT, type,
        ImmutableList.copyOf(prefix), slice, ImmutableList.copyOf(suffix));
  }

  public Core.OrPat orPat(Pos pos, Type type, List<Core.Pat> pats) {
    return new Core.OrPat(pos, type, ImmutableList.copyOf(pats));
  }

  public Core.AscribeUserTypePat ascribeUserTypePat(Pos pos, Type type,
      Core.Pat pat, Core.Ascription ascription) {
    return new Core.AscribeUserTypePat(pos, type, pat, ascription);
  }

  public Core.ErrorPat errorPat(Pos pos, Type type,
      CompileException error) {
    return new Core.ErrorPat(pos, type, error);
  }
}

// End CoreBuilder.java
