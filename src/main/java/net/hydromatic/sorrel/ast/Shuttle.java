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

/** Visits and transforms patterns.
 *
 * <p>The default implementation of each method rebuilds a node only if one
 * of its children changed; so a shuttle that overrides nothing returns its
 * argument. */
public class Shuttle {
  /** Creates a Shuttle. */
  public Shuttle() {
  }

  protected List<Core.Pat> visitList(List<Core.Pat> pats) {
    final ImmutableList.Builder<Core.Pat> list = ImmutableList.builder();
    for (Core.Pat pat : pats) {
      list.add(pat.accept(this));
    }
    return list.build();
  }

  protected List<Core.FieldPat> visitFields(List<Core.FieldPat> fieldPats) {
    final ImmutableList.Builder<Core.FieldPat> list = ImmutableList.builder();
    for (Core.FieldPat fieldPat : fieldPats) {
      list.add(fieldPat.copy(fieldPat.pat.accept(this)));
    }
    return list.build();
  }

  protected Core.Pat visit(Core.WildcardPat wildcardPat) {
    return wildcardPat; // leaf
  }

  protected Core.Pat visit(Core.BindingPat bindingPat) {
    return bindingPat.copy(
        bindingPat.pat == null ? null : bindingPat.pat.accept(this));
  }

  protected Core.Pat visit(Core.VariantPat variantPat) {
    return variantPat.copy(visitFields(variantPat.subPats));
  }

  protected Core.Pat visit(Core.LeafPat leafPat) {
    return leafPat.copy(visitFields(leafPat.subPats));
  }

  protected Core.Pat visit(Core.DerefPat derefPat) {
    return derefPat.copy(derefPat.pat.accept(this));
  }

  protected Core.Pat visit(Core.ConstantPat constantPat) {
    return constantPat; // leaf
  }

  protected Core.Pat visit(Core.RangePat rangePat) {
    return rangePat; // leaf
  }

  protected Core.Pat visit(Core.SlicePat slicePat) {
    return slicePat.copy(visitList(slicePat.prefix),
        slicePat.slice == null ? null : slicePat.slice.accept(this),
        visitList(slicePat.suffix));
  }

  protected Core.Pat visit(Core.OrPat orPat) {
    return orPat.copy(visitList(orPat.pats));
  }

  protected Core.Pat visit(Core.AscribeUserTypePat ascribeUserTypePat) {
    return ascribeUserTypePat.copy(ascribeUserTypePat.pat.accept(this));
  }

  protected Core.Pat visit(Core.ErrorPat errorPat) {
    return errorPat; // leaf
  }
}

// End Shuttle.java
