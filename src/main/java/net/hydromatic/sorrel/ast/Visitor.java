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

/** Visits patterns. */
public class Visitor {

  /** For use as a method reference. */
  protected <E extends Core.Pat> void accept(E e) {
    e.accept(this);
  }

  protected void visit(Core.WildcardPat wildcardPat) {}

  protected void visit(Core.BindingPat bindingPat) {
    if (bindingPat.pat != null) {
      bindingPat.pat.accept(this);
    }
  }

  protected void visit(Core.VariantPat variantPat) {
    variantPat.subPats.forEach(fieldPat -> fieldPat.pat.accept(this));
  }

  protected void visit(Core.LeafPat leafPat) {
    leafPat.subPats.forEach(fieldPat -> fieldPat.pat.accept(this));
  }

  protected void visit(Core.DerefPat derefPat) {
    derefPat.pat.accept(this);
  }

  protected void visit(Core.ConstantPat constantPat) {}

  protected void visit(Core.RangePat rangePat) {}

  protected void visit(Core.SlicePat slicePat) {
    slicePat.prefix.forEach(this::accept);
    if (slicePat.slice != null) {
      slicePat.slice.accept(this);
    }
    slicePat.suffix.forEach(this::accept);
  }

  protected void visit(Core.OrPat orPat) {
    orPat.pats.forEach(this::accept);
  }

  protected void visit(Core.AscribeUserTypePat ascribeUserTypePat) {
    ascribeUserTypePat.pat.accept(this);
  }

  protected void visit(Core.ErrorPat errorPat) {}
}

// End Visitor.java
