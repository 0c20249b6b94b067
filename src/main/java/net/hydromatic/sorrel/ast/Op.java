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

/** Sub-types of {@link AstNode}, and operators of types. */
public enum Op {
  // identifiers and paths
  ID,
  QPATH,

  // expressions that may occur in a pattern
  LITERAL,
  NEGATE("-", 8),
  PATH,
  CONST_BLOCK,

  // patterns; some occur in Ast only, some in Core only, some in both
  WILDCARD_PAT,
  BINDING_PAT(" @ ", 2),
  LIT_PAT, // Ast only
  RANGE_PAT("..", 3),
  PATH_PAT, // Ast only
  REF_PAT("&", 8), // Ast only
  BOX_PAT("box ", 8), // Ast only
  SLICE_PAT,
  ARRAY_PAT, // Core only
  TUPLE_PAT, // Ast only
  TUPLE_STRUCT_PAT, // Ast only
  STRUCT_PAT, // Ast only
  FIELD_PAT,
  OR_PAT(" | ", 1),
  VARIANT_PAT, // Core only
  LEAF_PAT, // Core only
  DEREF_PAT("&", 8), // Core only
  CONSTANT_PAT, // Core only
  ASCRIBE_USER_TYPE_PAT(" : ", 1), // Core only
  ERROR_PAT, // Core only

  // types
  PRIMITIVE_TYPE,
  REF_TYPE,
  BOX_TYPE,
  ADT_TYPE,
  TUPLE_TYPE,
  ARRAY_TYPE,
  SLICE_TYPE,
  PARAM_TYPE,
  ERROR_TYPE;

  /** Padded name, e.g. " | ". Empty for atoms. */
  public final String padded;
  /** Left precedence. */
  public final int left;
  /** Right precedence. */
  public final int right;

  Op() {
    this("", 99);
  }

  Op(String padded, int precedence) {
    this.padded = padded;
    this.left = precedence * 2;
    this.right = precedence * 2 + 1;
  }
}

// End Op.java
