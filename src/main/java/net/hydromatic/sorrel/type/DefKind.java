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

/** Kind of a definition. */
public enum DefKind {
  STRUCT,
  UNION,
  ENUM,
  VARIANT,
  /** Constructor of a tuple-like or unit-like struct. */
  CTOR_STRUCT,
  /** Constructor of a tuple-like or unit-like enum variant. */
  CTOR_VARIANT,
  TY_ALIAS,
  ASSOC_TY,
  CONST,
  ASSOC_CONST,
  /** Const generic parameter, e.g. {@code N} in {@code fn f<const N: u8>}. */
  CONST_PARAM,
  STATIC,
  FN,
  /** Inline constant block, {@code const { ... }}. */
  INLINE_CONST
}

// End DefKind.java
