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

/** Variance with which a user type ascription relates to the type it
 * annotates.
 *
 * <p>A pattern such as {@code Foo::<&'static str> { .. }} is checked
 * covariantly: the scrutinee may be a subtype of the ascribed type. An
 * associated constant is checked contravariantly, because its value flows
 * into the comparison rather than out of the scrutinee. */
public enum Variance {
  COVARIANT,
  INVARIANT,
  CONTRAVARIANT,
  BIVARIANT
}

// End Variance.java
