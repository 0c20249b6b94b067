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
package net.hydromatic.sorrel.util;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.Collection;
import java.util.List;
import java.util.function.Function;

/** Utilities. */
public class Static {
  private Static() {}

  /** Returns a list with one element appended. */
  public static <E> List<E> append(List<E> list, E e) {
    return ImmutableList.<E>builder().addAll(list).add(e).build();
  }

  /**
   * Eagerly converts a Collection to an ImmutableList, applying a mapping
   * function to each element.
   */
  public static <E, T> ImmutableList<T> transformEager(
      Collection<? extends E> elements, Function<E, T> mapper) {
    if (elements.isEmpty()) {
      // Save ourselves the effort of creating a Builder.
      return ImmutableList.of();
    }
    final ImmutableList.Builder<T> b =
        ImmutableList.builderWithExpectedSize(elements.size());
    elements.forEach(e -> b.add(mapper.apply(e)));
    return b.build();
  }

  /**
   * Returns the position of the {@code i}th of {@code size} elements in a
   * sequence of {@code expectedSize} positions, where a rest marker
   * ("{@code ..}") before the element at {@code gapPos} stands for the
   * missing elements.
   *
   * <p>For example, in "{@code (a, .., b, c)}" against a 5-tuple,
   * {@code size} is 3, {@code gapPos} is 1, and the elements are at positions
   * 0, 3 and 4.
   *
   * <p>If {@code gapPos} is negative there is no rest marker, and the
   * position is {@code i}.
   */
  public static int adjustedIndex(int i, int size, int expectedSize,
      int gapPos) {
    checkArgument(i >= 0 && i < size, "index %s out of range", i);
    if (gapPos < 0 || i < gapPos) {
      return i;
    }
    checkArgument(expectedSize >= size,
        "%s elements do not fit in %s positions", size, expectedSize);
    return i + expectedSize - size;
  }
}

// End Static.java
