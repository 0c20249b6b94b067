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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests for {@link Prop}. */
public class PropTest {
  @Test
  void testLookup() {
    assertThat(Prop.lookup("teach"), sameInstance(Prop.TEACH));
    assertThat(Prop.lookup("TEACH"), sameInstance(Prop.TEACH));
    assertThat(Prop.lookup("inlineConstFastPath"),
        sameInstance(Prop.INLINE_CONST_FAST_PATH));
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> Prop.lookup("verbose"));
    assertThat(e.getMessage(), is("property verbose not found"));
  }

  /** Properties are sorted by camel-case name. */
  @Test
  void testByCamelName() {
    assertThat(Prop.BY_CAMEL_NAME.get(0), is(Prop.DELAYED_BUGS_FATAL));
    assertThat(Prop.BY_CAMEL_NAME.get(1), is(Prop.INLINE_CONST_FAST_PATH));
    assertThat(Prop.BY_CAMEL_NAME.get(2), is(Prop.TEACH));
    assertThat(Prop.BY_NAME.size(), is(Prop.values().length * 2));
  }

  @Test
  void testDefaults() {
    final Map<Prop, Object> map = new HashMap<>();
    assertThat(Prop.TEACH.booleanValue(map), is(false));
    assertThat(Prop.INLINE_CONST_FAST_PATH.booleanValue(map), is(true));
    assertThat(Prop.DELAYED_BUGS_FATAL.booleanValue(map), is(false));
    assertThat(Prop.TEACH.get(map), is(false));
  }

  @Test
  void testSet() {
    final Map<Prop, Object> map = new HashMap<>();
    Prop.TEACH.set(map, true);
    assertThat(Prop.TEACH.booleanValue(map), is(true));

    Prop.INLINE_CONST_FAST_PATH.setLenient(map, "FALSE");
    assertThat(Prop.INLINE_CONST_FAST_PATH.booleanValue(map), is(false));
    Prop.INLINE_CONST_FAST_PATH.setLenient(map, "true");
    assertThat(Prop.INLINE_CONST_FAST_PATH.booleanValue(map), is(true));

    assertThrows(IllegalArgumentException.class,
        () -> Prop.TEACH.set(map, "true"));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.TEACH.setLenient(map, "yes"));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.TEACH.set(map, null));
    assertThat(Prop.TEACH.booleanValue(map), is(true));
  }

  /** Properties set on a context do not affect other contexts. */
  @Test
  void testContextProps() {
    final Fixture f = new Fixture();
    final PatternContext cx = f.context();
    final PatternContext cx2 = cx.withProp(Prop.TEACH, "true");
    assertThat(cx.is(Prop.TEACH), is(false));
    assertThat(cx2.is(Prop.TEACH), is(true));
    assertThat(cx2.withProp(Prop.TEACH, false).is(Prop.TEACH), is(false));
  }
}

// End PropTest.java
