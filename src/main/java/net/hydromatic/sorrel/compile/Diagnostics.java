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
import java.util.ArrayList;
import java.util.List;

/** Collects the diagnostics emitted while lowering patterns.
 *
 * <p>Several lowerings may share one instance, so its methods are
 * synchronized. Delayed bugs are kept apart from user-facing errors. */
public class Diagnostics {
  private final List<CompileException> errors = new ArrayList<>();
  private final List<CompileException> delayedBugs = new ArrayList<>();

  /** Records a diagnostic. */
  public synchronized void add(CompileException e) {
    requireNonNull(e);
    if (e.kind == ErrorKind.DELAYED_BUG) {
      delayedBugs.add(e);
    } else {
      errors.add(e);
    }
  }

  /** Returns the user-facing errors, in the order they were emitted. */
  public synchronized List<CompileException> errors() {
    return ImmutableList.copyOf(errors);
  }

  /** Returns the delayed bugs, in the order they were emitted. */
  public synchronized List<CompileException> delayedBugs() {
    return ImmutableList.copyOf(delayedBugs);
  }

  /** Returns whether nothing has been emitted. */
  public synchronized boolean isEmpty() {
    return errors.isEmpty() && delayedBugs.isEmpty();
  }

  @Override public synchronized String toString() {
    final StringBuilder buf = new StringBuilder();
    for (CompileException e : errors) {
      e.describeTo(buf).append('\n');
    }
    for (CompileException e : delayedBugs) {
      e.describeTo(buf).append('\n');
    }
    return buf.toString();
  }
}

// End Diagnostics.java
