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
import java.util.List;
import net.hydromatic.sorrel.ast.Pos;

/** An error occurred during compilation.
 *
 * <p>Lowering does not throw these; it reports them via
 * {@link PatternContext#emit} and keeps the exception as the handle of an
 * error node. Callers that want to abort may throw it. */
public class CompileException extends RuntimeException {
  private final Pos pos;
  public final ErrorKind kind;
  /** Additional lines of explanation, printed after the message. */
  public final List<String> notes;

  public CompileException(ErrorKind kind, String message, Pos pos) {
    this(kind, message, pos, ImmutableList.of());
  }

  public CompileException(ErrorKind kind, String message, Pos pos,
      List<String> notes) {
    super(message);
    this.kind = requireNonNull(kind);
    this.pos = requireNonNull(pos);
    this.notes = ImmutableList.copyOf(notes);
  }

  @Override
  public String toString() {
    return super.toString() + " at " + pos;
  }

  public Pos pos() {
    return pos;
  }

  public StringBuilder describeTo(StringBuilder buf) {
    pos.describeTo(buf).append(" Error");
    if (kind.code != null) {
      buf.append('[').append(kind.code).append(']');
    }
    buf.append(": ").append(getMessage());
    for (String note : notes) {
      buf.append("\n  = note: ").append(note);
    }
    return buf;
  }
}

// End CompileException.java
