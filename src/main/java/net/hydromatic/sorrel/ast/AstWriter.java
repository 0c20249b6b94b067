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

import java.util.List;

/** Prints ASTs as source code. */
public class AstWriter {
  private final StringBuilder b = new StringBuilder();

  /** Returns the result of writing. */
  @Override
  public String toString() {
    return b.toString();
  }

  /** Appends a string to the output. */
  public AstWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends a node, enclosing it in parentheses if its precedence is lower
   * than the surrounding operators'. */
  public AstWriter append(AstNode node, int left, int right) {
    final Op op = node.precedence();
    if (left > op.left || right > op.right) {
      b.append('(');
      node.unparse(this, 0, 0);
      b.append(')');
    } else {
      node.unparse(this, left, right);
    }
    return this;
  }

  /** Appends a list of nodes, separated by a string, each at the lowest
   * precedence. */
  public AstWriter appendAll(List<? extends AstNode> nodes, String sep) {
    for (int i = 0; i < nodes.size(); i++) {
      if (i > 0) {
        b.append(sep);
      }
      append(nodes.get(i), 0, 0);
    }
    return this;
  }

  /** Appends a list of nodes as operands of an infix operator. Lower
   * precedence operands are parenthesized. */
  public AstWriter infix(int left, List<? extends AstNode> nodes, Op op,
      int right) {
    if (left > op.left || right > op.right) {
      b.append('(');
      infix(0, nodes, op, 0);
      return append(")");
    }
    for (int i = 0; i < nodes.size(); i++) {
      if (i > 0) {
        b.append(op.padded);
      }
      append(nodes.get(i), i == 0 ? left : op.right,
          i == nodes.size() - 1 ? right : op.left);
    }
    return this;
  }

  /** Appends a prefix operator and its operand. */
  public AstWriter prefix(int left, String prefix, AstNode node, Op op,
      int right) {
    if (left > op.left || right > op.right) {
      b.append('(');
      prefix(0, prefix, node, op, 0);
      return append(")");
    }
    b.append(prefix);
    return append(node, op.left, right);
  }
}

// End AstWriter.java
