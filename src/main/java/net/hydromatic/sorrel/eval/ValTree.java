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
package net.hydromatic.sorrel.eval;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Structured value of a constant: a tree whose leaves are scalars.
 *
 * <p>A struct or tuple is a branch with one child per field; an enum value
 * is a branch whose first child is the variant index followed by the
 * variant's fields; an array, slice or string is a branch with one child
 * per element (or byte); a reference is represented by its referent.
 *
 * <p>Only constants whose value can be compared structurally have a
 * valtree. For others, evaluation yields an opaque {@link ConstValue}.
 */
public abstract class ValTree implements Comparable<ValTree> {
  private ValTree() {}

  public static Leaf leaf(ScalarInt scalar) {
    return new Leaf(scalar);
  }

  public static Branch branch(List<? extends ValTree> children) {
    return new Branch(ImmutableList.copyOf(children));
  }

  /** Returns the scalar of a leaf; throws if this is a branch. */
  public abstract ScalarInt unwrapLeaf();

  /** Returns the children of a branch; throws if this is a leaf. */
  public abstract List<ValTree> unwrapBranch();

  /** Leaf, containing a scalar. */
  public static class Leaf extends ValTree {
    public final ScalarInt scalar;

    Leaf(ScalarInt scalar) {
      this.scalar = requireNonNull(scalar);
    }

    @Override
    public ScalarInt unwrapLeaf() {
      return scalar;
    }

    @Override
    public List<ValTree> unwrapBranch() {
      throw new IllegalStateException("not a branch: " + this);
    }

    @Override
    public int compareTo(ValTree o) {
      return o instanceof Leaf ? scalar.compareTo(((Leaf) o).scalar) : -1;
    }

    @Override
    public int hashCode() {
      return scalar.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Leaf && scalar.equals(((Leaf) o).scalar);
    }

    @Override
    public String toString() {
      return scalar.toString();
    }
  }

  /** Branch, containing zero or more child trees. */
  public static class Branch extends ValTree {
    public final List<ValTree> children;

    Branch(ImmutableList<ValTree> children) {
      this.children = requireNonNull(children);
    }

    @Override
    public ScalarInt unwrapLeaf() {
      throw new IllegalStateException("not a leaf: " + this);
    }

    @Override
    public List<ValTree> unwrapBranch() {
      return children;
    }

    @Override
    public int compareTo(ValTree o) {
      if (o instanceof Leaf) {
        return 1;
      }
      final List<ValTree> children2 = ((Branch) o).children;
      final int n = Math.min(children.size(), children2.size());
      for (int i = 0; i < n; i++) {
        final int c = children.get(i).compareTo(children2.get(i));
        if (c != 0) {
          return c;
        }
      }
      return Integer.compare(children.size(), children2.size());
    }

    @Override
    public int hashCode() {
      return children.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Branch && children.equals(((Branch) o).children);
    }

    @Override
    public String toString() {
      return children.toString();
    }
  }
}

// End ValTree.java
