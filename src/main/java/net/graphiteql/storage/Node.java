// This file is part of GraphiteQL.
// Copyright (C) 2026  The GraphiteQL Authors.
//
// This program is free software: you can redistribute it and/or modify it
// under the terms of the GNU Lesser General Public License as published by
// the Free Software Foundation, either version 2.1 of the License, or (at your
// option) any later version.  This program is distributed in the hope that it
// will be useful, but WITHOUT ANY WARRANTY; without even the implied warranty
// of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the GNU Lesser
// General Public License for more details.  You should have received a copy
// of the GNU Lesser General Public License along with this program.  If not,
// see <http://www.gnu.org/licenses/>.
package net.graphiteql.storage;

/**
 * An entry in the dotted namespace, either a branch with children or a leaf
 * with data. Two nodes are equal when they share a path and are of the same
 * kind, no matter which finder reported them.
 * @since 1.0
 */
public abstract class Node {

  /** The full dotted path */
  protected final String path;

  /** The last segment of the path */
  protected final String name;

  /**
   * Default ctor
   * @param path The full dotted path
   * @throws IllegalArgumentException if the path was null or empty
   */
  protected Node(final String path) {
    if (path == null || path.isEmpty()) {
      throw new IllegalArgumentException("Node path cannot be null or empty");
    }
    this.path = path;
    name = path.substring(path.lastIndexOf('.') + 1);
  }

  /** @return the full dotted path */
  public String getPath() {
    return path;
  }

  /** @return the last segment of the path */
  public String getName() {
    return name;
  }

  /** @return whether or not this node carries data */
  public abstract boolean isLeaf();

  @Override
  public boolean equals(final Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Node)) {
      return false;
    }
    final Node other = (Node) obj;
    return isLeaf() == other.isLeaf() && path.equals(other.path);
  }

  @Override
  public int hashCode() {
    return path.hashCode() * 31 + (isLeaf() ? 1 : 0);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(" + path + ")";
  }
}
