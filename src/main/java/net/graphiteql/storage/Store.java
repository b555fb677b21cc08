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

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;

/**
 * Resolves path patterns against every registered finder and reduces the
 * answers to one node per path and kind. Leaves that several finders report
 * for the same path are collapsed into a single leaf backed by a
 * {@link MultiReader}.
 * @since 1.0
 */
public class Store {
  private static final Logger LOG = LoggerFactory.getLogger(Store.class);

  /**
   * How to treat a path that one finder reports as a branch and another as a
   * leaf.
   */
  public enum ConflictPolicy {
    /** Yield both, branch first, and log a warning */
    BOTH,
    /** Drop the branch */
    LEAF_WINS;

    /**
     * @param name both or leaf_wins, case insensitive
     * @return The policy
     * @throws IllegalArgumentException if the name is unknown
     */
    public static ConflictPolicy fromString(final String name) {
      if (name == null || name.trim().isEmpty()) {
        return BOTH;
      }
      try {
        return valueOf(name.trim().toUpperCase());
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException("Unknown conflict policy: " + name
            + ", must be 'both' or 'leaf_wins'", e);
      }
    }
  }

  private final List<Finder> finders;
  private final ConflictPolicy conflict_policy;

  /**
   * Ctor using the {@link ConflictPolicy#BOTH} policy
   * @param finders The finders to query, in registration order
   */
  public Store(final List<Finder> finders) {
    this(finders, ConflictPolicy.BOTH);
  }

  /**
   * Default ctor
   * @param finders The finders to query, in registration order
   * @param conflict_policy Branch versus leaf tie break
   */
  public Store(final List<Finder> finders,
      final ConflictPolicy conflict_policy) {
    if (finders == null) {
      throw new IllegalArgumentException("Finders cannot be null");
    }
    this.finders = ImmutableList.copyOf(finders);
    this.conflict_policy = conflict_policy == null ? ConflictPolicy.BOTH
        : conflict_policy;
  }

  /** @return the finders in registration order */
  public List<Finder> getFinders() {
    return finders;
  }

  public ConflictPolicy getConflictPolicy() {
    return conflict_policy;
  }

  /**
   * Asks every finder for the pattern and returns the reduced nodes sorted
   * by path. The finders are queried on the first call to
   * {@code hasNext()}; the iterator cannot be restarted.
   * A finder that fails is logged and skipped.
   * @param pattern The dotted path pattern
   * @param start_time Optional lower bound in seconds
   * @param end_time Optional upper bound in seconds
   * @return A single use iterator of nodes
   */
  public Iterator<Node> find(final String pattern, final Long start_time,
      final Long end_time) {
    final FindQuery query = new FindQuery(pattern, start_time, end_time);
    return new AbstractIterator<Node>() {
      private Iterator<Map.Entry<String, List<Node>>> groups;
      private final List<Node> pending = new ArrayList<Node>();
      private final Set<String> found_branches = Sets.newHashSet();

      @Override
      protected Node computeNext() {
        if (groups == null) {
          groups = groupByPath(query).entrySet().iterator();
        }
        while (pending.isEmpty()) {
          if (!groups.hasNext()) {
            return endOfData();
          }
          final Map.Entry<String, List<Node>> group = groups.next();
          reduce(group.getKey(), group.getValue(), found_branches, pending);
        }
        return pending.remove(0);
      }
    };
  }

  /**
   * Queries every finder and groups the distinct node instances by path.
   * The same instance returned twice by a finder is only counted once.
   */
  private TreeMap<String, List<Node>> groupByPath(final FindQuery query) {
    final Set<Node> matching = Sets.newIdentityHashSet();
    final List<Node> ordered = new ArrayList<Node>();
    for (final Finder finder : finders) {
      if (LOG.isDebugEnabled()) {
        LOG.debug("Querying finder " + finder + " with " + query);
      }
      try {
        for (final Node node : finder.findNodes(query)) {
          if (matching.add(node)) {
            ordered.add(node);
          }
        }
      } catch (Exception e) {
        LOG.error("Finder " + finder + " failed for " + query, e);
      }
    }

    final TreeMap<String, List<Node>> by_path =
        new TreeMap<String, List<Node>>();
    for (final Node node : ordered) {
      List<Node> group = by_path.get(node.getPath());
      if (group == null) {
        group = new ArrayList<Node>();
        by_path.put(node.getPath(), group);
      }
      group.add(node);
    }
    return by_path;
  }

  /**
   * Reduces the nodes of one path: at most one branch, then either the
   * single leaf or a synthetic leaf over a {@link MultiReader}.
   */
  private void reduce(final String path, final List<Node> nodes,
      final Set<String> found_branches, final List<Node> out) {
    Node branch = null;
    final List<LeafNode> leaves = new ArrayList<LeafNode>();
    for (final Node node : nodes) {
      if (node.isLeaf()) {
        leaves.add((LeafNode) node);
      } else if (branch == null && !found_branches.contains(path)) {
        branch = node;
      }
    }

    if (branch != null && !leaves.isEmpty()) {
      LOG.warn("Path " + path + " is reported as both a branch and a leaf, "
          + "check the finder configuration. Policy: " + conflict_policy);
      if (conflict_policy == ConflictPolicy.LEAF_WINS) {
        branch = null;
      }
    }
    if (branch != null) {
      found_branches.add(path);
      out.add(branch);
    }

    if (leaves.size() == 1) {
      out.add(leaves.get(0));
    } else if (leaves.size() > 1) {
      out.add(new LeafNode(path, new MultiReader(leaves)));
    }
  }

  @Override
  public String toString() {
    return "Store(finders=" + finders + ", conflictPolicy="
        + conflict_policy + ")";
  }
}
