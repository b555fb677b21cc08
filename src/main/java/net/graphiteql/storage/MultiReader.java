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
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.RangeSet;
import com.google.common.collect.TreeRangeSet;

import net.graphiteql.core.RequestContext;

/**
 * Reads one logical leaf that several finders report, merging what each of
 * them returns. Finer resolution samples win; gaps are filled from coarser
 * sources.
 * @since 1.0
 */
public class MultiReader implements Reader {
  private static final Logger LOG = LoggerFactory.getLogger(MultiReader.class);

  private final List<LeafNode> nodes;

  /**
   * Default ctor
   * @param nodes The leaves for the same path, at least one
   */
  public MultiReader(final List<LeafNode> nodes) {
    if (nodes == null || nodes.isEmpty()) {
      throw new IllegalArgumentException("MultiReader needs at least one node");
    }
    this.nodes = ImmutableList.copyOf(nodes);
  }

  /** @return the underlying leaves */
  public List<LeafNode> getNodes() {
    return nodes;
  }

  /**
   * Fetches from every node, logging individual failures, and folds the
   * results together pairwise.
   * @throws AllSourcesFailedException if no node returned data
   */
  @Override
  public FetchResult fetch(final long start, final long end, final Long now,
      final RequestContext context) throws AllSourcesFailedException {
    final List<FetchResult> results = new ArrayList<FetchResult>(nodes.size());
    for (final LeafNode node : nodes) {
      try {
        final FetchResult result = node.fetch(start, end, now, context);
        if (result != null) {
          results.add(result);
        }
      } catch (Exception e) {
        LOG.error("Fetch error for " + node + " from " + start + " to " + end,
            e);
      }
    }

    FetchResult data = null;
    for (final FetchResult result : results) {
      data = data == null ? result : merge(data, result);
    }
    if (data == null) {
      throw new AllSourcesFailedException("All sub-fetches failed for "
          + nodes.get(0).getPath());
    }
    return data;
  }

  /**
   * Merges two results over the union of their windows at the finer step.
   * For each timestamp the finer sample is used unless it is missing, in
   * which case the coarser sample covering the timestamp is used.
   * Package private for UTs.
   * @param first A result
   * @param second Another result
   * @return The merged result
   */
  static FetchResult merge(final FetchResult first, final FetchResult second) {
    final FetchResult fine;
    final FetchResult coarse;
    if (first.getTimeInfo().getStep() > second.getTimeInfo().getStep()) {
      fine = second;
      coarse = first;
    } else {
      fine = first;
      coarse = second;
    }
    final TimeInfo fine_info = fine.getTimeInfo();
    final TimeInfo coarse_info = coarse.getTimeInfo();
    final List<Double> fine_values = fine.getValues();
    final List<Double> coarse_values = coarse.getValues();

    final long step = fine_info.getStep();
    final long start = Math.min(fine_info.getStart(), coarse_info.getStart());
    final long end = Math.max(fine_info.getEnd(), coarse_info.getEnd());

    final List<Double> values = new ArrayList<Double>();
    for (long t = start; t < end; t += step) {
      Double value = valueAt(fine_values, fine_info, t);
      if (value == null) {
        value = valueAt(coarse_values, coarse_info, t);
      }
      values.add(value);
    }
    return new FetchResult(new TimeInfo(start, end, step), values);
  }

  private static Double valueAt(final List<Double> values,
      final TimeInfo info, final long timestamp) {
    final long idx = Math.floorDiv(timestamp - info.getStart(), info.getStep());
    if (idx < 0 || idx >= values.size()) {
      return null;
    }
    return values.get((int) idx);
  }

  /** @return the union of every node's intervals */
  @Override
  public RangeSet<Long> intervals() {
    final RangeSet<Long> union = TreeRangeSet.create();
    for (final LeafNode node : nodes) {
      union.addAll(node.intervals());
    }
    return union;
  }

  @Override
  public String toString() {
    return "MultiReader(" + nodes + ")";
  }
}
