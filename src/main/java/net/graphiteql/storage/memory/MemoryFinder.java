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
package net.graphiteql.storage.memory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentSkipListMap;

import com.google.common.base.Splitter;
import com.google.common.collect.Range;
import com.google.common.collect.RangeSet;
import com.google.common.collect.TreeRangeSet;

import net.graphiteql.core.RequestContext;
import net.graphiteql.storage.BranchNode;
import net.graphiteql.storage.FetchResult;
import net.graphiteql.storage.FindQuery;
import net.graphiteql.storage.LeafNode;
import net.graphiteql.storage.MultiFetchFinder;
import net.graphiteql.storage.MultiFetchResult;
import net.graphiteql.storage.Node;
import net.graphiteql.storage.Reader;
import net.graphiteql.storage.TimeInfo;
import net.graphiteql.utils.GlobMatcher;

/**
 * A finder over series held in memory, for embedding the engine and for
 * tests. When built with a multi-fetch tag its leaves are tagged and can be
 * fetched in batches through {@link #fetchMulti}.
 * <p>
 * Series are added with {@link #addSeries}; every dotted prefix of an added
 * path becomes a branch.
 * @since 1.0
 */
public class MemoryFinder implements MultiFetchFinder {

  private final String multi_fetch_tag;

  /** Stored series keyed on path, sorted */
  private final ConcurrentSkipListMap<String, MemoryReader> series =
      new ConcurrentSkipListMap<String, MemoryReader>();

  /** Ctor for a finder whose leaves are fetched one at a time */
  public MemoryFinder() {
    this(null);
  }

  /**
   * Ctor enabling batched fetches
   * @param multi_fetch_tag The tag to put on leaves, null to disable batching
   */
  public MemoryFinder(final String multi_fetch_tag) {
    this.multi_fetch_tag = multi_fetch_tag;
  }

  /**
   * Stores or replaces a series.
   * @param path The dotted leaf path
   * @param start Timestamp of the first value in seconds
   * @param step Seconds between values
   * @param values The values, nulls for gaps
   * @return this finder for chaining
   */
  public MemoryFinder addSeries(final String path, final long start,
      final long step, final List<Double> values) {
    if (path == null || path.isEmpty()) {
      throw new IllegalArgumentException("Path cannot be null or empty");
    }
    series.put(path, new MemoryReader(start, step, values));
    return this;
  }

  @Override
  public String multiFetchTag() {
    return multi_fetch_tag;
  }

  @Override
  public Iterable<Node> findNodes(final FindQuery query) {
    final List<String> pattern = GlobMatcher.splitPattern(query.getPattern());
    final TreeSet<String> branches = new TreeSet<String>();
    final List<Node> nodes = new ArrayList<Node>();

    for (final Map.Entry<String, MemoryReader> entry : series.entrySet()) {
      final List<String> parts = Splitter.on('.').splitToList(entry.getKey());
      if (parts.size() < pattern.size() || !matches(parts, pattern)) {
        continue;
      }
      if (parts.size() == pattern.size()) {
        nodes.add(new LeafNode(entry.getKey(), entry.getValue(),
            multi_fetch_tag));
      } else {
        branches.add(entry.getKey().substring(0,
            prefixLength(parts, pattern.size())));
      }
    }
    for (final String branch : branches) {
      nodes.add(new BranchNode(branch));
    }
    return nodes;
  }

  private static boolean matches(final List<String> parts,
      final List<String> pattern) {
    for (int i = 0; i < pattern.size(); i++) {
      if (!GlobMatcher.matches(parts.get(i), pattern.get(i))) {
        return false;
      }
    }
    return true;
  }

  private static int prefixLength(final List<String> parts, final int depth) {
    int length = depth - 1;
    for (int i = 0; i < depth; i++) {
      length += parts.get(i).length();
    }
    return length;
  }

  @Override
  public MultiFetchResult fetchMulti(final List<LeafNode> nodes,
      final long start, final long end, final Long now,
      final RequestContext context) throws IOException {
    final Map<String, List<Double>> results =
        new LinkedHashMap<String, List<Double>>();
    TimeInfo time_info = null;
    for (final LeafNode node : nodes) {
      final FetchResult result = node.fetch(start, end, now, context);
      if (result == null) {
        continue;
      }
      if (time_info == null) {
        time_info = result.getTimeInfo();
      }
      results.put(node.getPath(), result.getValues());
    }
    if (time_info == null) {
      time_info = new TimeInfo(start, start, 1);
    }
    return new MultiFetchResult(time_info, results);
  }

  @Override
  public String toString() {
    return "MemoryFinder(series=" + series.size() + ", multiFetchTag="
        + multi_fetch_tag + ")";
  }

  /**
   * Serves one stored series. Windows are aligned down to a multiple of the
   * step so series sharing a step line up.
   */
  static class MemoryReader implements Reader {
    private final long start;
    private final long step;
    private final List<Double> values;

    MemoryReader(final long start, final long step, final List<Double> values) {
      if (step <= 0) {
        throw new IllegalArgumentException("Step must be greater than zero");
      }
      this.start = start;
      this.step = step;
      this.values = new ArrayList<Double>(values);
    }

    @Override
    public FetchResult fetch(final long from, final long until, final Long now,
        final RequestContext context) {
      final long stored_end = start + values.size() * step;
      if (until <= start || from >= stored_end) {
        return null;
      }
      final long aligned = from - Math.floorMod(from, step);
      final int count = (int) ((until - aligned + step - 1) / step);
      final List<Double> window = new ArrayList<Double>(count);
      for (int i = 0; i < count; i++) {
        final long idx = Math.floorDiv(aligned + i * step - start, step);
        window.add(idx >= 0 && idx < values.size() ? values.get((int) idx)
            : null);
      }
      return new FetchResult(new TimeInfo(aligned, aligned + count * step,
          step), window);
    }

    @Override
    public RangeSet<Long> intervals() {
      final RangeSet<Long> intervals = TreeRangeSet.create();
      intervals.add(Range.closed(start, start + values.size() * step));
      return intervals;
    }
  }
}
