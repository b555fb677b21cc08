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
package net.graphiteql.query;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import net.graphiteql.core.TimeSeries;
import net.graphiteql.storage.FetchResult;
import net.graphiteql.storage.TimeInfo;

/**
 * Per request store of fetched data. Maps each requested pattern to the
 * concrete paths it resolved to and each path to the raw blocks fetched for
 * it. Filled once by the {@link FetchOrchestrator}, then only read by the
 * evaluator.
 * @since 1.0
 */
public class FetchAccumulator {

  /** Pattern to the concrete paths it resolved to */
  private final Map<String, Set<String>> paths =
      new HashMap<String, Set<String>>();

  /** Concrete path to the raw blocks fetched for it */
  private final Map<String, List<FetchResult>> data =
      new HashMap<String, List<FetchResult>>();

  /**
   * Records that a pattern was resolved, even if it matched nothing.
   * @param pattern The pattern
   */
  public void addPattern(final String pattern) {
    if (!paths.containsKey(pattern)) {
      paths.put(pattern, new TreeSet<String>());
    }
  }

  /** @return true if the pattern has been resolved into this accumulator */
  public boolean hasPattern(final String pattern) {
    return paths.containsKey(pattern);
  }

  /**
   * Records that the pattern resolved to the path.
   * @param pattern The pattern
   * @param path A concrete leaf path
   */
  public void addPath(final String pattern, final String path) {
    addPattern(pattern);
    paths.get(pattern).add(path);
  }

  /** @return the concrete paths of the pattern, sorted */
  public List<String> getPaths(final String pattern) {
    final Set<String> found = paths.get(pattern);
    if (found == null) {
      return new ArrayList<String>();
    }
    return new ArrayList<String>(found);
  }

  /** @return true if at least one block was stored for the path */
  public boolean hasData(final String path) {
    return data.containsKey(path);
  }

  /**
   * Stores a block for the path. An all-null block is dropped if the path
   * already holds a block with data; otherwise it is appended.
   * @param path The concrete path
   * @param time_info The block's window
   * @param values The samples
   */
  public void addData(final String path, final TimeInfo time_info,
      final List<Double> values) {
    List<FetchResult> blocks = data.get(path);
    if (blocks == null) {
      blocks = new ArrayList<FetchResult>(1);
      data.put(path, blocks);
    }
    if (!FetchResult.hasData(values)) {
      for (final FetchResult block : blocks) {
        if (block.hasData()) {
          return;
        }
      }
    }
    blocks.add(new FetchResult(time_info, values));
  }

  /** @return the blocks stored for a path, empty if none */
  public List<FetchResult> getData(final String path) {
    final List<FetchResult> blocks = data.get(path);
    return blocks == null ? new ArrayList<FetchResult>() : blocks;
  }

  /**
   * Builds fresh series for every block of every path of the pattern, in
   * path order. Each series is named after its path and remembers the
   * pattern as its path expression.
   * @param pattern The pattern
   * @return The series, empty if nothing was found
   */
  public List<TimeSeries> getSeriesList(final String pattern) {
    final List<TimeSeries> series = new ArrayList<TimeSeries>();
    for (final String path : getPaths(pattern)) {
      for (final FetchResult block : getData(path)) {
        final TimeInfo info = block.getTimeInfo();
        final TimeSeries ts = new TimeSeries(path, info.getStart(),
            info.getEnd(), info.getStep(), block.getValues());
        ts.setPathExpression(pattern);
        series.add(ts);
      }
    }
    return series;
  }

  @Override
  public String toString() {
    return "FetchAccumulator(patterns=" + paths.keySet() + ", paths="
        + data.keySet() + ")";
  }
}
