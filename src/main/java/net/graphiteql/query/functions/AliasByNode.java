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
package net.graphiteql.query.functions;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.Joiner;

import net.graphiteql.core.RequestContext;
import net.graphiteql.core.TimeSeries;
import net.graphiteql.query.expression.SeriesFunction;

/**
 * {@code aliasByNode(seriesList, *nodes)}: renames each series to the
 * selected, zero indexed, dot separated nodes of its metric path. The metric
 * path is dug out of any function calls wrapping it. Negative indices count
 * from the end.
 * @since 1.0
 */
public class AliasByNode implements SeriesFunction {
  static final String NAME = "aliasByNode";

  /** The innermost metric path of a possibly wrapped name */
  private static final Pattern METRIC =
      Pattern.compile("(?:.*\\()?(?<name>[-\\w*.]+)(?:,|\\)?.*)?");

  @Override
  public Object evaluate(final RequestContext context, final List<Object> args,
      final Map<String, Object> kwargs) {
    final List<TimeSeries> series_list =
        FunctionArgs.seriesList(NAME, args, kwargs, 0, "seriesList");
    final List<Integer> nodes = new ArrayList<Integer>();
    for (int i = 1; i < args.size(); i++) {
      nodes.add(FunctionArgs.integer(NAME, args, kwargs, i, "nodes", null));
    }

    for (final TimeSeries series : series_list) {
      final Matcher matcher = METRIC.matcher(series.getName());
      if (!matcher.find()) {
        continue;
      }
      final String[] pieces = matcher.group("name").split("\\.", -1);
      final List<String> selected = new ArrayList<String>(nodes.size());
      for (final int node : nodes) {
        final int idx = node < 0 ? pieces.length + node : node;
        if (idx < 0 || idx >= pieces.length) {
          throw new IllegalArgumentException("Node " + node
              + " is out of range for " + series.getName());
        }
        selected.add(pieces[idx]);
      }
      series.setName(Joiner.on('.').join(selected));
    }
    return series_list;
  }
}
