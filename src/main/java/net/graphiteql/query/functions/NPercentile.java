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
import java.util.Collections;
import java.util.List;
import java.util.Map;

import net.graphiteql.core.RequestContext;
import net.graphiteql.core.SeriesLists;
import net.graphiteql.core.TimeSeries;
import net.graphiteql.query.expression.SeriesFunction;

/**
 * {@code nPercentile(seriesList, n)}: replaces each series by a flat line at
 * its own n-th percentile. Series without any value are dropped.
 * @since 1.0
 */
public class NPercentile implements SeriesFunction {
  static final String NAME = "nPercentile";

  @Override
  public Object evaluate(final RequestContext context, final List<Object> args,
      final Map<String, Object> kwargs) {
    final List<TimeSeries> series_list =
        FunctionArgs.seriesList(NAME, args, kwargs, 0, "seriesList");
    final double n =
        FunctionArgs.number(NAME, args, kwargs, 1, "n", null).doubleValue();
    if (n <= 0) {
      throw new IllegalArgumentException(
          "The requested percent is required to be greater than 0");
    }

    final List<TimeSeries> results = new ArrayList<TimeSeries>();
    for (final TimeSeries series : series_list) {
      final List<Double> values = series.consolidatedValues();
      if (SeriesLists.nonNull(values).isEmpty()) {
        continue;
      }
      final Double percentile = Percentiles.getPercentile(values, n, false);
      final String name = NAME + "(" + series.getName() + ", "
          + SeriesLists.formatG(n) + ")";
      final int points = (int) ((series.getEnd() - series.getStart())
          / series.getStep());
      results.add(new TimeSeries(name, series.getStart(), series.getEnd(),
          series.getStep(), Collections.nCopies(Math.max(points, 0),
              percentile)));
    }
    return results;
  }
}
