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

import net.graphiteql.core.RequestContext;
import net.graphiteql.core.SeriesLists;
import net.graphiteql.core.TimeSeries;
import net.graphiteql.query.expression.SeriesFunction;

/**
 * {@code percentileOfSeries(seriesList, n, interpolate=false)}: one series
 * holding, at each point, the n-th percentile across all the inputs.
 * @since 1.0
 */
public class PercentileOfSeries implements SeriesFunction {
  static final String NAME = "percentileOfSeries";

  @Override
  public Object evaluate(final RequestContext context, final List<Object> args,
      final Map<String, Object> kwargs) {
    final List<TimeSeries> series_list =
        FunctionArgs.seriesList(NAME, args, kwargs, 0, "seriesList");
    final double n =
        FunctionArgs.number(NAME, args, kwargs, 1, "n", null).doubleValue();
    final boolean interpolate =
        FunctionArgs.bool(NAME, args, kwargs, 2, "interpolate", false);
    if (n <= 0) {
      throw new IllegalArgumentException(
          "The requested percent is required to be greater than 0");
    }
    final List<TimeSeries> results = new ArrayList<TimeSeries>(1);
    if (series_list.isEmpty()) {
      return results;
    }

    final String name = NAME + "(" + series_list.get(0).getPathExpression()
        + "," + SeriesLists.formatG(n) + ")";
    final SeriesLists.Normalized normalized =
        SeriesLists.normalizeOne(series_list);
    final List<Double> values = new ArrayList<Double>();
    for (final List<Double> row : normalized.rows()) {
      values.add(Percentiles.getPercentile(row, n, interpolate));
    }
    results.add(new TimeSeries(name, normalized.start(), normalized.end(),
        normalized.step(), values));
    return results;
  }
}
