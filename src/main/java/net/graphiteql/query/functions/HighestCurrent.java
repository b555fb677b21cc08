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
 * {@code highestCurrent(seriesList, n=1)} and
 * {@code lowestCurrent(seriesList, n=1)}: keeps the n series with the highest
 * or lowest last non-null value. The result is ordered by that value,
 * ascending. Series without any value sort lowest.
 * @since 1.0
 */
public class HighestCurrent implements SeriesFunction {

  private final boolean lowest;

  /**
   * Default ctor
   * @param lowest Whether to keep the lowest instead of the highest
   */
  public HighestCurrent(final boolean lowest) {
    this.lowest = lowest;
  }

  @Override
  public Object evaluate(final RequestContext context, final List<Object> args,
      final Map<String, Object> kwargs) {
    final String function = lowest ? "lowestCurrent" : "highestCurrent";
    final List<TimeSeries> series_list =
        FunctionArgs.seriesList(function, args, kwargs, 0, "seriesList");
    final int n = FunctionArgs.integer(function, args, kwargs, 1, "n", 1);
    if (n <= 0) {
      return new ArrayList<TimeSeries>();
    }

    Collections.sort(series_list, new SeriesComparator() {
      @Override
      Double key(final TimeSeries series) {
        return SeriesLists.safeLast(series.consolidatedValues());
      }
    });
    final int size = series_list.size();
    if (lowest) {
      return new ArrayList<TimeSeries>(series_list.subList(0, Math.min(n, size)));
    }
    return new ArrayList<TimeSeries>(
        series_list.subList(Math.max(0, size - n), size));
  }
}
