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
 * {@code highestMax(seriesList, n=1)}: keeps the n series with the highest
 * maximum, highest first.
 * @since 1.0
 */
public class HighestMax implements SeriesFunction {
  static final String NAME = "highestMax";

  @Override
  public Object evaluate(final RequestContext context, final List<Object> args,
      final Map<String, Object> kwargs) {
    final List<TimeSeries> series_list =
        FunctionArgs.seriesList(NAME, args, kwargs, 0, "seriesList");
    final int n = FunctionArgs.integer(NAME, args, kwargs, 1, "n", 1);
    if (n <= 0) {
      return new ArrayList<TimeSeries>();
    }

    final SeriesComparator by_max = new SeriesComparator() {
      @Override
      Double key(final TimeSeries series) {
        return SeriesLists.safeMax(series);
      }
    };
    Collections.sort(series_list, by_max);
    final List<TimeSeries> results = new ArrayList<TimeSeries>(
        series_list.subList(Math.max(0, series_list.size() - n),
            series_list.size()));
    Collections.sort(results, Collections.reverseOrder(by_max));
    return results;
  }
}
