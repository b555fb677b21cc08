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

import java.util.List;
import java.util.Map;

import net.graphiteql.core.RequestContext;
import net.graphiteql.core.TimeSeries;
import net.graphiteql.query.expression.SeriesFunction;

/**
 * {@code keepLastValue(seriesList, limit=INF)}: fills runs of nulls with the
 * value preceding them, as long as the run is no longer than {@code limit}.
 * A trailing run is only filled when strictly shorter than the limit. The
 * first point is never filled.
 * @since 1.0
 */
public class KeepLastValue implements SeriesFunction {
  static final String NAME = "keepLastValue";

  @Override
  public Object evaluate(final RequestContext context, final List<Object> args,
      final Map<String, Object> kwargs) {
    final List<TimeSeries> series_list =
        FunctionArgs.seriesList(NAME, args, kwargs, 0, "seriesList");
    final double limit = FunctionArgs.number(NAME, args, kwargs, 1, "limit",
        Double.POSITIVE_INFINITY).doubleValue();

    for (final TimeSeries series : series_list) {
      series.setName(NAME + "(" + series.getName() + ")");
      series.setPathExpression(series.getName());
      int consecutive_nulls = 0;
      for (int i = 1; i < series.size(); i++) {
        if (series.get(i) == null) {
          consecutive_nulls++;
          continue;
        }
        if (consecutive_nulls > 0 && consecutive_nulls <= limit) {
          backfill(series, i - consecutive_nulls, i);
        }
        consecutive_nulls = 0;
      }
      if (consecutive_nulls > 0 && consecutive_nulls < limit) {
        backfill(series, series.size() - consecutive_nulls, series.size());
      }
    }
    return series_list;
  }

  /** Copies the value just before {@code from} into [from, to) */
  private static void backfill(final TimeSeries series, final int from,
      final int to) {
    final Double last = series.get(from - 1);
    for (int i = from; i < to; i++) {
      series.set(i, last);
    }
  }
}
