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
import net.graphiteql.core.SeriesLists;
import net.graphiteql.core.TimeSeries;
import net.graphiteql.query.expression.SeriesFunction;

/**
 * Adds a constant to every non-null point, in place.
 * @since 1.0
 */
public class Offset implements SeriesFunction {
  static final String NAME = "offset";

  @Override
  public Object evaluate(final RequestContext context, final List<Object> args,
      final Map<String, Object> kwargs) {
    final List<TimeSeries> series_list =
        FunctionArgs.seriesList(NAME, args, kwargs, 0, "seriesList");
    final double factor =
        FunctionArgs.number(NAME, args, kwargs, 1, "factor", null).doubleValue();
    for (final TimeSeries series : series_list) {
      series.setName(NAME + "(" + series.getName() + ","
          + SeriesLists.formatG(factor) + ")");
      series.setPathExpression(series.getName());
      for (int i = 0; i < series.size(); i++) {
        if (series.get(i) != null) {
          series.set(i, series.get(i) + factor);
        }
      }
    }
    return series_list;
  }
}
