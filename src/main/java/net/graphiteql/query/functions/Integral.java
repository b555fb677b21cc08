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
import net.graphiteql.core.TimeSeries;
import net.graphiteql.query.expression.SeriesFunction;

/**
 * Running sum over time. Nulls stay null and do not reset the sum.
 * @since 1.0
 */
public class Integral implements SeriesFunction {
  static final String NAME = "integral";

  @Override
  public Object evaluate(final RequestContext context, final List<Object> args,
      final Map<String, Object> kwargs) {
    final List<TimeSeries> series_list =
        FunctionArgs.seriesList(NAME, args, kwargs, 0, "seriesList");
    final List<TimeSeries> results = new ArrayList<TimeSeries>();
    for (final TimeSeries series : series_list) {
      final List<Double> values = new ArrayList<Double>(series.size());
      double current = 0;
      for (int i = 0; i < series.size(); i++) {
        final Double value = series.get(i);
        if (value == null) {
          values.add(null);
        } else {
          current += value;
          values.add(current);
        }
      }
      results.add(new TimeSeries(NAME + "(" + series.getName() + ")",
          series.getStart(), series.getEnd(), series.getStep(), values));
    }
    return results;
  }
}
