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
 * {@code identity(name, step=60)}: a series whose value at each point is the
 * point's own timestamp. Also registered as {@code time}.
 * @since 1.0
 */
public class Identity implements SeriesFunction {
  static final String NAME = "identity";

  @Override
  public Object evaluate(final RequestContext context, final List<Object> args,
      final Map<String, Object> kwargs) {
    final String name = FunctionArgs.string(NAME, args, kwargs, 0, "name", null);
    final long step = FunctionArgs.number(NAME, args, kwargs, 1, "step", 60L)
        .longValue();
    if (step <= 0) {
      throw new IllegalArgumentException("Step must be greater than zero: "
          + step);
    }
    final long start = context.getStartTime();
    final long end = context.getEndTime();
    final List<Double> values = new ArrayList<Double>();
    for (long ts = start; ts < end; ts += step) {
      values.add((double) ts);
    }
    final TimeSeries series = new TimeSeries(name, start, end, step, values);
    series.setPathExpression(NAME + "(\"" + name + "\")");
    final List<TimeSeries> results = new ArrayList<TimeSeries>(1);
    results.add(series);
    return results;
  }
}
