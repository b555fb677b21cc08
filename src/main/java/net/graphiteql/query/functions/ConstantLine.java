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
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import net.graphiteql.core.RequestContext;
import net.graphiteql.core.SeriesLists;
import net.graphiteql.core.TimeSeries;
import net.graphiteql.query.expression.SeriesFunction;

/**
 * {@code constantLine(value)}: a two point series at the value spanning the
 * request window.
 * @since 1.0
 */
public class ConstantLine implements SeriesFunction {
  static final String NAME = "constantLine";

  @Override
  public Object evaluate(final RequestContext context, final List<Object> args,
      final Map<String, Object> kwargs) {
    final Number value = FunctionArgs.number(NAME, args, kwargs, 0, "value",
        null);
    final long start = context.getStartTime();
    final long end = context.getEndTime();
    final double v = value.doubleValue();
    final TimeSeries series = new TimeSeries(SeriesLists.formatNumber(value),
        start, end, Math.max(end - start, 1), Arrays.asList(v, v));
    series.setPathExpression(NAME + "(" + SeriesLists.formatNumber(value) + ")");
    final List<TimeSeries> results = new ArrayList<TimeSeries>(1);
    results.add(series);
    return results;
  }
}
