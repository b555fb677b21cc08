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
 * {@code divideSeries(dividendSeriesList, divisorSeriesList)}: divides every
 * dividend by the single divisor series. Each pair is normalized on its own.
 * @since 1.0
 */
public class DivideSeries implements SeriesFunction {
  static final String NAME = "divideSeries";

  @Override
  public Object evaluate(final RequestContext context, final List<Object> args,
      final Map<String, Object> kwargs) {
    final List<TimeSeries> dividends =
        FunctionArgs.seriesList(NAME, args, kwargs, 0, "dividendSeriesList");
    final List<TimeSeries> divisors =
        FunctionArgs.seriesList(NAME, args, kwargs, 1, "divisorSeriesList");
    if (divisors.size() != 1) {
      throw new IllegalArgumentException(
          "divideSeries second argument must reference exactly 1 series");
    }
    final TimeSeries divisor = divisors.get(0);

    final List<TimeSeries> results = new ArrayList<TimeSeries>();
    for (final TimeSeries dividend : dividends) {
      final String name = NAME + "(" + dividend.getName() + ","
          + divisor.getName() + ")";
      final SeriesLists.Normalized pair =
          SeriesLists.normalizeOne(Arrays.asList(dividend, divisor));
      final List<Double> values = new ArrayList<Double>();
      for (final List<Double> row : pair.rows()) {
        values.add(SeriesLists.safeDiv(row.get(0), row.get(1)));
      }
      results.add(new TimeSeries(name, pair.start(), pair.end(), pair.step(),
          values));
    }
    return results;
  }
}
