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
import net.graphiteql.core.TimeSeries;
import net.graphiteql.query.expression.SeriesFunction;

/**
 * {@code holtWintersAberration(seriesList, delta=3)}: how far each value lies
 * outside the Holt-Winters confidence bands. Positive above the upper band,
 * negative below the lower one, zero inside or when the value is missing.
 * @since 1.0
 */
public class HoltWintersAberration implements SeriesFunction {
  static final String NAME = "holtWintersAberration";

  @Override
  public Object evaluate(final RequestContext context, final List<Object> args,
      final Map<String, Object> kwargs) {
    final List<TimeSeries> series_list =
        FunctionArgs.seriesList(NAME, args, kwargs, 0, "seriesList");
    final double delta =
        FunctionArgs.number(NAME, args, kwargs, 1, "delta", 3).doubleValue();

    final List<TimeSeries> results = new ArrayList<TimeSeries>();
    for (final TimeSeries series : series_list) {
      final List<TimeSeries> bands = HoltWintersConfidenceBands.bands(context,
          Collections.singletonList(series), delta);
      final TimeSeries lower = bands.get(0);
      final TimeSeries upper = bands.get(1);
      final List<Double> aberration = new ArrayList<Double>(series.size());
      for (int i = 0; i < series.size(); i++) {
        final Double actual = series.get(i);
        final Double high = i < upper.size() ? upper.get(i) : null;
        final Double low = i < lower.size() ? lower.get(i) : null;
        if (actual == null) {
          aberration.add(0.0);
        } else if (high != null && actual > high) {
          aberration.add(actual - high);
        } else if (low != null && actual < low) {
          aberration.add(actual - low);
        } else {
          aberration.add(0.0);
        }
      }
      results.add(new TimeSeries(NAME + "(" + series.getName() + ")",
          series.getStart(), series.getEnd(), series.getStep(), aberration));
    }
    return results;
  }
}
