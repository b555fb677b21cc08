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
 * {@code holtWintersConfidenceBands(seriesList, delta=3)}: the Holt-Winters
 * forecast plus and minus {@code delta} times the forecast deviation. Emits a
 * lower then an upper band per input series.
 * @since 1.0
 */
public class HoltWintersConfidenceBands implements SeriesFunction {
  static final String NAME = "holtWintersConfidenceBands";

  @Override
  public Object evaluate(final RequestContext context, final List<Object> args,
      final Map<String, Object> kwargs) {
    final List<TimeSeries> series_list =
        FunctionArgs.seriesList(NAME, args, kwargs, 0, "seriesList");
    final double delta =
        FunctionArgs.number(NAME, args, kwargs, 1, "delta", 3).doubleValue();
    return bands(context, series_list, delta);
  }

  /**
   * Computes the bands.
   * @return For every input a lower then an upper band
   */
  static List<TimeSeries> bands(final RequestContext context,
      final List<TimeSeries> series_list, final double delta) {
    final List<TimeSeries> results = new ArrayList<TimeSeries>();
    if (series_list.isEmpty()) {
      return results;
    }
    final List<TimeSeries> bootstraps = Bootstrap.fetchWithBootstrap(context,
        series_list, HoltWinters.BOOTSTRAP_SECONDS);
    for (int s = 0; s < series_list.size(); s++) {
      final TimeSeries series = series_list.get(s);
      final HoltWinters.Analysis analysis =
          HoltWinters.analyze(bootstraps.get(s));
      final TimeSeries forecast =
          Bootstrap.trimBootstrap(analysis.predictions(), series);
      final TimeSeries deviation =
          Bootstrap.trimBootstrap(analysis.deviations(), series);

      final List<Double> upper = new ArrayList<Double>(forecast.size());
      final List<Double> lower = new ArrayList<Double>(forecast.size());
      for (int i = 0; i < forecast.size(); i++) {
        final Double predicted = forecast.get(i);
        final Double deviated = i < deviation.size() ? deviation.get(i) : null;
        if (predicted == null || deviated == null) {
          upper.add(null);
          lower.add(null);
        } else {
          final double scaled = delta * deviated;
          upper.add(predicted + scaled);
          lower.add(predicted - scaled);
        }
      }

      final TimeSeries lower_series = new TimeSeries(
          "holtWintersConfidenceLower(" + series.getName() + ")",
          forecast.getStart(), forecast.getEnd(), forecast.getStep(), lower);
      final TimeSeries upper_series = new TimeSeries(
          "holtWintersConfidenceUpper(" + series.getName() + ")",
          forecast.getStart(), forecast.getEnd(), forecast.getStep(), upper);
      lower_series.setPathExpression(series.getPathExpression());
      upper_series.setPathExpression(series.getPathExpression());
      results.add(lower_series);
      results.add(upper_series);
    }
    return results;
  }
}
