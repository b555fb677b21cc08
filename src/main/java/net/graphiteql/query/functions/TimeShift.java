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
import net.graphiteql.query.expression.Evaluator;
import net.graphiteql.query.expression.SeriesFunction;
import net.graphiteql.utils.DateTime;

/**
 * {@code timeShift(seriesList, "7d", resetEnd=true)}: re-evaluates the
 * expression of the series over a shifted window and draws the result over
 * the original window. An unsigned shift moves back in time.
 * <p>
 * All series of the list share one path expression, only the first one is
 * evaluated.
 * @since 1.0
 */
public class TimeShift implements SeriesFunction {
  static final String NAME = "timeShift";

  @Override
  public Object evaluate(final RequestContext context, final List<Object> args,
      final Map<String, Object> kwargs) {
    final List<TimeSeries> series_list =
        FunctionArgs.seriesList(NAME, args, kwargs, 0, "seriesList");
    String shift = FunctionArgs.string(NAME, args, kwargs, 1, "timeShift",
        null);
    final boolean reset_end =
        FunctionArgs.bool(NAME, args, kwargs, 2, "resetEnd", true);
    if (shift.isEmpty()) {
      throw new IllegalArgumentException("Empty time shift");
    }
    if (Character.isDigit(shift.charAt(0))) {
      shift = "-" + shift;
    }
    final long delta = DateTime.parseTimeOffset(shift);

    final List<TimeSeries> results = new ArrayList<TimeSeries>();
    if (series_list.isEmpty()) {
      return results;
    }
    final Evaluator evaluator = context.getEvaluator();
    if (evaluator == null) {
      throw new IllegalStateException("The request has no evaluator to "
          + "shift with");
    }
    final RequestContext shifted_context = context.copy(
        context.getStartTime() + delta, context.getEndTime() + delta);
    final TimeSeries series = series_list.get(0);
    for (final TimeSeries shifted : evaluator.evaluateTarget(shifted_context,
        series.getPathExpression())) {
      shifted.setName(NAME + "(" + shifted.getName() + ", " + shift + ")");
      if (reset_end) {
        shifted.setEnd(series.getEnd());
      } else {
        shifted.setEnd(shifted.getEnd() - shifted.getStart()
            + series.getStart());
      }
      shifted.setStart(series.getStart());
      results.add(shifted);
    }
    return results;
  }
}
