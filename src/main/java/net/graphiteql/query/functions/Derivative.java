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
 * The difference between consecutive points. A point is null if it or its
 * predecessor is null. Three flavors share this class:
 * <ul>
 * <li>{@code derivative(seriesList)}: the raw deltas</li>
 * <li>{@code nonNegativeDerivative(seriesList, maxValue)}: negative deltas
 * become nulls, or wrap around {@code maxValue} when given</li>
 * <li>{@code perSecond(seriesList, maxValue)}: like the non negative flavor,
 * divided by the step</li>
 * </ul>
 * @since 1.0
 */
public class Derivative implements SeriesFunction {

  public enum Mode {
    DERIVATIVE("derivative"),
    NON_NEGATIVE("nonNegativeDerivative"),
    PER_SECOND("perSecond");

    private final String function_name;

    Mode(final String function_name) {
      this.function_name = function_name;
    }
  }

  private final Mode mode;

  public Derivative(final Mode mode) {
    this.mode = mode;
  }

  @Override
  public Object evaluate(final RequestContext context, final List<Object> args,
      final Map<String, Object> kwargs) {
    final String function = mode.function_name;
    final List<TimeSeries> series_list =
        FunctionArgs.seriesList(function, args, kwargs, 0, "seriesList");
    Double max_value = null;
    if (mode != Mode.DERIVATIVE
        && FunctionArgs.get(args, kwargs, 1, "maxValue") != null) {
      max_value = FunctionArgs.number(function, args, kwargs, 1, "maxValue",
          null).doubleValue();
    }

    final List<TimeSeries> results = new ArrayList<TimeSeries>();
    for (final TimeSeries series : series_list) {
      final double divisor = mode == Mode.PER_SECOND ? series.getStep() : 1;
      final List<Double> values = new ArrayList<Double>(series.size());
      Double prev = null;
      for (int i = 0; i < series.size(); i++) {
        final Double value = series.get(i);
        if (prev == null || value == null) {
          values.add(null);
        } else if (mode == Mode.DERIVATIVE) {
          values.add(value - prev);
        } else {
          final double diff = value - prev;
          if (diff >= 0) {
            values.add(diff / divisor);
          } else if (max_value != null && max_value >= value) {
            values.add(((max_value - prev) + value + 1) / divisor);
          } else {
            values.add(null);
          }
        }
        prev = value;
      }
      results.add(new TimeSeries(function + "(" + series.getName() + ")",
          series.getStart(), series.getEnd(), series.getStep(), values));
    }
    return results;
  }
}
