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

import net.graphiteql.core.ConsolidationFunction;
import net.graphiteql.core.RequestContext;
import net.graphiteql.core.TimeSeries;
import net.graphiteql.query.expression.SeriesFunction;

/**
 * {@code consolidateBy(seriesList, consolidationFunc)}: changes how points
 * are folded together when a series is consolidated. Valid names are sum,
 * average, max and min. {@code cumulative(seriesList)} is the sum flavor.
 * @since 1.0
 */
public class ConsolidateBy implements SeriesFunction {
  static final String NAME = "consolidateBy";

  /** Fixed function for the cumulative alias, null to read the argument */
  private final ConsolidationFunction fixed;

  /** Ctor for consolidateBy */
  public ConsolidateBy() {
    this(null);
  }

  /**
   * Ctor for aliases that always use the same function
   * @param fixed The function to apply
   */
  public ConsolidateBy(final ConsolidationFunction fixed) {
    this.fixed = fixed;
  }

  @Override
  public Object evaluate(final RequestContext context, final List<Object> args,
      final Map<String, Object> kwargs) {
    final List<TimeSeries> series_list =
        FunctionArgs.seriesList(NAME, args, kwargs, 0, "seriesList");
    final ConsolidationFunction function = fixed != null ? fixed
        : ConsolidationFunction.fromName(FunctionArgs.string(NAME, args,
            kwargs, 1, "consolidationFunc", null));
    for (final TimeSeries series : series_list) {
      series.setConsolidationFunction(function);
      series.setName(NAME + "(" + series.getName() + ",\""
          + function.functionName() + "\")");
      series.setPathExpression(series.getName());
    }
    return series_list;
  }
}
