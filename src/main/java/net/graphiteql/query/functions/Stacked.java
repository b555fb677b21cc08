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
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import net.graphiteql.core.RequestContext;
import net.graphiteql.core.TimeSeries;
import net.graphiteql.query.expression.SeriesFunction;

/**
 * {@code stacked(seriesList, stack='__DEFAULT__')}: replaces each value with
 * the running total of that point across every series stacked so far. The
 * totals live in the request scratch map, keyed by stack name, so several
 * targets of one request stack on top of each other.
 * @since 1.0
 */
public class Stacked implements SeriesFunction {
  static final String NAME = "stacked";

  /** Scratch key holding the totals of every stack */
  static final String TOTAL_STACK = "totalStack";

  static final String DEFAULT_STACK = "__DEFAULT__";

  @Override
  public Object evaluate(final RequestContext context, final List<Object> args,
      final Map<String, Object> kwargs) {
    final List<TimeSeries> series_list =
        FunctionArgs.seriesList(NAME, args, kwargs, 0, "seriesLists");
    final String stack_name = FunctionArgs.string(NAME, args, kwargs, 1,
        "stackName", DEFAULT_STACK);

    final Map<String, List<Double>> stacks = stacks(context);
    List<Double> total = stacks.get(stack_name);
    if (total == null) {
      total = new ArrayList<Double>();
    }

    final List<TimeSeries> results = new ArrayList<TimeSeries>();
    for (final TimeSeries series : series_list) {
      final List<Double> values = new ArrayList<Double>(series.size());
      for (int i = 0; i < series.size(); i++) {
        if (total.size() <= i) {
          total.add(0.0);
        }
        final Double value = series.get(i);
        if (value != null) {
          total.set(i, total.get(i) + value);
          values.add(total.get(i));
        } else {
          values.add(null);
        }
      }

      final String new_name = DEFAULT_STACK.equals(stack_name)
          ? NAME + "(" + series.getName() + ")" : series.getName();
      final TimeSeries stacked = new TimeSeries(new_name, series.getStart(),
          series.getEnd(), series.getStep(), values);
      stacked.getOptions().put("stacked", true);
      results.add(stacked);
    }
    stacks.put(stack_name, total);
    return results;
  }

  @SuppressWarnings("unchecked")
  private static Map<String, List<Double>> stacks(
      final RequestContext context) {
    Map<String, List<Double>> stacks =
        (Map<String, List<Double>>) context.getScratch().get(TOTAL_STACK);
    if (stacks == null) {
      stacks = new HashMap<String, List<Double>>();
      context.getScratch().put(TOTAL_STACK, stacks);
    }
    return stacks;
  }
}
