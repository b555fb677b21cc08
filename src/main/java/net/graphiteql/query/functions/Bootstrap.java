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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.graphiteql.core.RequestContext;
import net.graphiteql.core.TimeSeries;
import net.graphiteql.query.expression.Evaluator;

/**
 * Re-fetches series over a window preceding the request so windowed
 * functions have history to work with at the start of the graph.
 * @since 1.0
 */
final class Bootstrap {
  private static final Logger LOG = LoggerFactory.getLogger(Bootstrap.class);

  /** Don't instantiate me! */
  private Bootstrap() { }

  /**
   * Evaluates the path expression of every series again over
   * {@code [start - seconds, start)} and prepends the result to the
   * original values. Coarser bootstrap data is repeated to match the
   * original step. Bootstrap series are paired with the originals by name,
   * an original without a namesake in the bootstrap window is returned
   * unextended.
   * @param context The request
   * @param series_list The series to extend
   * @param seconds How far back to go
   * @return One extended series per input, in input order. The extended
   * series start where the bootstrap starts.
   */
  static List<TimeSeries> fetchWithBootstrap(final RequestContext context,
      final List<TimeSeries> series_list, final long seconds) {
    final Evaluator evaluator = context.getEvaluator();
    if (evaluator == null) {
      throw new IllegalStateException("The request has no evaluator to "
          + "fetch bootstrap data with");
    }
    final RequestContext bootstrap_context = context.copy(
        context.getStartTime() - seconds, context.getStartTime());

    // several series may come from the same expression, fetch it once
    final Set<String> expressions = new LinkedHashSet<String>();
    for (final TimeSeries series : series_list) {
      expressions.add(series.getPathExpression());
    }
    final List<TimeSeries> bootstraps = evaluator.evaluateTargets(
        bootstrap_context, new ArrayList<String>(expressions));
    final Map<String, TimeSeries> by_name = new HashMap<String, TimeSeries>();
    for (final TimeSeries bootstrap : bootstraps) {
      if (!by_name.containsKey(bootstrap.getName())) {
        by_name.put(bootstrap.getName(), bootstrap);
      }
    }

    final List<TimeSeries> results = new ArrayList<TimeSeries>();
    for (final TimeSeries original : series_list) {
      final TimeSeries bootstrap = by_name.get(original.getName());
      if (bootstrap == null && LOG.isDebugEnabled()) {
        LOG.debug("No bootstrap data for " + original.getName() + " from "
            + bootstrap_context.getStartTime() + " to "
            + bootstrap_context.getEndTime());
      }
      final List<Double> values = new ArrayList<Double>();
      long start = original.getStart();
      if (bootstrap != null) {
        start = bootstrap.getStart();
        if (bootstrap.getStep() > original.getStep()) {
          final long ratio = bootstrap.getStep() / original.getStep();
          for (final Double value : bootstrap.rawValues()) {
            for (long r = 0; r < ratio; r++) {
              values.add(value);
            }
          }
        } else {
          values.addAll(bootstrap.rawValues());
        }
      }
      values.addAll(original.rawValues());
      final TimeSeries extended = new TimeSeries(original.getName(), start,
          original.getEnd(), original.getStep(), values);
      extended.setPathExpression(original.getPathExpression());
      results.add(extended);
    }
    return results;
  }

  /**
   * Cuts the bootstrap period off the front of a series computed over the
   * extended window so it lines up with the original again.
   * @param bootstrap The series over the extended window
   * @param original The series over the requested window
   * @return A new series ending where the bootstrap ends
   */
  static TimeSeries trimBootstrap(final TimeSeries bootstrap,
      final TimeSeries original) {
    final int length_limit = (int) ((original.size() * original.getStep())
        / bootstrap.getStep());
    final int from = Math.max(0, bootstrap.size() - length_limit);
    final long trim_start = bootstrap.getEnd()
        - (length_limit * bootstrap.getStep());
    final TimeSeries trimmed = new TimeSeries(bootstrap.getName(), trim_start,
        bootstrap.getEnd(), bootstrap.getStep(),
        bootstrap.rawValues().subList(from, bootstrap.size()));
    trimmed.setPathExpression(bootstrap.getPathExpression());
    return trimmed;
  }
}
