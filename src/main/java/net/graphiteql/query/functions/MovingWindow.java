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
import net.graphiteql.core.SeriesLists;
import net.graphiteql.core.TimeSeries;
import net.graphiteql.query.expression.SeriesFunction;
import net.graphiteql.utils.DateTime;

/**
 * Base for functions computing a statistic over the points preceding each
 * point, e.g. {@code movingAverage(seriesList, 5)} or
 * {@code movingAverage(seriesList, '10min')}. The window is either a number
 * of points or a quoted time offset. History before the request window is
 * fetched through {@link Bootstrap} so the first points have a full window.
 * Points whose window reaches past the available history are null.
 * @since 1.0
 */
public abstract class MovingWindow implements SeriesFunction {

  /** @return the function name used in series names */
  protected abstract String name();

  /** @return the statistic over the window, null when nothing to compute */
  protected abstract Double aggregate(List<Double> window);

  /** @return how the numeric window size renders in the series name */
  protected String formatPoints(final Number window_size,
      final long window_points) {
    return SeriesLists.formatNumber(window_size);
  }

  @Override
  public Object evaluate(final RequestContext context, final List<Object> args,
      final Map<String, Object> kwargs) {
    final List<TimeSeries> series_list =
        FunctionArgs.seriesList(name(), args, kwargs, 0, "seriesList");
    final Object window_size = FunctionArgs.get(args, kwargs, 1, "windowSize");
    if (series_list.isEmpty()) {
      return new ArrayList<TimeSeries>();
    }

    long window_interval = 0;
    long window_points = 0;
    if (window_size instanceof String) {
      window_interval = Math.abs(DateTime.parseTimeOffset((String) window_size));
      if (window_interval <= 0) {
        throw new IllegalArgumentException(name() + " window must be greater "
            + "than zero: " + window_size);
      }
    } else if (window_size instanceof Number) {
      window_points = ((Number) window_size).longValue();
      if (window_points <= 0) {
        throw new IllegalArgumentException(name() + " window must be an "
            + "integer greater than zero");
      }
    } else {
      throw new IllegalArgumentException("Unparseable window size: "
          + window_size);
    }

    final long bootstrap_seconds;
    if (window_interval > 0) {
      bootstrap_seconds = window_interval;
    } else {
      long max_step = 0;
      for (final TimeSeries series : series_list) {
        max_step = Math.max(max_step, series.getStep());
      }
      bootstrap_seconds = max_step * window_points;
    }
    final List<TimeSeries> bootstraps =
        Bootstrap.fetchWithBootstrap(context, series_list, bootstrap_seconds);

    final List<TimeSeries> results = new ArrayList<TimeSeries>();
    for (int s = 0; s < series_list.size(); s++) {
      final TimeSeries series = series_list.get(s);
      final TimeSeries bootstrap = bootstraps.get(s);
      final long points = window_interval > 0
          ? window_interval / series.getStep() : window_points;
      final String new_name;
      if (window_size instanceof String) {
        new_name = name() + "(" + series.getName() + ",\"" + window_size + "\")";
      } else {
        new_name = name() + "(" + series.getName() + ","
            + formatPoints((Number) window_size, points) + ")";
      }

      final List<Double> bootstrap_values = bootstrap.rawValues();
      final int offset = bootstrap_values.size() - series.size();
      final List<Double> values = new ArrayList<Double>(series.size());
      for (int i = 0; i < series.size(); i++) {
        final long from = i + offset - points;
        final int to = i + offset;
        if (from < 0 || to < from) {
          values.add(null);
        } else {
          values.add(aggregate(bootstrap_values.subList((int) from, to)));
        }
      }
      results.add(new TimeSeries(new_name, series.getStart(), series.getEnd(),
          series.getStep(), values));
    }
    return results;
  }
}
