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

import com.google.common.base.Joiner;

import net.graphiteql.core.RequestContext;
import net.graphiteql.core.SeriesLists;
import net.graphiteql.core.TimeSeries;
import net.graphiteql.query.expression.SeriesFunction;

/**
 * Combines every series of every argument into one series, point by point.
 * The inputs are normalized to a common step and window first. The result is
 * named {@code fn(pathExpressions)} so it can be evaluated again.
 * @since 1.0
 */
public class AggregateSeries implements SeriesFunction {

  /** How a row of aligned samples is reduced to one value */
  public enum Aggregator {
    SUM("sumSeries") {
      @Override
      Double apply(final List<Double> row) {
        return SeriesLists.safeSum(row);
      }
    },
    AVERAGE("averageSeries") {
      @Override
      Double apply(final List<Double> row) {
        return SeriesLists.safeAvg(row);
      }
    },
    MIN("minSeries") {
      @Override
      Double apply(final List<Double> row) {
        return SeriesLists.safeMin(row);
      }
    },
    MAX("maxSeries") {
      @Override
      Double apply(final List<Double> row) {
        return SeriesLists.safeMax(row);
      }
    },
    DIFF("diffSeries") {
      @Override
      Double apply(final List<Double> row) {
        return SeriesLists.safeDiff(row);
      }
    },
    MULTIPLY("multiplySeries") {
      @Override
      Double apply(final List<Double> row) {
        return SeriesLists.safeMul(row.toArray(new Double[row.size()]));
      }
    },
    RANGE("rangeOfSeries") {
      @Override
      Double apply(final List<Double> row) {
        final Double max = SeriesLists.safeMax(row);
        final Double min = SeriesLists.safeMin(row);
        return max == null ? null : max - min;
      }
    },
    STDDEV("stddevSeries") {
      @Override
      Double apply(final List<Double> row) {
        return SeriesLists.safeStdDev(row);
      }
    },
    COUNT("countSeries") {
      @Override
      Double apply(final List<Double> row) {
        return (double) row.size();
      }
    };

    private final String function_name;

    Aggregator(final String function_name) {
      this.function_name = function_name;
    }

    abstract Double apply(List<Double> row);

    public String functionName() {
      return function_name;
    }
  }

  private final Aggregator aggregator;

  public AggregateSeries(final Aggregator aggregator) {
    if (aggregator == null) {
      throw new IllegalArgumentException("Aggregator cannot be null");
    }
    this.aggregator = aggregator;
  }

  @Override
  public Object evaluate(final RequestContext context, final List<Object> args,
      final Map<String, Object> kwargs) {
    final List<List<TimeSeries>> series_lists =
        FunctionArgs.seriesLists(aggregator.functionName(), args, 0);
    boolean any = false;
    for (final List<TimeSeries> list : series_lists) {
      any |= !list.isEmpty();
    }
    if (!any) {
      return new ArrayList<TimeSeries>();
    }

    final SeriesLists.Normalized normalized =
        SeriesLists.normalize(series_lists);
    if (aggregator == Aggregator.MULTIPLY && normalized.series().size() == 1) {
      return new ArrayList<TimeSeries>(normalized.series());
    }

    final String name;
    if (aggregator == Aggregator.MULTIPLY) {
      final List<String> names = new ArrayList<String>();
      for (final TimeSeries series : normalized.series()) {
        names.add(series.getName());
      }
      name = aggregator.functionName() + "(" + Joiner.on(',').join(names) + ")";
    } else {
      name = aggregator.functionName() + "("
          + SeriesLists.formatPathExpressions(normalized.series()) + ")";
    }

    final List<Double> values = new ArrayList<Double>();
    for (final List<Double> row : normalized.rows()) {
      values.add(aggregator.apply(row));
    }
    final TimeSeries result = new TimeSeries(name, normalized.start(),
        normalized.end(), normalized.step(), values);
    final List<TimeSeries> results = new ArrayList<TimeSeries>(1);
    results.add(result);
    return results;
  }

  public Aggregator getAggregator() {
    return aggregator;
  }
}
