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

import java.util.Map;

import com.google.common.collect.ImmutableMap;

import net.graphiteql.core.ConsolidationFunction;
import net.graphiteql.query.expression.FunctionModule;
import net.graphiteql.query.expression.SeriesFunction;

/**
 * The built-in functions. Several names alias the same implementation, e.g.
 * {@code sum} and {@code sumSeries}.
 * @since 1.0
 */
public class SeriesFunctions implements FunctionModule {

  @Override
  public Map<String, SeriesFunction> functions() {
    final SeriesFunction sum =
        new AggregateSeries(AggregateSeries.Aggregator.SUM);
    final SeriesFunction average =
        new AggregateSeries(AggregateSeries.Aggregator.AVERAGE);
    final SeriesFunction identity = new Identity();

    return ImmutableMap.<String, SeriesFunction>builder()
        // combining
        .put("sumSeries", sum)
        .put("sum", sum)
        .put("averageSeries", average)
        .put("avg", average)
        .put("minSeries", new AggregateSeries(AggregateSeries.Aggregator.MIN))
        .put("maxSeries", new AggregateSeries(AggregateSeries.Aggregator.MAX))
        .put("diffSeries", new AggregateSeries(AggregateSeries.Aggregator.DIFF))
        .put("multiplySeries",
            new AggregateSeries(AggregateSeries.Aggregator.MULTIPLY))
        .put("rangeOfSeries",
            new AggregateSeries(AggregateSeries.Aggregator.RANGE))
        .put("stddevSeries",
            new AggregateSeries(AggregateSeries.Aggregator.STDDEV))
        .put("countSeries",
            new AggregateSeries(AggregateSeries.Aggregator.COUNT))
        .put(PercentileOfSeries.NAME, new PercentileOfSeries())
        .put(DivideSeries.NAME, new DivideSeries())
        .put(Group.NAME, new Group())
        .put(Stacked.NAME, new Stacked())

        // transforms
        .put(Scale.NAME, new Scale())
        .put(Offset.NAME, new Offset())
        .put(Absolute.NAME, new Absolute())
        .put(Invert.NAME, new Invert())
        .put("derivative", new Derivative(Derivative.Mode.DERIVATIVE))
        .put("nonNegativeDerivative",
            new Derivative(Derivative.Mode.NON_NEGATIVE))
        .put("perSecond", new Derivative(Derivative.Mode.PER_SECOND))
        .put(Integral.NAME, new Integral())
        .put(KeepLastValue.NAME, new KeepLastValue())
        .put(TransformNull.NAME, new TransformNull())
        .put(ConsolidateBy.NAME, new ConsolidateBy())
        .put("cumulative", new ConsolidateBy(ConsolidationFunction.SUM))
        .put(NPercentile.NAME, new NPercentile())
        .put("movingAverage", new MovingAverage())
        .put("movingMedian", new MovingMedian())
        .put(HoltWintersForecast.NAME, new HoltWintersForecast())
        .put(HoltWintersConfidenceBands.NAME, new HoltWintersConfidenceBands())
        .put(HoltWintersAberration.NAME, new HoltWintersAberration())
        .put(TimeShift.NAME, new TimeShift())

        // naming
        .put(Alias.NAME, new Alias())
        .put(AliasByNode.NAME, new AliasByNode())
        .put(AliasByMetric.NAME, new AliasByMetric())
        .put(AliasSub.NAME, new AliasSub())

        // generators
        .put(ConstantLine.NAME, new ConstantLine())
        .put(Identity.NAME, identity)
        .put("time", identity)
        .put("timeFunction", identity)

        // filters and sorting
        .put(RemoveEmptySeries.NAME, new RemoveEmptySeries())
        .put(HighestMax.NAME, new HighestMax())
        .put("highestCurrent", new HighestCurrent(false))
        .put("lowestCurrent", new HighestCurrent(true))
        .put(Limit.NAME, new Limit())
        .put(SortByName.NAME, new SortByName())
        .build();
  }
}
