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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import net.graphiteql.core.TimeSeries;

public class TestAggregateSeries extends BaseFunctionTest {

  private List<TimeSeries> aggregate(final AggregateSeries.Aggregator aggregator,
      final Object... args) {
    return results(new AggregateSeries(aggregator).evaluate(context,
        args(args), noKwargs()));
  }

  @Test (expected = IllegalArgumentException.class)
  public void ctorNull() throws Exception {
    new AggregateSeries(null);
  }

  @Test
  public void sum() throws Exception {
    final List<TimeSeries> results = aggregate(AggregateSeries.Aggregator.SUM,
        list(series("a", 1.0, 2.0, null), series("b", 2.0, null, null)));
    assertEquals(1, results.size());
    assertEquals("sumSeries(a,b)", results.get(0).getName());
    assertEquals(Arrays.asList(3.0, 2.0, null), results.get(0).rawValues());
    assertEquals(10, results.get(0).getStep());
  }

  @Test
  public void sumAcrossArguments() throws Exception {
    final List<TimeSeries> results = aggregate(AggregateSeries.Aggregator.SUM,
        list(series("a", 1.0)), list(series("b", 2.0), series("c", 3.0)));
    assertEquals("sumSeries(a,b,c)", results.get(0).getName());
    assertEquals(Arrays.asList(6.0), results.get(0).rawValues());
  }

  @Test
  public void nameUsesPathExpressions() throws Exception {
    final TimeSeries a = series("x.a", 1.0);
    a.setPathExpression("x.*");
    final TimeSeries b = series("x.b", 1.0);
    b.setPathExpression("x.*");
    final List<TimeSeries> results =
        aggregate(AggregateSeries.Aggregator.AVERAGE, list(a, b));
    assertEquals("averageSeries(x.*)", results.get(0).getName());
  }

  @Test
  public void emptyInput() throws Exception {
    assertTrue(aggregate(AggregateSeries.Aggregator.SUM, list()).isEmpty());
    assertTrue(aggregate(AggregateSeries.Aggregator.SUM).isEmpty());
  }

  @Test
  public void differentSteps() throws Exception {
    final TimeSeries a = new TimeSeries("a", 0, 60, 10,
        Arrays.asList(1.0, 1.0, 1.0, 1.0, 1.0, 1.0));
    final TimeSeries b = new TimeSeries("b", 0, 60, 20,
        Arrays.asList(2.0, 4.0, 6.0));
    final List<TimeSeries> results =
        aggregate(AggregateSeries.Aggregator.SUM, list(a, b));
    assertEquals(20, results.get(0).getStep());
    assertEquals(Arrays.asList(3.0, 5.0, 7.0), results.get(0).rawValues());
  }

  @Test
  public void otherAggregators() throws Exception {
    assertEquals(Arrays.asList(2.0, null), aggregate(
        AggregateSeries.Aggregator.AVERAGE,
        list(series("a", 1.0, null), series("b", 3.0, null))).get(0)
          .rawValues());
    assertEquals(Arrays.asList(1.0), aggregate(AggregateSeries.Aggregator.MIN,
        list(series("a", 1.0), series("b", 3.0))).get(0).rawValues());
    assertEquals(Arrays.asList(3.0), aggregate(AggregateSeries.Aggregator.MAX,
        list(series("a", 1.0), series("b", 3.0))).get(0).rawValues());
    assertEquals(Arrays.asList(-2.0), aggregate(
        AggregateSeries.Aggregator.DIFF,
        list(series("a", 1.0), series("b", 3.0))).get(0).rawValues());
    assertEquals(Arrays.asList(2.0), aggregate(
        AggregateSeries.Aggregator.RANGE,
        list(series("a", 1.0), series("b", 3.0))).get(0).rawValues());
    assertEquals(Arrays.asList(1.0), aggregate(
        AggregateSeries.Aggregator.STDDEV,
        list(series("a", 1.0), series("b", 3.0))).get(0).rawValues());
    assertEquals(Arrays.asList(2.0, 2.0), aggregate(
        AggregateSeries.Aggregator.COUNT,
        list(series("a", 1.0, null), series("b", 3.0, null))).get(0)
          .rawValues());
  }

  @Test
  public void multiply() throws Exception {
    final List<TimeSeries> results = aggregate(
        AggregateSeries.Aggregator.MULTIPLY,
        list(series("a", 2.0, 2.0), series("b", 3.0, null)));
    assertEquals("multiplySeries(a,b)", results.get(0).getName());
    assertEquals(Arrays.asList(6.0, null), results.get(0).rawValues());
  }

  @Test
  public void multiplySingleSeries() throws Exception {
    final TimeSeries a = series("a", 2.0);
    final List<TimeSeries> results =
        aggregate(AggregateSeries.Aggregator.MULTIPLY, list(a));
    assertSame(a, results.get(0));
  }

  @Test
  public void throughEvaluator() throws Exception {
    finder.addSeries("web.host1.cpu", 0, 10, Arrays.asList(1.0, 2.0))
      .addSeries("web.host2.cpu", 0, 10, Arrays.asList(3.0, 4.0));
    context = newContext(0, 20);
    final List<TimeSeries> results =
        evaluator.evaluateTarget(context, "sum(web.*.cpu)");
    assertEquals("sumSeries(web.*.cpu)", results.get(0).getName());
    assertEquals(Arrays.asList(4.0, 6.0), results.get(0).rawValues());
  }

  @Test (expected = IllegalArgumentException.class)
  public void notASeriesList() throws Exception {
    aggregate(AggregateSeries.Aggregator.SUM, "nope");
  }
}
