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
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import net.graphiteql.core.TimeSeries;

public class TestPercentiles extends BaseFunctionTest {

  private static List<Double> oneToHundred() {
    final List<Double> values = new ArrayList<Double>(100);
    for (int i = 100; i > 0; i--) {
      values.add((double) i);
    }
    return values;
  }

  @Test
  public void getPercentile() throws Exception {
    assertEquals(31.0, Percentiles.getPercentile(oneToHundred(), 30, false),
        0.0001);
    assertEquals(30.3, Percentiles.getPercentile(oneToHundred(), 30, true),
        0.0001);
  }

  @Test
  public void getPercentileMidpoint() throws Exception {
    final List<Double> values = Arrays.asList(4.0, null, 2.0, 1.0, 3.0);
    assertEquals(3.0, Percentiles.getPercentile(values, 50, false), 0.0001);
    assertEquals(2.5, Percentiles.getPercentile(values, 50, true), 0.0001);
  }

  @Test
  public void getPercentileBounds() throws Exception {
    final List<Double> values = Arrays.asList(1.0, 2.0, 3.0);
    assertEquals(3.0, Percentiles.getPercentile(values, 100, false), 0.0001);
    assertEquals(3.0, Percentiles.getPercentile(values, 100, true), 0.0001);
    assertEquals(1.0, Percentiles.getPercentile(values, 1, false), 0.0001);
    assertEquals(1.0, Percentiles.getPercentile(values, 1, true), 0.0001);
  }

  @Test
  public void getPercentileNoValues() throws Exception {
    assertNull(Percentiles.getPercentile(Collections.<Double>emptyList(), 50,
        false));
    assertNull(Percentiles.getPercentile(Arrays.asList((Double) null), 50,
        true));
  }

  @Test
  public void percentileOfSeries() throws Exception {
    final List<TimeSeries> results = results(new PercentileOfSeries().evaluate(
        context, args(list(series("a", 1.0, 2.0, null),
            series("b", 3.0, null, null), series("c", 5.0, 6.0, null)), 50L),
        noKwargs()));
    assertEquals(1, results.size());
    assertEquals("percentileOfSeries(a,50)", results.get(0).getName());
    assertEquals(Arrays.asList(3.0, 6.0, null), results.get(0).rawValues());
  }

  @Test
  public void percentileOfSeriesInterpolated() throws Exception {
    final List<TimeSeries> results = results(new PercentileOfSeries().evaluate(
        context, args(list(series("a", 1.0, 2.0),
            series("b", 3.0, null), series("c", 5.0, 6.0)), 50L, true),
        noKwargs()));
    assertEquals(Arrays.asList(3.0, 4.0), results.get(0).rawValues());
  }

  @Test
  public void percentileOfSeriesEmpty() throws Exception {
    assertTrue(results(new PercentileOfSeries().evaluate(context,
        args(list(), 50L), noKwargs())).isEmpty());
  }

  @Test (expected = IllegalArgumentException.class)
  public void percentileOfSeriesZero() throws Exception {
    new PercentileOfSeries().evaluate(context,
        args(list(series("a", 1.0)), 0L), noKwargs());
  }

  @Test
  public void nPercentile() throws Exception {
    final List<TimeSeries> results = results(new NPercentile().evaluate(
        context, args(list(series("a", 4.0, 1.0, 3.0, 2.0),
            series("empty", null, null)), 50L), noKwargs()));
    assertEquals(1, results.size());
    assertEquals("nPercentile(a, 50)", results.get(0).getName());
    assertEquals(Arrays.asList(3.0, 3.0, 3.0, 3.0),
        results.get(0).rawValues());
    assertEquals(0, results.get(0).getStart());
    assertEquals(40, results.get(0).getEnd());
  }

  @Test
  public void nPercentileThroughEvaluator() throws Exception {
    finder.addSeries("a.b", 0, 10, Arrays.asList(1.0, 2.0, 3.0, 4.0, 5.0, 6.0));
    final List<TimeSeries> results =
        evaluator.evaluateTarget(context, "nPercentile(a.b, 50)");
    assertEquals(1, results.size());
    assertEquals("nPercentile(a.b, 50)", results.get(0).getName());
    assertEquals(4.0, results.get(0).get(0), 0.0001);
  }

  @Test (expected = IllegalArgumentException.class)
  public void nPercentileNegative() throws Exception {
    new NPercentile().evaluate(context, args(list(series("a", 1.0)), -5L),
        noKwargs());
  }
}
