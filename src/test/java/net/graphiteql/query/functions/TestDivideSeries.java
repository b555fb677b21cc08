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
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import net.graphiteql.core.TimeSeries;

public class TestDivideSeries extends BaseFunctionTest {

  @Test
  public void divide() throws Exception {
    final List<TimeSeries> results = results(new DivideSeries().evaluate(
        context, args(list(series("a", 10.0, 20.0, null, 40.0),
            series("b", 1.0, 2.0, 3.0, 4.0)),
            list(series("d", 2.0, 0.0, 5.0, 4.0))), noKwargs()));
    assertEquals(2, results.size());
    assertEquals("divideSeries(a,d)", results.get(0).getName());
    assertEquals(Arrays.asList(5.0, null, null, 10.0),
        results.get(0).rawValues());
    assertEquals("divideSeries(b,d)", results.get(1).getName());
    assertEquals(Arrays.asList(0.5, null, 0.6, 1.0),
        results.get(1).rawValues());
  }

  @Test
  public void divideDifferentSteps() throws Exception {
    final TimeSeries divisor = new TimeSeries("d", 0, 40, 20,
        Arrays.asList(2.0, 4.0));
    final List<TimeSeries> results = results(new DivideSeries().evaluate(
        context, args(list(series("a", 2.0, 6.0, 8.0, 8.0)), list(divisor)),
        noKwargs()));
    assertEquals(20, results.get(0).getStep());
    assertEquals(Arrays.asList(2.0, 2.0), results.get(0).rawValues());
  }

  @Test
  public void divideEmptyDividends() throws Exception {
    assertTrue(results(new DivideSeries().evaluate(context,
        args(list(), list(series("d", 1.0))), noKwargs())).isEmpty());
  }

  @Test (expected = IllegalArgumentException.class)
  public void divideTooManyDivisors() throws Exception {
    new DivideSeries().evaluate(context, args(list(series("a", 1.0)),
        list(series("d", 1.0), series("e", 1.0))), noKwargs());
  }

  @Test (expected = IllegalArgumentException.class)
  public void divideNoDivisor() throws Exception {
    new DivideSeries().evaluate(context, args(list(series("a", 1.0)),
        list()), noKwargs());
  }

  @Test
  public void divideThroughEvaluator() throws Exception {
    finder.addSeries("a.b", 0, 10, Arrays.asList(4.0, 8.0))
      .addSeries("a.c", 0, 10, Arrays.asList(2.0, 2.0));
    final List<TimeSeries> results = evaluator.evaluateTarget(
        newContext(0, 20), "divideSeries(a.b,a.c)");
    assertEquals("divideSeries(a.b,a.c)", results.get(0).getName());
    assertEquals(Arrays.asList(2.0, 4.0), results.get(0).rawValues());
  }
}
