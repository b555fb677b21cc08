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

public class TestStacked extends BaseFunctionTest {

  @Test
  public void stacked() throws Exception {
    final List<TimeSeries> results = results(new Stacked().evaluate(context,
        args(list(series("a", 1.0, 2.0, null), series("b", 10.0, 20.0, 30.0))),
        noKwargs()));
    assertEquals(2, results.size());
    assertEquals("stacked(a)", results.get(0).getName());
    assertEquals(Arrays.asList(1.0, 2.0, null), results.get(0).rawValues());
    assertEquals("stacked(b)", results.get(1).getName());
    assertEquals(Arrays.asList(11.0, 22.0, 30.0), results.get(1).rawValues());
    assertEquals(true, results.get(1).getOptions().get("stacked"));
  }

  @Test
  public void namedStackKeepsNames() throws Exception {
    final List<TimeSeries> results = results(new Stacked().evaluate(context,
        args(list(series("a", 1.0)), "mine"), noKwargs()));
    assertEquals("a", results.get(0).getName());
  }

  @Test
  public void totalsCarryAcrossCalls() throws Exception {
    new Stacked().evaluate(context, args(list(series("a", 1.0, 2.0))),
        noKwargs());
    new Stacked().evaluate(context, args(list(series("x", 100.0)), "other"),
        noKwargs());
    final List<TimeSeries> results = results(new Stacked().evaluate(context,
        args(list(series("b", 5.0, 5.0))), noKwargs()));
    assertEquals(Arrays.asList(6.0, 7.0), results.get(0).rawValues());
    assertTrue(context.getScratch().containsKey(Stacked.TOTAL_STACK));
  }

  @Test
  public void separateRequestsStartFresh() throws Exception {
    new Stacked().evaluate(context, args(list(series("a", 1.0))), noKwargs());
    final List<TimeSeries> results = results(new Stacked().evaluate(
        newContext(0, 60), args(list(series("b", 5.0))), noKwargs()));
    assertEquals(Arrays.asList(5.0), results.get(0).rawValues());
  }

  @Test
  public void throughEvaluator() throws Exception {
    finder.addSeries("web.a", 0, 10, Arrays.asList(1.0, 2.0))
      .addSeries("web.b", 0, 10, Arrays.asList(3.0, 4.0));
    final List<TimeSeries> results = evaluator.evaluateTarget(
        newContext(0, 20), "stacked(web.*)");
    assertEquals(2, results.size());
    assertEquals(Arrays.asList(4.0, 6.0), results.get(1).rawValues());
  }
}
