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

public class TestLimit extends BaseFunctionTest {

  @Test
  public void limit() throws Exception {
    final TimeSeries a = series("a", 1.0);
    final TimeSeries b = series("b", 1.0);
    final TimeSeries c = series("c", 1.0);
    assertEquals(Arrays.asList(a, b), results(new Limit().evaluate(context,
        args(list(a, b, c), 2L), noKwargs())));
    assertEquals(Arrays.asList(a, b, c), results(new Limit().evaluate(
        context, args(list(a, b, c), 10L), noKwargs())));
    assertTrue(results(new Limit().evaluate(context, args(list(a), 0L),
        noKwargs())).isEmpty());
  }

  @Test (expected = IllegalArgumentException.class)
  public void limitMissingN() throws Exception {
    new Limit().evaluate(context, args(list(series("a", 1.0))), noKwargs());
  }

  @Test
  public void sortByName() throws Exception {
    final TimeSeries a = series("a.x", 1.0);
    final TimeSeries b = series("b", 1.0);
    final TimeSeries c = series("c", 1.0);
    assertEquals(Arrays.asList(a, b, c), results(new SortByName().evaluate(
        context, args(list(c, a, b)), noKwargs())));
  }

  @Test
  public void removeEmptySeries() throws Exception {
    final TimeSeries a = series("a", null, 1.0);
    final TimeSeries empty = series("empty", null, null);
    final TimeSeries none = series("none");
    assertEquals(Arrays.asList(a), results(new RemoveEmptySeries().evaluate(
        context, args(list(a, empty, none)), noKwargs())));
  }

  @Test
  public void group() throws Exception {
    final TimeSeries a = series("a", 1.0);
    final TimeSeries b = series("b", 1.0);
    final TimeSeries c = series("c", 1.0);
    assertEquals(Arrays.asList(a, b, c), results(new Group().evaluate(context,
        args(list(a), list(b, c), list()), noKwargs())));
    assertTrue(results(new Group().evaluate(context, args(),
        noKwargs())).isEmpty());
  }

  @Test (expected = IllegalArgumentException.class)
  public void groupNotSeries() throws Exception {
    new Group().evaluate(context, args(list(series("a", 1.0)), 5L),
        noKwargs());
  }

  @Test
  public void throughEvaluator() throws Exception {
    finder.addSeries("web.b", 0, 10, Arrays.asList(1.0))
      .addSeries("web.a", 0, 10, Arrays.asList(2.0))
      .addSeries("db.a", 0, 10, Arrays.asList((Double) null));
    final List<TimeSeries> results = evaluator.evaluateTarget(
        newContext(0, 10),
        "limit(sortByName(removeEmptySeries(group(web.*, db.*))), 5)");
    assertEquals(2, results.size());
    assertEquals("web.a", results.get(0).getName());
    assertEquals("web.b", results.get(1).getName());
  }
}
