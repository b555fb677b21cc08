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

import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import net.graphiteql.core.TimeSeries;

public class TestAlias extends BaseFunctionTest {

  @Test
  public void alias() throws Exception {
    final List<TimeSeries> results = results(new Alias().evaluate(context,
        args(list(series("a.b", 1.0), series("a.c", 2.0)), "renamed"),
        noKwargs()));
    assertEquals("renamed", results.get(0).getName());
    assertEquals("renamed", results.get(1).getName());
    // the path expression is kept for re-evaluation
    assertEquals("a.b", results.get(0).getPathExpression());
  }

  @Test (expected = IllegalArgumentException.class)
  public void aliasMissingName() throws Exception {
    new Alias().evaluate(context, args(list(series("a.b", 1.0))), noKwargs());
  }

  @Test
  public void aliasByNode() throws Exception {
    final List<TimeSeries> results = results(new AliasByNode().evaluate(
        context, args(list(series("web.host1.cpu", 1.0)), 0L, 2L),
        noKwargs()));
    assertEquals("web.cpu", results.get(0).getName());
  }

  @Test
  public void aliasByNodeNegative() throws Exception {
    final List<TimeSeries> results = results(new AliasByNode().evaluate(
        context, args(list(series("web.host1.cpu", 1.0)), -2L), noKwargs()));
    assertEquals("host1", results.get(0).getName());
  }

  @Test
  public void aliasByNodeWrappedName() throws Exception {
    final List<TimeSeries> results = results(new AliasByNode().evaluate(
        context, args(list(series("sumSeries(scale(web.host1.cpu,2))", 1.0)),
            1L), noKwargs()));
    assertEquals("host1", results.get(0).getName());
  }

  @Test (expected = IllegalArgumentException.class)
  public void aliasByNodeOutOfRange() throws Exception {
    new AliasByNode().evaluate(context,
        args(list(series("web.host1.cpu", 1.0)), 5L), noKwargs());
  }

  @Test
  public void aliasByMetric() throws Exception {
    final List<TimeSeries> results = results(new AliasByMetric().evaluate(
        context, args(list(series("web.host1.cpu", 1.0),
            series("scale(web.host1.mem,2)", 1.0))), noKwargs()));
    assertEquals("cpu", results.get(0).getName());
    assertEquals("mem", results.get(1).getName());
  }

  @Test
  public void aliasSub() throws Exception {
    final List<TimeSeries> results = results(new AliasSub().evaluate(context,
        args(list(series("web.host1.cpu", 1.0)), "^web\\.(\\w+)\\.(.*)$",
            "\\2-\\1"), noKwargs()));
    assertEquals("cpu-host1", results.get(0).getName());
  }

  @Test
  public void aliasSubNamedGroup() throws Exception {
    final List<TimeSeries> results = results(new AliasSub().evaluate(context,
        args(list(series("web.host1.cpu", 1.0)), "(?<host>host\\d)",
            "\\g<host>.local"), noKwargs()));
    assertEquals("web.host1.local.cpu", results.get(0).getName());
  }

  @Test (expected = IllegalArgumentException.class)
  public void aliasSubBadPattern() throws Exception {
    new AliasSub().evaluate(context, args(list(series("a", 1.0)), "(", "x"),
        noKwargs());
  }

  @Test
  public void toJavaReplacement() throws Exception {
    assertEquals("$1", AliasSub.toJavaReplacement("\\1"));
    assertEquals("$2x", AliasSub.toJavaReplacement("\\g<2>x"));
    assertEquals("${name}", AliasSub.toJavaReplacement("\\g<name>"));
    assertEquals("cost \\$", AliasSub.toJavaReplacement("cost $"));
    assertEquals("plain", AliasSub.toJavaReplacement("plain"));
  }

  @Test
  public void aliasThroughEvaluator() throws Exception {
    finder.addSeries("web.host1.cpu", 0, 10, Arrays.asList(1.0, 2.0));
    final List<TimeSeries> results = evaluator.evaluateTarget(
        newContext(0, 20), "aliasByNode(scale(web.*.cpu, 2), 1)");
    assertEquals("host1", results.get(0).getName());
    assertEquals(Arrays.asList(2.0, 4.0), results.get(0).rawValues());
  }
}
