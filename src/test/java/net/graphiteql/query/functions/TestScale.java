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

public class TestScale extends BaseFunctionTest {

  @Test
  public void scale() throws Exception {
    final List<TimeSeries> results = results(new Scale().evaluate(context,
        args(list(series("a", 1.0, null, 3.0)), 2L), noKwargs()));
    assertEquals("scale(a,2)", results.get(0).getName());
    assertEquals("scale(a,2)", results.get(0).getPathExpression());
    assertEquals(Arrays.asList(2.0, null, 6.0), results.get(0).rawValues());
  }

  @Test
  public void scaleFraction() throws Exception {
    final List<TimeSeries> results = results(new Scale().evaluate(context,
        args(list(series("a", 4.0))), kwargs("factor", 0.5)));
    assertEquals("scale(a,0.5)", results.get(0).getName());
    assertEquals(Arrays.asList(2.0), results.get(0).rawValues());
  }

  @Test (expected = IllegalArgumentException.class)
  public void scaleMissingFactor() throws Exception {
    new Scale().evaluate(context, args(list(series("a", 4.0))), noKwargs());
  }

  @Test (expected = IllegalArgumentException.class)
  public void scaleFactorNotANumber() throws Exception {
    new Scale().evaluate(context, args(list(series("a", 4.0)), "two"),
        noKwargs());
  }

  @Test
  public void offset() throws Exception {
    final List<TimeSeries> results = results(new Offset().evaluate(context,
        args(list(series("a", 1.0, null, 3.0)), 10L), noKwargs()));
    assertEquals("offset(a,10)", results.get(0).getName());
    assertEquals(Arrays.asList(11.0, null, 13.0), results.get(0).rawValues());
  }

  @Test
  public void invert() throws Exception {
    final List<TimeSeries> results = results(new Invert().evaluate(context,
        args(list(series("a", 2.0, 0.0, null))), noKwargs()));
    assertEquals("invert(a)", results.get(0).getName());
    assertEquals(Arrays.asList(0.5, null, null), results.get(0).rawValues());
  }

  @Test
  public void absolute() throws Exception {
    final List<TimeSeries> results = results(new Absolute().evaluate(context,
        args(list(series("a", -1.0, null, 2.0))), noKwargs()));
    assertEquals("absolute(a)", results.get(0).getName());
    assertEquals(Arrays.asList(1.0, null, 2.0), results.get(0).rawValues());
  }

  @Test
  public void transformNull() throws Exception {
    List<TimeSeries> results = results(new TransformNull().evaluate(context,
        args(list(series("a", 1.0, null, 3.0))), noKwargs()));
    assertEquals("transformNull(a,0)", results.get(0).getName());
    assertEquals(Arrays.asList(1.0, 0.0, 3.0), results.get(0).rawValues());

    results = results(new TransformNull().evaluate(context,
        args(list(series("a", null, 2.0)), -1L), noKwargs()));
    assertEquals("transformNull(a,-1)", results.get(0).getName());
    assertEquals(Arrays.asList(-1.0, 2.0), results.get(0).rawValues());
  }

  @Test
  public void scaleThroughEvaluator() throws Exception {
    finder.addSeries("a.b", 0, 10, Arrays.asList(1.0, 2.0));
    final List<TimeSeries> results = evaluator.evaluateTarget(
        newContext(0, 20), "scale(offset(a.b, 1), 0.5)");
    assertEquals("scale(offset(a.b,1),0.5)", results.get(0).getName());
    assertEquals(Arrays.asList(1.0, 1.5), results.get(0).rawValues());
  }
}
