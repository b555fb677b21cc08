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

public class TestIntegral extends BaseFunctionTest {

  @Test
  public void integral() throws Exception {
    final TimeSeries input = series("a", 1.0, null, 2.0, 3.0);
    final List<TimeSeries> results = results(new Integral().evaluate(context,
        args(list(input)), noKwargs()));
    assertEquals("integral(a)", results.get(0).getName());
    assertEquals(Arrays.asList(1.0, null, 3.0, 6.0),
        results.get(0).rawValues());
    // the input is untouched
    assertEquals(Arrays.asList(1.0, null, 2.0, 3.0), input.rawValues());
  }

  @Test
  public void integralAllNull() throws Exception {
    final List<TimeSeries> results = results(new Integral().evaluate(context,
        args(list(series("a", null, null))), noKwargs()));
    assertEquals(Arrays.asList(null, null), results.get(0).rawValues());
  }

  @Test
  public void keepLastValue() throws Exception {
    final List<TimeSeries> results = results(new KeepLastValue().evaluate(
        context, args(list(series("a", 1.0, null, null, 4.0, null))),
        noKwargs()));
    assertEquals("keepLastValue(a)", results.get(0).getName());
    assertEquals(Arrays.asList(1.0, 1.0, 1.0, 4.0, 4.0),
        results.get(0).rawValues());
  }

  @Test
  public void keepLastValueLimit() throws Exception {
    final List<TimeSeries> results = results(new KeepLastValue().evaluate(
        context, args(list(series("a", 1.0, null, null, 4.0, null, 6.0,
            null)), 1L), noKwargs()));
    assertEquals(Arrays.asList(1.0, null, null, 4.0, 4.0, 6.0, null),
        results.get(0).rawValues());
  }

  @Test
  public void keepLastValueLeadingNulls() throws Exception {
    final List<TimeSeries> results = results(new KeepLastValue().evaluate(
        context, args(list(series("a", null, null, 3.0))), noKwargs()));
    assertEquals(Arrays.asList(null, null, 3.0), results.get(0).rawValues());
  }
}
