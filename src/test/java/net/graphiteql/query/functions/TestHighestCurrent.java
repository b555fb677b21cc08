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

import org.junit.Before;
import org.junit.Test;

import net.graphiteql.core.TimeSeries;

public class TestHighestCurrent extends BaseFunctionTest {
  private TimeSeries a;
  private TimeSeries b;
  private TimeSeries c;
  private TimeSeries d;

  @Before
  public void before() throws Exception {
    a = series("a", 1.0, 9.0);
    b = series("b", 5.0, null);
    c = series("c", null, null);
    d = series("d", 7.0, 3.0);
  }

  private List<TimeSeries> current(final boolean lowest,
      final Object... args) {
    return results(new HighestCurrent(lowest).evaluate(context, args(args),
        noKwargs()));
  }

  @Test
  public void highest() throws Exception {
    assertEquals(Arrays.asList(a), current(false, list(a, b, c, d)));
    assertEquals(Arrays.asList(b, a), current(false, list(a, b, c, d), 2L));
  }

  @Test
  public void lowest() throws Exception {
    assertEquals(Arrays.asList(c), current(true, list(a, b, c, d)));
    assertEquals(Arrays.asList(c, d), current(true, list(a, b, c, d), 2L));
  }

  @Test
  public void moreThanAvailable() throws Exception {
    assertEquals(Arrays.asList(c, d, b, a),
        current(false, list(a, b, c, d), 5L));
  }

  @Test
  public void zeroOrNegative() throws Exception {
    assertTrue(current(false, list(a, b), 0L).isEmpty());
    assertTrue(current(true, list(a, b), -3L).isEmpty());
  }

  @Test
  public void usesConsolidatedValues() throws Exception {
    final TimeSeries consolidated = series("x", 10.0, 0.0, 0.0);
    consolidated.consolidate(2);
    // the buckets average to 5 and 0
    final TimeSeries other = series("y", 1.0, 1.0, 1.0);
    assertEquals(Arrays.asList(other),
        current(false, list(consolidated, other)));
  }

  @Test
  public void registeredNames() throws Exception {
    finder.addSeries("web.a", 0, 10, Arrays.asList(1.0, 2.0))
      .addSeries("web.b", 0, 10, Arrays.asList(4.0, 0.0));
    final List<TimeSeries> results = evaluator.evaluateTargets(
        newContext(0, 20), Arrays.asList("highestCurrent(web.*)",
            "lowestCurrent(web.*)"));
    assertEquals(2, results.size());
    assertEquals("web.a", results.get(0).getName());
    assertEquals("web.b", results.get(1).getName());
  }
}
