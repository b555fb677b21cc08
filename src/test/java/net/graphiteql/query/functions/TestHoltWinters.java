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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import net.graphiteql.core.RequestContext;
import net.graphiteql.core.TimeSeries;

public class TestHoltWinters extends BaseFunctionTest {

  /** One week in, ten hourly points */
  private RequestContext window() {
    return newContext(HoltWinters.BOOTSTRAP_SECONDS,
        HoltWinters.BOOTSTRAP_SECONDS + 36000);
  }

  @Test
  public void analyze() throws Exception {
    final TimeSeries input = new TimeSeries("a", 0, 240, 60,
        Arrays.asList(10.0, 20.0, null, 30.0));
    final HoltWinters.Analysis analysis = HoltWinters.analyze(input);

    final TimeSeries predictions = analysis.predictions();
    assertEquals("holtWintersForecast(a)", predictions.getName());
    assertEquals(10.0, predictions.get(0), 0.0001);
    assertEquals(10.0, predictions.get(1), 0.0001);
    assertEquals(11.0035, predictions.get(2), 0.0001);
    assertNull(predictions.get(3));

    final TimeSeries deviations = analysis.deviations();
    assertEquals("holtWintersDeviation(a)", deviations.getName());
    assertEquals(0.0, deviations.get(0), 0.0001);
    assertEquals(1.0, deviations.get(1), 0.0001);
    assertEquals(0.0, deviations.get(2), 0.0001);
    assertEquals(3.0, deviations.get(3), 0.0001);
  }

  @Test
  public void trimBootstrap() throws Exception {
    final TimeSeries original = new TimeSeries("a", 100, 130, 10,
        Arrays.asList(1.0, 2.0, 3.0));
    final TimeSeries extended = new TimeSeries("a", 50, 130, 10,
        Arrays.asList(0.0, 0.0, 0.0, 0.0, 0.0, 1.0, 2.0, 3.0));
    final TimeSeries trimmed = Bootstrap.trimBootstrap(extended, original);
    assertEquals(100, trimmed.getStart());
    assertEquals(130, trimmed.getEnd());
    assertEquals(Arrays.asList(1.0, 2.0, 3.0), trimmed.rawValues());
  }

  @Test
  public void forecastConstant() throws Exception {
    finder.addSeries("hw.const", 0, 3600,
        Collections.nCopies(200, 5.0));
    final List<TimeSeries> results = evaluator.evaluateTarget(window(),
        "holtWintersForecast(hw.const)");
    assertEquals(1, results.size());
    final TimeSeries forecast = results.get(0);
    assertEquals("holtWintersForecast(hw.const)", forecast.getName());
    assertEquals(HoltWinters.BOOTSTRAP_SECONDS, forecast.getStart());
    assertEquals(HoltWinters.BOOTSTRAP_SECONDS + 36000, forecast.getEnd());
    assertEquals(10, forecast.size());
    for (final Double value : forecast.rawValues()) {
      assertEquals(5.0, value, 0.0001);
    }
  }

  @Test
  public void confidenceBandsConstant() throws Exception {
    finder.addSeries("hw.const", 0, 3600,
        Collections.nCopies(200, 5.0));
    final List<TimeSeries> results = evaluator.evaluateTarget(window(),
        "holtWintersConfidenceBands(hw.const)");
    assertEquals(2, results.size());
    assertEquals("holtWintersConfidenceLower(hw.const)",
        results.get(0).getName());
    assertEquals("holtWintersConfidenceUpper(hw.const)",
        results.get(1).getName());
    for (final TimeSeries band : results) {
      assertEquals(10, band.size());
      for (final Double value : band.rawValues()) {
        assertEquals(5.0, value, 0.0001);
      }
    }
  }

  @Test
  public void forecastReorderedList() throws Exception {
    finder.addSeries("hw.a", 0, 3600, Collections.nCopies(200, 5.0));
    finder.addSeries("hw.b", 0, 3600, Collections.nCopies(200, 50.0));
    final List<TimeSeries> results = evaluator.evaluateTarget(window(),
        "holtWintersForecast(highestMax(hw.*,2))");
    assertEquals(2, results.size());
    assertEquals("holtWintersForecast(hw.b)", results.get(0).getName());
    for (final Double value : results.get(0).rawValues()) {
      assertEquals(50.0, value, 0.0001);
    }
    assertEquals("holtWintersForecast(hw.a)", results.get(1).getName());
    for (final Double value : results.get(1).rawValues()) {
      assertEquals(5.0, value, 0.0001);
    }
  }

  @Test
  public void confidenceBandsReorderedList() throws Exception {
    finder.addSeries("hw.a", 0, 3600, Collections.nCopies(200, 5.0));
    finder.addSeries("hw.b", 0, 3600, Collections.nCopies(200, 50.0));
    final List<TimeSeries> results = evaluator.evaluateTarget(window(),
        "holtWintersConfidenceBands(highestMax(hw.*,2))");
    assertEquals(4, results.size());
    assertEquals("holtWintersConfidenceLower(hw.b)", results.get(0).getName());
    assertEquals(50.0, results.get(0).get(0), 0.0001);
    assertEquals("holtWintersConfidenceUpper(hw.b)", results.get(1).getName());
    assertEquals(50.0, results.get(1).get(9), 0.0001);
    assertEquals("holtWintersConfidenceLower(hw.a)", results.get(2).getName());
    assertEquals(5.0, results.get(2).get(0), 0.0001);
  }

  @Test
  public void aberration() throws Exception {
    final List<Double> values = new ArrayList<Double>(
        Collections.nCopies(178, 5.0));
    values.set(175, 50.0);
    finder.addSeries("hw.spike", 0, 3600, values);
    final List<TimeSeries> results = evaluator.evaluateTarget(window(),
        "holtWintersAberration(hw.spike)");
    assertEquals(1, results.size());
    final TimeSeries aberration = results.get(0);
    assertEquals("holtWintersAberration(hw.spike)", aberration.getName());
    assertEquals(10, aberration.size());
    for (int i = 0; i < 7; i++) {
      assertEquals(0.0, aberration.get(i), 0.0001);
    }
    // deviation 0.1 * (50 - 5), upper band 5 + 3 * 4.5
    assertEquals(31.5, aberration.get(7), 0.0001);
  }

  @Test
  public void aberrationNullIsZero() throws Exception {
    final List<Double> values = new ArrayList<Double>(
        Collections.nCopies(178, 5.0));
    values.set(170, null);
    finder.addSeries("hw.gap", 0, 3600, values);
    final List<TimeSeries> results = evaluator.evaluateTarget(window(),
        "holtWintersAberration(hw.gap, 2)");
    assertEquals(0.0, results.get(0).get(2), 0.0001);
  }

  @Test
  public void emptyList() throws Exception {
    assertEquals(0, results(new HoltWintersForecast().evaluate(context,
        args(new ArrayList<TimeSeries>()), noKwargs())).size());
    assertEquals(0, HoltWintersConfidenceBands.bands(context,
        new ArrayList<TimeSeries>(), 3).size());
  }
}
