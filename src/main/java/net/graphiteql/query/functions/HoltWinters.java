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

import java.util.ArrayList;
import java.util.List;

import net.graphiteql.core.TimeSeries;

/**
 * Triple exponential smoothing over a series with a one day season. Produces
 * a forecast for every point along with the smoothed absolute deviation of
 * the actual values from that forecast.
 * <p>
 * A missing actual value breaks the recurrence: the point gets no intercept,
 * a zero slope, seasonal and deviation, the previous forecast, and the next
 * forecast is unknown.
 * @since 1.0
 */
final class HoltWinters {

  /** How far back the forecasting functions bootstrap, one week */
  static final long BOOTSTRAP_SECONDS = 7 * 86400;

  static final double ALPHA = 0.1;
  static final double BETA = 0.0035;
  static final double GAMMA = 0.1;

  /** The forecast and deviation series of one analysis */
  static final class Analysis {
    private final TimeSeries predictions;
    private final TimeSeries deviations;

    Analysis(final TimeSeries predictions, final TimeSeries deviations) {
      this.predictions = predictions;
      this.deviations = deviations;
    }

    TimeSeries predictions() {
      return predictions;
    }

    TimeSeries deviations() {
      return deviations;
    }
  }

  /** Don't instantiate me! */
  private HoltWinters() { }

  static double intercept(final double alpha, final double actual,
      final double last_season, final double last_intercept,
      final double last_slope) {
    return alpha * (actual - last_season)
        + (1 - alpha) * (last_intercept + last_slope);
  }

  static double slope(final double beta, final double intercept,
      final double last_intercept, final double last_slope) {
    return beta * (intercept - last_intercept) + (1 - beta) * last_slope;
  }

  static double seasonal(final double gamma, final double actual,
      final double intercept, final double last_season) {
    return gamma * (actual - intercept) + (1 - gamma) * last_season;
  }

  /** A null prediction counts as zero */
  static double deviation(final double gamma, final double actual,
      final Double prediction, final double last_seasonal_dev) {
    final double predicted = prediction == null ? 0 : prediction;
    return gamma * Math.abs(actual - predicted)
        + (1 - gamma) * last_seasonal_dev;
  }

  /**
   * Runs the analysis over the consolidated values of the series.
   * @param series The input
   * @return Forecast and deviation series named
   * {@code holtWintersForecast(name)} and {@code holtWintersDeviation(name)}
   */
  static Analysis analyze(final TimeSeries series) {
    final int season_length =
        (int) Math.max(1, 86400 / series.getStep());
    final List<Double> intercepts = new ArrayList<Double>();
    final List<Double> slopes = new ArrayList<Double>();
    final List<Double> seasonals = new ArrayList<Double>();
    final List<Double> predictions = new ArrayList<Double>();
    final List<Double> deviations = new ArrayList<Double>();

    Double next_pred = null;
    int i = 0;
    for (final Double actual : series) {
      if (actual == null) {
        intercepts.add(null);
        slopes.add(0.0);
        seasonals.add(0.0);
        predictions.add(next_pred);
        deviations.add(0.0);
        next_pred = null;
        i++;
        continue;
      }

      double last_intercept;
      final double last_slope;
      final Double prediction;
      if (i == 0) {
        last_intercept = actual;
        last_slope = 0;
        prediction = actual;
      } else {
        final Double previous = intercepts.get(intercepts.size() - 1);
        last_intercept = previous == null ? actual : previous;
        last_slope = slopes.get(slopes.size() - 1);
        prediction = next_pred;
      }

      final double last_seasonal = lastSeasonal(seasonals, i, season_length);
      final double next_last_seasonal =
          lastSeasonal(seasonals, i + 1, season_length);
      final double last_seasonal_dev =
          lastSeasonal(deviations, i, season_length);

      final double intercept =
          intercept(ALPHA, actual, last_seasonal, last_intercept, last_slope);
      final double slope = slope(BETA, intercept, last_intercept, last_slope);
      final double seasonal =
          seasonal(GAMMA, actual, intercept, last_seasonal);
      next_pred = intercept + slope + next_last_seasonal;
      final double deviation =
          deviation(GAMMA, actual, prediction, last_seasonal_dev);

      intercepts.add(intercept);
      slopes.add(slope);
      seasonals.add(seasonal);
      predictions.add(prediction);
      deviations.add(deviation);
      i++;
    }

    final String forecast_name = "holtWintersForecast(" + series.getName() + ")";
    final TimeSeries forecast = new TimeSeries(forecast_name,
        series.getStart(), series.getEnd(), series.getStep(), predictions);
    final String deviation_name =
        "holtWintersDeviation(" + series.getName() + ")";
    final TimeSeries deviation = new TimeSeries(deviation_name,
        series.getStart(), series.getEnd(), series.getStep(), deviations);
    return new Analysis(forecast, deviation);
  }

  /** @return the value one season before the index, 0 if there is none yet */
  private static double lastSeasonal(final List<Double> values, final int idx,
      final int season_length) {
    final int j = idx - season_length;
    if (j >= 0 && j < values.size()) {
      final Double value = values.get(j);
      return value == null ? 0 : value;
    }
    return 0;
  }
}
