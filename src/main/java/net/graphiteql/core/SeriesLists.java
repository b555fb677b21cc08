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
package net.graphiteql.core;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.TreeSet;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/**
 * Helpers shared by the series functions: normalization of several series to
 * a common step and window, null-tolerant arithmetic and naming.
 * @since 1.0
 */
public final class SeriesLists {

  /** Don't instantiate me! */
  private SeriesLists() { }

  /**
   * The outcome of {@link #normalize(List)}: the flattened series, now
   * consolidated to a common step, plus the shared window.
   */
  public static final class Normalized {
    private final List<TimeSeries> series;
    private final long start;
    private final long end;
    private final long step;

    Normalized(final List<TimeSeries> series, final long start,
        final long end, final long step) {
      this.series = series;
      this.start = start;
      this.end = end;
      this.step = step;
    }

    public List<TimeSeries> series() {
      return series;
    }

    public long start() {
      return start;
    }

    public long end() {
      return end;
    }

    public long step() {
      return step;
    }

    /** @return true if there was nothing to normalize */
    public boolean isEmpty() {
      return series.isEmpty();
    }

    /**
     * Zips the consolidated values of every series row by row, padding the
     * shorter series with nulls.
     * @return One row per output point
     */
    public List<List<Double>> rows() {
      return SeriesLists.rows(series);
    }
  }

  /**
   * Flattens the lists, consolidates every series to the least common
   * multiple of their steps and computes the shared window. The end is
   * pulled back so the window is a whole number of steps.
   * @param series_lists The lists to normalize, may be empty
   * @return The normalized result, empty if no series were given
   */
  public static Normalized normalize(final List<List<TimeSeries>> series_lists) {
    final List<TimeSeries> flat = new ArrayList<TimeSeries>();
    for (final List<TimeSeries> list : series_lists) {
      flat.addAll(list);
    }
    if (flat.isEmpty()) {
      return new Normalized(flat, 0, 0, 1);
    }
    long step = flat.get(0).getStep();
    long start = flat.get(0).getStart();
    long end = flat.get(0).getEnd();
    for (final TimeSeries series : flat) {
      step = lcm(step, series.getStep());
      start = Math.min(start, series.getStart());
      end = Math.max(end, series.getEnd());
    }
    for (final TimeSeries series : flat) {
      series.consolidate((int) (step / series.getStep()));
    }
    end -= (end - start) % step;
    return new Normalized(flat, start, end, step);
  }

  /** Single list flavor of {@link #normalize(List)} */
  public static Normalized normalizeOne(final List<TimeSeries> series) {
    return normalize(Collections.singletonList(series));
  }

  /**
   * Zips the consolidated values of the series, padding with nulls.
   * @param series The series to zip
   * @return One row per point
   */
  public static List<List<Double>> rows(final List<TimeSeries> series) {
    final List<Iterator<Double>> iterators =
        new ArrayList<Iterator<Double>>(series.size());
    for (final TimeSeries ts : series) {
      iterators.add(ts.iterator());
    }
    final List<List<Double>> rows = new ArrayList<List<Double>>();
    while (true) {
      boolean any = false;
      final List<Double> row = new ArrayList<Double>(iterators.size());
      for (final Iterator<Double> it : iterators) {
        if (it.hasNext()) {
          any = true;
          row.add(it.next());
        } else {
          row.add(null);
        }
      }
      if (!any) {
        return rows;
      }
      rows.add(row);
    }
  }

  /**
   * @return the sorted, de-duplicated path expressions of the series joined
   * by commas, used when naming aggregates
   */
  public static String formatPathExpressions(final List<TimeSeries> series) {
    final TreeSet<String> expressions = new TreeSet<String>();
    for (final TimeSeries ts : series) {
      expressions.add(ts.getPathExpression());
    }
    return Joiner.on(',').join(expressions);
  }

  public static long gcd(final long a, final long b) {
    if (b == 0) {
      return a;
    }
    return gcd(b, a % b);
  }

  public static long lcm(final long a, final long b) {
    if (a == b) {
      return a;
    }
    if (a < b) {
      return lcm(b, a);
    }
    return a / gcd(a, b) * b;
  }

  /** @return the non-null values in order */
  public static List<Double> nonNull(final Iterable<Double> values) {
    final List<Double> result = new ArrayList<Double>();
    for (final Double value : values) {
      if (value != null) {
        result.add(value);
      }
    }
    return result;
  }

  /** @return the sum of the non-null values or null if there are none */
  public static Double safeSum(final Iterable<Double> values) {
    final List<Double> non_null = nonNull(values);
    if (non_null.isEmpty()) {
      return null;
    }
    double sum = 0;
    for (final Double value : non_null) {
      sum += value;
    }
    return sum;
  }

  /** @return the mean of the non-null values or null if there are none */
  public static Double safeAvg(final Iterable<Double> values) {
    final List<Double> non_null = nonNull(values);
    if (non_null.isEmpty()) {
      return null;
    }
    return safeSum(non_null) / non_null.size();
  }

  /** @return the population standard deviation of the non-null values */
  public static Double safeStdDev(final Iterable<Double> values) {
    final List<Double> non_null = nonNull(values);
    if (non_null.isEmpty()) {
      return null;
    }
    final double avg = safeAvg(non_null);
    double sum = 0;
    for (final Double value : non_null) {
      sum += (value - avg) * (value - avg);
    }
    return Math.sqrt(sum / non_null.size());
  }

  public static Double safeMax(final Iterable<Double> values) {
    final List<Double> non_null = nonNull(values);
    return non_null.isEmpty() ? null : Collections.max(non_null);
  }

  public static Double safeMin(final Iterable<Double> values) {
    final List<Double> non_null = nonNull(values);
    return non_null.isEmpty() ? null : Collections.min(non_null);
  }

  /** @return the last non-null value or null */
  public static Double safeLast(final List<Double> values) {
    for (int i = values.size() - 1; i >= 0; i--) {
      if (values.get(i) != null) {
        return values.get(i);
      }
    }
    return null;
  }

  /** @return a divided by b, null if either is null or b is zero */
  public static Double safeDiv(final Double a, final Double b) {
    if (a == null || b == null || b == 0) {
      return null;
    }
    return a / b;
  }

  /** @return the product, null if any factor is null */
  public static Double safeMul(final Double... factors) {
    if (factors.length == 0) {
      return null;
    }
    double product = 1;
    for (final Double factor : factors) {
      if (factor == null) {
        return null;
      }
      product *= factor;
    }
    return product;
  }

  /**
   * The first non-null value minus the sum of the other non-null values.
   * @return The difference or null if every value is null
   */
  public static Double safeDiff(final List<Double> values) {
    final List<Double> non_null = nonNull(values);
    if (non_null.isEmpty()) {
      return null;
    }
    double result = non_null.get(0);
    for (final Double value : non_null.subList(1, non_null.size())) {
      result -= value;
    }
    return result;
  }

  /**
   * Renders a number the way it was written in a target: integral values
   * parsed as integers print without a decimal point.
   * @param value A Long, Double or other number
   * @return The string form
   */
  public static String formatNumber(final Object value) {
    if (value instanceof Double || value instanceof Float) {
      return Double.toString(((Number) value).doubleValue());
    }
    return String.valueOf(value);
  }

  /**
   * Renders a double in {@code %g} style, the way function names print their
   * numeric arguments: six significant digits, no trailing zeros, and
   * scientific notation below 1e-4 or from 1e6 up. E.g. {@code 95},
   * {@code 0.5}, {@code 1e-05}, {@code 1.5e+06}.
   * @param value The value to render
   * @return The string form
   */
  public static String formatG(final double value) {
    if (Double.isNaN(value)) {
      return "nan";
    }
    if (Double.isInfinite(value)) {
      return value > 0 ? "inf" : "-inf";
    }
    if (value == 0) {
      return 1 / value < 0 ? "-0" : "0";
    }
    final BigDecimal rounded = new BigDecimal(value)
        .round(new MathContext(6, RoundingMode.HALF_EVEN));
    final int exponent = rounded.precision() - rounded.scale() - 1;
    if (exponent >= -4 && exponent < 6) {
      return rounded.stripTrailingZeros().toPlainString();
    }
    final String mantissa = rounded.movePointLeft(exponent)
        .stripTrailingZeros().toPlainString();
    final int abs = Math.abs(exponent);
    return mantissa + "e" + (exponent < 0 ? "-" : "+")
        + (abs < 10 ? "0" : "") + abs;
  }

  /** @return an immutable empty list typed for series */
  public static List<TimeSeries> empty() {
    return ImmutableList.of();
  }
}
