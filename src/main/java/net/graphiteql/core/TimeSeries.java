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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import com.google.common.base.MoreObjects;
import com.google.common.collect.AbstractIterator;
import com.google.common.collect.Lists;

/**
 * An ordered run of optional samples spaced {@code step} seconds apart,
 * starting at {@code start}. Missing samples are stored as nulls.
 * <p>
 * The raw values are only ever touched through {@link #get(int)},
 * {@link #set(int, Double)} and {@link #add(Double)}. Iterating the series
 * returns the consolidated view instead: with a {@code valuesPerPoint} of N,
 * every N raw samples are folded into one by the series' consolidation
 * function. Changing the values per point never rewrites the raw samples.
 * @since 1.0
 */
public class TimeSeries implements Iterable<Double> {

  private String name;
  private long start;
  private long end;
  private long step;
  private final List<Double> values;
  private ConsolidationFunction consolidation_function =
      ConsolidationFunction.AVERAGE;
  private int values_per_point = 1;
  private String path_expression;

  /** Render hints, opaque to the engine */
  private final Map<String, Object> options = new HashMap<String, Object>();

  /**
   * Default ctor
   * @param name The display name, also used as the initial path expression
   * @param start Timestamp of the first sample in seconds
   * @param end End of the window in seconds
   * @param step Seconds between samples
   * @param values The raw samples, copied
   * @throws IllegalArgumentException if the step was not positive
   */
  public TimeSeries(final String name, final long start, final long end,
      final long step, final List<Double> values) {
    if (step <= 0) {
      throw new IllegalArgumentException("Step must be greater than zero: "
          + step);
    }
    this.name = name;
    this.start = start;
    this.end = end;
    this.step = step;
    this.values = values == null ? new ArrayList<Double>() :
      new ArrayList<Double>(values);
    path_expression = name;
  }

  /**
   * Changes the number of raw samples folded into each point on iteration.
   * @param values_per_point Must be at least 1
   */
  public void consolidate(final int values_per_point) {
    if (values_per_point < 1) {
      throw new IllegalArgumentException("Values per point must be at "
          + "least 1: " + values_per_point);
    }
    this.values_per_point = values_per_point;
  }

  /**
   * Iterates over the consolidated values. With one value per point this is
   * just the raw samples.
   */
  @Override
  public Iterator<Double> iterator() {
    if (values_per_point == 1) {
      return values.iterator();
    }
    return new AbstractIterator<Double>() {
      private int idx = 0;

      @Override
      protected Double computeNext() {
        if (idx >= values.size()) {
          return endOfData();
        }
        final int bucket_end = Math.min(idx + values_per_point, values.size());
        final Double result =
            consolidation_function.consolidate(values.subList(idx, bucket_end));
        idx = bucket_end;
        return result;
      }
    };
  }

  /** @return A copy of the consolidated values */
  public List<Double> consolidatedValues() {
    return Lists.newArrayList(iterator());
  }

  /** @return the number of consolidated points */
  public int consolidatedSize() {
    return (values.size() + values_per_point - 1) / values_per_point;
  }

  /** @return the live list of raw samples */
  public List<Double> rawValues() {
    return values;
  }

  /** @return the raw sample at the index */
  public Double get(final int idx) {
    return values.get(idx);
  }

  /** Replaces the raw sample at the index */
  public void set(final int idx, final Double value) {
    values.set(idx, value);
  }

  /** Appends a raw sample */
  public void add(final Double value) {
    values.add(value);
  }

  /** @return the number of raw samples */
  public int size() {
    return values.size();
  }

  /** @return true if there are no samples or every sample is null */
  public boolean isAllNull() {
    for (final Double value : values) {
      if (value != null) {
        return false;
      }
    }
    return true;
  }

  /**
   * Creates a new series with the same window and settings but new values.
   * @param new_name The name of the copy, also its path expression
   * @param new_values The samples for the copy
   * @return A new series
   */
  public TimeSeries copy(final String new_name, final List<Double> new_values) {
    final TimeSeries copy = new TimeSeries(new_name, start, end, step,
        new_values);
    copy.consolidation_function = consolidation_function;
    copy.values_per_point = values_per_point;
    copy.options.putAll(options);
    return copy;
  }

  public String getName() {
    return name;
  }

  public void setName(final String name) {
    this.name = name;
  }

  public long getStart() {
    return start;
  }

  public void setStart(final long start) {
    this.start = start;
  }

  public long getEnd() {
    return end;
  }

  public void setEnd(final long end) {
    this.end = end;
  }

  public long getStep() {
    return step;
  }

  public void setStep(final long step) {
    if (step <= 0) {
      throw new IllegalArgumentException("Step must be greater than zero: "
          + step);
    }
    this.step = step;
  }

  public ConsolidationFunction getConsolidationFunction() {
    return consolidation_function;
  }

  public void setConsolidationFunction(final ConsolidationFunction function) {
    if (function == null) {
      throw new IllegalArgumentException("Consolidation function cannot be null");
    }
    consolidation_function = function;
  }

  public int getValuesPerPoint() {
    return values_per_point;
  }

  /** @return the pattern or expression that produced this series */
  public String getPathExpression() {
    return path_expression;
  }

  public void setPathExpression(final String path_expression) {
    this.path_expression = path_expression;
  }

  /** @return the mutable render option bag */
  public Map<String, Object> getOptions() {
    return options;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("name", name)
        .add("start", start)
        .add("end", end)
        .add("step", step)
        .add("valuesPerPoint", values_per_point)
        .add("values", values)
        .toString();
  }
}
