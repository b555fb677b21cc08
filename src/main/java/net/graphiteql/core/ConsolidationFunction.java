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

import java.util.List;

/**
 * The functions used to fold several raw samples into one output point when
 * a series is consolidated.
 * @since 1.0
 */
public enum ConsolidationFunction {
  SUM("sum") {
    @Override
    double apply(final List<Double> values) {
      double sum = 0;
      for (final Double value : values) {
        sum += value;
      }
      return sum;
    }
  },
  AVERAGE("average") {
    @Override
    double apply(final List<Double> values) {
      return SUM.apply(values) / values.size();
    }
  },
  MAX("max") {
    @Override
    double apply(final List<Double> values) {
      double max = values.get(0);
      for (final Double value : values) {
        max = Math.max(max, value);
      }
      return max;
    }
  },
  MIN("min") {
    @Override
    double apply(final List<Double> values) {
      double min = values.get(0);
      for (final Double value : values) {
        min = Math.min(min, value);
      }
      return min;
    }
  };

  private final String name;

  ConsolidationFunction(final String name) {
    this.name = name;
  }

  /**
   * Folds a non-empty list of non-null samples into one value.
   * @param values The samples
   * @return The consolidated value
   */
  abstract double apply(List<Double> values);

  /**
   * Folds a bucket of raw samples, nulls included.
   * @param bucket The raw samples
   * @return The consolidated value or null if every sample was null
   */
  public Double consolidate(final List<Double> bucket) {
    final List<Double> non_null = SeriesLists.nonNull(bucket);
    if (non_null.isEmpty()) {
      return null;
    }
    return apply(non_null);
  }

  /** @return the name used in target strings */
  public String functionName() {
    return name;
  }

  /**
   * Looks up a function by the name used in target strings.
   * @param name One of sum, average, max or min
   * @return The matching function
   * @throws IllegalArgumentException if the name is unknown
   */
  public static ConsolidationFunction fromName(final String name) {
    for (final ConsolidationFunction function : values()) {
      if (function.name.equals(name)) {
        return function;
      }
    }
    throw new IllegalArgumentException("Invalid consolidation function: '"
        + name + "', must be one of sum, average, max or min");
  }
}
