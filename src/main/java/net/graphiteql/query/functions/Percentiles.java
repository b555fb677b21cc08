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

import java.util.Collections;
import java.util.List;

import net.graphiteql.core.SeriesLists;

/**
 * Percentile computation following the NIST Engineering Statistics Handbook:
 * the rank of the n-th percentile among {@code count} sorted values is
 * {@code (n / 100) * (count + 1)}.
 * @since 1.0
 */
public final class Percentiles {

  /** Don't instantiate me! */
  private Percentiles() { }

  /**
   * Computes the n-th percentile of the non-null values.
   * @param values The values, nulls are ignored
   * @param n The percentile, greater than zero
   * @param interpolate If false the fractional rank is rounded up and the
   * result is one of the values; if true the result is blended linearly
   * between the floor rank and the next value
   * @return The percentile or null if there are no non-null values
   */
  public static Double getPercentile(final List<Double> values,
      final double n, final boolean interpolate) {
    final List<Double> sorted = SeriesLists.nonNull(values);
    if (sorted.isEmpty()) {
      return null;
    }
    Collections.sort(sorted);

    final double fractional_rank = (n / 100.0) * (sorted.size() + 1);
    int rank = (int) fractional_rank;
    final double rank_fraction = fractional_rank - rank;
    if (!interpolate) {
      rank += (int) Math.ceil(rank_fraction);
    }

    double percentile;
    if (rank == 0) {
      percentile = sorted.get(0);
    } else if (rank - 1 >= sorted.size()) {
      percentile = sorted.get(sorted.size() - 1);
    } else {
      percentile = sorted.get(rank - 1);
    }

    if (interpolate && rank < sorted.size()) {
      final double next = sorted.get(rank);
      percentile = percentile + rank_fraction * (next - percentile);
    }
    return percentile;
  }
}
