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

import java.util.Comparator;

import net.graphiteql.core.TimeSeries;

/**
 * Orders series by a nullable numeric key, nulls first.
 */
abstract class SeriesComparator implements Comparator<TimeSeries> {

  /** @return the sort key of the series, may be null */
  abstract Double key(TimeSeries series);

  @Override
  public int compare(final TimeSeries a, final TimeSeries b) {
    final Double key_a = key(a);
    final Double key_b = key(b);
    if (key_a == null) {
      return key_b == null ? 0 : -1;
    }
    if (key_b == null) {
      return 1;
    }
    return Double.compare(key_a, key_b);
  }
}
