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
 * The median of the non-null values in the preceding window. With an even
 * count the upper of the two middle values is used.
 * @since 1.0
 */
public class MovingMedian extends MovingWindow {

  @Override
  protected String name() {
    return "movingMedian";
  }

  @Override
  protected String formatPoints(final Number window_size,
      final long window_points) {
    return Long.toString(window_points);
  }

  @Override
  protected Double aggregate(final List<Double> window) {
    final List<Double> non_null = SeriesLists.nonNull(window);
    if (non_null.isEmpty()) {
      return null;
    }
    Collections.sort(non_null);
    return non_null.get(non_null.size() / 2);
  }
}
