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

import java.util.List;

import net.graphiteql.core.SeriesLists;

/**
 * The average of the non-null values in the preceding window.
 * @since 1.0
 */
public class MovingAverage extends MovingWindow {

  @Override
  protected String name() {
    return "movingAverage";
  }

  @Override
  protected Double aggregate(final List<Double> window) {
    return SeriesLists.safeAvg(window);
  }
}
