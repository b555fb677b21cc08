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
package net.graphiteql.storage;

import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableMap;

/**
 * The answer of a batched fetch: one window shared by every path.
 * @since 1.0
 */
public final class MultiFetchResult {
  private final TimeInfo time_info;
  private final Map<String, List<Double>> series;

  public MultiFetchResult(final TimeInfo time_info,
      final Map<String, List<Double>> series) {
    if (time_info == null) {
      throw new IllegalArgumentException("Time info cannot be null");
    }
    this.time_info = time_info;
    this.series = series == null ? ImmutableMap.<String, List<Double>>of()
        : series;
  }

  public TimeInfo getTimeInfo() {
    return time_info;
  }

  /** @return samples keyed on concrete path */
  public Map<String, List<Double>> getSeries() {
    return series;
  }
}
