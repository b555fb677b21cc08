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

import java.util.ArrayList;
import java.util.List;

/**
 * A block of samples read for one leaf.
 * @since 1.0
 */
public final class FetchResult {
  private final TimeInfo time_info;
  private final List<Double> values;

  public FetchResult(final TimeInfo time_info, final List<Double> values) {
    if (time_info == null) {
      throw new IllegalArgumentException("Time info cannot be null");
    }
    this.time_info = time_info;
    this.values = values == null ? new ArrayList<Double>() : values;
  }

  public TimeInfo getTimeInfo() {
    return time_info;
  }

  /** @return the samples, nulls for gaps */
  public List<Double> getValues() {
    return values;
  }

  /** @return true if at least one sample is not null */
  public boolean hasData() {
    return hasData(values);
  }

  /** @return true if at least one of the values is not null */
  public static boolean hasData(final List<Double> values) {
    for (final Double value : values) {
      if (value != null) {
        return true;
      }
    }
    return false;
  }

  @Override
  public String toString() {
    return "FetchResult(" + time_info + ", " + values + ")";
  }
}
