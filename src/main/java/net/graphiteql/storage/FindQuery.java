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

import java.util.Date;

import com.google.common.collect.Range;

import net.graphiteql.utils.GlobMatcher;

/**
 * A pattern lookup with optional time bounds. A null bound means the query
 * is unconstrained on that side.
 * @since 1.0
 */
public final class FindQuery {
  private final String pattern;
  private final Long start_time;
  private final Long end_time;
  private final Range<Long> interval;

  /**
   * Default ctor
   * @param pattern The dotted path pattern
   * @param start_time Lower bound in seconds, may be null
   * @param end_time Upper bound in seconds, may be null
   * @throws IllegalArgumentException if the pattern is null or the bounds
   * are inverted
   */
  public FindQuery(final String pattern, final Long start_time,
      final Long end_time) {
    if (pattern == null) {
      throw new IllegalArgumentException("Pattern cannot be null");
    }
    if (start_time != null && end_time != null && end_time < start_time) {
      throw new IllegalArgumentException("End time " + end_time
          + " is before start time " + start_time);
    }
    this.pattern = pattern;
    this.start_time = start_time;
    this.end_time = end_time;
    if (start_time == null && end_time == null) {
      interval = Range.all();
    } else if (start_time == null) {
      interval = Range.atMost(end_time);
    } else if (end_time == null) {
      interval = Range.atLeast(start_time);
    } else {
      interval = Range.closed(start_time, end_time);
    }
  }

  public String getPattern() {
    return pattern;
  }

  /** @return the lower bound or null */
  public Long getStartTime() {
    return start_time;
  }

  /** @return the upper bound or null */
  public Long getEndTime() {
    return end_time;
  }

  /** @return the bounds as a range, unbounded where a bound is null */
  public Range<Long> getInterval() {
    return interval;
  }

  /** @return true if the pattern carries wildcards or brace groups */
  public boolean isPattern() {
    return GlobMatcher.isPattern(pattern);
  }

  @Override
  public String toString() {
    return "<FindQuery: " + pattern + " from "
        + (start_time == null ? "*" : new Date(start_time * 1000).toString())
        + " until "
        + (end_time == null ? "*" : new Date(end_time * 1000).toString())
        + ">";
  }
}
