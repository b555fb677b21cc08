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

import com.google.common.base.Objects;

import net.graphiteql.core.IllegalDataException;

/**
 * The window and spacing of a fetched block of samples.
 * @since 1.0
 */
public final class TimeInfo {
  private final long start;
  private final long end;
  private final long step;

  /**
   * Default ctor
   * @param start First timestamp in seconds
   * @param end End of the window in seconds
   * @param step Seconds between samples
   * @throws IllegalDataException if the step is not positive or the window
   * is inverted
   */
  public TimeInfo(final long start, final long end, final long step) {
    if (step <= 0) {
      throw new IllegalDataException("Step must be greater than zero: " + step);
    }
    if (end < start) {
      throw new IllegalDataException("End " + end + " is before start "
          + start);
    }
    this.start = start;
    this.end = end;
    this.step = step;
  }

  public long getStart() {
    return start;
  }

  public long getEnd() {
    return end;
  }

  public long getStep() {
    return step;
  }

  @Override
  public boolean equals(final Object obj) {
    if (!(obj instanceof TimeInfo)) {
      return false;
    }
    final TimeInfo other = (TimeInfo) obj;
    return start == other.start && end == other.end && step == other.step;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(start, end, step);
  }

  @Override
  public String toString() {
    return "(" + start + ", " + end + ", " + step + ")";
  }
}
