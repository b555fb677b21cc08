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
package net.graphiteql.utils;

import java.util.TimeZone;
import java.util.concurrent.TimeUnit;

/**
 * Utility class for parsing Graphite relative time strings and time zones.
 * @since 1.0
 */
public class DateTime {

  /** Graphite treats a month as 30 days */
  static final long MONTH_SECONDS = TimeUnit.DAYS.toSeconds(30);

  /** And a year as 365 days */
  static final long YEAR_SECONDS = TimeUnit.DAYS.toSeconds(365);

  /**
   * Parses a relative time offset such as {@code 5min}, {@code -1d} or
   * {@code +2hours} into a number of seconds. A missing sign means a
   * positive offset. Several terms may be chained, e.g. {@code 1h30min}.
   * <p>
   * Units are matched on their prefix like Graphite does:
   * <ul>
   * <li>s, sec, seconds - seconds</li>
   * <li>min, minutes - minutes</li>
   * <li>h, hours - hours</li>
   * <li>d, days - days</li>
   * <li>w, weeks - weeks</li>
   * <li>mon, months - 30 days</li>
   * <li>y, years - 365 days</li>
   * </ul>
   * @param offset The offset to parse
   * @return The offset in seconds, signed
   * @throws IllegalArgumentException if the offset was null, empty or
   * malformed
   */
  public static final long parseTimeOffset(final String offset) {
    if (offset == null || offset.trim().isEmpty()) {
      throw new IllegalArgumentException("Time offset cannot be null or empty");
    }
    final String trimmed = offset.trim();
    int idx = 0;
    long sign = 1;
    if (trimmed.charAt(0) == '-') {
      sign = -1;
      idx++;
    } else if (trimmed.charAt(0) == '+') {
      idx++;
    }
    if (idx >= trimmed.length()) {
      throw new IllegalArgumentException("Invalid time offset: " + offset);
    }

    long seconds = 0;
    while (idx < trimmed.length()) {
      final int num_start = idx;
      while (idx < trimmed.length() && Character.isDigit(trimmed.charAt(idx))) {
        idx++;
      }
      if (idx == num_start) {
        throw new IllegalArgumentException("Invalid time offset: " + offset);
      }
      final long amount;
      try {
        amount = Long.parseLong(trimmed.substring(num_start, idx));
      } catch (NumberFormatException nfe) {
        throw new IllegalArgumentException("Invalid time offset: " + offset, nfe);
      }
      final int unit_start = idx;
      while (idx < trimmed.length() && Character.isLetter(trimmed.charAt(idx))) {
        idx++;
      }
      seconds += amount * unitSeconds(trimmed.substring(unit_start, idx),
          offset);
    }
    return sign * seconds;
  }

  /**
   * Returns the number of seconds in a Graphite time unit.
   * @param unit The unit string
   * @param offset The full offset for error messages
   * @return The seconds in one unit
   */
  static long unitSeconds(final String unit, final String offset) {
    if (unit.startsWith("s")) {
      return 1;
    } else if (unit.startsWith("min")) {
      return TimeUnit.MINUTES.toSeconds(1);
    } else if (unit.startsWith("h")) {
      return TimeUnit.HOURS.toSeconds(1);
    } else if (unit.startsWith("d")) {
      return TimeUnit.DAYS.toSeconds(1);
    } else if (unit.startsWith("w")) {
      return TimeUnit.DAYS.toSeconds(7);
    } else if (unit.startsWith("mon")) {
      return MONTH_SECONDS;
    } else if (unit.startsWith("y")) {
      return YEAR_SECONDS;
    }
    throw new IllegalArgumentException("Invalid time unit '" + unit
        + "' in offset: " + offset);
  }

  /**
   * Resolves a time zone id, rejecting ids the JVM does not know about
   * instead of silently falling back to GMT.
   * @param tz The time zone id
   * @return The time zone
   * @throws IllegalArgumentException if the id is unknown
   */
  public static final TimeZone timezoneFromString(final String tz) {
    if (tz == null || tz.isEmpty()) {
      throw new IllegalArgumentException("Time zone cannot be null or empty");
    }
    final TimeZone zone = TimeZone.getTimeZone(tz);
    if (!zone.getID().equals(tz) && !"GMT".equals(tz)) {
      throw new IllegalArgumentException("Unknown time zone: " + tz);
    }
    return zone;
  }
}
