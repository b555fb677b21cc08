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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import net.graphiteql.core.TimeSeries;

/**
 * Helpers to pull typed arguments out of an evaluated call. An argument is
 * looked up by position first, then by keyword name, so both
 * {@code movingAverage(a, 5)} and {@code movingAverage(a, windowSize=5)}
 * work.
 * @since 1.0
 */
final class FunctionArgs {

  /** Don't instantiate me! */
  private FunctionArgs() { }

  /** @return the argument at the index or keyword, or null if absent */
  static Object get(final List<Object> args, final Map<String, Object> kwargs,
      final int index, final String name) {
    if (index < args.size()) {
      return args.get(index);
    }
    return kwargs.get(name);
  }

  /**
   * @return the series list argument, a mutable copy of the list
   * @throws IllegalArgumentException if missing or not a series list
   */
  static List<TimeSeries> seriesList(final String function,
      final List<Object> args, final Map<String, Object> kwargs,
      final int index, final String name) {
    final Object value = get(args, kwargs, index, name);
    if (value == null) {
      throw new IllegalArgumentException(function + " requires a series "
          + "list for '" + name + "'");
    }
    return toSeriesList(function, value);
  }

  /**
   * Collects every positional argument from the index on as series lists.
   * @throws IllegalArgumentException if one of them is not a series list
   */
  static List<List<TimeSeries>> seriesLists(final String function,
      final List<Object> args, final int from) {
    final List<List<TimeSeries>> lists = new ArrayList<List<TimeSeries>>();
    for (int i = from; i < args.size(); i++) {
      lists.add(toSeriesList(function, args.get(i)));
    }
    return lists;
  }

  @SuppressWarnings("unchecked")
  static List<TimeSeries> toSeriesList(final String function,
      final Object value) {
    if (value instanceof TimeSeries) {
      final List<TimeSeries> list = new ArrayList<TimeSeries>(1);
      list.add((TimeSeries) value);
      return list;
    }
    if (value instanceof List) {
      for (final Object item : (List<Object>) value) {
        if (!(item instanceof TimeSeries)) {
          throw new IllegalArgumentException(function + " expected a series "
              + "list but got " + value);
        }
      }
      return new ArrayList<TimeSeries>((List<TimeSeries>) value);
    }
    throw new IllegalArgumentException(function + " expected a series list "
        + "but got " + value);
  }

  /**
   * @return the numeric argument or the default when absent
   * @throws IllegalArgumentException if present but not a number, or absent
   * with a null default
   */
  static Number number(final String function, final List<Object> args,
      final Map<String, Object> kwargs, final int index, final String name,
      final Number default_value) {
    final Object value = get(args, kwargs, index, name);
    if (value == null) {
      if (default_value == null) {
        throw new IllegalArgumentException(function + " requires a number "
            + "for '" + name + "'");
      }
      return default_value;
    }
    if (!(value instanceof Number)) {
      throw new IllegalArgumentException(function + " expected a number for '"
          + name + "' but got " + value);
    }
    return (Number) value;
  }

  /** @return the argument as an int, see {@link #number} */
  static int integer(final String function, final List<Object> args,
      final Map<String, Object> kwargs, final int index, final String name,
      final Integer default_value) {
    return number(function, args, kwargs, index, name, default_value)
        .intValue();
  }

  /**
   * @return the string argument or the default when absent
   * @throws IllegalArgumentException if present but not a string, or absent
   * with a null default
   */
  static String string(final String function, final List<Object> args,
      final Map<String, Object> kwargs, final int index, final String name,
      final String default_value) {
    final Object value = get(args, kwargs, index, name);
    if (value == null) {
      if (default_value == null) {
        throw new IllegalArgumentException(function + " requires a string "
            + "for '" + name + "'");
      }
      return default_value;
    }
    if (!(value instanceof String)) {
      throw new IllegalArgumentException(function + " expected a string for '"
          + name + "' but got " + value);
    }
    return (String) value;
  }

  /** @return the boolean argument or the default when absent */
  static boolean bool(final String function, final List<Object> args,
      final Map<String, Object> kwargs, final int index, final String name,
      final boolean default_value) {
    final Object value = get(args, kwargs, index, name);
    if (value == null) {
      return default_value;
    }
    if (!(value instanceof Boolean)) {
      throw new IllegalArgumentException(function + " expected a boolean for '"
          + name + "' but got " + value);
    }
    return (Boolean) value;
  }
}
