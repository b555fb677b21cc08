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
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import net.graphiteql.core.RequestContext;
import net.graphiteql.core.TimeSeries;
import net.graphiteql.query.expression.SeriesFunction;

/**
 * {@code aliasSub(seriesList, search, replace)}: runs the names through a
 * regex search and replace. Group references in the replacement are written
 * {@code \1} or {@code \g<name>}.
 * @since 1.0
 */
public class AliasSub implements SeriesFunction {
  static final String NAME = "aliasSub";

  @Override
  public Object evaluate(final RequestContext context, final List<Object> args,
      final Map<String, Object> kwargs) {
    final List<TimeSeries> series_list =
        FunctionArgs.seriesList(NAME, args, kwargs, 0, "seriesList");
    final String search =
        FunctionArgs.string(NAME, args, kwargs, 1, "search", null);
    final String replace =
        FunctionArgs.string(NAME, args, kwargs, 2, "replace", null);

    final Pattern pattern;
    try {
      pattern = Pattern.compile(search);
    } catch (PatternSyntaxException e) {
      throw new IllegalArgumentException("Invalid search pattern: " + search, e);
    }
    final String replacement = toJavaReplacement(replace);
    for (final TimeSeries series : series_list) {
      series.setName(pattern.matcher(series.getName()).replaceAll(replacement));
    }
    return series_list;
  }

  /**
   * Translates backslash group references into {@link Matcher} syntax and
   * quotes everything else.
   * Package private for UTs.
   */
  static String toJavaReplacement(final String replace) {
    final StringBuilder buf = new StringBuilder();
    int i = 0;
    while (i < replace.length()) {
      final char c = replace.charAt(i);
      if (c == '\\' && i + 1 < replace.length()) {
        final char next = replace.charAt(i + 1);
        if (Character.isDigit(next)) {
          buf.append('$').append(next);
          i += 2;
          continue;
        }
        final int close = replace.indexOf('>', i);
        if (next == 'g' && i + 2 < replace.length()
            && replace.charAt(i + 2) == '<' && close > 0) {
          final String group = replace.substring(i + 3, close);
          if (!group.isEmpty() && Character.isDigit(group.charAt(0))) {
            buf.append('$').append(group);
          } else {
            buf.append("${").append(group).append('}');
          }
          i = close + 1;
          continue;
        }
        buf.append(Matcher.quoteReplacement(String.valueOf(next)));
        i += 2;
        continue;
      }
      buf.append(Matcher.quoteReplacement(String.valueOf(c)));
      i++;
    }
    return buf.toString();
  }
}
