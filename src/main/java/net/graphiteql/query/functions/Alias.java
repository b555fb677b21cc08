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

import net.graphiteql.core.RequestContext;
import net.graphiteql.core.TimeSeries;
import net.graphiteql.query.expression.SeriesFunction;

/**
 * {@code alias(seriesList, newName)}: renames every series. The path
 * expression is left alone.
 * @since 1.0
 */
public class Alias implements SeriesFunction {
  static final String NAME = "alias";

  @Override
  public Object evaluate(final RequestContext context, final List<Object> args,
      final Map<String, Object> kwargs) {
    final List<TimeSeries> series_list =
        FunctionArgs.seriesList(NAME, args, kwargs, 0, "seriesList");
    final String new_name =
        FunctionArgs.string(NAME, args, kwargs, 1, "newName", null);
    for (final TimeSeries series : series_list) {
      series.setName(new_name);
    }
    return series_list;
  }
}
