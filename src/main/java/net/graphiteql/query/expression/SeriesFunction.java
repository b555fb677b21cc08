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
package net.graphiteql.query.expression;

import java.util.List;
import java.util.Map;

import net.graphiteql.core.RequestContext;

/**
 * The interface for the functions a target may call, e.g.
 * {@code sumSeries(a.*)}. Arguments arrive already evaluated: series lists
 * as {@code List<TimeSeries>}, numbers as {@code Long} or {@code Double},
 * strings and booleans as themselves.
 * <p>
 * Implementations may modify and return the series they are given or build
 * new ones. They must be stateless; per request state belongs in
 * {@link RequestContext#getScratch()}.
 * @since 1.0
 */
public interface SeriesFunction {

  /**
   * Runs the function.
   * @param context The request being evaluated
   * @param args Positional arguments in call order
   * @param kwargs Keyword arguments in call order
   * @return A single series, a list of series or a scalar
   * @throws IllegalArgumentException if the arguments are invalid
   */
  public Object evaluate(RequestContext context, List<Object> args,
      Map<String, Object> kwargs);

}
