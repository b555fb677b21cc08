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

import java.io.IOException;

import com.google.common.collect.RangeSet;

import net.graphiteql.core.RequestContext;

/**
 * Backend specific access to the samples of one leaf.
 * @since 1.0
 */
public interface Reader {

  /**
   * Fetches the samples for the window.
   * @param start Window start in seconds
   * @param end Window end in seconds
   * @param now Optional current time in seconds, may be null
   * @param context The request, may be null outside of a query
   * @return The samples or null if the backend has nothing for the window
   * @throws IOException if the backend could not be read
   */
  FetchResult fetch(long start, long end, Long now, RequestContext context)
      throws IOException;

  /** @return the time ranges, in seconds, the backend can answer for */
  RangeSet<Long> intervals();
}
