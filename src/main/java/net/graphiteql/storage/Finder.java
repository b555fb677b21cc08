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

/**
 * A storage backend plugin. Finders resolve path patterns to nodes; the
 * leaves they return carry the readers used to fetch data.
 * @since 1.0
 */
public interface Finder {

  /**
   * Resolves the query's pattern against the backend's namespace.
   * @param query The pattern and optional time bounds
   * @return The matching branches and leaves, in any order
   * @throws IOException if the backend could not be searched
   */
  Iterable<Node> findNodes(FindQuery query) throws IOException;
}
