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
import java.util.List;

import net.graphiteql.core.RequestContext;

/**
 * A finder able to fetch many of its own leaves in one round trip. Leaves it
 * returns should be tagged with {@link #multiFetchTag()}.
 * @since 1.0
 */
public interface MultiFetchFinder extends Finder {

  /** @return the tag identifying this finder's leaves, null to disable
   * batching */
  String multiFetchTag();

  /**
   * Fetches every node in one call.
   * @param nodes Leaves previously returned by this finder
   * @param start Window start in seconds
   * @param end Window end in seconds
   * @param now Optional current time in seconds, may be null
   * @param context The request
   * @return One shared window and the samples per path
   * @throws IOException if the backend could not be read
   */
  MultiFetchResult fetchMulti(List<LeafNode> nodes, long start, long end,
      Long now, RequestContext context) throws IOException;
}
