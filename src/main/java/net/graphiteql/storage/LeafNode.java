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
 * A namespace entry that owns a {@link Reader}. Leaves reported by a finder
 * that can fetch many nodes in one call carry that finder's multi-fetch tag
 * so the fetch orchestrator can batch them.
 * @since 1.0
 */
public class LeafNode extends Node {

  private final Reader reader;

  /** Tag of the multi-fetch finder that owns this node, may be null */
  private final String multi_fetch_tag;

  /**
   * Ctor for a leaf fetched one at a time
   * @param path The full dotted path
   * @param reader The reader for the node's data
   */
  public LeafNode(final String path, final Reader reader) {
    this(path, reader, null);
  }

  /**
   * Ctor for a leaf owned by a multi-fetch capable finder
   * @param path The full dotted path
   * @param reader The reader for the node's data
   * @param multi_fetch_tag The owning finder's tag, null if none
   * @throws IllegalArgumentException if the reader was null
   */
  public LeafNode(final String path, final Reader reader,
      final String multi_fetch_tag) {
    super(path);
    if (reader == null) {
      throw new IllegalArgumentException("Leaf reader cannot be null");
    }
    this.reader = reader;
    this.multi_fetch_tag = multi_fetch_tag;
  }

  @Override
  public boolean isLeaf() {
    return true;
  }

  public Reader getReader() {
    return reader;
  }

  /** @return the multi-fetch tag or null if the node is fetched alone */
  public String getMultiFetchTag() {
    return multi_fetch_tag;
  }

  /** @see Reader#fetch(long, long, Long, RequestContext) */
  public FetchResult fetch(final long start, final long end, final Long now,
      final RequestContext context) throws IOException {
    return reader.fetch(start, end, now, context);
  }

  /** @see Reader#intervals() */
  public RangeSet<Long> intervals() {
    return reader.intervals();
  }
}
