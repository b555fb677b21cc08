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
package net.graphiteql.storage.json;

import net.graphiteql.storage.Finder;
import net.graphiteql.storage.FinderDescriptor;
import net.graphiteql.utils.Config;

/**
 * Creates a {@link JsonFinder} over {@code graphite.json.directories}.
 */
public class JsonFinderDescriptor extends FinderDescriptor {
  @Override
  public Finder createFinder(final Config config) {
    return new JsonFinder(config.getList(Config.JSON_DIRECTORIES));
  }
}
