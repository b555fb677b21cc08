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

import net.graphiteql.utils.Config;

/**
 * Registered through {@link java.util.ServiceLoader} to make a finder
 * available to the engine. The descriptor's canonical class name is what the
 * {@code graphite.finders} setting refers to.
 * @since 1.0
 */
public abstract class FinderDescriptor {
  public abstract Finder createFinder(Config config);
}
