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

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.MoreObjects;
import com.google.common.base.Supplier;
import com.google.common.collect.ImmutableList;

import net.graphiteql.utils.Config;

/**
 * Use this class to create the finders the configuration asks for. Given a
 * config and the available descriptors this class instantiates one finder
 * per name listed in {@code graphite.finders}, in the listed order.
 */
public class FinderSupplier implements Supplier<List<Finder>> {
  private static final Logger LOG = LoggerFactory.getLogger(FinderSupplier.class);

  /**
   * The config object handed to every descriptor.
   */
  private final Config config;

  /**
   * The finder descriptors to look among.
   */
  private final Iterable<FinderDescriptor> finder_plugins;

  /**
   * Instantiates a supplier for further use.
   *
   * @param config The configuration object used when creating finders.
   * @param finder_plugins The descriptors to look among for matching ones.
   */
  public FinderSupplier(final Config config,
                        final Iterable<FinderDescriptor> finder_plugins) {
    this.config = checkNotNull(config);
    this.finder_plugins = checkNotNull(finder_plugins);
  }

  /**
   * Get the finders that the configuration specifies. This method will
   * create new instances on each call.
   *
   * @return The configured finders in configuration order.
   * @throws IllegalArgumentException if no finder is configured or a name
   * does not match any descriptor
   */
  @Override
  public List<Finder> get() {
    final List<String> names = config.getList(Config.FINDERS);
    if (names.isEmpty()) {
      throw new IllegalArgumentException("The config could not find the" +
          " field '" + Config.FINDERS + "', please make sure it was " +
          "configured correctly.");
    }

    final ImmutableList.Builder<Finder> finders = ImmutableList.builder();
    for (final String name : names) {
      finders.add(createFinder(name));
    }
    return finders.build();
  }

  private Finder createFinder(final String name) {
    for (final FinderDescriptor descriptor : finder_plugins) {
      final String plugin_name = descriptor.getClass().getCanonicalName();
      if (plugin_name.equals(name)) {
        LOG.info("Loading finder " + plugin_name);
        return descriptor.createFinder(config);
      }
    }

    throw new IllegalArgumentException("The config could not find a valid" +
        " finder for the field '" + Config.FINDERS + "', please make sure" +
        " it was configured correctly. It was '" + name + "'.");
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("config.finders", config.getString(Config.FINDERS))
        .toString();
  }
}
