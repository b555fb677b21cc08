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

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.graphiteql.utils.Config;

/**
 * Stores the functions targets may call, by name. Built once at startup from
 * the configured {@link FunctionModule}s and handed to the {@link Evaluator}.
 * <p>
 * WARNING: The map is not thread safe so don't register functions while
 * requests are being evaluated.
 * @since 1.0
 */
public final class FunctionRegistry {
  private static final Logger LOG = LoggerFactory.getLogger(FunctionRegistry.class);

  private final Map<String, SeriesFunction> functions =
      new HashMap<String, SeriesFunction>();

  /**
   * Builds a registry from the modules named in {@code graphite.functions},
   * registered in the listed order so later modules may override names.
   * @param config The config to read the module names from
   * @param modules The modules to look among
   * @return A populated registry
   * @throws IllegalArgumentException if no module is configured or a name
   * does not match any available module
   */
  public static FunctionRegistry fromConfig(final Config config,
      final Iterable<FunctionModule> modules) {
    checkNotNull(config);
    checkNotNull(modules);
    final List<String> names = config.getList(Config.FUNCTIONS);
    if (names.isEmpty()) {
      throw new IllegalArgumentException("The config could not find the"
          + " field '" + Config.FUNCTIONS + "', please make sure it was "
          + "configured correctly.");
    }

    final FunctionRegistry registry = new FunctionRegistry();
    for (final String name : names) {
      FunctionModule found = null;
      for (final FunctionModule module : modules) {
        if (module.getClass().getCanonicalName().equals(name)) {
          found = module;
          break;
        }
      }
      if (found == null) {
        throw new IllegalArgumentException("The config could not find a "
            + "function module for the field '" + Config.FUNCTIONS
            + "'. It was '" + name + "'.");
      }
      LOG.info("Loading function module " + name);
      registry.registerFunctions(found.functions());
    }
    return registry;
  }

  /**
   * Adds or replaces functions.
   * @param to_register Functions keyed by name
   * @throws IllegalArgumentException if a name is empty or a function null
   */
  public void registerFunctions(final Map<String, SeriesFunction> to_register) {
    for (final Map.Entry<String, SeriesFunction> entry : to_register.entrySet()) {
      registerFunction(entry.getKey(), entry.getValue());
    }
  }

  /**
   * Adds or replaces a function.
   * @param name The name targets call it by
   * @param function The implementation
   * @throws IllegalArgumentException if the name is null or empty or the
   * function is null.
   */
  public void registerFunction(final String name, final SeriesFunction function) {
    if (name == null || name.isEmpty()) {
      throw new IllegalArgumentException("Missing function name");
    }
    if (function == null) {
      throw new IllegalArgumentException("Function cannot be null");
    }
    if (functions.put(name, function) != null && LOG.isDebugEnabled()) {
      LOG.debug("Replaced function " + name);
    }
  }

  /**
   * Returns the function given the name
   * @param name The name of the function
   * @return The function when located
   * @throws UnsupportedOperationException if the requested function hasn't
   * been registered.
   */
  public SeriesFunction getByName(final String name) {
    final SeriesFunction function = functions.get(name);
    if (function == null) {
      throw new UnsupportedOperationException("Function " + name
          + " has not been implemented");
    }
    return function;
  }

  public boolean contains(final String name) {
    return functions.containsKey(name);
  }

  /** @return the registered names, sorted */
  public Set<String> names() {
    return new TreeSet<String>(functions.keySet());
  }

  @Override
  public String toString() {
    return "FunctionRegistry(" + functions.size() + " functions)";
  }
}
