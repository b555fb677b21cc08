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
package net.graphiteql.utils;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * GraphiteQL Configuration Class
 *
 * This handles all of the user configurable variables for the query engine.
 * On initialization default values are configured for all variables. Then
 * implementations should call the {@link #loadConfig()} methods to search for
 * a default configuration or try to load one provided by the user.
 *
 * To add a configuration, simply set a default value in {@link #setDefaults()}.
 * Wherever you need to access the config value, use the proper helper to fetch
 * the value, accounting for exceptions that may be thrown if necessary.
 *
 * The get<type> number helpers will return NumberFormatExceptions if the
 * requested property is null or unparseable.
 * <p>
 * Finder plugins should never change the engine's config properties, rather a
 * plugin should use the Config(final Config parent) constructor to get a copy
 * of the parent's properties and then work with the values locally.
 * @since 1.0
 */
public class Config {
  private static final Logger LOG = LoggerFactory.getLogger(Config.class);

  /** Comma separated list of finder descriptor class names */
  public static final String FINDERS = "graphite.finders";

  /** Comma separated list of function module class names */
  public static final String FUNCTIONS = "graphite.functions";

  /** Comma separated list of root directories for the JSON finder */
  public static final String JSON_DIRECTORIES = "graphite.json.directories";

  /** Default time zone id for new request contexts */
  public static final String TIME_ZONE = "graphite.time_zone";

  /** Number of threads used to issue backend fetches */
  public static final String FETCH_WORKER_THREADS =
      "graphite.fetch.worker_threads";

  /** How the store treats a path reported as both branch and leaf */
  public static final String STORE_CONFLICT_POLICY =
      "graphite.store.conflict_policy";

  // Accessed on every request so they get their own fields. Their value is
  // refreshed whenever the config is loaded or overridden.
  // NOTE: edit the setDefaults() method if you add a field

  /** graphite.fetch.worker_threads */
  private int fetch_worker_threads = 8;

  /** graphite.time_zone */
  private String time_zone = "UTC";

  /**
   * The list of properties configured to their defaults or modified by users
   */
  protected final HashMap<String, String> properties =
    new HashMap<String, String>();

  /** Holds default values for the config */
  protected static final HashMap<String, String> default_map =
    new HashMap<String, String>();

  /** Tracks the location of the file that was actually loaded */
  protected String config_location;

  /**
   * Constructor that initializes default configuration values. May attempt to
   * search for a config file if configured.
   * @param auto_load_config When set to true, attempts to search for a config
   *          file in the default locations
   * @throws IOException Thrown if unable to read or parse one of the default
   *           config files
   */
  public Config(final boolean auto_load_config) throws IOException {
    if (auto_load_config) {
      loadConfig();
    }
    setDefaults();
  }

  /**
   * Constructor that initializes default values and attempts to load the given
   * properties file
   * @param file Path to the file to load
   * @throws IOException Thrown if unable to read or parse the file
   */
  public Config(final String file) throws IOException {
    loadConfig(file);
    setDefaults();
  }

  /**
   * Constructor for plugins that want a copy of the parent properties
   * without the ability to modify them
   * @param parent Parent configuration object to load from
   */
  public Config(final Config parent) {
    properties.putAll(parent.properties);
    config_location = parent.config_location;
    setDefaults();
  }

  /** @return The file that generated this config. May be null */
  public String configLocation() {
    return config_location;
  }

  /** @return the number of fetch worker threads */
  public int fetch_worker_threads() {
    return fetch_worker_threads;
  }

  /** @return the default request time zone id */
  public String time_zone() {
    return time_zone;
  }

  /**
   * Allows for modifying properties after creation or loading.
   *
   * WARNING: This should only be used on initialization and is meant for
   * command line overrides or tests. Also note that it will reset all cached
   * config variables when called.
   *
   * @param property The name of the property to override
   * @param value The value to store
   */
  public void overrideConfig(final String property, final String value) {
    properties.put(property, value);
    loadStaticVariables();
  }

  /**
   * Returns the given property as a String
   * @param property The property to load
   * @return The property value as a string, null if it did not exist
   */
  public final String getString(final String property) {
    return properties.get(property);
  }

  /**
   * Returns the given property split on commas with empty entries dropped
   * @param property The property to load
   * @return A list of trimmed values, empty if the property is missing
   */
  public final List<String> getList(final String property) {
    final String value = properties.get(property);
    if (value == null || value.trim().isEmpty()) {
      return ImmutableList.of();
    }
    return ImmutableList.copyOf(Splitter.on(',').trimResults()
        .omitEmptyStrings().split(value));
  }

  /**
   * Returns the given property as an integer
   * @param property The property to load
   * @return A parsed integer or an exception if the value could not be parsed
   * @throws NumberFormatException if the property could not be parsed
   */
  public final int getInt(final String property) {
    return Integer.parseInt(sanitize(properties.get(property)));
  }

  /**
   * Returns the given string trimmed or null if is null
   * @param string The string be trimmed of
   * @return The string trimmed or null
   */
  private final String sanitize(final String string) {
    if (string == null) {
      return null;
    }
    return string.trim();
  }

  /**
   * Returns the given property as a long
   * @param property The property to load
   * @return A parsed long or an exception if the value could not be parsed
   * @throws NumberFormatException if the property could not be parsed
   */
  public final long getLong(final String property) {
    return Long.parseLong(sanitize(properties.get(property)));
  }

  /**
   * Returns the given property as a double
   * @param property The property to load
   * @return A parsed double or an exception if the value could not be parsed
   * @throws NumberFormatException if the property could not be parsed
   */
  public final double getDouble(final String property) {
    return Double.parseDouble(sanitize(properties.get(property)));
  }

  /**
   * Returns the given property as a boolean
   *
   * Property values are case insensitive and the following values will result
   * in a True return value: - 1 - True - Yes
   *
   * Any other values, including an empty string, will result in a False
   *
   * @param property The property to load
   * @return A parsed boolean
   * @throws NullPointerException if the property was not found
   */
  public final boolean getBoolean(final String property) {
    final String val = properties.get(property).trim().toUpperCase();
    if (val.equals("1"))
      return true;
    if (val.equals("TRUE"))
      return true;
    if (val.equals("YES"))
      return true;
    return false;
  }

  /**
   * Determines if the given propery is in the map
   * @param property The property to search for
   * @return True if the property exists and has a value, not an empty string
   */
  public final boolean hasProperty(final String property) {
    final String val = properties.get(property);
    if (val == null)
      return false;
    if (val.isEmpty())
      return false;
    return true;
  }

  /**
   * Returns a simple string with the configured properties for debugging
   * @return A string with information about the config
   */
  public final String dumpConfiguration() {
    if (properties.isEmpty())
      return "No configuration settings stored";

    StringBuilder response = new StringBuilder("GraphiteQL Configuration:\n");
    response.append("File [" + config_location + "]\n");
    int line = 0;
    for (Map.Entry<String, String> entry : properties.entrySet()) {
      if (line > 0) {
        response.append("\n");
      }
      response.append("Key [" + entry.getKey() + "]  Value [");
      if (entry.getKey().toUpperCase().contains("PASS")) {
         response.append("********");
      } else {
        response.append(entry.getValue());
      }
      response.append("]");
      line++;
    }
    return response.toString();
  }

  /** @return An immutable copy of the configuration map */
  public final Map<String, String> getMap() {
    return ImmutableMap.copyOf(properties);
  }

  /**
   * Loads default entries that were not provided by a file or command line
   *
   * This should be called in the constructor
   */
  protected void setDefaults() {
    default_map.put(FINDERS,
        "net.graphiteql.storage.json.JsonFinderDescriptor");
    default_map.put(FUNCTIONS,
        "net.graphiteql.query.functions.SeriesFunctions");
    default_map.put(JSON_DIRECTORIES, "/srv/graphite/json");
    default_map.put(TIME_ZONE, "UTC");
    default_map.put(FETCH_WORKER_THREADS, "8");
    default_map.put(STORE_CONFLICT_POLICY, "both");

    for (Map.Entry<String, String> entry : default_map.entrySet()) {
      if (!properties.containsKey(entry.getKey()))
        properties.put(entry.getKey(), entry.getValue());
    }

    loadStaticVariables();
  }

  /**
   * Searches a list of locations for a valid graphiteql.conf file
   *
   * The config file must be a standard JAVA properties formatted file. If none
   * of the locations have a config file, then the defaults or command line
   * arguments will be used for the configuration
   *
   * Defaults are: ./graphiteql.conf /etc/graphiteql.conf
   * /etc/graphiteql/graphiteql.conf
   *
   * @throws IOException Thrown if there was an issue reading a file
   */
  protected void loadConfig() throws IOException {
    if (config_location != null && !config_location.isEmpty()) {
      loadConfig(config_location);
      return;
    }

    final ArrayList<String> file_locations = new ArrayList<String>();
    file_locations.add("graphiteql.conf");
    file_locations.add("/etc/graphiteql.conf");
    file_locations.add("/etc/graphiteql/graphiteql.conf");

    for (String file : file_locations) {
      try {
        loadConfig(file);
        return;
      } catch (FileNotFoundException e) {
        // the file may be missing and that's fine
        LOG.debug("Unable to find " + file, e);
      }
    }

    LOG.info("No configuration found, will use defaults");
  }

  /**
   * Attempts to load the configuration from the given location
   * @param file Path to the file to load
   * @throws IOException Thrown if there was an issue reading the file
   * @throws FileNotFoundException Thrown if the config file was not found
   */
  protected void loadConfig(final String file) throws FileNotFoundException,
      IOException {
    final FileInputStream file_stream = new FileInputStream(file);
    try {
      final Properties props = new Properties();
      props.load(file_stream);
      loadHashMap(props);
      LOG.info("Successfully loaded configuration file: " + file);
      config_location = file;
    } finally {
      file_stream.close();
    }
  }

  /**
   * Loads the cached variables for values that are called often. This
   * should be called any time the configuration changes.
   */
  public void loadStaticVariables() {
    if (hasProperty(FETCH_WORKER_THREADS)) {
      fetch_worker_threads = getInt(FETCH_WORKER_THREADS);
    }
    if (hasProperty(TIME_ZONE)) {
      time_zone = getString(TIME_ZONE).trim();
    }
  }

  /**
   * Called from {@link #loadConfig} to copy the properties into the hash map
   * @param props The loaded Properties object to copy
   */
  private void loadHashMap(final Properties props) {
    properties.clear();

    @SuppressWarnings("rawtypes")
    Enumeration e = props.propertyNames();
    while (e.hasMoreElements()) {
      String key = (String) e.nextElement();
      properties.put(key, props.getProperty(key));
    }
  }
}
