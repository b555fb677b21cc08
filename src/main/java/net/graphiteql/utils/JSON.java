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

import java.io.IOException;
import java.io.InputStream;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * This class simply provides a static initialization and configuration of the
 * Jackson ObjectMapper for use throughout GraphiteQL. Since the mapper takes a
 * fair amount of construction and is thread safe, the Jackson docs recommend
 * initializing it once per app.
 * <p>
 * Finders that keep their data in JSON read it through here so every backend
 * shares the same parser settings.
 * @since 1.0
 */
public final class JSON {
  /**
   * Jackson de/serializer initialized, configured and shared
   */
  private static final ObjectMapper jsonMapper = new ObjectMapper();
  static {
    // stored series may carry NaN for missing points
    jsonMapper.configure(JsonParser.Feature.ALLOW_NON_NUMERIC_NUMBERS, true);
    jsonMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES,
        false);
  }

  /** Don't instantiate me! */
  private JSON() { }

  /**
   * Deserializes a JSON stream to a specific class type. Read failures are
   * passed along to the caller.
   * @param json The stream to deserialize, not closed by this method
   * @param pojo The class type of the object used for deserialization
   * @return An object of the {@code pojo} type
   * @throws IOException if the stream could not be read or parsed
   */
  public static final <T> T parseToObject(final InputStream json,
      final Class<T> pojo) throws IOException {
    if (json == null)
      throw new IllegalArgumentException("Incoming stream was null");
    if (pojo == null)
      throw new IllegalArgumentException("Missing class type");
    return jsonMapper.readValue(json, pojo);
  }
}
