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

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Range;
import com.google.common.collect.RangeSet;
import com.google.common.collect.TreeRangeSet;

import net.graphiteql.core.IllegalDataException;
import net.graphiteql.core.RequestContext;
import net.graphiteql.storage.FetchResult;
import net.graphiteql.storage.Reader;
import net.graphiteql.storage.TimeInfo;
import net.graphiteql.utils.JSON;

/**
 * Reads one series file. The requested window is aligned down to the file's
 * step and points are bucketed into it; a later point in the same bucket
 * replaces an earlier one.
 * @since 1.0
 */
public class JsonReader implements Reader {
  private static final Logger LOG = LoggerFactory.getLogger(JsonReader.class);

  private final Path file;

  public JsonReader(final Path file) {
    this.file = file;
  }

  /** @return the file backing this reader */
  public Path getFile() {
    return file;
  }

  @Override
  public FetchResult fetch(final long start, final long end, final Long now,
      final RequestContext context) throws IOException {
    if (LOG.isDebugEnabled()) {
      LOG.debug("Fetching " + file + " from " + start + " to " + end);
    }
    final JsonSeriesFile series = read();
    final long step = series.getStep();
    final long aligned = start - Math.floorMod(start, step);
    final int count = end <= aligned ? 0 : (int) ((end - aligned + step - 1) / step);
    final List<Double> values =
        new ArrayList<Double>(Collections.<Double>nCopies(count, null));
    for (final List<Double> point : series.getPoints()) {
      if (point == null || point.isEmpty() || point.get(0) == null) {
        throw new IllegalDataException("Malformed point " + point + " in "
            + file);
      }
      final long timestamp = point.get(0).longValue();
      if (timestamp < aligned || timestamp >= end) {
        continue;
      }
      final Double value = point.size() > 1 ? point.get(1) : null;
      values.set((int) ((timestamp - aligned) / step),
          value == null || value.isNaN() ? null : value);
    }
    return new FetchResult(new TimeInfo(aligned, aligned + count * step, step),
        values);
  }

  /** @return the span between the first and one step past the last point,
   * empty if the file could not be read or holds no points */
  @Override
  public RangeSet<Long> intervals() {
    final RangeSet<Long> intervals = TreeRangeSet.create();
    final JsonSeriesFile series;
    try {
      series = read();
    } catch (IOException e) {
      LOG.error("Unable to read intervals from " + file, e);
      return intervals;
    }
    long first = Long.MAX_VALUE;
    long last = Long.MIN_VALUE;
    for (final List<Double> point : series.getPoints()) {
      if (point == null || point.isEmpty() || point.get(0) == null) {
        continue;
      }
      first = Math.min(first, point.get(0).longValue());
      last = Math.max(last, point.get(0).longValue());
    }
    if (first <= last) {
      intervals.add(Range.closed(first, last + series.getStep()));
    }
    return intervals;
  }

  private JsonSeriesFile read() throws IOException {
    final InputStream stream = Files.newInputStream(file);
    try {
      final JsonSeriesFile series = JSON.parseToObject(stream,
          JsonSeriesFile.class);
      if (series.getStep() <= 0) {
        throw new IllegalDataException("Invalid step " + series.getStep()
            + " in " + file);
      }
      return series;
    } finally {
      stream.close();
    }
  }

  @Override
  public String toString() {
    return "JsonReader(" + file + ")";
  }
}
