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

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The on-disk layout of one series: a step in seconds and a list of
 * {@code [timestamp, value]} pairs where value may be null.
 * @since 1.0
 */
public final class JsonSeriesFile {
  private final long step;
  private final List<List<Double>> points;

  @JsonCreator
  public JsonSeriesFile(@JsonProperty("step") final long step,
      @JsonProperty("points") final List<List<Double>> points) {
    this.step = step;
    this.points = points == null ? new ArrayList<List<Double>>() : points;
  }

  @JsonProperty("step")
  public long getStep() {
    return step;
  }

  @JsonProperty("points")
  public List<List<Double>> getPoints() {
    return points;
  }
}
