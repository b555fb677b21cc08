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
package net.graphiteql.core;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TimeZone;

import com.google.common.base.MoreObjects;

import net.graphiteql.query.expression.Evaluator;

/**
 * Per request state handed to the evaluator and every series function. Holds
 * the query window, template overrides, the evaluator itself so functions can
 * re-enter the fetch pipeline, and a scratch map functions may use to share
 * state across repeated calls within one request.
 * <p>
 * Not thread safe, a context belongs to a single request.
 * @since 1.0
 */
public class RequestContext {

  /** Start of the window in Unix epoch seconds */
  private final long start_time;

  /** End of the window in Unix epoch seconds */
  private final long end_time;

  /** Optional "current" time passed through to readers, may be null */
  private final Long now;

  private final TimeZone time_zone;

  /** Caller supplied template bindings, applied over the target's own */
  private final Map<String, Object> template;

  /** Scratch state shared by functions during one request */
  private final Map<String, Object> scratch;

  /** Series collected for the caller, e.g. for the render layer */
  private final List<TimeSeries> data;

  private final Evaluator evaluator;

  /**
   * Default ctor
   * @param evaluator The evaluator handling this request
   * @param start_time Window start in seconds
   * @param end_time Window end in seconds
   * @param now Optional current time in seconds
   * @param time_zone The requester's time zone
   * @param template Template overrides, may be null
   * @throws IllegalArgumentException if the window is inverted
   */
  public RequestContext(final Evaluator evaluator, final long start_time,
      final long end_time, final Long now, final TimeZone time_zone,
      final Map<String, Object> template) {
    if (end_time < start_time) {
      throw new IllegalArgumentException("End time " + end_time
          + " is before start time " + start_time);
    }
    this.evaluator = evaluator;
    this.start_time = start_time;
    this.end_time = end_time;
    this.now = now;
    this.time_zone = time_zone == null ? TimeZone.getTimeZone("UTC")
        : time_zone;
    this.template = template == null ? new HashMap<String, Object>()
        : new HashMap<String, Object>(template);
    scratch = new HashMap<String, Object>();
    data = new ArrayList<TimeSeries>();
  }

  private RequestContext(final RequestContext parent, final long start_time,
      final long end_time) {
    evaluator = parent.evaluator;
    this.start_time = start_time;
    this.end_time = end_time;
    now = parent.now;
    time_zone = parent.time_zone;
    template = parent.template;
    scratch = parent.scratch;
    data = parent.data;
  }

  /**
   * Creates a shallow copy over another window. Template bindings, scratch
   * state and collected data are shared with this context.
   * @param start_time The new start
   * @param end_time The new end
   * @return A new context
   */
  public RequestContext copy(final long start_time, final long end_time) {
    if (end_time < start_time) {
      throw new IllegalArgumentException("End time " + end_time
          + " is before start time " + start_time);
    }
    return new RequestContext(this, start_time, end_time);
  }

  public long getStartTime() {
    return start_time;
  }

  public long getEndTime() {
    return end_time;
  }

  /** @return the current time override, may be null */
  public Long getNow() {
    return now;
  }

  public TimeZone getTimeZone() {
    return time_zone;
  }

  public Map<String, Object> getTemplate() {
    return template;
  }

  public Map<String, Object> getScratch() {
    return scratch;
  }

  public List<TimeSeries> getData() {
    return data;
  }

  public Evaluator getEvaluator() {
    return evaluator;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("startTime", start_time)
        .add("endTime", end_time)
        .add("now", now)
        .add("timeZone", time_zone.getID())
        .add("template", template)
        .toString();
  }
}
