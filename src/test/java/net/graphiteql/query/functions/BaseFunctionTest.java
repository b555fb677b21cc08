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
package net.graphiteql.query.functions;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.Before;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.MoreExecutors;

import net.graphiteql.core.RequestContext;
import net.graphiteql.core.TimeSeries;
import net.graphiteql.query.FetchOrchestrator;
import net.graphiteql.query.expression.Evaluator;
import net.graphiteql.query.expression.FunctionRegistry;
import net.graphiteql.storage.Finder;
import net.graphiteql.storage.Store;
import net.graphiteql.storage.memory.MemoryFinder;

/**
 * Wires an evaluator over an in-memory finder with the built-in functions
 * and a same-thread fetch pool. Subclasses add their series to
 * {@link #finder} and either call functions directly or evaluate targets.
 */
public abstract class BaseFunctionTest {
  protected MemoryFinder finder;
  protected FunctionRegistry registry;
  protected Evaluator evaluator;
  protected RequestContext context;

  @Before
  public void beforeBase() throws Exception {
    finder = new MemoryFinder();
    registry = new FunctionRegistry();
    registry.registerFunctions(new SeriesFunctions().functions());
    evaluator = new Evaluator(registry, new FetchOrchestrator(
        new Store(ImmutableList.<Finder>of(finder)),
        MoreExecutors.newDirectExecutorService()));
    context = newContext(0, 60);
  }

  /** @return a request over the window bound to the test evaluator */
  protected RequestContext newContext(final long start, final long end) {
    return new RequestContext(evaluator, start, end, null, null, null);
  }

  /** @return a series with step 10 starting at 0 */
  protected static TimeSeries series(final String name,
      final Double... values) {
    return new TimeSeries(name, 0, values.length * 10, 10,
        Arrays.asList(values));
  }

  /** @return the arguments as a mutable list */
  protected static List<Object> args(final Object... args) {
    return new ArrayList<Object>(Arrays.asList(args));
  }

  /** @return a mutable list of the series */
  protected static List<TimeSeries> list(final TimeSeries... series) {
    return new ArrayList<TimeSeries>(Arrays.asList(series));
  }

  protected static Map<String, Object> noKwargs() {
    return new HashMap<String, Object>();
  }

  /** @return a mutable map with the one keyword argument */
  protected static Map<String, Object> kwargs(final String name,
      final Object value) {
    final Map<String, Object> kwargs = noKwargs();
    kwargs.put(name, value);
    return kwargs;
  }

  @SuppressWarnings("unchecked")
  protected static List<TimeSeries> results(final Object result) {
    return (List<TimeSeries>) result;
  }

  /** @return the values ts / step for ts in [0, count * step) */
  protected static List<Double> ramp(final int count) {
    final List<Double> values = new ArrayList<Double>(count);
    for (int i = 0; i < count; i++) {
      values.add((double) i);
    }
    return values;
  }
}
