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

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import net.graphiteql.query.FetchOrchestrator;
import net.graphiteql.query.expression.Evaluator;
import net.graphiteql.query.expression.FunctionModule;
import net.graphiteql.query.expression.FunctionRegistry;
import net.graphiteql.storage.Finder;
import net.graphiteql.storage.FinderDescriptor;
import net.graphiteql.storage.FinderSupplier;
import net.graphiteql.storage.Node;
import net.graphiteql.storage.Store;
import net.graphiteql.utils.Config;
import net.graphiteql.utils.DateTime;

/**
 * The assembled engine: the configured finders behind a {@link Store}, the
 * configured function modules in a {@link FunctionRegistry}, a worker pool
 * for backend calls and the {@link Evaluator}. One instance serves any
 * number of concurrent requests, each with its own {@link RequestContext}.
 * @since 1.0
 */
public class QueryEngine {
  private static final Logger LOG = LoggerFactory.getLogger(QueryEngine.class);

  private final Config config;
  private final Store store;
  private final FunctionRegistry registry;
  private final ExecutorService executor;
  private final Evaluator evaluator;

  /**
   * Builds the engine from the finders and function modules registered as
   * services and named in the config.
   * @param config The configuration
   * @throws IllegalArgumentException if a configured finder or function
   * module could not be found
   */
  public QueryEngine(final Config config) {
    this(config,
        new FinderSupplier(config, ServiceLoader.load(FinderDescriptor.class))
          .get(),
        FunctionRegistry.fromConfig(config,
            ServiceLoader.load(FunctionModule.class)));
  }

  /**
   * Builds the engine around the given finders and functions.
   * @param config The configuration, for the pool size, time zone and
   * conflict policy
   * @param finders The finders in priority order
   * @param registry The functions
   */
  public QueryEngine(final Config config, final List<Finder> finders,
      final FunctionRegistry registry) {
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null");
    }
    this.config = config;
    store = new Store(finders, Store.ConflictPolicy.fromString(
        config.getString(Config.STORE_CONFLICT_POLICY)));
    this.registry = registry;
    executor = Executors.newFixedThreadPool(config.fetch_worker_threads(),
        new ThreadFactoryBuilder()
          .setNameFormat("GraphiteQL Fetcher #%d")
          .setDaemon(true)
          .build());
    evaluator = new Evaluator(registry, new FetchOrchestrator(store, executor));
    LOG.info("Initialized query engine with " + finders.size()
        + " finders and " + registry);
  }

  /**
   * Creates a request over the window in the configured time zone.
   * @param start_time Window start in seconds
   * @param end_time Window end in seconds
   * @return A new context bound to this engine's evaluator
   */
  public RequestContext newContext(final long start_time, final long end_time) {
    return newContext(start_time, end_time, null, null);
  }

  /**
   * Creates a request over the window in the configured time zone.
   * @param start_time Window start in seconds
   * @param end_time Window end in seconds
   * @param now Optional current time handed to readers
   * @param template Optional template overrides
   * @return A new context bound to this engine's evaluator
   */
  public RequestContext newContext(final long start_time, final long end_time,
      final Long now, final Map<String, Object> template) {
    return new RequestContext(evaluator, start_time, end_time, now,
        DateTime.timezoneFromString(config.time_zone()), template);
  }

  /** @see Evaluator#evaluateTarget(RequestContext, String) */
  public List<TimeSeries> evaluateTarget(final RequestContext context,
      final String target) {
    return context.getEvaluator().evaluateTarget(context, target);
  }

  /** @see Evaluator#evaluateTargets(RequestContext, List) */
  public List<TimeSeries> evaluateTargets(final RequestContext context,
      final List<String> targets) {
    return context.getEvaluator().evaluateTargets(context, targets);
  }

  /** @see Store#find(String, Long, Long) */
  public Iterator<Node> find(final String pattern, final Long start_time,
      final Long end_time) {
    return store.find(pattern, start_time, end_time);
  }

  /**
   * Stops the worker pool, waiting briefly for running fetches.
   */
  public void shutdown() {
    executor.shutdown();
    boolean completed;
    try {
      completed = executor.awaitTermination(30, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      completed = false;
    }
    if (!completed) {
      LOG.warn("Fetch workers were still running at shutdown");
      executor.shutdownNow();
    }
  }

  public Store getStore() {
    return store;
  }

  public FunctionRegistry getRegistry() {
    return registry;
  }

  public Evaluator getEvaluator() {
    return evaluator;
  }

  public Config getConfig() {
    return config;
  }
}
