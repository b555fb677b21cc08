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
package net.graphiteql.query;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.stumbleupon.async.Callback;
import com.stumbleupon.async.Deferred;

import net.graphiteql.core.QueryException;
import net.graphiteql.core.RequestContext;
import net.graphiteql.storage.FetchResult;
import net.graphiteql.storage.Finder;
import net.graphiteql.storage.LeafNode;
import net.graphiteql.storage.MultiFetchFinder;
import net.graphiteql.storage.MultiFetchResult;
import net.graphiteql.storage.Node;
import net.graphiteql.storage.Store;

/**
 * Resolves a batch of patterns and fetches every leaf they match in one pass.
 * Leaves owned by a multi-fetch finder are fetched with a single call per
 * finder, the rest one call per leaf. All calls run concurrently on the
 * worker pool and are joined before any result touches the accumulator.
 * <p>
 * Results are applied in a fixed order, batched calls in finder registration
 * order followed by single fetches in resolution order, so the accumulator's
 * empty block rule gives the same answer on every run.
 * @since 1.0
 */
public class FetchOrchestrator {
  private static final Logger LOG =
      LoggerFactory.getLogger(FetchOrchestrator.class);

  private final Store store;
  private final ExecutorService executor;

  /**
   * Default ctor
   * @param store The storage resolver
   * @param executor The pool backend calls run on
   */
  public FetchOrchestrator(final Store store, final ExecutorService executor) {
    if (store == null) {
      throw new IllegalArgumentException("Store cannot be null");
    }
    if (executor == null) {
      throw new IllegalArgumentException("Executor cannot be null");
    }
    this.store = store;
    this.executor = executor;
  }

  /**
   * Resolves and fetches the patterns into a new accumulator.
   * @param context The request
   * @param patterns The path patterns to resolve
   * @return The filled accumulator
   */
  public FetchAccumulator fetchData(final RequestContext context,
      final Collection<String> patterns) {
    final FetchAccumulator accumulator = new FetchAccumulator();
    fetchData(context, patterns, accumulator);
    return accumulator;
  }

  /**
   * Resolves and fetches the patterns into an existing accumulator. Paths
   * that already hold data are not fetched again.
   * @param context The request
   * @param patterns The path patterns to resolve
   * @param accumulator Where to store results
   */
  public void fetchData(final RequestContext context,
      final Collection<String> patterns, final FetchAccumulator accumulator) {
    final long start = context.getStartTime();
    final long end = context.getEndTime();

    // path to the node that will be fetched for it
    final Map<String, LeafNode> leaves = new LinkedHashMap<String, LeafNode>();
    for (final String pattern : patterns) {
      accumulator.addPattern(pattern);
      final Iterator<Node> nodes = store.find(pattern, start, end);
      while (nodes.hasNext()) {
        final Node node = nodes.next();
        if (!node.isLeaf()) {
          continue;
        }
        accumulator.addPath(pattern, node.getPath());
        if (!leaves.containsKey(node.getPath())
            && !accumulator.hasData(node.getPath())) {
          leaves.put(node.getPath(), (LeafNode) node);
        }
      }
    }
    if (leaves.isEmpty()) {
      return;
    }

    final Map<String, MultiFetchFinder> multi_finders =
        new LinkedHashMap<String, MultiFetchFinder>();
    for (final Finder finder : store.getFinders()) {
      if (finder instanceof MultiFetchFinder) {
        final String tag = ((MultiFetchFinder) finder).multiFetchTag();
        if (tag != null && !multi_finders.containsKey(tag)) {
          multi_finders.put(tag, (MultiFetchFinder) finder);
        }
      }
    }

    final Map<String, List<LeafNode>> multi_nodes =
        new LinkedHashMap<String, List<LeafNode>>();
    for (final String tag : multi_finders.keySet()) {
      multi_nodes.put(tag, new ArrayList<LeafNode>());
    }
    final List<LeafNode> single_nodes = new ArrayList<LeafNode>();
    for (final LeafNode node : leaves.values()) {
      final List<LeafNode> group = node.getMultiFetchTag() == null ? null
          : multi_nodes.get(node.getMultiFetchTag());
      if (group != null) {
        group.add(node);
      } else {
        single_nodes.add(node);
      }
    }

    final List<Deferred<FetchOutcome>> deferreds =
        new ArrayList<Deferred<FetchOutcome>>();
    for (final Map.Entry<String, List<LeafNode>> entry : multi_nodes.entrySet()) {
      if (!entry.getValue().isEmpty()) {
        deferreds.add(submit(new MultiFetch(multi_finders.get(entry.getKey()),
            entry.getValue(), context)));
      }
    }
    for (final LeafNode node : single_nodes) {
      deferreds.add(submit(new SingleFetch(node, context)));
    }

    class ApplyCB implements Callback<Integer, ArrayList<FetchOutcome>> {
      @Override
      public Integer call(final ArrayList<FetchOutcome> outcomes) {
        int failures = 0;
        for (final FetchOutcome outcome : outcomes) {
          if (outcome.error != null) {
            failures++;
          } else {
            outcome.apply(accumulator);
          }
        }
        return failures;
      }
    }

    final int failures;
    try {
      failures = Deferred.groupInOrder(deferreds).addCallback(new ApplyCB())
          .joinUninterruptibly();
    } catch (Exception e) {
      throw new QueryException(QueryException.SERVICE_UNAVAILABLE,
          "Unexpected failure while fetching " + patterns, e);
    }
    // failed paths simply contribute no data
    if (failures > 0) {
      LOG.warn(failures + " of " + deferreds.size() + " fetches failed for "
          + patterns);
    }
  }

  /**
   * Runs the fetch on the pool. The deferred always completes with an
   * outcome, failures are carried inside it.
   */
  private Deferred<FetchOutcome> submit(final FetchTask task) {
    final Deferred<FetchOutcome> deferred = new Deferred<FetchOutcome>();
    try {
      executor.execute(new Runnable() {
        @Override
        public void run() {
          deferred.callback(task.run());
        }
      });
    } catch (RejectedExecutionException e) {
      LOG.error("Fetch pool rejected " + task, e);
      deferred.callback(new FetchOutcome(task.toString(), e));
    }
    return deferred;
  }

  /** A backend call that never throws */
  private abstract static class FetchTask {
    abstract FetchOutcome run();
  }

  private static final class SingleFetch extends FetchTask {
    private final LeafNode node;
    private final RequestContext context;

    SingleFetch(final LeafNode node, final RequestContext context) {
      this.node = node;
      this.context = context;
    }

    @Override
    FetchOutcome run() {
      try {
        final FetchResult result = node.fetch(context.getStartTime(),
            context.getEndTime(), context.getNow(), context);
        if (result == null) {
          LOG.info("No results for " + node + " from "
              + context.getStartTime() + " to " + context.getEndTime());
        }
        return new FetchOutcome(node.getPath(), result);
      } catch (Exception e) {
        LOG.error("Fetch failed for " + node, e);
        return new FetchOutcome(node.getPath(), e);
      }
    }

    @Override
    public String toString() {
      return "SingleFetch(" + node.getPath() + ")";
    }
  }

  private static final class MultiFetch extends FetchTask {
    private final MultiFetchFinder finder;
    private final List<LeafNode> nodes;
    private final RequestContext context;

    MultiFetch(final MultiFetchFinder finder, final List<LeafNode> nodes,
        final RequestContext context) {
      this.finder = finder;
      this.nodes = nodes;
      this.context = context;
    }

    @Override
    FetchOutcome run() {
      try {
        return new FetchOutcome(finder.fetchMulti(nodes, context.getStartTime(),
            context.getEndTime(), context.getNow(), context));
      } catch (Exception e) {
        LOG.error("Multi fetch failed on " + finder + " for " + nodes.size()
            + " nodes", e);
        return new FetchOutcome(finder.toString(), e);
      }
    }

    @Override
    public String toString() {
      return "MultiFetch(" + finder + ", " + nodes.size() + " nodes)";
    }
  }

  /** What a fetch produced: a single block, a batch, nothing or an error */
  private static final class FetchOutcome {
    private final String path;
    private final FetchResult single;
    private final MultiFetchResult multi;
    private final Exception error;

    FetchOutcome(final String path, final FetchResult single) {
      this.path = path;
      this.single = single;
      multi = null;
      error = null;
    }

    FetchOutcome(final MultiFetchResult multi) {
      path = null;
      single = null;
      this.multi = multi;
      error = null;
    }

    FetchOutcome(final String path, final Exception error) {
      this.path = path;
      single = null;
      multi = null;
      this.error = error;
    }

    void apply(final FetchAccumulator accumulator) {
      if (single != null) {
        accumulator.addData(path, single.getTimeInfo(), single.getValues());
      } else if (multi != null) {
        for (final Map.Entry<String, List<Double>> entry :
            multi.getSeries().entrySet()) {
          accumulator.addData(entry.getKey(), multi.getTimeInfo(),
              entry.getValue());
        }
      }
    }
  }
}
