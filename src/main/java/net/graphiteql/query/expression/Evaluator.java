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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableMap;

import net.graphiteql.core.RequestContext;
import net.graphiteql.core.SeriesLists;
import net.graphiteql.core.TimeSeries;
import net.graphiteql.query.FetchAccumulator;
import net.graphiteql.query.FetchOrchestrator;

/**
 * Evaluates targets in two passes. The first walks every parse tree and
 * collects the path patterns it references so they can all be fetched in one
 * batch. The second walks the trees again, replacing paths with the fetched
 * series and calling functions from the {@link FunctionRegistry}.
 * <p>
 * Inside a {@code template(...)} the {@code $name} markers of path
 * expressions are substituted first. A path that is exactly one marker
 * evaluates to the bound value instead of a series lookup; numeric strings
 * are converted to doubles.
 * @since 1.0
 */
public class Evaluator {
  private static final Logger LOG = LoggerFactory.getLogger(Evaluator.class);

  /** A bound string that should be treated as a number */
  private static final Pattern NUMERIC = Pattern.compile("^-?[\\d.]+$");

  private static final String TEMPLATE = "template";

  private static final Map<String, Object> NO_BINDINGS = ImmutableMap.of();

  private final FunctionRegistry registry;
  private final FetchOrchestrator orchestrator;

  /**
   * Default ctor
   * @param registry The functions targets may call
   * @param orchestrator Used to fetch the referenced paths
   */
  public Evaluator(final FunctionRegistry registry,
      final FetchOrchestrator orchestrator) {
    if (registry == null) {
      throw new IllegalArgumentException("Function registry cannot be null");
    }
    if (orchestrator == null) {
      throw new IllegalArgumentException("Fetch orchestrator cannot be null");
    }
    this.registry = registry;
    this.orchestrator = orchestrator;
  }

  /**
   * Evaluates a single target, fetching its paths first.
   * @param context The request
   * @param target The target string
   * @return The resulting series
   * @throws ExpressionSyntaxException if the target is malformed
   * @throws UnsupportedOperationException if a function is unknown
   * @throws IllegalArgumentException if the target does not produce series
   */
  public List<TimeSeries> evaluateTarget(final RequestContext context,
      final String target) {
    return evaluateTargets(context, Collections.singletonList(target));
  }

  /**
   * Evaluates several targets with a single fetch across all of them.
   * @param context The request
   * @param targets The target strings
   * @return The series of every target, in target order
   * @throws ExpressionSyntaxException if a target is malformed
   * @throws UnsupportedOperationException if a function is unknown
   * @throws IllegalArgumentException if a target does not produce series
   */
  public List<TimeSeries> evaluateTargets(final RequestContext context,
      final List<String> targets) {
    final List<ParseNode> trees = new ArrayList<ParseNode>(targets.size());
    final Set<String> paths = new LinkedHashSet<String>();
    for (final String target : targets) {
      final ParseNode tree = ExpressionParser.parse(target);
      trees.add(tree);
      collectPaths(context, tree, NO_BINDINGS, paths);
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Fetching " + paths + " for " + targets);
    }

    final FetchAccumulator accumulator =
        orchestrator.fetchData(context, paths);
    final List<TimeSeries> results = new ArrayList<TimeSeries>();
    for (int i = 0; i < trees.size(); i++) {
      final Object result = evaluate(context, trees.get(i), accumulator,
          NO_BINDINGS);
      results.addAll(toSeriesList(targets.get(i), result));
    }
    return results;
  }

  /**
   * Parses the target and returns the path patterns it would fetch.
   * @param context The request, for its template overrides
   * @param target The target string
   * @return The patterns in the order they appear
   */
  public List<String> pathsFromTarget(final RequestContext context,
      final String target) {
    final Set<String> paths = new LinkedHashSet<String>();
    collectPaths(context, ExpressionParser.parse(target), NO_BINDINGS, paths);
    return new ArrayList<String>(paths);
  }

  public FunctionRegistry getRegistry() {
    return registry;
  }

  private void collectPaths(final RequestContext context, final ParseNode node,
      final Map<String, Object> bindings, final Set<String> paths) {
    switch (node.getType()) {
      case EXPRESSION:
        collectPaths(context, ((ParseNode.Expression) node).getChild(),
            bindings, paths);
        break;
      case PATH_EXPRESSION:
        final Object resolved = substitute(
            ((ParseNode.PathExpression) node).getPattern(), bindings);
        if (resolved instanceof String) {
          paths.add((String) resolved);
        }
        break;
      case CALL:
        final ParseNode.Call call = (ParseNode.Call) node;
        for (final ParseNode arg : call.getArgs()) {
          collectPaths(context, arg, bindings, paths);
        }
        for (final ParseNode arg : call.getKwargs().values()) {
          collectPaths(context, arg, bindings, paths);
        }
        break;
      case TEMPLATE:
        final ParseNode.Template template = (ParseNode.Template) node;
        collectPaths(context, template.getInner(),
            templateBindings(context, template), paths);
        break;
      default:
        // literals reference no paths
        break;
    }
  }

  private Object evaluate(final RequestContext context, final ParseNode node,
      final FetchAccumulator accumulator, final Map<String, Object> bindings) {
    switch (node.getType()) {
      case EXPRESSION:
        return evaluate(context, ((ParseNode.Expression) node).getChild(),
            accumulator, bindings);
      case PATH_EXPRESSION:
        final Object resolved = substitute(
            ((ParseNode.PathExpression) node).getPattern(), bindings);
        if (!(resolved instanceof String)) {
          return resolved;
        }
        final String pattern = (String) resolved;
        if (!accumulator.hasPattern(pattern)) {
          orchestrator.fetchData(context, Collections.singletonList(pattern),
              accumulator);
        }
        return accumulator.getSeriesList(pattern);
      case CALL:
        return evaluateCall(context, (ParseNode.Call) node, accumulator,
            bindings);
      case TEMPLATE:
        final ParseNode.Template template = (ParseNode.Template) node;
        return evaluate(context, template.getInner(), accumulator,
            templateBindings(context, template));
      case NUMBER:
        return ((ParseNode.NumberLiteral) node).getValue();
      case STRING:
        return ((ParseNode.StringLiteral) node).getValue();
      case BOOLEAN:
        return ((ParseNode.BooleanLiteral) node).getValue();
      default:
        throw new IllegalStateException("Unknown node type " + node.getType());
    }
  }

  private Object evaluateCall(final RequestContext context,
      final ParseNode.Call call, final FetchAccumulator accumulator,
      final Map<String, Object> bindings) {
    if (TEMPLATE.equals(call.getName())) {
      throw new InvalidTemplateException("Invalid template " + call
          + ", arguments must be number or string literals");
    }
    final SeriesFunction function = registry.getByName(call.getName());
    final List<Object> args = new ArrayList<Object>(call.getArgs().size());
    for (final ParseNode arg : call.getArgs()) {
      args.add(evaluate(context, arg, accumulator, bindings));
    }
    final Map<String, Object> kwargs = new LinkedHashMap<String, Object>();
    for (final Map.Entry<String, ParseNode> entry : call.getKwargs().entrySet()) {
      kwargs.put(entry.getKey(),
          evaluate(context, entry.getValue(), accumulator, bindings));
    }
    return function.evaluate(context, args, kwargs);
  }

  /**
   * Keyword arguments, then positional ones as "1", "2"..., then the
   * request's overrides on top.
   */
  private static Map<String, Object> templateBindings(
      final RequestContext context, final ParseNode.Template template) {
    final Map<String, Object> bindings = new LinkedHashMap<String, Object>();
    for (final Map.Entry<String, ParseNode> entry :
        template.getKwargs().entrySet()) {
      bindings.put(entry.getKey(), literalValue(entry.getValue()));
    }
    for (int i = 0; i < template.getArgs().size(); i++) {
      bindings.put(Integer.toString(i + 1),
          literalValue(template.getArgs().get(i)));
    }
    bindings.putAll(context.getTemplate());
    return bindings;
  }

  private static Object literalValue(final ParseNode node) {
    switch (node.getType()) {
      case NUMBER:
        return ((ParseNode.NumberLiteral) node).getValue();
      case STRING:
        return ((ParseNode.StringLiteral) node).getValue();
      default:
        throw new InvalidTemplateException("Template arguments must be "
            + "number or string literals: " + node);
    }
  }

  /**
   * Applies template bindings to a pattern.
   * @return The rewritten pattern or, if the pattern is a single bound
   * marker, the bound value
   */
  static Object substitute(final String pattern,
      final Map<String, Object> bindings) {
    if (bindings.isEmpty() || pattern.indexOf('$') < 0) {
      return pattern;
    }
    if (pattern.startsWith("$") && bindings.containsKey(pattern.substring(1))) {
      final Object value = bindings.get(pattern.substring(1));
      if (!(value instanceof String)) {
        return value;
      }
      final String string = (String) value;
      if (NUMERIC.matcher(string).matches()) {
        try {
          return Double.parseDouble(string);
        } catch (NumberFormatException e) {
          // e.g. "1.2.3", keep it as a path
          return string;
        }
      }
      return string;
    }

    // longest names first so $10 isn't rewritten by $1
    final List<String> names = new ArrayList<String>(bindings.keySet());
    Collections.sort(names, new Comparator<String>() {
      @Override
      public int compare(final String a, final String b) {
        return b.length() - a.length();
      }
    });
    String result = pattern;
    for (final String name : names) {
      result = result.replace("$" + name,
          SeriesLists.formatNumber(bindings.get(name)));
    }
    return result;
  }

  private static List<TimeSeries> toSeriesList(final String target,
      final Object result) {
    if (result instanceof TimeSeries) {
      return Collections.singletonList((TimeSeries) result);
    }
    if (result instanceof List) {
      final List<TimeSeries> series = new ArrayList<TimeSeries>();
      for (final Object item : (List<?>) result) {
        if (!(item instanceof TimeSeries)) {
          throw new IllegalArgumentException("Target " + target
              + " produced a non series value: " + item);
        }
        series.add((TimeSeries) item);
      }
      return series;
    }
    throw new IllegalArgumentException("Target " + target
        + " did not evaluate to series: " + result);
  }

  @Override
  public String toString() {
    return "Evaluator(" + registry + ")";
  }
}
