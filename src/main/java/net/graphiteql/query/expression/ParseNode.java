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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import net.graphiteql.core.SeriesLists;

/**
 * An immutable node of a parsed target. The set of node kinds is closed; use
 * {@link #getType()} to dispatch and cast to the matching nested class.
 * {@link #toString()} renders the node back into target syntax.
 * @since 1.0
 */
public abstract class ParseNode {

  /** The kinds of node */
  public enum Type {
    EXPRESSION,
    CALL,
    PATH_EXPRESSION,
    NUMBER,
    STRING,
    BOOLEAN,
    TEMPLATE
  }

  private final Type type;

  private ParseNode(final Type type) {
    this.type = type;
  }

  public Type getType() {
    return type;
  }

  /** Wraps a call, template or path expression */
  public static final class Expression extends ParseNode {
    private final ParseNode child;

    public Expression(final ParseNode child) {
      super(Type.EXPRESSION);
      if (child == null) {
        throw new IllegalArgumentException("Expression child cannot be null");
      }
      this.child = child;
    }

    public ParseNode getChild() {
      return child;
    }

    @Override
    public String toString() {
      return child.toString();
    }
  }

  /** A function call with positional then keyword arguments */
  public static final class Call extends ParseNode {
    private final String name;
    private final List<ParseNode> args;
    private final Map<String, ParseNode> kwargs;

    public Call(final String name, final List<ParseNode> args,
        final Map<String, ParseNode> kwargs) {
      super(Type.CALL);
      if (name == null || name.isEmpty()) {
        throw new IllegalArgumentException("Function name cannot be empty");
      }
      this.name = name;
      this.args = args == null ? ImmutableList.<ParseNode>of()
          : Collections.unmodifiableList(new ArrayList<ParseNode>(args));
      this.kwargs = kwargs == null ? ImmutableMap.<String, ParseNode>of()
          : Collections.unmodifiableMap(
              new LinkedHashMap<String, ParseNode>(kwargs));
    }

    public String getName() {
      return name;
    }

    public List<ParseNode> getArgs() {
      return args;
    }

    /** @return keyword arguments in the order written */
    public Map<String, ParseNode> getKwargs() {
      return kwargs;
    }

    @Override
    public String toString() {
      return name + "(" + renderArgs(args, kwargs) + ")";
    }
  }

  /** A dotted path pattern, kept exactly as written, escapes included */
  public static final class PathExpression extends ParseNode {
    private final String pattern;

    public PathExpression(final String pattern) {
      super(Type.PATH_EXPRESSION);
      if (pattern == null || pattern.isEmpty()) {
        throw new IllegalArgumentException("Path cannot be empty");
      }
      this.pattern = pattern;
    }

    public String getPattern() {
      return pattern;
    }

    @Override
    public String toString() {
      return pattern;
    }
  }

  /** An integer (Long) or a decimal or scientific number (Double) */
  public static final class NumberLiteral extends ParseNode {
    private final Number value;

    public NumberLiteral(final Number value) {
      super(Type.NUMBER);
      if (value == null) {
        throw new IllegalArgumentException("Number cannot be null");
      }
      this.value = value;
    }

    public Number getValue() {
      return value;
    }

    @Override
    public String toString() {
      return SeriesLists.formatNumber(value);
    }
  }

  /** A quoted string, unescaped */
  public static final class StringLiteral extends ParseNode {
    private final String value;

    public StringLiteral(final String value) {
      super(Type.STRING);
      this.value = value == null ? "" : value;
    }

    public String getValue() {
      return value;
    }

    @Override
    public String toString() {
      return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
  }

  /** true or false */
  public static final class BooleanLiteral extends ParseNode {
    private final boolean value;

    public BooleanLiteral(final boolean value) {
      super(Type.BOOLEAN);
      this.value = value;
    }

    public boolean getValue() {
      return value;
    }

    @Override
    public String toString() {
      return Boolean.toString(value);
    }
  }

  /**
   * A call or path whose {@code $name} markers are substituted from literal
   * arguments before evaluation. Positional arguments bind to {@code $1},
   * {@code $2} and so on.
   */
  public static final class Template extends ParseNode {
    private final ParseNode inner;
    private final List<ParseNode> args;
    private final Map<String, ParseNode> kwargs;

    public Template(final ParseNode inner, final List<ParseNode> args,
        final Map<String, ParseNode> kwargs) {
      super(Type.TEMPLATE);
      if (inner == null) {
        throw new IllegalArgumentException("Template body cannot be null");
      }
      this.inner = inner;
      this.args = args == null ? ImmutableList.<ParseNode>of()
          : Collections.unmodifiableList(new ArrayList<ParseNode>(args));
      this.kwargs = kwargs == null ? ImmutableMap.<String, ParseNode>of()
          : Collections.unmodifiableMap(
              new LinkedHashMap<String, ParseNode>(kwargs));
    }

    /** @return the call or path expression being templated */
    public ParseNode getInner() {
      return inner;
    }

    public List<ParseNode> getArgs() {
      return args;
    }

    public Map<String, ParseNode> getKwargs() {
      return kwargs;
    }

    @Override
    public String toString() {
      final String rest = renderArgs(args, kwargs);
      return "template(" + inner + (rest.isEmpty() ? "" : "," + rest) + ")";
    }
  }

  private static String renderArgs(final List<ParseNode> args,
      final Map<String, ParseNode> kwargs) {
    final List<String> parts = new ArrayList<String>();
    for (final ParseNode arg : args) {
      parts.add(arg.toString());
    }
    for (final Map.Entry<String, ParseNode> entry : kwargs.entrySet()) {
      parts.add(entry.getKey() + "=" + entry.getValue());
    }
    return Joiner.on(',').join(parts);
  }
}
