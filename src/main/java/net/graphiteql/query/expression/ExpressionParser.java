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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Recursive descent parser for Graphite targets. Grammar, informally:
 * <pre>
 * target     := expression EOF
 * expression := template | call | path
 * template   := 'template' '(' (call | path) [',' literals [',' kwliterals]] ')'
 * call       := name '(' [args [',' kwargs] | kwargs] ')'
 * arg        := boolean | number | string | expression
 * kwarg      := name '=' arg
 * path       := element ('.' element)*
 * element    := (char | '\' symbol | '{' element (',' element)* '}')+
 * </pre>
 * Numbers and booleans are only literals when followed by a comma, a closing
 * parenthesis or the end of input; otherwise the text is read as a path.
 * A template whose arguments are not all literals is not a template and is
 * parsed as a plain call named {@code template}.
 * <p>
 * The reserved symbols {@code (){},=.'"\} must be escaped with a backslash
 * to appear in a path. Escapes are kept in the parsed pattern.
 * @since 1.0
 */
public class ExpressionParser {

  /** Characters that must be escaped inside paths */
  public static final String SYMBOLS = "(){},=.'\"\\";

  private static final String TEMPLATE = "template";

  private final String target;
  private final ExpressionReader reader;

  /** The failure that got the furthest, reported when nothing matches */
  private ExpressionSyntaxException farthest;

  private ExpressionParser(final String target) {
    this.target = target;
    reader = new ExpressionReader(target.toCharArray());
  }

  /**
   * Parses a target string.
   * @param target The target to parse
   * @return The root node, always an {@link ParseNode.Expression}
   * @throws ExpressionSyntaxException if the target is malformed
   * @throws IllegalArgumentException if the target is null
   */
  public static ParseNode parse(final String target) {
    if (target == null) {
      throw new IllegalArgumentException("Target cannot be null");
    }
    return new ExpressionParser(target).parseTarget();
  }

  private ParseNode parseTarget() {
    reader.skipWhitespaces();
    if (reader.isEOF()) {
      throw fail("Empty target");
    }
    final ParseNode node;
    try {
      node = parseExpression();
    } catch (ExpressionSyntaxException e) {
      throw farthest != null && farthest.getPosition() > e.getPosition()
          ? farthest : e;
    }
    reader.skipWhitespaces();
    if (!reader.isEOF()) {
      if (farthest != null && farthest.getPosition() > reader.getMark()) {
        throw farthest;
      }
      throw fail("Unexpected character '" + reader.peek() + "'");
    }
    return node;
  }

  private ParseNode parseExpression() {
    final int start = reader.getMark();
    try {
      return new ParseNode.Expression(parseTemplate());
    } catch (ExpressionSyntaxException e) {
      reader.reset(start);
    }
    try {
      return new ParseNode.Expression(parseCall());
    } catch (ExpressionSyntaxException e) {
      reader.reset(start);
    }
    return new ParseNode.Expression(parsePath());
  }

  private ParseNode parseTemplate() {
    if (!reader.isNextSeq(TEMPLATE)) {
      throw fail("Expected template");
    }
    reader.skip(TEMPLATE.length());
    reader.skipWhitespaces();
    expect('(');
    reader.skipWhitespaces();

    final int start = reader.getMark();
    ParseNode inner;
    try {
      inner = parseCall();
    } catch (ExpressionSyntaxException e) {
      reader.reset(start);
      inner = parsePath();
    }

    final List<ParseNode> args = new ArrayList<ParseNode>();
    final Map<String, ParseNode> kwargs = new LinkedHashMap<String, ParseNode>();
    reader.skipWhitespaces();
    if (consume(',')) {
      parseArguments(args, kwargs, true);
    }
    reader.skipWhitespaces();
    expect(')');
    return new ParseNode.Template(inner, args, kwargs);
  }

  private ParseNode parseCall() {
    final String name = reader.readIdentifier();
    if (name == null) {
      throw fail("Expected function name");
    }
    reader.skipWhitespaces();
    expect('(');
    reader.skipWhitespaces();

    final List<ParseNode> args = new ArrayList<ParseNode>();
    final Map<String, ParseNode> kwargs = new LinkedHashMap<String, ParseNode>();
    if (!consume(')')) {
      parseArguments(args, kwargs, false);
      reader.skipWhitespaces();
      expect(')');
    }
    return new ParseNode.Call(name, args, kwargs);
  }

  /**
   * Reads a comma separated argument list: positional arguments first, then
   * keyword arguments.
   * @param literals_only Whether only numbers and strings are allowed
   */
  private void parseArguments(final List<ParseNode> args,
      final Map<String, ParseNode> kwargs, final boolean literals_only) {
    boolean in_kwargs = false;
    do {
      reader.skipWhitespaces();
      final String kwarg = readKwargName();
      if (kwarg != null) {
        in_kwargs = true;
        reader.skipWhitespaces();
        kwargs.put(kwarg, literals_only ? parseLiteral() : parseArg());
      } else if (in_kwargs) {
        throw fail("Positional argument after keyword argument");
      } else {
        args.add(literals_only ? parseLiteral() : parseArg());
      }
      reader.skipWhitespaces();
    } while (consume(','));
  }

  /** @return the keyword name, consuming the '=', or null with the index
   * left untouched */
  private String readKwargName() {
    final int start = reader.getMark();
    final String name = reader.readIdentifier();
    if (name != null) {
      reader.skipWhitespaces();
      if (!reader.isEOF() && reader.isNextChar('=')) {
        reader.next();
        return name;
      }
    }
    reader.reset(start);
    return null;
  }

  private ParseNode parseArg() {
    final int start = reader.getMark();
    try {
      return parseBoolean();
    } catch (ExpressionSyntaxException e) {
      reader.reset(start);
    }
    try {
      return parseNumber();
    } catch (ExpressionSyntaxException e) {
      reader.reset(start);
    }
    if (!reader.isEOF() && (reader.peek() == '\'' || reader.peek() == '"')) {
      return parseString();
    }
    return parseExpression();
  }

  private ParseNode parseLiteral() {
    final int start = reader.getMark();
    try {
      return parseNumber();
    } catch (ExpressionSyntaxException e) {
      reader.reset(start);
    }
    if (!reader.isEOF() && (reader.peek() == '\'' || reader.peek() == '"')) {
      return parseString();
    }
    throw fail("Expected a number or string literal");
  }

  private ParseNode parseBoolean() {
    final String word = reader.readIdentifier();
    if (word == null || !(word.equalsIgnoreCase("true")
        || word.equalsIgnoreCase("false"))) {
      throw fail("Expected boolean");
    }
    checkLiteralEnd();
    return new ParseNode.BooleanLiteral(word.equalsIgnoreCase("true"));
  }

  private ParseNode parseNumber() {
    final StringBuilder text = new StringBuilder();
    if (!reader.isEOF() && reader.isNextChar('-')) {
      text.append(reader.next());
    }
    if (readDigits(text) == 0) {
      throw fail("Expected number");
    }
    boolean is_double = false;
    if (reader.isNextSeq(".") && reader.getMark() + 1 < target.length()
        && Character.isDigit(target.charAt(reader.getMark() + 1))) {
      text.append(reader.next());
      readDigits(text);
      is_double = true;
    }
    if (!reader.isEOF() && (reader.peek() == 'e' || reader.peek() == 'E')) {
      final int exponent_start = reader.getMark();
      final StringBuilder exponent = new StringBuilder();
      exponent.append(reader.next());
      if (!reader.isEOF() && reader.isNextChar('-')) {
        exponent.append(reader.next());
      }
      if (readDigits(exponent) > 0) {
        text.append(exponent);
        is_double = true;
      } else {
        reader.reset(exponent_start);
      }
    }
    checkLiteralEnd();

    if (is_double) {
      return new ParseNode.NumberLiteral(Double.parseDouble(text.toString()));
    }
    try {
      return new ParseNode.NumberLiteral(Long.parseLong(text.toString()));
    } catch (NumberFormatException e) {
      return new ParseNode.NumberLiteral(Double.parseDouble(text.toString()));
    }
  }

  private int readDigits(final StringBuilder text) {
    int count = 0;
    while (!reader.isEOF() && Character.isDigit(reader.peek())) {
      text.append(reader.next());
      count++;
    }
    return count;
  }

  /** A number or boolean must be followed by ',' or ')' or the end */
  private void checkLiteralEnd() {
    final int end = reader.getMark();
    reader.skipWhitespaces();
    final boolean ok = reader.isEOF() || reader.isNextChar(',')
        || reader.isNextChar(')');
    reader.reset(end);
    if (!ok) {
      throw fail("Literal must be followed by ',' or ')'");
    }
  }

  private ParseNode parseString() {
    final char quote = reader.next();
    final StringBuilder value = new StringBuilder();
    while (!reader.isEOF()) {
      final char c = reader.next();
      if (c == '\\' && !reader.isEOF()) {
        value.append(reader.next());
      } else if (c == quote) {
        return new ParseNode.StringLiteral(value.toString());
      } else {
        value.append(c);
      }
    }
    throw fail("Unterminated string");
  }

  private ParseNode parsePath() {
    final StringBuilder path = new StringBuilder();
    parsePathElement(path);
    while (!reader.isEOF() && reader.isNextChar('.')) {
      path.append(reader.next());
      parsePathElement(path);
    }
    return new ParseNode.PathExpression(path.toString());
  }

  /** Reads one dot-free element, brace groups and escapes included */
  private void parsePathElement(final StringBuilder path) {
    int pieces = 0;
    while (!reader.isEOF()) {
      final char c = reader.peek();
      if (c == '\\') {
        final int next = reader.getMark() + 1;
        if (next >= target.length() || SYMBOLS.indexOf(target.charAt(next)) < 0) {
          throw fail("Only symbols " + SYMBOLS + " may be escaped");
        }
        path.append(reader.next()).append(reader.next());
      } else if (c == '{') {
        parseMatchEnum(path);
      } else if (isPathChar(c)) {
        path.append(reader.next());
      } else {
        break;
      }
      pieces++;
    }
    if (pieces == 0) {
      throw fail("Expected path expression");
    }
  }

  private void parseMatchEnum(final StringBuilder path) {
    path.append(reader.next());
    while (true) {
      parsePathElement(path);
      if (consume(',')) {
        path.append(',');
      } else if (consume('}')) {
        path.append('}');
        return;
      } else {
        throw fail("Unterminated brace group");
      }
    }
  }

  static boolean isPathChar(final char c) {
    return !Character.isWhitespace(c) && !Character.isISOControl(c)
        && SYMBOLS.indexOf(c) < 0;
  }

  private boolean consume(final char c) {
    if (!reader.isEOF() && reader.isNextChar(c)) {
      reader.next();
      return true;
    }
    return false;
  }

  private void expect(final char c) {
    if (!consume(c)) {
      throw fail("Expected '" + c + "'");
    }
  }

  private ExpressionSyntaxException fail(final String msg) {
    final ExpressionSyntaxException e =
        new ExpressionSyntaxException(target, reader.getMark(), msg);
    if (farthest == null || e.getPosition() >= farthest.getPosition()) {
      farthest = e;
    }
    return e;
  }
}
