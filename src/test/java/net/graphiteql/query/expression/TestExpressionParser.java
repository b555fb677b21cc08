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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

public class TestExpressionParser {

  @Test
  public void path() throws Exception {
    final ParseNode node = ExpressionParser.parse("sys.cpu.user");
    assertEquals(ParseNode.Type.EXPRESSION, node.getType());
    final ParseNode child = ((ParseNode.Expression) node).getChild();
    assertEquals(ParseNode.Type.PATH_EXPRESSION, child.getType());
    assertEquals("sys.cpu.user",
        ((ParseNode.PathExpression) child).getPattern());
  }

  @Test
  public void pathWithGlobs() throws Exception {
    assertEquals("sys.*.{user,system}.cpu[0-3]?",
        pathOf(ExpressionParser.parse("sys.*.{user,system}.cpu[0-3]?")));
  }

  @Test
  public void pathNestedBraces() throws Exception {
    assertEquals("a{b,c{d,e}}", pathOf(ExpressionParser.parse("a{b,c{d,e}}")));
  }

  @Test
  public void pathKeepsEscapes() throws Exception {
    assertEquals("a\\.b.c\\(d\\)",
        pathOf(ExpressionParser.parse("a\\.b.c\\(d\\)")));
  }

  @Test (expected = ExpressionSyntaxException.class)
  public void pathBadEscape() throws Exception {
    ExpressionParser.parse("a\\b");
  }

  @Test
  public void pathStartingWithDigits() throws Exception {
    assertEquals("1a.b", pathOf(ExpressionParser.parse("1a.b")));
  }

  @Test
  public void call() throws Exception {
    final ParseNode.Call call = callOf(
        ExpressionParser.parse("sumSeries(a.*, b)"));
    assertEquals("sumSeries", call.getName());
    assertEquals(2, call.getArgs().size());
    assertTrue(call.getKwargs().isEmpty());
    assertEquals("a.*", pathOf(call.getArgs().get(0)));
    assertEquals("b", pathOf(call.getArgs().get(1)));
  }

  @Test
  public void callNoArgs() throws Exception {
    final ParseNode.Call call = callOf(ExpressionParser.parse("f()"));
    assertEquals("f", call.getName());
    assertTrue(call.getArgs().isEmpty());
  }

  @Test
  public void callNested() throws Exception {
    final ParseNode.Call call = callOf(ExpressionParser.parse(
        "alias(sumSeries(a, b), 'total')"));
    assertEquals("alias", call.getName());
    final ParseNode.Call inner = callOf(call.getArgs().get(0));
    assertEquals("sumSeries", inner.getName());
    assertEquals("total",
        ((ParseNode.StringLiteral) call.getArgs().get(1)).getValue());
  }

  @Test
  public void callWhitespace() throws Exception {
    final ParseNode.Call call = callOf(ExpressionParser.parse(
        "  scale ( a , 2 )  "));
    assertEquals("scale", call.getName());
    assertEquals(2L, ((ParseNode.NumberLiteral) call.getArgs().get(1))
        .getValue());
  }

  @Test
  public void numbers() throws Exception {
    final ParseNode.Call call = callOf(ExpressionParser.parse(
        "f(5, -3, 2.5, 1e3, -1.5E-2, 99999999999999999999)"));
    assertEquals(5L, number(call, 0));
    assertEquals(-3L, number(call, 1));
    assertEquals(2.5, number(call, 2));
    assertEquals(1000.0, number(call, 3));
    assertEquals(-0.015, number(call, 4));
    assertEquals(1.0E20, number(call, 5));
  }

  @Test
  public void numberFollowedByTextIsPath() throws Exception {
    final ParseNode.Call call = callOf(ExpressionParser.parse("f(5min.x)"));
    assertEquals("5min.x", pathOf(call.getArgs().get(0)));
  }

  @Test
  public void strings() throws Exception {
    final ParseNode.Call call = callOf(ExpressionParser.parse(
        "f('single', \"double\", 'it\\'s', \"a,b)\")"));
    assertEquals("single", string(call, 0));
    assertEquals("double", string(call, 1));
    assertEquals("it's", string(call, 2));
    assertEquals("a,b)", string(call, 3));
  }

  @Test (expected = ExpressionSyntaxException.class)
  public void stringUnterminated() throws Exception {
    ExpressionParser.parse("f('abc)");
  }

  @Test
  public void booleans() throws Exception {
    final ParseNode.Call call = callOf(ExpressionParser.parse(
        "f(true, False, trueish)"));
    assertTrue(((ParseNode.BooleanLiteral) call.getArgs().get(0)).getValue());
    assertFalse(((ParseNode.BooleanLiteral) call.getArgs().get(1)).getValue());
    assertEquals("trueish", pathOf(call.getArgs().get(2)));
  }

  @Test
  public void kwargs() throws Exception {
    final ParseNode.Call call = callOf(ExpressionParser.parse(
        "movingAverage(a, windowSize='5min', xFilesFactor=0.5)"));
    assertEquals(1, call.getArgs().size());
    assertEquals(2, call.getKwargs().size());
    assertEquals("5min", ((ParseNode.StringLiteral) call.getKwargs()
        .get("windowSize")).getValue());
    assertEquals(0.5, ((ParseNode.NumberLiteral) call.getKwargs()
        .get("xFilesFactor")).getValue());
  }

  @Test
  public void kwargsOnly() throws Exception {
    final ParseNode.Call call = callOf(ExpressionParser.parse(
        "identity(name = 'x')"));
    assertTrue(call.getArgs().isEmpty());
    assertEquals("x", ((ParseNode.StringLiteral) call.getKwargs()
        .get("name")).getValue());
  }

  @Test (expected = ExpressionSyntaxException.class)
  public void positionalAfterKwarg() throws Exception {
    ExpressionParser.parse("f(n=1, a)");
  }

  @Test
  public void template() throws Exception {
    final ParseNode node = ExpressionParser.parse(
        "template(sumSeries(hosts.$1.cpu), 'web01', metric=\"load\")");
    final ParseNode child = ((ParseNode.Expression) node).getChild();
    assertEquals(ParseNode.Type.TEMPLATE, child.getType());
    final ParseNode.Template template = (ParseNode.Template) child;
    assertEquals(ParseNode.Type.CALL, template.getInner().getType());
    assertEquals(1, template.getArgs().size());
    assertEquals("load", ((ParseNode.StringLiteral) template.getKwargs()
        .get("metric")).getValue());
  }

  @Test
  public void templatePath() throws Exception {
    final ParseNode.Template template = (ParseNode.Template)
        ((ParseNode.Expression) ExpressionParser.parse(
            "template(hosts.$host.cpu, host='a')")).getChild();
    assertEquals("hosts.$host.cpu",
        ((ParseNode.PathExpression) template.getInner()).getPattern());
  }

  @Test
  public void templateWithNonLiteralIsCall() throws Exception {
    final ParseNode.Call call = callOf(ExpressionParser.parse(
        "template(a.$1, b.c)"));
    assertEquals("template", call.getName());
  }

  @Test
  public void toStringRoundTrip() throws Exception {
    assertEquals("f(a.b,5,\"x\",n=true)",
        ExpressionParser.parse("f( a.b , 5 , 'x' , n=true )").toString());
  }

  @Test (expected = ExpressionSyntaxException.class)
  public void empty() throws Exception {
    ExpressionParser.parse("   ");
  }

  @Test (expected = IllegalArgumentException.class)
  public void nullTarget() throws Exception {
    ExpressionParser.parse(null);
  }

  @Test
  public void trailingInput() throws Exception {
    try {
      ExpressionParser.parse("a.b)");
      fail("Expected an ExpressionSyntaxException");
    } catch (ExpressionSyntaxException e) {
      assertEquals(3, e.getPosition());
    }
  }

  @Test
  public void unclosedCallReportsFarthestFailure() throws Exception {
    try {
      ExpressionParser.parse("f(a");
      fail("Expected an ExpressionSyntaxException");
    } catch (ExpressionSyntaxException e) {
      assertEquals(3, e.getPosition());
    }
  }

  private static String pathOf(final ParseNode node) {
    final ParseNode child = ((ParseNode.Expression) node).getChild();
    return ((ParseNode.PathExpression) child).getPattern();
  }

  private static ParseNode.Call callOf(final ParseNode node) {
    return (ParseNode.Call) ((ParseNode.Expression) node).getChild();
  }

  private static Object number(final ParseNode.Call call, final int idx) {
    return ((ParseNode.NumberLiteral) call.getArgs().get(idx)).getValue();
  }

  private static String string(final ParseNode.Call call, final int idx) {
    return ((ParseNode.StringLiteral) call.getArgs().get(idx)).getValue();
  }
}
