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

/**
 * Thrown when a target string cannot be parsed.
 * @since 1.0
 */
public class ExpressionSyntaxException extends IllegalArgumentException {

  /** Index in the target where parsing failed */
  private final int position;

  /**
   * Default ctor
   * @param target The target being parsed
   * @param position Where parsing failed
   * @param msg What was expected
   */
  public ExpressionSyntaxException(final String target, final int position,
      final String msg) {
    super(msg + " at position " + position + " in target: " + target);
    this.position = position;
  }

  /** @return the index in the target where parsing failed */
  public int getPosition() {
    return position;
  }

  private static final long serialVersionUID = -5193645813208217421L;
}
